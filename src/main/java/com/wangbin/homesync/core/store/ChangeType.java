package com.wangbin.homesync.core.store;

/**
 * 副本变更类型
 */
public enum ChangeType {
    /** 全量快照替换 */
    SNAPSHOT,
    /** 推送增量合并 */
    PATCH,
    /** 本地乐观写入 */
    OPTIMISTIC,
    /** 待确认写入标记变化 */
    PENDING,
    /** 会话结束清空 */
    CLEARED
}
