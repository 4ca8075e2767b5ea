package com.wangbin.homesync.core.write;

/**
 * 属性写入方式
 */
public enum PropertyKind {

    /**
     * 滑块类，防抖合并后发送
     */
    CONTINUOUS,

    /**
     * 开关类，立即发送
     */
    DISCRETE
}
