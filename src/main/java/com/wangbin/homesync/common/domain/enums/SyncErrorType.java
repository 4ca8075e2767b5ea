package com.wangbin.homesync.common.domain.enums;

import com.wangbin.homesync.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 同步子系统错误分类，错误码与接口响应码一致
 */
@Getter
public enum SyncErrorType {

    /**
     * 连接级错误，触发重连
     */
    TRANSPORT(ResultCode.CONNECTION_ERROR, "传输错误"),

    /**
     * 帧格式错误，丢弃该帧，通道保持
     */
    PROTOCOL(ResultCode.PROTOCOL_ERROR, "协议错误"),

    /**
     * 轮询失败，下个周期重试，状态不变
     */
    FETCH(ResultCode.FETCH_ERROR, "快照拉取错误"),

    /**
     * 写入被拒绝或超时，触发该设备的重新同步
     */
    WRITE(ResultCode.WRITE_ERROR, "设备写入错误");

    private final ResultCode resultCode;
    private final String description;

    SyncErrorType(ResultCode resultCode, String description) {
        this.resultCode = resultCode;
        this.description = description;
    }

    public int getCode() {
        return resultCode.getCode();
    }
}
