package com.wangbin.homesync.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_NOT_FOUND(1001, "数据不存在"),

    // 同步相关错误
    CONNECTION_ERROR(2001, "连接错误"),
    PROTOCOL_ERROR(2002, "协议错误"),
    FETCH_ERROR(2004, "快照拉取错误"),
    WRITE_ERROR(2006, "设备写入错误"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    SERVICE_UNAVAILABLE(5001, "服务不可用");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
