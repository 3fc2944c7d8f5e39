package com.imperium.aries.common;

/**
 * 响应信封中的语义状态码，与 HTTP 状态码无关（HTTP 恒为 200）。
 */
public enum ResultCode {

    SUCCESS(100),
    /** 请求数据有误或业务规则不满足，msg 直接展示给调用方 */
    REQUEST_ERROR(103),
    /** 服务器内部错误，msg 为通用提示，细节只写日志 */
    SERVER_ERROR(104),
    /** 未携带 token 或 token 无效/过期 */
    UNAUTHORIZED(105);

    private final int code;

    ResultCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
