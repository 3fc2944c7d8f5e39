package com.imperium.aries.common;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应信封 {code, msg, data}。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "统一响应结构")
public class Result<T> {

    public static final String SERVER_ERROR_MSG = "服务器端错误";

    @Schema(description = "状态码：100 成功，103 请求错误，104 服务器错误，105 未授权")
    private int code;

    @Schema(description = "提示信息")
    private String msg;

    @Schema(description = "数据")
    private T data;

    public static <T> Result<T> success(String msg) {
        return new Result<>(ResultCode.SUCCESS.getCode(), msg, null);
    }

    public static <T> Result<T> success(String msg, T data) {
        return new Result<>(ResultCode.SUCCESS.getCode(), msg, data);
    }

    public static <T> Result<T> requestError(String msg) {
        return new Result<>(ResultCode.REQUEST_ERROR.getCode(), msg, null);
    }

    public static <T> Result<T> serverError() {
        return serverError(SERVER_ERROR_MSG);
    }

    public static <T> Result<T> serverError(String msg) {
        return new Result<>(ResultCode.SERVER_ERROR.getCode(), msg, null);
    }

    public static <T> Result<T> unauthorized(String msg) {
        return new Result<>(ResultCode.UNAUTHORIZED.getCode(), msg, null);
    }
}
