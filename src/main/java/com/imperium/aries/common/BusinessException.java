package com.imperium.aries.common;

/**
 * 请求错误：输入不合法、账号重复、凭证错误、验证码无效等。消息直接返回给调用方。
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
