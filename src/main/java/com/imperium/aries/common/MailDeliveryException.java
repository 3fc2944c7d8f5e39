package com.imperium.aries.common;

/**
 * 邮件未能送达（SMTP 未配置、认证失败、连接超时等）。消息面向调用方，原始异常仅用于日志。
 */
public class MailDeliveryException extends RuntimeException {

    public MailDeliveryException(String message) {
        super(message);
    }

    public MailDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
