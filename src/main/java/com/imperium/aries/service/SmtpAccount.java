package com.imperium.aries.service;

/**
 * 发信使用的 SMTP 账号。
 *
 * @param host       SMTP 地址
 * @param port       端口，465 走 SSL，其它端口走 STARTTLS
 * @param account    登录帐号，同时作为发件地址
 * @param password   登录密码或授权码
 * @param senderName 发件人显示名
 */
public record SmtpAccount(String host, int port, String account, String password, String senderName) {

    public static final int SSL_PORT = 465;

    public SmtpAccount withSenderName(String name) {
        return new SmtpAccount(host, port, account, password, name);
    }

    public boolean isComplete() {
        return host != null && !host.isBlank()
                && port > 0
                && account != null && !account.isBlank()
                && password != null && !password.isBlank();
    }
}
