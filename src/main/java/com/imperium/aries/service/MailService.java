package com.imperium.aries.service;

import com.imperium.aries.model.dto.request.EmailSendRequest;

import java.util.Optional;

/**
 * SMTP 发信。失败时抛出 {@link com.imperium.aries.common.MailDeliveryException}。
 */
public interface MailService {

    /**
     * 当前生效的 SMTP 账号：优先“邮件设置”分组，其次 app.smtp 配置。
     */
    Optional<SmtpAccount> currentAccount();

    void sendHtml(SmtpAccount account, String to, String subject, String html);

    /**
     * 发送忘记密码验证码邮件。
     */
    void sendForgetPwdCode(String to, String username, String verifyCode);

    /**
     * 发送测试邮件，验证 SMTP 配置。
     */
    void sendTestMail(EmailSendRequest request);
}
