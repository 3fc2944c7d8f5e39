package com.imperium.aries.mail;

import com.imperium.aries.service.SmtpAccount;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * 按 SMTP 账号构造 {@link JavaMailSender}。账号可在运行时通过“邮件设置”修改，因此每次发信现建。
 */
@Component
public class MailSenderFactory {

    private final int timeoutMs;

    public MailSenderFactory(@Value("${app.smtp.timeout-ms:10000}") int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public JavaMailSender create(SmtpAccount account) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(account.host());
        sender.setPort(account.port());
        sender.setUsername(account.account());
        sender.setPassword(account.password());
        sender.setDefaultEncoding(StandardCharsets.UTF_8.name());

        Properties props = sender.getJavaMailProperties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.auth", "true");
        if (account.port() == SmtpAccount.SSL_PORT) {
            props.put("mail.smtp.ssl.enable", "true");
        } else {
            props.put("mail.smtp.starttls.enable", "true");
        }
        String timeout = String.valueOf(timeoutMs);
        props.put("mail.smtp.connectiontimeout", timeout);
        props.put("mail.smtp.timeout", timeout);
        props.put("mail.smtp.writetimeout", timeout);
        return sender;
    }
}
