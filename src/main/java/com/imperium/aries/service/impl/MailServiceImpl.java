package com.imperium.aries.service.impl;

import com.imperium.aries.cache.CacheKeys;
import com.imperium.aries.common.BusinessException;
import com.imperium.aries.common.MailDeliveryException;
import com.imperium.aries.mail.MailSenderFactory;
import com.imperium.aries.mail.MailTemplateRenderer;
import com.imperium.aries.model.dto.request.EmailSendRequest;
import com.imperium.aries.service.MailService;
import com.imperium.aries.service.SmtpAccount;
import com.imperium.aries.service.SysSettingService;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

@Service
public class MailServiceImpl implements MailService {

    static final String FORGET_PWD_SUBJECT = "忘记密码验证";
    static final String CODE_SEND_FAILED_MSG = "验证码发送失败，请检查 smtp 配置";
    static final String MAIL_SEND_FAILED_MSG = "邮件发送失败，请检查 smtp 配置";
    static final String SMTP_NOT_CONFIGURED_MSG = "请先配置 SMTP";

    private static final Logger log = LoggerFactory.getLogger(MailServiceImpl.class);

    private final SysSettingService sysSettingService;
    private final MailSenderFactory senderFactory;
    private final MailTemplateRenderer templateRenderer;

    @Value("${app.smtp.host:}")
    private String host;

    @Value("${app.smtp.port:465}")
    private int port;

    @Value("${app.smtp.account:}")
    private String account;

    @Value("${app.smtp.password:}")
    private String password;

    @Value("${app.smtp.sender:Aries}")
    private String sender;

    public MailServiceImpl(SysSettingService sysSettingService,
                           MailSenderFactory senderFactory,
                           MailTemplateRenderer templateRenderer) {
        this.sysSettingService = sysSettingService;
        this.senderFactory = senderFactory;
        this.templateRenderer = templateRenderer;
    }

    @Override
    public Optional<SmtpAccount> currentAccount() {
        Optional<SmtpAccount> stored = sysSettingService.findSmtpAccount();
        if (stored.isPresent()) {
            return stored;
        }
        SmtpAccount configured = new SmtpAccount(host, port, account, password, sender);
        return configured.isComplete() ? Optional.of(configured) : Optional.empty();
    }

    @Override
    public void sendHtml(SmtpAccount smtp, String to, String subject, String html) {
        JavaMailSender mailSender = senderFactory.create(smtp);
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
            helper.setFrom(smtp.account(), smtp.senderName());
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(html, true);
            mailSender.send(message);
            log.info("Mail '{}' sent to {} via {}:{}", subject, to, smtp.host(), smtp.port());
        } catch (MailException | MessagingException | UnsupportedEncodingException e) {
            log.error("Failed to send mail '{}' to {} via {}:{}", subject, to, smtp.host(), smtp.port(), e);
            throw new MailDeliveryException(MAIL_SEND_FAILED_MSG, e);
        }
    }

    @Override
    public void sendForgetPwdCode(String to, String username, String verifyCode) {
        SmtpAccount smtp = currentAccount().orElseThrow(() -> {
            log.error("Cannot send reset code to {}: SMTP is not configured", to);
            return new MailDeliveryException(CODE_SEND_FAILED_MSG);
        });
        String html = templateRenderer.render(MailTemplateRenderer.FORGET_PWD, Map.of(
                "username", username,
                "code", verifyCode,
                "expireMinutes", String.valueOf(CacheKeys.PWD_RESET_CODE_TTL.toMinutes())));
        try {
            sendHtml(smtp, to, FORGET_PWD_SUBJECT, html);
        } catch (MailDeliveryException e) {
            throw new MailDeliveryException(CODE_SEND_FAILED_MSG, e.getCause());
        }
    }

    @Override
    public void sendTestMail(EmailSendRequest request) {
        SmtpAccount smtp = currentAccount()
                .orElseThrow(() -> new BusinessException(SMTP_NOT_CONFIGURED_MSG));
        sendHtml(smtp.withSenderName(request.getSender()), request.getReceiveEmail(),
                request.getTitle(), request.getContent());
    }
}
