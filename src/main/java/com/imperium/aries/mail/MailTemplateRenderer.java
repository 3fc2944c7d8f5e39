package com.imperium.aries.mail;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 加载 classpath:templates/mail/ 下的 HTML 模板，替换 {{name}} 占位符（值会做 HTML 转义）。
 */
@Component
public class MailTemplateRenderer {

    public static final String FORGET_PWD = "forget-pwd.html";

    private static final String TEMPLATE_DIR = "templates/mail/";

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public String render(String templateName, Map<String, String> variables) {
        String html = templates.computeIfAbsent(templateName, MailTemplateRenderer::load);
        for (Map.Entry<String, String> e : variables.entrySet()) {
            String value = e.getValue() != null ? HtmlUtils.htmlEscape(e.getValue()) : "";
            html = html.replace("{{" + e.getKey() + "}}", value);
        }
        return html;
    }

    private static String load(String templateName) {
        ClassPathResource resource = new ClassPathResource(TEMPLATE_DIR + templateName);
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Mail template not found: " + templateName, e);
        }
    }
}
