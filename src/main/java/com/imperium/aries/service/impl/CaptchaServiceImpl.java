package com.imperium.aries.service.impl;

import com.imperium.aries.cache.CacheKeys;
import com.imperium.aries.cache.ExpiringCache;
import com.imperium.aries.captcha.CaptchaImageRenderer;
import com.imperium.aries.model.dto.response.CaptchaResponse;
import com.imperium.aries.service.CaptchaService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Random;
import java.util.UUID;

/**
 * 图片验证码：答案存入 {@link ExpiringCache}，校验时一次性消费。
 */
@Service
public class CaptchaServiceImpl implements CaptchaService {

    /** 去掉了 0/O、1/I/l 等易混淆字符 */
    static final String ALPHABET = "23456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghjkmnpqrstuvwxyz";

    private final ExpiringCache cache;
    private final CaptchaImageRenderer renderer;
    private final Random random = new SecureRandom();

    @Value("${app.captcha.length:4}")
    private int length = 4;

    @Value("${app.captcha.expire-seconds:300}")
    private long expireSeconds = 300;

    @Value("${app.captcha.case-sensitive:false}")
    private boolean caseSensitive;

    public CaptchaServiceImpl(ExpiringCache cache, CaptchaImageRenderer renderer) {
        this.cache = cache;
        this.renderer = renderer;
    }

    @Override
    public CaptchaResponse create() {
        String id = UUID.randomUUID().toString().replace("-", "");
        String answer = randomText();
        String dataUrl = renderer.renderDataUrl(answer);
        cache.put(CacheKeys.LOGIN_CAPTCHA + id, answer, Duration.ofSeconds(expireSeconds));
        return CaptchaResponse.builder()
                .captchaId(id)
                .captchaUrl(dataUrl)
                .build();
    }

    @Override
    public boolean verify(String captchaId, String answer) {
        if (captchaId == null || captchaId.isBlank()) {
            return false;
        }
        String expected = cache.remove(CacheKeys.LOGIN_CAPTCHA + captchaId);
        if (expected == null || answer == null) {
            return false;
        }
        String actual = answer.trim();
        return caseSensitive ? expected.equals(actual) : expected.equalsIgnoreCase(actual);
    }

    private String randomText() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    void setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }
}
