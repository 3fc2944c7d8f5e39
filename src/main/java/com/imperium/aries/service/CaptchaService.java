package com.imperium.aries.service;

import com.imperium.aries.model.dto.response.CaptchaResponse;

/**
 * 登录图片验证码。
 */
public interface CaptchaService {

    /**
     * 生成验证码图片，答案按 ID 缓存。
     */
    CaptchaResponse create();

    /**
     * 校验用户输入。无论结果如何，该 ID 对应的验证码都会被消费。
     */
    boolean verify(String captchaId, String answer);
}
