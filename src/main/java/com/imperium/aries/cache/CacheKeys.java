package com.imperium.aries.cache;

import java.time.Duration;

/**
 * 进程内缓存的键前缀与过期时间。
 */
public final class CacheKeys {

    /** 忘记密码邮箱验证码：前缀 + 邮箱 */
    public static final String PWD_RESET_CODE = "auth:pwd:reset:";

    /** 忘记密码验证码有效期 */
    public static final Duration PWD_RESET_CODE_TTL = Duration.ofMinutes(15);

    /** 登录图片验证码：前缀 + captchaId */
    public static final String LOGIN_CAPTCHA = "auth:login:captcha:";

    private CacheKeys() {
    }
}
