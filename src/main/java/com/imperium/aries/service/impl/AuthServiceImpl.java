package com.imperium.aries.service.impl;

import com.imperium.aries.cache.CacheKeys;
import com.imperium.aries.cache.ExpiringCache;
import com.imperium.aries.common.BusinessException;
import com.imperium.aries.model.dto.request.ForgetPwdRequest;
import com.imperium.aries.model.dto.request.LoginRequest;
import com.imperium.aries.model.dto.request.RegisterRequest;
import com.imperium.aries.model.dto.request.ResetPwdRequest;
import com.imperium.aries.model.dto.response.TokenResponse;
import com.imperium.aries.model.entity.SysSetting;
import com.imperium.aries.model.entity.SysSettingItem;
import com.imperium.aries.model.entity.User;
import com.imperium.aries.security.JwtTokenProvider;
import com.imperium.aries.service.AuthService;
import com.imperium.aries.service.CaptchaService;
import com.imperium.aries.service.MailService;
import com.imperium.aries.service.SysSettingItemService;
import com.imperium.aries.service.SysSettingService;
import com.imperium.aries.service.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.function.Supplier;

@Service
public class AuthServiceImpl implements AuthService {

    static final String USER_EXISTS_MSG = "该用户已被注册";
    static final String EMAIL_EXISTS_MSG = "该邮箱已被注册";
    static final String CAPTCHA_ERROR_MSG = "验证码错误";
    static final String USER_NOT_FOUND_MSG = "不存在该用户";
    static final String PASSWORD_ERROR_MSG = "密码错误";
    static final String EMAIL_NOT_FOUND_MSG = "不存在该邮箱帐号";
    static final String VERIFY_CODE_INVALID_MSG = "验证码无效或错误";

    static final int VERIFY_CODE_LENGTH = 6;

    private static final String EMAIL_UNIQUE_KEY = "uk_users_email";

    private static final Logger log = LoggerFactory.getLogger(AuthServiceImpl.class);

    private final UserService userService;
    private final SysSettingService sysSettingService;
    private final SysSettingItemService sysSettingItemService;
    private final CaptchaService captchaService;
    private final MailService mailService;
    private final JwtTokenProvider tokenProvider;
    private final PasswordEncoder passwordEncoder;
    private final ExpiringCache cache;
    private final Random random = new SecureRandom();

    private Supplier<String> verifyCodeSupplier = this::randomVerifyCode;

    @Value("${app.auth.default-avatar:}")
    private String defaultAvatar = "";

    /** 重置成功后是否立即作废验证码；默认保留到自然过期 */
    @Value("${app.auth.invalidate-code-after-reset:false}")
    private boolean invalidateCodeAfterReset;

    public AuthServiceImpl(UserService userService,
                           SysSettingService sysSettingService,
                           SysSettingItemService sysSettingItemService,
                           CaptchaService captchaService,
                           MailService mailService,
                           JwtTokenProvider tokenProvider,
                           PasswordEncoder passwordEncoder,
                           ExpiringCache cache) {
        this.userService = userService;
        this.sysSettingService = sysSettingService;
        this.sysSettingItemService = sysSettingItemService;
        this.captchaService = captchaService;
        this.mailService = mailService;
        this.tokenProvider = tokenProvider;
        this.passwordEncoder = passwordEncoder;
        this.cache = cache;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void register(RegisterRequest request) {
        if (userService.getByUsername(request.getUsername()) != null) {
            throw new BusinessException(USER_EXISTS_MSG);
        }
        if (userService.getByEmail(request.getEmail()) != null) {
            throw new BusinessException(EMAIL_EXISTS_MSG);
        }

        LocalDateTime now = LocalDateTime.now();
        User user = new User();
        user.setUsername(request.getUsername());
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setEmail(request.getEmail());
        user.setUserImg(defaultAvatar);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        boolean saved;
        try {
            saved = userService.save(user);
        } catch (DuplicateKeyException e) {
            // 并发注册：检查通过后被另一请求抢先插入
            log.info("Register raced on unique key for '{}': {}", request.getUsername(), e.getMessage());
            throw new BusinessException(isEmailConflict(e) ? EMAIL_EXISTS_MSG : USER_EXISTS_MSG);
        }
        if (!saved) {
            throw new IllegalStateException("Insert user returned no rows: " + request.getUsername());
        }

        SysSetting site = sysSettingService.getOrCreate(SysSetting.SITE);
        sysSettingItemService.upsertBatch(site.getId(), List.of(
                new SysSettingItem(site.getId(), "type_name", SysSetting.SITE),
                new SysSettingItem(site.getId(), "site_name", request.getSiteName()),
                new SysSettingItem(site.getId(), "site_url", request.getSiteUrl())));
        log.info("Registered user '{}' (id={}), site settings group {}", user.getUsername(), user.getId(), site.getId());
    }

    @Override
    public TokenResponse login(LoginRequest request) {
        if (!captchaService.verify(request.getCaptchaId(), request.getCaptchaVal())) {
            throw new BusinessException(CAPTCHA_ERROR_MSG);
        }
        User user = userService.getByUsername(request.getUsername());
        if (user == null) {
            throw new BusinessException(USER_NOT_FOUND_MSG);
        }
        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            log.info("Login rejected for '{}': wrong password", request.getUsername());
            throw new BusinessException(PASSWORD_ERROR_MSG);
        }
        String token = tokenProvider.createToken(user.getUsername(), user.getUserImg());
        return TokenResponse.builder()
                .token(token)
                .userId(user.getId())
                .username(user.getUsername())
                .userImg(user.getUserImg())
                .build();
    }

    @Override
    public void forgetPwd(ForgetPwdRequest request) {
        User user = userService.getByEmail(request.getEmail());
        if (user == null) {
            throw new BusinessException(EMAIL_NOT_FOUND_MSG);
        }
        String code = cache.getOrCreate(resetCodeKey(request.getEmail()),
                verifyCodeSupplier, CacheKeys.PWD_RESET_CODE_TTL);
        mailService.sendForgetPwdCode(request.getEmail(), user.getUsername(), code);
    }

    @Override
    public void resetPwd(ResetPwdRequest request) {
        String key = resetCodeKey(request.getEmail());
        String cached = cache.get(key);
        if (cached == null || !cached.equals(request.getVerifyCode().trim())) {
            throw new BusinessException(VERIFY_CODE_INVALID_MSG);
        }
        if (!userService.updatePasswordByEmail(request.getEmail(), passwordEncoder.encode(request.getPassword()))) {
            throw new IllegalStateException("No user updated for email " + request.getEmail());
        }
        if (invalidateCodeAfterReset) {
            cache.remove(key);
        }
        log.info("Password reset for {}", request.getEmail());
    }

    /**
     * 邮箱按库中大小写不敏感的比较规则归一化，忘记密码与重置密码共用同一个 key。
     */
    static String resetCodeKey(String email) {
        return CacheKeys.PWD_RESET_CODE + email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isEmailConflict(DuplicateKeyException e) {
        String detail = e.getMostSpecificCause().getMessage();
        return detail != null && detail.contains(EMAIL_UNIQUE_KEY);
    }

    private String randomVerifyCode() {
        StringBuilder sb = new StringBuilder(VERIFY_CODE_LENGTH);
        for (int i = 0; i < VERIFY_CODE_LENGTH; i++) {
            sb.append(random.nextInt(10));
        }
        return sb.toString();
    }

    void setVerifyCodeSupplier(Supplier<String> verifyCodeSupplier) {
        this.verifyCodeSupplier = verifyCodeSupplier;
    }

    void setInvalidateCodeAfterReset(boolean invalidateCodeAfterReset) {
        this.invalidateCodeAfterReset = invalidateCodeAfterReset;
    }
}
