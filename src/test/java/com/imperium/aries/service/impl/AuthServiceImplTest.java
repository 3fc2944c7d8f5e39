package com.imperium.aries.service.impl;

import com.imperium.aries.cache.CacheKeys;
import com.imperium.aries.cache.ExpiringCache;
import com.imperium.aries.common.BusinessException;
import com.imperium.aries.common.MailDeliveryException;
import com.imperium.aries.model.dto.request.ForgetPwdRequest;
import com.imperium.aries.model.dto.request.LoginRequest;
import com.imperium.aries.model.dto.request.RegisterRequest;
import com.imperium.aries.model.dto.request.ResetPwdRequest;
import com.imperium.aries.model.dto.response.TokenResponse;
import com.imperium.aries.model.entity.SysSetting;
import com.imperium.aries.model.entity.SysSettingItem;
import com.imperium.aries.model.entity.User;
import com.imperium.aries.security.JwtTokenProvider;
import com.imperium.aries.service.CaptchaService;
import com.imperium.aries.service.MailService;
import com.imperium.aries.service.SysSettingItemService;
import com.imperium.aries.service.SysSettingService;
import com.imperium.aries.service.UserService;
import com.imperium.aries.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AuthServiceImplTest {

    private UserService userService;
    private SysSettingService sysSettingService;
    private SysSettingItemService sysSettingItemService;
    private CaptchaService captchaService;
    private MailService mailService;
    private JwtTokenProvider tokenProvider;
    private PasswordEncoder passwordEncoder;
    private MutableClock clock;
    private ExpiringCache cache;
    private AuthServiceImpl authService;

    @BeforeEach
    void setUp() {
        userService = mock(UserService.class);
        sysSettingService = mock(SysSettingService.class);
        sysSettingItemService = mock(SysSettingItemService.class);
        captchaService = mock(CaptchaService.class);
        mailService = mock(MailService.class);
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        tokenProvider = new JwtTokenProvider("unit-test-secret-that-is-long-enough-for-hs256", 7200, clock);
        passwordEncoder = new BCryptPasswordEncoder(4);
        cache = new ExpiringCache(clock);
        authService = new AuthServiceImpl(userService, sysSettingService, sysSettingItemService,
                captchaService, mailService, tokenProvider, passwordEncoder, cache);
    }

    // ---- register ----

    @Test
    void register_createsHashedUserAndSiteSettings() {
        SysSetting site = new SysSetting(7L, SysSetting.SITE, null, null);
        when(sysSettingService.getOrCreate(SysSetting.SITE)).thenReturn(site);
        when(userService.save(any(User.class))).thenReturn(true);

        authService.register(registerRequest("alice", "Secret123!", "a@x.com", "Blog", "https://blog.x.com"));

        ArgumentCaptor<User> userCaptor = ArgumentCaptor.forClass(User.class);
        verify(userService).save(userCaptor.capture());
        User saved = userCaptor.getValue();
        assertEquals("alice", saved.getUsername());
        assertEquals("a@x.com", saved.getEmail());
        assertNotEquals("Secret123!", saved.getPassword());
        assertTrue(passwordEncoder.matches("Secret123!", saved.getPassword()));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<SysSettingItem>> itemsCaptor = ArgumentCaptor.forClass(Collection.class);
        verify(sysSettingItemService).upsertBatch(eq(7L), itemsCaptor.capture());
        Map<String, String> items = itemsCaptor.getValue().stream()
                .collect(Collectors.toMap(SysSettingItem::getKey, SysSettingItem::getVal));
        assertEquals(Map.of(
                "type_name", SysSetting.SITE,
                "site_name", "Blog",
                "site_url", "https://blog.x.com"), items);
    }

    @Test
    void register_duplicateUsername_isRequestErrorAndCreatesNothing() {
        when(userService.getByUsername("alice")).thenReturn(user(1L, "alice", "a@x.com", "Secret123!"));

        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.register(registerRequest("alice", "Secret123!", "other@x.com", "Blog", "https://b")));

        assertEquals("该用户已被注册", ex.getMessage());
        verify(userService, never()).save(any());
        verifyNoInteractions(sysSettingService, sysSettingItemService);
    }

    @Test
    void register_duplicateEmail_isRequestError() {
        when(userService.getByEmail("a@x.com")).thenReturn(user(1L, "alice", "a@x.com", "Secret123!"));

        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.register(registerRequest("bob", "Secret123!", "a@x.com", "Blog", "https://b")));

        assertEquals(AuthServiceImpl.EMAIL_EXISTS_MSG, ex.getMessage());
        verify(userService, never()).save(any());
    }

    @Test
    void register_concurrentDuplicateUsername_isRequestError() {
        when(userService.save(any(User.class))).thenThrow(new DuplicateKeyException("insert users",
                new SQLIntegrityConstraintViolationException("Duplicate entry 'alice' for key 'users.uk_users_username'")));

        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.register(registerRequest("alice", "Secret123!", "a@x.com", "Blog", "https://b")));

        assertEquals(AuthServiceImpl.USER_EXISTS_MSG, ex.getMessage());
        verifyNoInteractions(sysSettingService, sysSettingItemService);
    }

    @Test
    void register_concurrentDuplicateEmail_isRequestError() {
        when(userService.save(any(User.class))).thenThrow(new DuplicateKeyException("insert users",
                new SQLIntegrityConstraintViolationException("Duplicate entry 'a@x.com' for key 'users.uk_users_email'")));

        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.register(registerRequest("alice", "Secret123!", "a@x.com", "Blog", "https://b")));

        assertEquals(AuthServiceImpl.EMAIL_EXISTS_MSG, ex.getMessage());
    }

    @Test
    void register_settingsFailurePropagatesSoTransactionRollsBack() {
        when(userService.save(any(User.class))).thenReturn(true);
        when(sysSettingService.getOrCreate(SysSetting.SITE)).thenThrow(new IllegalStateException("db down"));

        assertThrows(IllegalStateException.class, () ->
                authService.register(registerRequest("alice", "Secret123!", "a@x.com", "Blog", "https://b")));
        verifyNoInteractions(sysSettingItemService);
    }

    // ---- login ----

    @Test
    void login_success_returnsTokenAndIdentity() {
        when(captchaService.verify("cid", "AbCd")).thenReturn(true);
        User alice = user(3L, "alice", "a@x.com", "Secret123!");
        alice.setUserImg("/img/a.png");
        when(userService.getByUsername("alice")).thenReturn(alice);

        TokenResponse response = authService.login(loginRequest("alice", "Secret123!", "cid", "AbCd"));

        assertEquals(3L, response.getUserId());
        assertEquals("alice", response.getUsername());
        assertEquals("/img/a.png", response.getUserImg());
        assertEquals("alice", tokenProvider.parse(response.getToken()).orElseThrow().username());
    }

    @Test
    void login_badCaptcha_isRequestErrorEvenWithCorrectCredentials() {
        when(captchaService.verify("cid", "xxxx")).thenReturn(false);

        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.login(loginRequest("alice", "Secret123!", "cid", "xxxx")));

        assertEquals("验证码错误", ex.getMessage());
        verifyNoInteractions(userService);
    }

    @Test
    void login_unknownUser_isRequestError() {
        when(captchaService.verify(anyString(), anyString())).thenReturn(true);

        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.login(loginRequest("ghost", "whatever", "cid", "abcd")));

        assertEquals("不存在该用户", ex.getMessage());
    }

    @Test
    void login_wrongPassword_isRequestError() {
        when(captchaService.verify(anyString(), anyString())).thenReturn(true);
        when(userService.getByUsername("alice")).thenReturn(user(3L, "alice", "a@x.com", "Secret123!"));

        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.login(loginRequest("alice", "secret123!", "cid", "abcd")));

        assertEquals("密码错误", ex.getMessage());
    }

    // ---- forget password ----

    @Test
    void forgetPwd_unknownEmail_isRequestErrorAndSendsNothing() {
        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.forgetPwd(forgetRequest("nobody@x.com")));

        assertEquals("不存在该邮箱帐号", ex.getMessage());
        verifyNoInteractions(mailService);
        assertNull(cache.get(CacheKeys.PWD_RESET_CODE + "nobody@x.com"));
    }

    @Test
    void forgetPwd_generatesSixDigitCodeAndMailsIt() {
        when(userService.getByEmail("a@x.com")).thenReturn(user(3L, "alice", "a@x.com", "pw"));

        authService.forgetPwd(forgetRequest("a@x.com"));

        ArgumentCaptor<String> codeCaptor = ArgumentCaptor.forClass(String.class);
        verify(mailService).sendForgetPwdCode(eq("a@x.com"), eq("alice"), codeCaptor.capture());
        assertTrue(codeCaptor.getValue().matches("\\d{6}"));
        assertEquals(codeCaptor.getValue(), cache.get(CacheKeys.PWD_RESET_CODE + "a@x.com"));
    }

    @Test
    void forgetPwd_twiceWithinTtl_sendsIdenticalCode() {
        AtomicInteger seq = new AtomicInteger(100000);
        authService.setVerifyCodeSupplier(() -> String.valueOf(seq.incrementAndGet()));
        when(userService.getByEmail("a@x.com")).thenReturn(user(3L, "alice", "a@x.com", "pw"));

        authService.forgetPwd(forgetRequest("a@x.com"));
        clock.advance(Duration.ofMinutes(14));
        authService.forgetPwd(forgetRequest("a@x.com"));

        List<String> codes = sentCodes(2);
        assertEquals(codes.get(0), codes.get(1));
    }

    @Test
    void forgetPwd_afterTtl_sendsDifferentCode() {
        AtomicInteger seq = new AtomicInteger(100000);
        authService.setVerifyCodeSupplier(() -> String.valueOf(seq.incrementAndGet()));
        when(userService.getByEmail("a@x.com")).thenReturn(user(3L, "alice", "a@x.com", "pw"));

        authService.forgetPwd(forgetRequest("a@x.com"));
        clock.advance(Duration.ofMinutes(15));
        authService.forgetPwd(forgetRequest("a@x.com"));

        List<String> codes = sentCodes(2);
        assertNotEquals(codes.get(0), codes.get(1));
    }

    @Test
    void forgetPwd_mailFailurePropagates() {
        when(userService.getByEmail("a@x.com")).thenReturn(user(3L, "alice", "a@x.com", "pw"));
        doThrow(new MailDeliveryException("验证码发送失败，请检查 smtp 配置"))
                .when(mailService).sendForgetPwdCode(anyString(), anyString(), anyString());

        assertThrows(MailDeliveryException.class, () -> authService.forgetPwd(forgetRequest("a@x.com")));
    }

    // ---- reset password ----

    @Test
    void resetPwd_withMatchingCode_updatesHashedPassword() {
        cache.put(CacheKeys.PWD_RESET_CODE + "a@x.com", "123456", CacheKeys.PWD_RESET_CODE_TTL);
        when(userService.updatePasswordByEmail(eq("a@x.com"), anyString())).thenReturn(true);

        authService.resetPwd(resetRequest("a@x.com", "123456", "NewSecret1"));

        ArgumentCaptor<String> hashCaptor = ArgumentCaptor.forClass(String.class);
        verify(userService).updatePasswordByEmail(eq("a@x.com"), hashCaptor.capture());
        assertTrue(passwordEncoder.matches("NewSecret1", hashCaptor.getValue()));
        assertEquals("123456", cache.get(CacheKeys.PWD_RESET_CODE + "a@x.com"), "code is kept by default");
    }

    @Test
    void resetPwd_acceptsCodeIssuedForDifferentlyCasedEmail() {
        when(userService.getByEmail("Alice@X.com")).thenReturn(user(3L, "alice", "alice@x.com", "pw"));
        when(userService.updatePasswordByEmail(eq("alice@x.com"), anyString())).thenReturn(true);

        authService.forgetPwd(forgetRequest("Alice@X.com"));
        ArgumentCaptor<String> codeCaptor = ArgumentCaptor.forClass(String.class);
        verify(mailService).sendForgetPwdCode(eq("Alice@X.com"), eq("alice"), codeCaptor.capture());

        authService.resetPwd(resetRequest("alice@x.com", codeCaptor.getValue(), "NewSecret1"));

        verify(userService).updatePasswordByEmail(eq("alice@x.com"), anyString());
    }

    @Test
    void resetCodeKey_trimsAndLowercases() {
        assertEquals(CacheKeys.PWD_RESET_CODE + "a@x.com", AuthServiceImpl.resetCodeKey("  A@X.Com "));
    }

    @Test
    void resetPwd_invalidatesCodeWhenConfigured() {
        authService.setInvalidateCodeAfterReset(true);
        cache.put(CacheKeys.PWD_RESET_CODE + "a@x.com", "123456", CacheKeys.PWD_RESET_CODE_TTL);
        when(userService.updatePasswordByEmail(eq("a@x.com"), anyString())).thenReturn(true);

        authService.resetPwd(resetRequest("a@x.com", "123456", "NewSecret1"));

        assertNull(cache.get(CacheKeys.PWD_RESET_CODE + "a@x.com"));
    }

    @Test
    void resetPwd_mismatchedCode_isRequestErrorAndDoesNotTouchUser() {
        cache.put(CacheKeys.PWD_RESET_CODE + "a@x.com", "123456", CacheKeys.PWD_RESET_CODE_TTL);

        BusinessException ex = assertThrows(BusinessException.class, () ->
                authService.resetPwd(resetRequest("a@x.com", "654321", "NewSecret1")));

        assertEquals("验证码无效或错误", ex.getMessage());
        verify(userService, never()).updatePasswordByEmail(anyString(), anyString());
    }

    @Test
    void resetPwd_expiredCode_isRequestError() {
        cache.put(CacheKeys.PWD_RESET_CODE + "a@x.com", "123456", CacheKeys.PWD_RESET_CODE_TTL);
        clock.advance(Duration.ofMinutes(16));

        assertThrows(BusinessException.class, () ->
                authService.resetPwd(resetRequest("a@x.com", "123456", "NewSecret1")));
        verify(userService, never()).updatePasswordByEmail(anyString(), anyString());
    }

    @Test
    void resetPwd_persistenceFailureIsServerSide() {
        cache.put(CacheKeys.PWD_RESET_CODE + "a@x.com", "123456", CacheKeys.PWD_RESET_CODE_TTL);
        when(userService.updatePasswordByEmail(eq("a@x.com"), anyString())).thenReturn(false);

        assertThrows(IllegalStateException.class, () ->
                authService.resetPwd(resetRequest("a@x.com", "123456", "NewSecret1")));
    }

    private List<String> sentCodes(int count) {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(mailService, times(count)).sendForgetPwdCode(eq("a@x.com"), eq("alice"), captor.capture());
        return new ArrayList<>(captor.getAllValues());
    }

    private User user(Long id, String username, String email, String rawPassword) {
        User user = new User();
        user.setId(id);
        user.setUsername(username);
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(rawPassword));
        return user;
    }

    private static RegisterRequest registerRequest(String username, String password, String email,
                                                   String siteName, String siteUrl) {
        RegisterRequest request = new RegisterRequest();
        request.setUsername(username);
        request.setPassword(password);
        request.setEmail(email);
        request.setSiteName(siteName);
        request.setSiteUrl(siteUrl);
        return request;
    }

    private static LoginRequest loginRequest(String username, String password, String captchaId, String captchaVal) {
        LoginRequest request = new LoginRequest();
        request.setUsername(username);
        request.setPassword(password);
        request.setCaptchaId(captchaId);
        request.setCaptchaVal(captchaVal);
        return request;
    }

    private static ForgetPwdRequest forgetRequest(String email) {
        ForgetPwdRequest request = new ForgetPwdRequest();
        request.setEmail(email);
        return request;
    }

    private static ResetPwdRequest resetRequest(String email, String code, String password) {
        ResetPwdRequest request = new ResetPwdRequest();
        request.setEmail(email);
        request.setVerifyCode(code);
        request.setPassword(password);
        return request;
    }
}
