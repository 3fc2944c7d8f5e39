package com.imperium.aries.controller;

import com.imperium.aries.common.Result;
import com.imperium.aries.model.dto.request.ForgetPwdRequest;
import com.imperium.aries.model.dto.request.LoginRequest;
import com.imperium.aries.model.dto.request.RegisterRequest;
import com.imperium.aries.model.dto.request.ResetPwdRequest;
import com.imperium.aries.model.dto.response.CaptchaResponse;
import com.imperium.aries.model.dto.response.TokenResponse;
import com.imperium.aries.service.AuthService;
import com.imperium.aries.service.CaptchaService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 授权接口：注册、登录、图片验证码、忘记/重置密码。无需 token。
 */
@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "授权", description = "注册、登录与密码找回")
public class AuthController {

    private final AuthService authService;
    private final CaptchaService captchaService;

    public AuthController(AuthService authService, CaptchaService captchaService) {
        this.authService = authService;
        this.captchaService = captchaService;
    }

    @PostMapping("/register")
    @Operation(summary = "注册", description = "创建管理员账号并初始化网站设置")
    public Result<Void> register(@Valid @RequestBody RegisterRequest request) {
        authService.register(request);
        return Result.success("注册成功");
    }

    @PostMapping("/login")
    @Operation(summary = "登录", description = "校验图片验证码与密码，返回 token")
    public Result<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return Result.success("登录成功", authService.login(request));
    }

    @GetMapping("/captcha")
    @Operation(summary = "创建验证码", description = "返回 captcha_id 与可嵌入的 base64 图片")
    public Result<CaptchaResponse> captcha() {
        return Result.success("验证码创建成功", captchaService.create());
    }

    @PostMapping("/pwd/forget")
    @Operation(summary = "忘记密码", description = "向注册邮箱发送 6 位验证码，15 分钟内有效")
    public Result<Void> forgetPwd(@Valid @RequestBody ForgetPwdRequest request) {
        authService.forgetPwd(request);
        return Result.success("验证码发送成功，请前往邮箱查看");
    }

    @PostMapping("/pwd/reset")
    @Operation(summary = "重置密码")
    public Result<Void> resetPwd(@Valid @RequestBody ResetPwdRequest request) {
        authService.resetPwd(request);
        return Result.success("重置密码成功");
    }
}
