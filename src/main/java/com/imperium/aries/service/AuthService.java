package com.imperium.aries.service;

import com.imperium.aries.model.dto.request.ForgetPwdRequest;
import com.imperium.aries.model.dto.request.LoginRequest;
import com.imperium.aries.model.dto.request.RegisterRequest;
import com.imperium.aries.model.dto.request.ResetPwdRequest;
import com.imperium.aries.model.dto.response.TokenResponse;

/**
 * 注册、登录、忘记密码、重置密码。
 * 业务校验失败抛出 {@link com.imperium.aries.common.BusinessException}。
 */
public interface AuthService {

    /**
     * 创建用户并初始化网站设置，整体在一个事务内。
     */
    void register(RegisterRequest request);

    /**
     * 校验验证码与密码后签发 token。
     */
    TokenResponse login(LoginRequest request);

    /**
     * 向注册邮箱发送验证码；15 分钟内重复请求发送同一个验证码。
     */
    void forgetPwd(ForgetPwdRequest request);

    void resetPwd(ResetPwdRequest request);
}
