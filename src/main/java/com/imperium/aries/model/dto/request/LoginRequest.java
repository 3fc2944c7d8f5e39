package com.imperium.aries.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "登录表单")
public class LoginRequest {

    @NotBlank(message = "用户名为必填字段")
    private String username;

    @NotBlank(message = "密码为必填字段")
    private String password;

    @NotBlank(message = "验证码 ID 为必填字段")
    @Schema(description = "GET /auth/captcha 返回的 captcha_id")
    private String captchaId;

    @NotBlank(message = "验证码为必填字段")
    @Schema(description = "用户输入的验证码")
    private String captchaVal;
}
