package com.imperium.aries.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "重置密码表单")
public class ResetPwdRequest {

    @NotBlank(message = "邮箱为必填字段")
    @Email(message = "邮箱格式不正确")
    private String email;

    @NotBlank(message = "验证码为必填字段")
    @Schema(description = "邮件中收到的 6 位验证码")
    private String verifyCode;

    @NotBlank(message = "新密码为必填字段")
    @Size(min = 6, max = 30, message = "新密码长度必须在 6 到 30 个字符之间")
    private String password;
}
