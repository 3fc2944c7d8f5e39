package com.imperium.aries.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 注册表单：管理员账号 + 初始网站设置。
 */
@Data
@Schema(description = "注册表单")
public class RegisterRequest {

    @NotBlank(message = "用户名为必填字段")
    @Size(max = 30, message = "用户名长度不能超过 30 个字符")
    private String username;

    @NotBlank(message = "密码为必填字段")
    @Size(min = 6, max = 30, message = "密码长度必须在 6 到 30 个字符之间")
    private String password;

    @NotBlank(message = "邮箱为必填字段")
    @Email(message = "邮箱格式不正确")
    @Size(max = 50, message = "邮箱长度不能超过 50 个字符")
    private String email;

    @NotBlank(message = "网站名称为必填字段")
    @Size(max = 50, message = "网站名称长度不能超过 50 个字符")
    @Schema(description = "网站名称", example = "Blog")
    private String siteName;

    @NotBlank(message = "网站地址为必填字段")
    @Size(max = 255, message = "网站地址长度不能超过 255 个字符")
    @Schema(description = "网站地址", example = "https://blog.example.com")
    private String siteUrl;
}
