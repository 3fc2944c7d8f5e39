package com.imperium.aries.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Schema(description = "SMTP 配置表单")
public class SmtpSettingRequest {

    private Long sysId;

    @NotBlank(message = "设置类型名称为必填字段")
    @Size(max = 50, message = "设置类型名称长度不能超过 50 个字符")
    private String typeName;

    @NotBlank(message = "SMTP 地址为必填字段")
    @Size(max = 30, message = "SMTP 地址长度不能超过 30 个字符")
    private String address;

    @NotBlank(message = "端口为必填字段")
    @Pattern(regexp = "^\\d{1,5}$", message = "端口必须为数字")
    private String port;

    @NotBlank(message = "邮箱帐号为必填字段")
    @Email(message = "邮箱帐号格式不正确")
    @Size(max = 30, message = "邮箱帐号长度不能超过 30 个字符")
    private String account;

    @NotBlank(message = "密码为必填字段")
    @Size(max = 30, message = "密码长度不能超过 30 个字符")
    private String pwd;

    @NotBlank(message = "发送人为必填字段")
    @Size(max = 30, message = "发送人长度不能超过 30 个字符")
    private String sender;

    public Map<String, String> toItems() {
        Map<String, String> items = new LinkedHashMap<>();
        items.put("type_name", typeName);
        items.put("address", address);
        items.put("port", port);
        items.put("account", account);
        items.put("pwd", pwd);
        items.put("sender", sender);
        return items;
    }
}
