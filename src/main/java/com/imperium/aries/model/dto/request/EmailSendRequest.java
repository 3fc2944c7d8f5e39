package com.imperium.aries.model.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 发送测试邮件表单。
 */
@Data
public class EmailSendRequest {

    @NotBlank(message = "发送人为必填字段")
    @Size(max = 30, message = "发送人长度不能超过 30 个字符")
    private String sender;

    @NotBlank(message = "接收邮箱为必填字段")
    @Email(message = "接收邮箱格式不正确")
    @Size(max = 30, message = "接收邮箱长度不能超过 30 个字符")
    private String receiveEmail;

    @NotBlank(message = "邮件标题为必填字段")
    @Size(max = 100, message = "邮件标题长度不能超过 100 个字符")
    private String title;

    @NotBlank(message = "邮件内容为必填字段")
    @Size(max = 1200, message = "邮件内容长度不能超过 1200 个字符")
    private String content;
}
