package com.imperium.aries.model.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ForgetPwdRequest {

    @NotBlank(message = "邮箱为必填字段")
    @Email(message = "邮箱格式不正确")
    private String email;
}
