package com.imperium.aries.model.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "图片验证码")
public class CaptchaResponse {

    @Schema(description = "验证码 ID，登录时回传")
    private String captchaId;

    @Schema(description = "可直接作为 img src 的 data URL")
    private String captchaUrl;
}
