package com.imperium.aries.model.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 登录成功返回的 token 与最小用户信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "登录结果")
public class TokenResponse {

    @Schema(description = "Bearer token")
    private String token;

    private Long userId;

    private String username;

    @Schema(description = "头像地址")
    private String userImg;
}
