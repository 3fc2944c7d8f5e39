package com.imperium.aries.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import jakarta.validation.groups.Default;
import lombok.Data;

/**
 * 添加/修改友链表单。修改时按 {@link Edit} 分组额外校验 id。
 */
@Data
@Schema(description = "友链表单")
public class LinkRequest {

    public interface Edit extends Default {
    }

    @NotNull(message = "ID 为必填字段", groups = Edit.class)
    private Long id;

    @Schema(description = "友链分类 ID，可为空")
    private Long categoryId;

    @NotBlank(message = "网站名称为必填字段")
    @Size(max = 100, message = "网站名称长度不能超过 100 个字符")
    private String name;

    @NotBlank(message = "网站地址为必填字段")
    @Size(max = 255, message = "网站地址长度不能超过 255 个字符")
    private String url;

    @Size(max = 255, message = "网站描述长度不能超过 255 个字符")
    @Schema(description = "网站描述")
    private String desc;

    @NotBlank(message = "图标为必填字段")
    @Size(max = 255, message = "图标地址长度不能超过 255 个字符")
    private String icon;
}
