package com.imperium.aries.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ArticleCategoryAddRequest {

    @NotBlank(message = "分类名称为必填字段")
    @Size(max = 100, message = "分类名称长度不能超过 100 个字符")
    private String name;

    @NotBlank(message = "访问 URL 为必填字段")
    @Size(max = 255, message = "访问 URL 长度不能超过 255 个字符")
    private String url;

    /** 父级分类 ID，为空或 0 表示顶级分类 */
    private Long parentId;
}
