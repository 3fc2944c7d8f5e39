package com.imperium.aries.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class LinkCategoryEditRequest {

    @NotNull(message = "ID 为必填字段")
    private Long id;

    @NotBlank(message = "分类名称为必填字段")
    @Size(max = 100, message = "分类名称长度不能超过 100 个字符")
    private String name;
}
