package com.imperium.aries.model.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Schema(description = "网站设置表单")
public class SiteSettingRequest {

    @Schema(description = "设置 ID，为空时按 type_name 创建分组")
    private Long sysId;

    @NotBlank(message = "设置类型名称为必填字段")
    @Size(max = 50, message = "设置类型名称长度不能超过 50 个字符")
    private String typeName;

    @NotBlank(message = "网站名称为必填字段")
    @Size(max = 50, message = "网站名称长度不能超过 50 个字符")
    private String siteName;

    private String siteDesc;

    @NotBlank(message = "网站地址为必填字段")
    @Size(max = 255, message = "网站地址长度不能超过 255 个字符")
    private String siteUrl;

    private String siteLogo;

    private String seoKeyWords;

    @Schema(description = "全局 head")
    private String headContent;

    @Schema(description = "全局 footer")
    private String footerContent;

    public Map<String, String> toItems() {
        Map<String, String> items = new LinkedHashMap<>();
        items.put("type_name", typeName);
        items.put("site_name", siteName);
        items.put("site_desc", siteDesc);
        items.put("site_url", siteUrl);
        items.put("site_logo", siteLogo);
        items.put("seo_key_words", seoKeyWords);
        items.put("head_content", headContent);
        items.put("footer_content", footerContent);
        return items;
    }
}
