package com.imperium.aries.model.dto.response;

import com.imperium.aries.model.entity.Category;
import com.imperium.aries.model.entity.Link;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "友链")
public class LinkResponse {

    private Long id;

    private Long categoryId;

    @Schema(description = "所属分类，已删除的分类仍会返回")
    private Category category;

    private String name;

    private String url;

    private String desc;

    private String icon;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static LinkResponse of(Link link, Category category) {
        return LinkResponse.builder()
                .id(link.getId())
                .categoryId(link.getCategoryId())
                .category(category)
                .name(link.getName())
                .url(link.getUrl())
                .desc(link.getDescription())
                .icon(link.getIcon())
                .createdAt(link.getCreatedAt())
                .updatedAt(link.getUpdatedAt())
                .build();
    }
}
