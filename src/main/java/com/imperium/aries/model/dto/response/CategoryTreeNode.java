package com.imperium.aries.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryTreeNode {

    private Long id;

    private String name;

    private String url;

    private Long parentId;

    @Builder.Default
    private List<CategoryTreeNode> children = new ArrayList<>();
}
