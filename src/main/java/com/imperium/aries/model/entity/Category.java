package com.imperium.aries.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableLogic;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 分类表实体，对应 categories 表。文章分类可按 parent_id 组成树，友链分类只有名称。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("categories")
public class Category {

    /** 分类类型：文章 */
    public static final int TYPE_ARTICLE = 0;
    /** 分类类型：友链 */
    public static final int TYPE_LINK = 1;

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 0 文章分类，1 友链分类 */
    private Integer type;

    private String name;

    /** 访问 URL（仅文章分类） */
    private String url;

    /** 父级分类 ID（仅文章分类，可为空） */
    @TableField("parent_id")
    private Long parentId;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;

    /** 软删除标记，为空表示未删除 */
    @JsonIgnore
    @TableLogic(value = "null", delval = "now()")
    @TableField("deleted_at")
    private LocalDateTime deletedAt;
}
