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
 * 友情链接表实体，对应 links 表。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("links")
public class Link {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 所属友链分类 ID，可为空 */
    @TableField("category_id")
    private Long categoryId;

    /** 网站名称 */
    private String name;

    /** 网站地址 */
    private String url;

    /** 网站描述 */
    private String description;

    /** 图标地址 */
    private String icon;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;

    @JsonIgnore
    @TableLogic(value = "null", delval = "now()")
    @TableField("deleted_at")
    private LocalDateTime deletedAt;
}
