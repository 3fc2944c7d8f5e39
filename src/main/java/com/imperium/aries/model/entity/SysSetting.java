package com.imperium.aries.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 设置分组，对应 sys_settings 表。name 唯一，每类设置（网站设置、邮件设置）一组。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("sys_settings")
public class SysSetting {

    /** 网站设置分组名 */
    public static final String SITE = "网站设置";
    /** SMTP 邮件设置分组名 */
    public static final String SMTP = "邮件设置";

    @TableId(type = IdType.AUTO)
    private Long id;

    private String name;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;
}
