package com.imperium.aries.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 设置项，对应 sys_setting_items 表，(sys_id, key) 唯一。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@TableName("sys_setting_items")
public class SysSettingItem {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 所属设置分组 ID */
    @TableField("sys_id")
    private Long sysId;

    @TableField("`key`")
    private String key;

    private String val;

    public SysSettingItem(Long sysId, String key, String val) {
        this.sysId = sysId;
        this.key = key;
        this.val = val;
    }
}
