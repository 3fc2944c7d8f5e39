package com.imperium.aries.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.aries.model.entity.SysSettingItem;

public interface SysSettingItemMapper extends BaseMapper<SysSettingItem> {
}
