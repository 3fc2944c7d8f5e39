package com.imperium.aries.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.aries.model.entity.SysSetting;

public interface SysSettingMapper extends BaseMapper<SysSetting> {
}
