package com.imperium.aries.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.aries.model.entity.Link;

public interface LinkMapper extends BaseMapper<Link> {
}
