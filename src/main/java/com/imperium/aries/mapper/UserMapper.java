package com.imperium.aries.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.aries.model.entity.User;

public interface UserMapper extends BaseMapper<User> {
}
