package com.imperium.aries.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.aries.mapper.UserMapper;
import com.imperium.aries.model.entity.User;
import com.imperium.aries.service.UserService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Service
public class UserServiceImpl extends ServiceImpl<UserMapper, User> implements UserService {

    @Override
    public User getByUsername(String username) {
        return lambdaQuery()
                .eq(User::getUsername, username)
                .last("LIMIT 1")
                .one();
    }

    @Override
    public User getByEmail(String email) {
        return lambdaQuery()
                .eq(User::getEmail, email)
                .last("LIMIT 1")
                .one();
    }

    @Override
    public boolean updatePasswordByEmail(String email, String passwordHash) {
        return lambdaUpdate()
                .eq(User::getEmail, email)
                .set(User::getPassword, passwordHash)
                .set(User::getUpdatedAt, LocalDateTime.now())
                .update();
    }
}
