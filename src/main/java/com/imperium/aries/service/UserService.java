package com.imperium.aries.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.aries.model.entity.User;

public interface UserService extends IService<User> {

    /**
     * @return 用户；不存在时返回 null
     */
    User getByUsername(String username);

    /**
     * @return 用户；不存在时返回 null
     */
    User getByEmail(String email);

    /**
     * 按邮箱更新密码。
     *
     * @param passwordHash 已哈希的新密码
     * @return 是否有记录被更新
     */
    boolean updatePasswordByEmail(String email, String passwordHash);
}
