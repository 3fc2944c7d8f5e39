package com.imperium.aries.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.aries.model.entity.SysSetting;

import java.util.Map;
import java.util.Optional;

/**
 * 设置分组：网站设置、邮件设置等。
 */
public interface SysSettingService extends IService<SysSetting> {

    /**
     * 按名称取分组，不存在则创建。
     */
    SysSetting getOrCreate(String name);

    /**
     * 取分组下全部设置项，附带 sys_id；分组不存在时返回空 Map。
     */
    Map<String, String> getItemsByName(String name);

    /**
     * 保存一组设置项。sysId 为空时按 typeName 取或建分组，之后批量 upsert。
     *
     * @return 分组 ID
     */
    Long saveSettings(Long sysId, String typeName, Map<String, String> items);

    /**
     * 从“邮件设置”分组读取 SMTP 账号；分组不存在或不完整时返回 empty。
     */
    Optional<SmtpAccount> findSmtpAccount();
}
