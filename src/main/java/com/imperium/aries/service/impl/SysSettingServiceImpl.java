package com.imperium.aries.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.aries.common.BusinessException;
import com.imperium.aries.mapper.SysSettingMapper;
import com.imperium.aries.model.entity.SysSetting;
import com.imperium.aries.model.entity.SysSettingItem;
import com.imperium.aries.service.SmtpAccount;
import com.imperium.aries.service.SysSettingItemService;
import com.imperium.aries.service.SysSettingService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class SysSettingServiceImpl extends ServiceImpl<SysSettingMapper, SysSetting> implements SysSettingService {

    static final String KEY_SYS_ID = "sys_id";

    private final SysSettingItemService itemService;

    public SysSettingServiceImpl(SysSettingItemService itemService) {
        this.itemService = itemService;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public SysSetting getOrCreate(String name) {
        SysSetting existing = findByName(name);
        if (existing != null) {
            return existing;
        }
        LocalDateTime now = LocalDateTime.now();
        SysSetting setting = new SysSetting();
        setting.setName(name);
        setting.setCreatedAt(now);
        setting.setUpdatedAt(now);
        save(setting);
        return setting;
    }

    @Override
    public Map<String, String> getItemsByName(String name) {
        SysSetting setting = findByName(name);
        if (setting == null) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        result.put(KEY_SYS_ID, String.valueOf(setting.getId()));
        for (SysSettingItem item : itemService.listBySysId(setting.getId())) {
            result.put(item.getKey(), item.getVal());
        }
        return result;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public Long saveSettings(Long sysId, String typeName, Map<String, String> items) {
        SysSetting setting;
        if (sysId == null) {
            setting = getOrCreate(typeName);
        } else {
            setting = getById(sysId);
            if (setting == null) {
                throw new BusinessException("设置不存在");
            }
        }
        List<SysSettingItem> itemList = items.entrySet().stream()
                .map(e -> new SysSettingItem(setting.getId(), e.getKey(), e.getValue()))
                .collect(Collectors.toList());
        itemService.upsertBatch(setting.getId(), itemList);

        setting.setUpdatedAt(LocalDateTime.now());
        updateById(setting);
        return setting.getId();
    }

    @Override
    public Optional<SmtpAccount> findSmtpAccount() {
        Map<String, String> items = getItemsByName(SysSetting.SMTP);
        if (items.isEmpty()) {
            return Optional.empty();
        }
        int port;
        try {
            port = Integer.parseInt(items.getOrDefault("port", "").trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        SmtpAccount account = new SmtpAccount(
                items.get("address"),
                port,
                items.get("account"),
                items.get("pwd"),
                items.getOrDefault("sender", items.get("account")));
        return account.isComplete() ? Optional.of(account) : Optional.empty();
    }

    private SysSetting findByName(String name) {
        return lambdaQuery()
                .eq(SysSetting::getName, name)
                .last("LIMIT 1")
                .one();
    }
}
