package com.imperium.aries.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.aries.model.entity.SysSettingItem;

import java.util.Collection;
import java.util.List;

public interface SysSettingItemService extends IService<SysSettingItem> {

    List<SysSettingItem> listBySysId(Long sysId);

    /**
     * 按 (sysId, key) 批量新增或更新设置项，整体在一个事务内完成。
     */
    void upsertBatch(Long sysId, Collection<SysSettingItem> items);
}
