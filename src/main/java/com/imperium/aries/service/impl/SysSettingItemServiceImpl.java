package com.imperium.aries.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.aries.mapper.SysSettingItemMapper;
import com.imperium.aries.model.entity.SysSettingItem;
import com.imperium.aries.service.SysSettingItemService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class SysSettingItemServiceImpl extends ServiceImpl<SysSettingItemMapper, SysSettingItem>
        implements SysSettingItemService {

    @Override
    public List<SysSettingItem> listBySysId(Long sysId) {
        return lambdaQuery()
                .eq(SysSettingItem::getSysId, sysId)
                .list();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void upsertBatch(Long sysId, Collection<SysSettingItem> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        Map<String, SysSettingItem> existingByKey = listBySysId(sysId).stream()
                .collect(Collectors.toMap(SysSettingItem::getKey, Function.identity(), (a, b) -> a));

        List<SysSettingItem> toInsert = new ArrayList<>();
        List<SysSettingItem> toUpdate = new ArrayList<>();
        for (SysSettingItem item : items) {
            SysSettingItem existing = existingByKey.get(item.getKey());
            String val = item.getVal() != null ? item.getVal() : "";
            if (existing == null) {
                toInsert.add(new SysSettingItem(sysId, item.getKey(), val));
            } else if (!val.equals(existing.getVal())) {
                existing.setVal(val);
                toUpdate.add(existing);
            }
        }
        if (!toInsert.isEmpty()) {
            saveBatch(toInsert);
        }
        if (!toUpdate.isEmpty()) {
            updateBatchById(toUpdate);
        }
    }
}
