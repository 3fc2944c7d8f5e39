package com.imperium.aries.controller;

import com.imperium.aries.common.BusinessException;
import com.imperium.aries.common.Result;
import com.imperium.aries.model.dto.request.EmailSendRequest;
import com.imperium.aries.model.dto.request.SiteSettingRequest;
import com.imperium.aries.model.dto.request.SmtpSettingRequest;
import com.imperium.aries.model.entity.SysSetting;
import com.imperium.aries.service.MailService;
import com.imperium.aries.service.SysSettingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 系统设置：网站设置、SMTP 设置，以及发送测试邮件。
 * 分组固定为“网站设置”“邮件设置”，表单中的 type_name 作为设置项保存。
 */
@RestController
@RequestMapping("/api/v1/sys_setting")
@Tag(name = "系统设置")
public class SysSettingController {

    private final SysSettingService sysSettingService;
    private final MailService mailService;

    public SysSettingController(SysSettingService sysSettingService, MailService mailService) {
        this.sysSettingService = sysSettingService;
        this.mailService = mailService;
    }

    @GetMapping("/items")
    @Operation(summary = "获取设置项", description = "按分组名称获取全部键值，附带 sys_id")
    public Result<Map<String, String>> items(
            @Parameter(description = "分组名称，如 网站设置、邮件设置", required = true)
            @RequestParam(required = false) String name) {
        if (name == null || name.isBlank()) {
            throw new BusinessException("设置名称为必填字段");
        }
        return Result.success("查询成功", sysSettingService.getItemsByName(name));
    }

    @PostMapping("/site")
    @Operation(summary = "保存网站设置")
    public Result<Long> saveSite(@Valid @RequestBody SiteSettingRequest request) {
        Long sysId = sysSettingService.saveSettings(request.getSysId(), SysSetting.SITE, request.toItems());
        return Result.success("保存成功", sysId);
    }

    @PostMapping("/smtp")
    @Operation(summary = "保存 SMTP 设置")
    public Result<Long> saveSmtp(@Valid @RequestBody SmtpSettingRequest request) {
        Long sysId = sysSettingService.saveSettings(request.getSysId(), SysSetting.SMTP, request.toItems());
        return Result.success("保存成功", sysId);
    }

    @PostMapping("/email/send")
    @Operation(summary = "发送测试邮件", description = "使用当前 SMTP 设置发送")
    public Result<Void> sendTestMail(@Valid @RequestBody EmailSendRequest request) {
        mailService.sendTestMail(request);
        return Result.success("发送成功");
    }
}
