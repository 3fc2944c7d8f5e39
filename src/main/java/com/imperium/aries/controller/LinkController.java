package com.imperium.aries.controller;

import com.imperium.aries.common.PageQuery;
import com.imperium.aries.common.Result;
import com.imperium.aries.model.dto.request.LinkRequest;
import com.imperium.aries.model.dto.response.LinkResponse;
import com.imperium.aries.model.dto.response.PageResponse;
import com.imperium.aries.model.entity.Link;
import com.imperium.aries.service.LinkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "友链", description = "友情链接管理")
public class LinkController {

    private final LinkService linkService;

    public LinkController(LinkService linkService) {
        this.linkService = linkService;
    }

    @GetMapping("/links")
    @Operation(summary = "分页获取友链")
    public Result<PageResponse<LinkResponse>> page(
            @Parameter(description = "名称关键词")
            @RequestParam(required = false) String key,
            @Parameter(description = "友链分类 ID")
            @RequestParam(value = "category_id", required = false) Long categoryId,
            @Valid PageQuery pageQuery) {
        return Result.success("查询成功", linkService.pageLinks(key, categoryId, pageQuery));
    }

    @GetMapping("/all_links")
    @Operation(summary = "获取全部友链")
    public Result<List<LinkResponse>> all() {
        return Result.success("查询成功", linkService.listAll());
    }

    @GetMapping("/links/{id}")
    @Operation(summary = "获取友链")
    public Result<LinkResponse> get(@PathVariable Long id) {
        return Result.success("查询成功", linkService.getLink(id));
    }

    @PostMapping("/links")
    @Operation(summary = "添加友链")
    public Result<Link> add(@Valid @RequestBody LinkRequest request) {
        return Result.success("添加成功", linkService.addLink(request));
    }

    @PutMapping("/links")
    @Operation(summary = "修改友链")
    public Result<Void> edit(@Validated(LinkRequest.Edit.class) @RequestBody LinkRequest request) {
        linkService.editLink(request);
        return Result.success("修改成功");
    }

    @DeleteMapping("/links/{id}")
    @Operation(summary = "删除友链")
    public Result<Void> delete(@PathVariable Long id) {
        linkService.deleteByIds(List.of(id));
        return Result.success("删除成功");
    }

    @DeleteMapping("/links")
    @Operation(summary = "批量删除友链", description = "ids 以逗号分隔，如 1,2,3")
    public Result<Void> deleteBatch(@RequestParam(required = false) List<Long> ids) {
        linkService.deleteByIds(ids);
        return Result.success("删除成功");
    }
}
