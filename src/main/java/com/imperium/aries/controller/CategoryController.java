package com.imperium.aries.controller;

import com.imperium.aries.common.BusinessException;
import com.imperium.aries.common.PageQuery;
import com.imperium.aries.common.Result;
import com.imperium.aries.model.dto.request.ArticleCategoryAddRequest;
import com.imperium.aries.model.dto.request.ArticleCategoryEditRequest;
import com.imperium.aries.model.dto.request.LinkCategoryAddRequest;
import com.imperium.aries.model.dto.request.LinkCategoryEditRequest;
import com.imperium.aries.model.dto.response.CategoryTreeNode;
import com.imperium.aries.model.dto.response.PageResponse;
import com.imperium.aries.model.entity.Category;
import com.imperium.aries.service.CategoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 分类接口：文章分类（可嵌套）与友链分类。category_type：0 文章，1 友链。
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "分类", description = "文章分类与友链分类管理")
public class CategoryController {

    private final CategoryService categoryService;

    public CategoryController(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @GetMapping("/categories")
    @Operation(summary = "分页获取分类")
    public Result<PageResponse<Category>> page(
            @Parameter(description = "分类类型：0 文章，1 友链", required = true)
            @RequestParam(value = "category_type", required = false) Integer categoryType,
            @Parameter(description = "名称关键词")
            @RequestParam(required = false) String key,
            @Valid PageQuery pageQuery) {
        return Result.success("查询成功", categoryService.pageByType(requireType(categoryType), key, pageQuery));
    }

    @GetMapping("/all_categories")
    @Operation(summary = "获取某类型的全部分类")
    public Result<List<Category>> all(
            @RequestParam(value = "category_type", required = false) Integer categoryType) {
        return Result.success("查询成功", categoryService.listByType(requireType(categoryType)));
    }

    @GetMapping("/categories/tree")
    @Operation(summary = "分类树", description = "按父级分类组装，默认文章分类")
    public Result<List<CategoryTreeNode>> tree(
            @RequestParam(value = "category_type", defaultValue = "0") Integer categoryType) {
        return Result.success("查询成功", categoryService.tree(requireType(categoryType)));
    }

    @GetMapping("/categories/{id}")
    @Operation(summary = "获取分类")
    public Result<Category> get(@PathVariable Long id) {
        return Result.success("查询成功", categoryService.getCategory(id));
    }

    @PostMapping("/article_categories")
    @Operation(summary = "添加文章分类")
    public Result<Category> addArticleCategory(@Valid @RequestBody ArticleCategoryAddRequest request) {
        return Result.success("添加成功", categoryService.addArticleCategory(request));
    }

    @PutMapping("/article_categories")
    @Operation(summary = "修改文章分类")
    public Result<Void> editArticleCategory(@Valid @RequestBody ArticleCategoryEditRequest request) {
        categoryService.editArticleCategory(request);
        return Result.success("修改成功");
    }

    @PostMapping("/link_categories")
    @Operation(summary = "添加友链分类")
    public Result<Category> addLinkCategory(@Valid @RequestBody LinkCategoryAddRequest request) {
        return Result.success("添加成功", categoryService.addLinkCategory(request));
    }

    @PutMapping("/link_categories")
    @Operation(summary = "修改友链分类")
    public Result<Void> editLinkCategory(@Valid @RequestBody LinkCategoryEditRequest request) {
        categoryService.editLinkCategory(request);
        return Result.success("修改成功");
    }

    @DeleteMapping("/categories/{id}")
    @Operation(summary = "删除分类")
    public Result<Void> delete(@PathVariable Long id) {
        categoryService.deleteByIds(List.of(id));
        return Result.success("删除成功");
    }

    @DeleteMapping("/categories")
    @Operation(summary = "批量删除分类", description = "ids 以逗号分隔，如 1,2,3")
    public Result<Void> deleteBatch(@RequestParam(required = false) List<Long> ids) {
        categoryService.deleteByIds(ids);
        return Result.success("删除成功");
    }

    private static int requireType(Integer categoryType) {
        if (categoryType == null) {
            throw new BusinessException("分类类型为必填字段");
        }
        if (categoryType != Category.TYPE_ARTICLE && categoryType != Category.TYPE_LINK) {
            throw new BusinessException("分类类型有误");
        }
        return categoryType;
    }
}
