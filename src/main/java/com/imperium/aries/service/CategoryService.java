package com.imperium.aries.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.aries.common.PageQuery;
import com.imperium.aries.model.dto.request.ArticleCategoryAddRequest;
import com.imperium.aries.model.dto.request.ArticleCategoryEditRequest;
import com.imperium.aries.model.dto.request.LinkCategoryAddRequest;
import com.imperium.aries.model.dto.request.LinkCategoryEditRequest;
import com.imperium.aries.model.dto.response.CategoryTreeNode;
import com.imperium.aries.model.dto.response.PageResponse;
import com.imperium.aries.model.entity.Category;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 文章分类与友链分类。删除为软删除。
 */
public interface CategoryService extends IService<Category> {

    PageResponse<Category> pageByType(int type, String key, PageQuery pageQuery);

    List<Category> listByType(int type);

    /**
     * 按 parent_id 组装的分类树；父级不存在或已删除的分类作为根节点。
     */
    List<CategoryTreeNode> tree(int type);

    /**
     * @throws com.imperium.aries.common.BusinessException 分类不存在
     */
    Category getCategory(Long id);

    Category addArticleCategory(ArticleCategoryAddRequest request);

    void editArticleCategory(ArticleCategoryEditRequest request);

    Category addLinkCategory(LinkCategoryAddRequest request);

    void editLinkCategory(LinkCategoryEditRequest request);

    void deleteByIds(Collection<Long> ids);

    /**
     * 解析分类引用，已软删除的分类同样返回。
     */
    Map<Long, Category> resolveIncludingDeleted(Collection<Long> ids);
}
