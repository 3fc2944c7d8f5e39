package com.imperium.aries.service.impl;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.aries.common.BusinessException;
import com.imperium.aries.common.PageQuery;
import com.imperium.aries.mapper.CategoryMapper;
import com.imperium.aries.model.dto.request.ArticleCategoryAddRequest;
import com.imperium.aries.model.dto.request.ArticleCategoryEditRequest;
import com.imperium.aries.model.dto.request.LinkCategoryAddRequest;
import com.imperium.aries.model.dto.request.LinkCategoryEditRequest;
import com.imperium.aries.model.dto.response.CategoryTreeNode;
import com.imperium.aries.model.dto.response.PageResponse;
import com.imperium.aries.model.entity.Category;
import com.imperium.aries.service.CategoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class CategoryServiceImpl extends ServiceImpl<CategoryMapper, Category> implements CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryServiceImpl.class);

    @Override
    public PageResponse<Category> pageByType(int type, String key, PageQuery pageQuery) {
        IPage<Category> page = lambdaQuery()
                .eq(Category::getType, type)
                .like(key != null && !key.isBlank(), Category::getName, key)
                .orderByDesc(Category::getCreatedAt)
                .orderByDesc(Category::getId)
                .page(pageQuery.toPage());
        return PageResponse.of(page);
    }

    @Override
    public List<Category> listByType(int type) {
        return lambdaQuery()
                .eq(Category::getType, type)
                .orderByAsc(Category::getId)
                .list();
    }

    @Override
    public List<CategoryTreeNode> tree(int type) {
        return buildTree(listByType(type));
    }

    /**
     * 按 parentId 组装森林，保持输入顺序。父级不在列表中的节点视为根节点。
     */
    static List<CategoryTreeNode> buildTree(List<Category> categories) {
        Map<Long, CategoryTreeNode> nodes = new LinkedHashMap<>();
        for (Category c : categories) {
            nodes.put(c.getId(), CategoryTreeNode.builder()
                    .id(c.getId())
                    .name(c.getName())
                    .url(c.getUrl())
                    .parentId(c.getParentId())
                    .build());
        }
        List<CategoryTreeNode> roots = new ArrayList<>();
        for (CategoryTreeNode node : nodes.values()) {
            CategoryTreeNode parent = node.getParentId() != null ? nodes.get(node.getParentId()) : null;
            if (parent == null || parent == node) {
                roots.add(node);
            } else {
                parent.getChildren().add(node);
            }
        }
        return roots;
    }

    @Override
    public Category getCategory(Long id) {
        Category category = getById(id);
        if (category == null) {
            throw new BusinessException("分类不存在");
        }
        return category;
    }

    @Override
    public Category addArticleCategory(ArticleCategoryAddRequest request) {
        Long parentId = normalizeParentId(request.getParentId());
        if (parentId != null) {
            requireArticleParent(parentId);
        }
        LocalDateTime now = LocalDateTime.now();
        Category category = new Category();
        category.setType(Category.TYPE_ARTICLE);
        category.setName(request.getName());
        category.setUrl(request.getUrl());
        category.setParentId(parentId);
        category.setCreatedAt(now);
        category.setUpdatedAt(now);
        save(category);
        return category;
    }

    @Override
    public void editArticleCategory(ArticleCategoryEditRequest request) {
        Category existing = getCategory(request.getId());
        if (existing.getType() != Category.TYPE_ARTICLE) {
            throw new BusinessException("该分类不是文章分类");
        }
        Long parentId = normalizeParentId(request.getParentId());
        if (parentId != null) {
            if (parentId.equals(existing.getId())) {
                throw new BusinessException("父级分类不能为自身");
            }
            requireArticleParent(parentId);
            if (isDescendant(parentId, existing.getId())) {
                throw new BusinessException("父级分类不能为其子分类");
            }
        }
        lambdaUpdate()
                .eq(Category::getId, existing.getId())
                .set(Category::getName, request.getName())
                .set(Category::getUrl, request.getUrl())
                .set(Category::getParentId, parentId)
                .set(Category::getUpdatedAt, LocalDateTime.now())
                .update();
    }

    @Override
    public Category addLinkCategory(LinkCategoryAddRequest request) {
        LocalDateTime now = LocalDateTime.now();
        Category category = new Category();
        category.setType(Category.TYPE_LINK);
        category.setName(request.getName());
        category.setCreatedAt(now);
        category.setUpdatedAt(now);
        save(category);
        return category;
    }

    @Override
    public void editLinkCategory(LinkCategoryEditRequest request) {
        Category existing = getCategory(request.getId());
        if (existing.getType() != Category.TYPE_LINK) {
            throw new BusinessException("该分类不是友链分类");
        }
        lambdaUpdate()
                .eq(Category::getId, existing.getId())
                .set(Category::getName, request.getName())
                .set(Category::getUpdatedAt, LocalDateTime.now())
                .update();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new BusinessException("请选择要删除的分类");
        }
        boolean removed = removeByIds(ids);
        log.info("Soft-deleted categories {} (changed={})", ids, removed);
    }

    @Override
    public Map<Long, Category> resolveIncludingDeleted(Collection<Long> ids) {
        Set<Long> distinct = ids == null ? Set.of() : ids.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(HashSet::new));
        if (distinct.isEmpty()) {
            return Map.of();
        }
        return getBaseMapper().selectByIdsIncludingDeleted(distinct).stream()
                .collect(Collectors.toMap(Category::getId, Function.identity()));
    }

    private void requireArticleParent(Long parentId) {
        Category parent = getById(parentId);
        if (parent == null || parent.getType() != Category.TYPE_ARTICLE) {
            throw new BusinessException("父级分类不存在");
        }
    }

    /**
     * candidateId 是否位于 ancestorId 的子树中（沿 candidate 的父链向上查找）。
     */
    private boolean isDescendant(Long candidateId, Long ancestorId) {
        Set<Long> visited = new HashSet<>();
        Long current = candidateId;
        while (current != null && visited.add(current)) {
            if (current.equals(ancestorId)) {
                return true;
            }
            Category node = getById(current);
            current = node != null ? node.getParentId() : null;
        }
        return false;
    }

    private static Long normalizeParentId(Long parentId) {
        return parentId == null || parentId <= 0 ? null : parentId;
    }
}
