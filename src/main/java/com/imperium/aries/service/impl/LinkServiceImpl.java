package com.imperium.aries.service.impl;

import com.baomidou.mybatisplus.core.metadata.IPage;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.aries.common.BusinessException;
import com.imperium.aries.common.PageQuery;
import com.imperium.aries.mapper.LinkMapper;
import com.imperium.aries.model.dto.request.LinkRequest;
import com.imperium.aries.model.dto.response.LinkResponse;
import com.imperium.aries.model.dto.response.PageResponse;
import com.imperium.aries.model.entity.Category;
import com.imperium.aries.model.entity.Link;
import com.imperium.aries.service.CategoryService;
import com.imperium.aries.service.LinkService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class LinkServiceImpl extends ServiceImpl<LinkMapper, Link> implements LinkService {

    private static final Logger log = LoggerFactory.getLogger(LinkServiceImpl.class);

    private final CategoryService categoryService;

    public LinkServiceImpl(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @Override
    public PageResponse<LinkResponse> pageLinks(String key, Long categoryId, PageQuery pageQuery) {
        IPage<Link> page = lambdaQuery()
                .like(key != null && !key.isBlank(), Link::getName, key)
                .eq(categoryId != null && categoryId > 0, Link::getCategoryId, categoryId)
                .orderByDesc(Link::getCreatedAt)
                .orderByDesc(Link::getId)
                .page(pageQuery.toPage());
        Map<Long, Category> categories = resolveCategories(page.getRecords());
        return PageResponse.of(page, link -> LinkResponse.of(link, categories.get(link.getCategoryId())));
    }

    @Override
    public List<LinkResponse> listAll() {
        List<Link> links = lambdaQuery().orderByAsc(Link::getId).list();
        Map<Long, Category> categories = resolveCategories(links);
        return links.stream()
                .map(link -> LinkResponse.of(link, categories.get(link.getCategoryId())))
                .collect(Collectors.toList());
    }

    @Override
    public LinkResponse getLink(Long id) {
        Link link = requireLink(id);
        return LinkResponse.of(link, resolveCategories(List.of(link)).get(link.getCategoryId()));
    }

    @Override
    public Link addLink(LinkRequest request) {
        Long categoryId = checkCategory(request.getCategoryId());
        LocalDateTime now = LocalDateTime.now();
        Link link = new Link();
        link.setCategoryId(categoryId);
        link.setName(request.getName());
        link.setUrl(request.getUrl());
        link.setDescription(request.getDesc());
        link.setIcon(request.getIcon());
        link.setCreatedAt(now);
        link.setUpdatedAt(now);
        save(link);
        return link;
    }

    @Override
    public void editLink(LinkRequest request) {
        Link existing = requireLink(request.getId());
        Long categoryId = checkCategory(request.getCategoryId());
        lambdaUpdate()
                .eq(Link::getId, existing.getId())
                .set(Link::getCategoryId, categoryId)
                .set(Link::getName, request.getName())
                .set(Link::getUrl, request.getUrl())
                .set(Link::getDescription, request.getDesc())
                .set(Link::getIcon, request.getIcon())
                .set(Link::getUpdatedAt, LocalDateTime.now())
                .update();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new BusinessException("请选择要删除的友链");
        }
        boolean removed = removeByIds(ids);
        log.info("Soft-deleted links {} (changed={})", ids, removed);
    }

    private Link requireLink(Long id) {
        Link link = getById(id);
        if (link == null) {
            throw new BusinessException("友链不存在");
        }
        return link;
    }

    /**
     * 分类可为空；非空时必须是未删除的友链分类。
     */
    private Long checkCategory(Long categoryId) {
        if (categoryId == null || categoryId <= 0) {
            return null;
        }
        Category category = categoryService.getById(categoryId);
        if (category == null || category.getType() != Category.TYPE_LINK) {
            throw new BusinessException("友链分类不存在");
        }
        return categoryId;
    }

    private Map<Long, Category> resolveCategories(List<Link> links) {
        return categoryService.resolveIncludingDeleted(links.stream()
                .map(Link::getCategoryId)
                .collect(Collectors.toList()));
    }
}
