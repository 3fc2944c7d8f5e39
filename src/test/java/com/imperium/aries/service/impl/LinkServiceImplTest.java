package com.imperium.aries.service.impl;

import com.imperium.aries.common.BusinessException;
import com.imperium.aries.model.dto.request.LinkRequest;
import com.imperium.aries.model.dto.response.LinkResponse;
import com.imperium.aries.model.entity.Category;
import com.imperium.aries.model.entity.Link;
import com.imperium.aries.service.CategoryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LinkServiceImplTest {

    private CategoryService categoryService;
    private LinkServiceImpl service;

    @BeforeEach
    void setUp() {
        categoryService = mock(CategoryService.class);
        service = spy(new LinkServiceImpl(categoryService));
    }

    @Test
    void addLink_articleCategory_isRejected() {
        when(categoryService.getById(3L)).thenReturn(category(3L, Category.TYPE_ARTICLE, "Java"));

        BusinessException ex = assertThrows(BusinessException.class, () -> service.addLink(linkRequest(3L)));

        assertEquals("友链分类不存在", ex.getMessage());
        verify(service, never()).save(any(Link.class));
    }

    @Test
    void addLink_missingCategory_isRejected() {
        BusinessException ex = assertThrows(BusinessException.class, () -> service.addLink(linkRequest(7L)));

        assertEquals("友链分类不存在", ex.getMessage());
        verify(service, never()).save(any(Link.class));
    }

    @Test
    void addLink_linkCategory_isSaved() {
        when(categoryService.getById(3L)).thenReturn(category(3L, Category.TYPE_LINK, "朋友们"));
        doReturn(true).when(service).save(any(Link.class));

        Link saved = service.addLink(linkRequest(3L));

        assertEquals(3L, saved.getCategoryId());
        assertEquals("golang", saved.getDescription());
        assertNotNull(saved.getCreatedAt());
    }

    @Test
    void addLink_withoutCategory_skipsCategoryCheck() {
        doReturn(true).when(service).save(any(Link.class));

        Link saved = service.addLink(linkRequest(0L));

        assertNull(saved.getCategoryId());
        verify(categoryService, never()).getById(any());
    }

    @Test
    void getLink_resolvesSoftDeletedCategory() {
        Link link = new Link();
        link.setId(5L);
        link.setCategoryId(3L);
        link.setName("Go");
        doReturn(link).when(service).getById(5L);
        // 分类已软删除，普通查询查不到，但解析引用时仍返回
        when(categoryService.resolveIncludingDeleted(anyCollection()))
                .thenReturn(Map.of(3L, category(3L, Category.TYPE_LINK, "旧分类")));

        LinkResponse response = service.getLink(5L);

        assertEquals("旧分类", response.getCategory().getName());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<Long>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(categoryService).resolveIncludingDeleted(captor.capture());
        assertEquals(List.of(3L), List.copyOf(captor.getValue()));
        verify(categoryService, never()).getById(any());
    }

    @Test
    void getLink_missing_isRejected() {
        doReturn(null).when(service).getById(5L);

        BusinessException ex = assertThrows(BusinessException.class, () -> service.getLink(5L));

        assertEquals("友链不存在", ex.getMessage());
    }

    @Test
    void editLink_missing_isRejected() {
        doReturn(null).when(service).getById(5L);
        LinkRequest request = linkRequest(3L);
        request.setId(5L);

        BusinessException ex = assertThrows(BusinessException.class, () -> service.editLink(request));

        assertEquals("友链不存在", ex.getMessage());
        verifyNoInteractions(categoryService);
    }

    @Test
    void deleteByIds_emptySelection_isRejected() {
        BusinessException ex = assertThrows(BusinessException.class, () -> service.deleteByIds(null));

        assertEquals("请选择要删除的友链", ex.getMessage());
    }

    private static LinkRequest linkRequest(Long categoryId) {
        LinkRequest request = new LinkRequest();
        request.setCategoryId(categoryId);
        request.setName("Go");
        request.setUrl("https://go.dev");
        request.setDesc("golang");
        request.setIcon("/go.png");
        return request;
    }

    private static Category category(Long id, int type, String name) {
        Category category = new Category();
        category.setId(id);
        category.setType(type);
        category.setName(name);
        return category;
    }
}
