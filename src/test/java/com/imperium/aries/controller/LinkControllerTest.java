package com.imperium.aries.controller;

import com.imperium.aries.common.BusinessException;
import com.imperium.aries.model.dto.response.LinkResponse;
import com.imperium.aries.model.entity.Category;
import com.imperium.aries.model.entity.Link;
import com.imperium.aries.service.LinkService;
import com.imperium.aries.support.MockMvcSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;

class LinkControllerTest {

    private static final String LINK_BODY =
            "{\"category_id\":3,\"name\":\"Go\",\"url\":\"https://go.dev\",\"desc\":\"golang\",\"icon\":\"/go.png\"}";

    private LinkService linkService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        linkService = mock(LinkService.class);
        mockMvc = MockMvcSupport.standalone(new LinkController(linkService));
    }

    @Test
    void add_bindsDescAndCategory() throws Exception {
        Link saved = new Link();
        saved.setId(5L);
        when(linkService.addLink(any())).thenReturn(saved);

        mockMvc.perform(post("/api/v1/links")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LINK_BODY))
                .andExpect(jsonPath("$.code").value(100))
                .andExpect(jsonPath("$.data.id").value(5));

        verify(linkService).addLink(argThat(r ->
                Long.valueOf(3L).equals(r.getCategoryId()) && "golang".equals(r.getDesc())));
    }

    @Test
    void edit_requiresId() throws Exception {
        mockMvc.perform(put("/api/v1/links")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LINK_BODY))
                .andExpect(jsonPath("$.code").value(103))
                .andExpect(jsonPath("$.msg").value("ID 为必填字段"));

        verifyNoInteractions(linkService);
    }

    @Test
    void edit_withId_stillChecksDefaultConstraints() throws Exception {
        mockMvc.perform(put("/api/v1/links")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":5,\"name\":\"Go\",\"url\":\"https://go.dev\"}"))
                .andExpect(jsonPath("$.code").value(103))
                .andExpect(jsonPath("$.msg").value("图标为必填字段"));
    }

    @Test
    void get_includesResolvedCategory() throws Exception {
        Link link = new Link();
        link.setId(5L);
        link.setCategoryId(3L);
        link.setName("Go");
        Category category = new Category();
        category.setId(3L);
        category.setName("技术");
        when(linkService.getLink(5L)).thenReturn(LinkResponse.of(link, category));

        mockMvc.perform(get("/api/v1/links/5"))
                .andExpect(jsonPath("$.code").value(100))
                .andExpect(jsonPath("$.data.category_id").value(3))
                .andExpect(jsonPath("$.data.category.name").value("技术"));
    }

    @Test
    void delete_emptySelection_isRequestError() throws Exception {
        doThrow(new BusinessException("请选择要删除的友链")).when(linkService).deleteByIds(any());

        mockMvc.perform(delete("/api/v1/links"))
                .andExpect(jsonPath("$.code").value(103))
                .andExpect(jsonPath("$.msg").value("请选择要删除的友链"));
    }

    @Test
    void deleteBatch_parsesIds() throws Exception {
        mockMvc.perform(delete("/api/v1/links").param("ids", "7,8"))
                .andExpect(jsonPath("$.code").value(100));

        verify(linkService).deleteByIds(List.of(7L, 8L));
    }
}
