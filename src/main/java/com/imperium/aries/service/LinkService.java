package com.imperium.aries.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.aries.common.PageQuery;
import com.imperium.aries.model.dto.request.LinkRequest;
import com.imperium.aries.model.dto.response.LinkResponse;
import com.imperium.aries.model.dto.response.PageResponse;
import com.imperium.aries.model.entity.Link;

import java.util.Collection;
import java.util.List;

public interface LinkService extends IService<Link> {

    PageResponse<LinkResponse> pageLinks(String key, Long categoryId, PageQuery pageQuery);

    List<LinkResponse> listAll();

    LinkResponse getLink(Long id);

    Link addLink(LinkRequest request);

    void editLink(LinkRequest request);

    void deleteByIds(Collection<Long> ids);
}
