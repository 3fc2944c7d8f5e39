package com.imperium.aries.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.aries.model.entity.Category;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.Collection;
import java.util.List;

public interface CategoryMapper extends BaseMapper<Category> {

    /**
     * 按 ID 批量查询，包含已软删除的分类，用于解析友链等历史引用。
     */
    @Select("<script>"
            + "SELECT id, type, name, url, parent_id, created_at, updated_at, deleted_at FROM categories WHERE id IN "
            + "<foreach collection='ids' item='id' open='(' separator=',' close=')'>#{id}</foreach>"
            + "</script>")
    List<Category> selectByIdsIncludingDeleted(@Param("ids") Collection<Long> ids);
}
