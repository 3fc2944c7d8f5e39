package com.imperium.aries.model.dto.response;

import com.baomidou.mybatisplus.core.metadata.IPage;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "分页结果")
public class PageResponse<T> {

    private List<T> list;

    private long total;

    private long page;

    private long size;

    public static <E, T> PageResponse<T> of(IPage<E> page, Function<E, T> mapper) {
        return PageResponse.<T>builder()
                .list(page.getRecords().stream().map(mapper).collect(Collectors.toList()))
                .total(page.getTotal())
                .page(page.getCurrent())
                .size(page.getSize())
                .build();
    }

    public static <T> PageResponse<T> of(IPage<T> page) {
        return of(page, Function.identity());
    }
}
