package com.imperium.aries.common;

import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * 分页参数，绑定自 query string：page 从 1 开始，size 默认 10、最大 100。
 */
@Data
public class PageQuery {

    @Min(value = 1, message = "页码最小为 1")
    @Schema(description = "页码，从 1 开始", defaultValue = "1")
    private long page = 1;

    @Min(value = 1, message = "每页条数最小为 1")
    @Max(value = 100, message = "每页条数最大为 100")
    @Schema(description = "每页条数", defaultValue = "10")
    private long size = 10;

    public <T> Page<T> toPage() {
        return new Page<>(page, size);
    }
}
