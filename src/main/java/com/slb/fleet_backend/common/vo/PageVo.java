package com.slb.fleet_backend.common.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 分页结果，page 从 1 开始
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageVo<T> {
    private Long total;
    private Integer page;
    private Integer size;
    private List<T> list;

    public boolean getHasMore() {
        return total != null && page != null && size != null && (long) page * size < total;
    }
}
