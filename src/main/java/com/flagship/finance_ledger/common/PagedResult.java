package com.flagship.finance_ledger.common;

import lombok.Value;

import java.util.List;

/**
 * One page of a list query.
 */
@Value
public class PagedResult<T> {
    List<T> items;
    long total;
    int page;
    int perPage;
    int totalPages;

    public static <T> PagedResult<T> of(List<T> items, long total, PageQuery query) {
        int totalPages = (int) ((total + query.getPerPage() - 1) / query.getPerPage());
        return new PagedResult<>(items, total, query.getPage(), query.getPerPage(), totalPages);
    }
}
