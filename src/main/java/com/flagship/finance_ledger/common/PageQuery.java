package com.flagship.finance_ledger.common;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;
import java.util.Set;

/**
 * Paging, search and sort parameters of a list command. Page numbers start at 1.
 */
@Value
@Builder
@Jacksonized
public class PageQuery {

    private static final int DEFAULT_PER_PAGE = 20;
    private static final int MAX_PER_PAGE = 500;

    Integer page;
    Integer perPage;
    String search;
    String sortBy;
    String sortOrder;

    public int getPage() {
        return page == null || page < 1 ? 1 : page;
    }

    public int getPerPage() {
        if (perPage == null || perPage < 1) {
            return DEFAULT_PER_PAGE;
        }
        return Math.min(perPage, MAX_PER_PAGE);
    }

    public int offset() {
        return (getPage() - 1) * getPerPage();
    }

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }

    public String searchPattern() {
        return "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
    }

    /**
     * Builds an ORDER BY clause from a whitelist of sortable columns, so
     * caller input never reaches the SQL text directly.
     */
    public String orderBy(Set<String> sortable, String defaultColumn) {
        String column = sortBy != null && sortable.contains(sortBy) ? sortBy : defaultColumn;
        String direction = "asc".equalsIgnoreCase(sortOrder) ? "ASC" : "DESC";
        return " ORDER BY " + column + " " + direction + ", id " + direction;
    }

    public static PageQuery defaults() {
        return PageQuery.builder().build();
    }
}
