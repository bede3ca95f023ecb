package com.cmflineage.query;

public record ExecutionQuery(
        int page,
        int pageSize,
        ExecutionField filterField,
        String filterValue,
        ExecutionField sortField,
        SortOrder sortOrder) {
    public static final int DEFAULT_PAGE_SIZE = 5;
    public static final int MAX_PAGE_SIZE = 1000;

    public ExecutionQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (filterField != null && filterValue == null) {
            throw new IllegalArgumentException("filterValue is required when filterField is set");
        }
        sortField = sortField == null ? ExecutionField.EXECUTION_ID : sortField;
        sortOrder = sortOrder == null ? SortOrder.ASC : sortOrder;
    }

    public static ExecutionQuery page(int page, int pageSize) {
        return new ExecutionQuery(page, pageSize, null, null, null, null);
    }

    public ExecutionQuery withFilter(ExecutionField field, String value) {
        return new ExecutionQuery(page, pageSize, field, value, sortField, sortOrder);
    }

    public ExecutionQuery sortedBy(ExecutionField field, SortOrder order) {
        return new ExecutionQuery(page, pageSize, filterField, filterValue, field, order);
    }

    public ExecutionQuery atPage(int newPage) {
        return new ExecutionQuery(newPage, pageSize, filterField, filterValue, sortField, sortOrder);
    }
}
