package com.cmflineage.query;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExecutionPage(List<ExecutionRow> items, @JsonProperty("total_items") long totalItems) {
    public ExecutionPage {
        items = List.copyOf(items);
    }
}
