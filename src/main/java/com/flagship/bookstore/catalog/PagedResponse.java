package com.flagship.bookstore.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

@Value
public class PagedResponse<T> {

    @JsonProperty("items")
    List<T> items;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total_items")
    long totalItems;

    @JsonProperty("total_pages")
    int totalPages;

    public <U> PagedResponse<U> map(Function<T, U> mapper) {
        return new PagedResponse<>(items.stream().map(mapper).toList(), page, size, totalItems, totalPages);
    }

    public static <D, T> PagedResponse<T> from(Page<D> page, Function<D, T> mapper) {
        return new PagedResponse<>(
                page.getContent().stream().map(mapper).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages());
    }
}
