package com.agenttracker.discovery.dto;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import org.springframework.data.domain.Page;

public record PageResponse<T>(
        List<T> content,
        int page,
        int size,
        long totalElements,
        int totalPages,
        boolean first,
        boolean last,
        boolean hasNext,
        boolean hasPrevious
) {
    public PageResponse {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static <E, T> PageResponse<T> from(Page<E> page, Function<E, T> mapper) {
        Objects.requireNonNull(page, "page must not be null");
        Page<T> mapped = page.map(mapper);
        return new PageResponse<>(
                mapped.getContent(),
                mapped.getNumber(),
                mapped.getSize(),
                mapped.getTotalElements(),
                mapped.getTotalPages(),
                mapped.isFirst(),
                mapped.isLast(),
                mapped.hasNext(),
                mapped.hasPrevious()
        );
    }
}
