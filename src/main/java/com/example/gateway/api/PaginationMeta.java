package com.example.gateway.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PaginationMeta(
        long total,
        int limit,
        int page,
        long totalPages,
        boolean hasNext,
        boolean hasPrevious
) {
    public static PaginationMeta of(long total, int page, int limit) {
        long totalPages = (total + limit - 1) / limit;
        return new PaginationMeta(total, limit, page, totalPages, page < totalPages, page > 1);
    }
}
