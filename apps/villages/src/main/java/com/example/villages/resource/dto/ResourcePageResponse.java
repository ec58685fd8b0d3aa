package com.example.villages.resource.dto;

import java.util.List;

/**
 * One page of visible resources.
 */
public record ResourcePageResponse(
        List<ResourceResponse> resources,
        int page,
        int size,
        long total,
        int totalPages
) {
    public static ResourcePageResponse of(List<ResourceResponse> resources, int page, int size, long total) {
        int totalPages = size > 0 ? (int) Math.ceil((double) total / size) : 0;
        return new ResourcePageResponse(resources, page, size, total, totalPages);
    }
}
