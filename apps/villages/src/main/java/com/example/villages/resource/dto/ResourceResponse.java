package com.example.villages.resource.dto;

import com.example.villages.resource.document.ResourceDoc;
import com.example.villages.resource.model.ResourceStatus;
import com.example.villages.resource.model.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceResponse(
        String id,
        String title,
        String description,
        String createdBy,
        String familyId,
        Visibility visibility,
        boolean systemGenerated,
        ResourceStatus status,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
    public static ResourceResponse from(ResourceDoc doc) {
        return new ResourceResponse(
                doc.getId(),
                doc.getTitle(),
                doc.getDescription(),
                doc.getCreatedBy(),
                doc.getFamilyId(),
                doc.getVisibility(),
                doc.isSystemGenerated(),
                doc.getStatus(),
                doc.getTags() != null ? List.copyOf(doc.getTags()) : List.of(),
                doc.getCreatedAt(),
                doc.getUpdatedAt());
    }
}
