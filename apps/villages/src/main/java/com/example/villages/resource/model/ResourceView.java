package com.example.villages.resource.model;

import com.example.villages.resource.document.ResourceDoc;
import org.springframework.lang.Nullable;

/**
 * The fields of a resource that visibility decisions read.
 */
public record ResourceView(
        String id,
        String createdBy,
        @Nullable String familyId,
        Visibility visibility,
        boolean systemGenerated,
        ResourceStatus status
) {
    public ResourceView {
        if (visibility == null) {
            visibility = Visibility.PRIVATE;
        }
        if (familyId != null && familyId.isBlank()) {
            familyId = null;
        }
    }

    public static ResourceView from(ResourceDoc doc) {
        return new ResourceView(
                doc.getId(),
                doc.getCreatedBy(),
                doc.getFamilyId(),
                doc.getVisibility(),
                doc.isSystemGenerated(),
                doc.getStatus());
    }

    public boolean isCreatedBy(String userId) {
        return createdBy != null && createdBy.equals(userId);
    }
}
