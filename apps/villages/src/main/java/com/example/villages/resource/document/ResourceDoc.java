package com.example.villages.resource.document;

import com.example.villages.resource.model.ResourceStatus;
import com.example.villages.resource.model.Visibility;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.List;

/**
 * MongoDB document for a shared resource (document, link, form template, ...).
 * Owned by the content features; the authorization core only reads it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "resources")
@CompoundIndexes({
        @CompoundIndex(name = "visibility_family_idx", def = "{'visibility': 1, 'familyId': 1}"),
        @CompoundIndex(name = "creator_status_idx", def = "{'createdBy': 1, 'status': 1}")
})
public class ResourceDoc {

    @Id
    private String id;

    private String title;

    private String description;

    /**
     * User ID of the creator.
     */
    @Indexed
    private String createdBy;

    /**
     * Owning family. Unset for system-wide resources.
     */
    private String familyId;

    private Visibility visibility;

    /**
     * Template authored by an admin or volunteer. Members only see these when assigned.
     */
    @Field("isSystemGenerated")
    private boolean systemGenerated;

    private ResourceStatus status;

    private List<String> tags;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    /**
     * Set together with {@link ResourceStatus#DELETED}; deletes are soft.
     */
    private Instant deletedAt;
}
