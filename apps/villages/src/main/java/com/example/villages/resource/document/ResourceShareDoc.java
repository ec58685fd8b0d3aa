package com.example.villages.resource.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Grants a user access to a SHARED resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "resource_shares")
@CompoundIndex(name = "resource_user_idx", def = "{'resourceId': 1, 'userId': 1}")
public class ResourceShareDoc {

    @Id
    private String id;

    private String resourceId;

    private String userId;

    @CreatedDate
    private Instant createdAt;
}
