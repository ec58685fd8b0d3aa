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
 * Grants one member read access to one system-generated resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "template_assignments")
@CompoundIndex(name = "resource_assignee_uidx", def = "{'resourceId': 1, 'assigneeId': 1}", unique = true)
public class TemplateAssignmentDoc {

    @Id
    private String id;

    private String resourceId;

    private String assigneeId;

    private String assignedBy;

    @CreatedDate
    private Instant createdAt;
}
