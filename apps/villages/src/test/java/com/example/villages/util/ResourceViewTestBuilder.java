package com.example.villages.util;

import com.example.villages.resource.document.ResourceDoc;
import com.example.villages.resource.model.ResourceStatus;
import com.example.villages.resource.model.ResourceView;
import com.example.villages.resource.model.Visibility;

/**
 * Test builder for resources. Produces either the decision view or the stored document.
 */
public class ResourceViewTestBuilder {

    private String id = "res-1";
    private String createdBy = "creator-1";
    private String familyId;
    private Visibility visibility = Visibility.PRIVATE;
    private boolean systemGenerated;
    private ResourceStatus status = ResourceStatus.ACTIVE;

    public static ResourceViewTestBuilder aResource() {
        return new ResourceViewTestBuilder();
    }

    public static ResourceViewTestBuilder aTemplate() {
        return aResource()
                .withCreatedBy("volunteer-1")
                .withSystemGenerated(true);
    }

    public ResourceViewTestBuilder withId(String id) {
        this.id = id;
        return this;
    }

    public ResourceViewTestBuilder withCreatedBy(String createdBy) {
        this.createdBy = createdBy;
        return this;
    }

    public ResourceViewTestBuilder withFamilyId(String familyId) {
        this.familyId = familyId;
        return this;
    }

    public ResourceViewTestBuilder withVisibility(Visibility visibility) {
        this.visibility = visibility;
        return this;
    }

    public ResourceViewTestBuilder withSystemGenerated(boolean systemGenerated) {
        this.systemGenerated = systemGenerated;
        return this;
    }

    public ResourceViewTestBuilder withStatus(ResourceStatus status) {
        this.status = status;
        return this;
    }

    public ResourceView build() {
        return new ResourceView(id, createdBy, familyId, visibility, systemGenerated, status);
    }

    public ResourceDoc buildDoc() {
        return ResourceDoc.builder()
                .id(id)
                .title("Resource " + id)
                .createdBy(createdBy)
                .familyId(familyId)
                .visibility(visibility)
                .systemGenerated(systemGenerated)
                .status(status)
                .build();
    }
}
