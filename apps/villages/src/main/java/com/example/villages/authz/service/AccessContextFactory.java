package com.example.villages.authz.service;

import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.EntityFacts;
import com.example.villages.authz.model.Viewer;
import com.example.villages.resource.model.ResourceView;
import com.example.villages.resource.model.Visibility;
import org.springframework.stereotype.Component;

/**
 * Projects a viewer and the fetched entity fields into an {@link AccessContext}.
 */
@Component
public class AccessContextFactory {

    public AccessContext forViewer(Viewer viewer) {
        return AccessContext.forUser(viewer.userId(), viewer.role(), viewer.familyId(), viewer.familyRole());
    }

    public AccessContext forEntity(Viewer viewer, EntityFacts entity) {
        return forViewer(viewer).withResource(entity.ownerId(), entity.familyId(), entity.isPublic());
    }

    public AccessContext forResource(Viewer viewer, ResourceView resource) {
        return forViewer(viewer).withResource(
                resource.createdBy(),
                resource.familyId(),
                resource.visibility() == Visibility.PUBLIC);
    }
}
