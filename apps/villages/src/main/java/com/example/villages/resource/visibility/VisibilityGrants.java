package com.example.villages.resource.visibility;

import java.util.HashSet;
import java.util.Set;

/**
 * Explicit per-user grants that widen visibility: template assignments and shares.
 *
 * @param assignedResourceIds system-generated resources assigned to the viewer
 * @param sharedResourceIds   resources shared with the viewer
 */
public record VisibilityGrants(Set<String> assignedResourceIds, Set<String> sharedResourceIds) {

    private static final VisibilityGrants NONE = new VisibilityGrants(Set.of(), Set.of());

    public VisibilityGrants {
        assignedResourceIds = assignedResourceIds == null ? Set.of() : Set.copyOf(assignedResourceIds);
        sharedResourceIds = sharedResourceIds == null ? Set.of() : Set.copyOf(sharedResourceIds);
    }

    public static VisibilityGrants none() {
        return NONE;
    }

    public VisibilityGrants withAssigned(String resourceId) {
        return new VisibilityGrants(plus(assignedResourceIds, resourceId), sharedResourceIds);
    }

    public VisibilityGrants withShared(String resourceId) {
        return new VisibilityGrants(assignedResourceIds, plus(sharedResourceIds, resourceId));
    }

    private static Set<String> plus(Set<String> ids, String id) {
        Set<String> copy = new HashSet<>(ids);
        copy.add(id);
        return copy;
    }
}
