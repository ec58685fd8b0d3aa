package com.example.villages.authz.dto;

import com.example.villages.authz.model.AccessDetails;
import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.ResourceType;

import java.util.List;

public record AccessDetailsResponse(
        ResourceType resourceType,
        AccessLevel accessLevel,
        List<String> matchedRules,
        boolean canRead,
        boolean canWrite,
        boolean canDelete,
        boolean canAdmin
) {
    public static AccessDetailsResponse from(ResourceType resourceType, AccessDetails details) {
        return new AccessDetailsResponse(
                resourceType,
                details.accessLevel(),
                details.matchedRuleDescriptions(),
                details.canRead(),
                details.canWrite(),
                details.canDelete(),
                details.canAdmin());
    }
}
