package com.example.villages.authz.dto;

import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;

public record AccessCheckResponse(
        ResourceType resourceType,
        Operation operation,
        boolean allowed,
        AccessLevel requiredLevel,
        AccessLevel accessLevel
) {
}
