package com.example.villages.authz.service;

import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.UserRole;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Coarse role gates for actions that are not tied to a rule table.
 * Platform admins pass every check.
 */
@Component
public class RoleGuards {

    public boolean isAdmin(AccessContext context) {
        return context.userRole() == UserRole.ADMIN;
    }

    public boolean ownsResource(AccessContext context, @Nullable String resourceOwnerId) {
        if (isAdmin(context)) {
            return true;
        }
        return context.userId().equals(resourceOwnerId);
    }
}
