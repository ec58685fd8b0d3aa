package com.example.villages.authz.service;

import com.example.villages.authz.model.AccessContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.example.villages.util.AccessContextTestBuilder.anAccessContext;
import static com.example.villages.util.AccessContextTestBuilder.anAdminContext;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RoleGuards")
class RoleGuardsTest {

    private final RoleGuards roleGuards = new RoleGuards();

    @Test
    @DisplayName("isAdmin should accept the platform admin role only")
    void isAdminShouldAcceptAdminOnly() {
        assertThat(roleGuards.isAdmin(anAdminContext())).isTrue();
        assertThat(roleGuards.isAdmin(anAccessContext().build())).isFalse();
    }

    @Test
    @DisplayName("ownsResource should match the owner unless admin")
    void ownsResourceShouldMatchOwner() {
        AccessContext ctx = anAccessContext().withUserId("u1").build();

        assertThat(roleGuards.ownsResource(ctx, "u1")).isTrue();
        assertThat(roleGuards.ownsResource(ctx, "u2")).isFalse();
        assertThat(roleGuards.ownsResource(ctx, null)).isFalse();
        assertThat(roleGuards.ownsResource(anAdminContext(), "u2")).isTrue();
    }
}
