package com.example.villages.authz.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AccessLevel")
class AccessLevelTest {

    @Test
    @DisplayName("should be ordered NONE < READ < WRITE < DELETE < ADMIN")
    void shouldBeOrdered() {
        assertThat(AccessLevel.values()).containsExactly(
                AccessLevel.NONE, AccessLevel.READ, AccessLevel.WRITE, AccessLevel.DELETE, AccessLevel.ADMIN);
    }

    @Test
    @DisplayName("sufficiency should be reflexive")
    void sufficiencyShouldBeReflexive() {
        for (AccessLevel level : AccessLevel.values()) {
            assertThat(level.isSufficientFor(level)).isTrue();
        }
    }

    @Test
    @DisplayName("sufficiency should be transitive")
    void sufficiencyShouldBeTransitive() {
        for (AccessLevel a : AccessLevel.values()) {
            for (AccessLevel b : AccessLevel.values()) {
                for (AccessLevel c : AccessLevel.values()) {
                    if (a.isSufficientFor(b) && b.isSufficientFor(c)) {
                        assertThat(a.isSufficientFor(c)).isTrue();
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("ADMIN should satisfy every level and NONE only itself")
    void adminAndNoneBounds() {
        for (AccessLevel level : AccessLevel.values()) {
            assertThat(AccessLevel.ADMIN.isSufficientFor(level)).isTrue();
            assertThat(AccessLevel.NONE.isSufficientFor(level)).isEqualTo(level == AccessLevel.NONE);
        }
    }

    @Test
    @DisplayName("max should pick the higher level")
    void maxShouldPickHigher() {
        assertThat(AccessLevel.max(AccessLevel.READ, AccessLevel.DELETE)).isEqualTo(AccessLevel.DELETE);
        assertThat(AccessLevel.max(AccessLevel.WRITE, AccessLevel.NONE)).isEqualTo(AccessLevel.WRITE);
        assertThat(AccessLevel.max(AccessLevel.READ, AccessLevel.READ)).isEqualTo(AccessLevel.READ);
    }
}
