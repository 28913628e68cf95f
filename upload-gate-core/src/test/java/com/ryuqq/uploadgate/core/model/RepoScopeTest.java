package com.ryuqq.uploadgate.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RepoScope 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RepoScopeTest {

    @Test
    void covers_WholeRepo_MatchesAnyDirectory() {
        // Given
        RepoScope scope = RepoScope.wholeRepo("libs-release");

        // When & Then
        assertTrue(scope.covers(""));
        assertTrue(scope.covers("com/acme"));
        assertFalse(scope.hasPathRoots());
    }

    @Test
    void covers_ExactRoot_Matches() {
        // Given
        RepoScope scope = RepoScope.of("r", List.of("immutable"));

        // When & Then
        assertTrue(scope.covers("immutable"));
    }

    @Test
    void covers_Subdirectory_Matches() {
        // Given
        RepoScope scope = RepoScope.of("r", List.of("immutable"));

        // When & Then
        assertTrue(scope.covers("immutable/sub"));
        assertTrue(scope.covers("immutable/sub/deeper"));
    }

    @Test
    void covers_SiblingWithSamePrefix_DoesNotMatch() {
        // Given
        RepoScope scope = RepoScope.of("r", List.of("immutable"));

        // When & Then
        assertFalse(scope.covers("immutable2"));
        assertFalse(scope.covers("immutable2/sub"));
        assertFalse(scope.covers("immutablefoo"));
    }

    @Test
    void covers_RootWithTrailingSlash_MatchesChildren() {
        // Given
        RepoScope scope = RepoScope.of("r", List.of("immutable/"));

        // When & Then
        assertTrue(scope.covers("immutable/sub"));
        assertFalse(scope.covers("immutable2"));
    }

    @Test
    void covers_AnyOfSeveralRoots_Matches() {
        // Given
        RepoScope scope = RepoScope.of("r", List.of("release", "immutable"));

        // When & Then
        assertTrue(scope.covers("immutable/x"));
        assertTrue(scope.covers("release"));
        assertFalse(scope.covers("snapshot"));
    }

    @Test
    void covers_RootDirectory_DoesNotMatchRestrictedScope() {
        // Given
        RepoScope scope = RepoScope.of("r", List.of("immutable"));

        // When & Then
        assertFalse(scope.covers(""));
        assertFalse(scope.covers(null));
    }

    @Test
    void of_PathRootsCopied_Immutable() {
        // Given
        List<String> roots = new ArrayList<>(List.of("a"));

        // When
        RepoScope scope = RepoScope.of("r", roots);
        roots.add("b");

        // Then
        assertEquals(List.of("a"), scope.pathRoots());
        assertThrows(UnsupportedOperationException.class, () -> scope.pathRoots().add("c"));
    }

    @Test
    void of_BlankName_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RepoScope.wholeRepo(" ")
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }
}
