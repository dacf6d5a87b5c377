package com.openrag.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity and retrieval scoping visible to one branch of a request's task tree.
 * <p>
 * Never mutated in place: every {@code with*} call returns a new snapshot, so a snapshot captured
 * by a child task cannot be changed by its parent or siblings afterwards.
 *
 * @param userId         caller user ID (nullable when nothing has been set)
 * @param jwtToken       token to forward to downstream services (nullable)
 * @param groups         RBAC groups
 * @param roles          RBAC roles
 * @param searchFilters  retrieval filters for tool calls (nullable)
 * @param searchLimit    maximum number of retrieval hits
 * @param scoreThreshold minimum retrieval score
 */
public record SecurityContextSnapshot(
        String userId,
        String jwtToken,
        List<String> groups,
        List<String> roles,
        Map<String, Object> searchFilters,
        int searchLimit,
        double scoreThreshold
) {

    public static final int DEFAULT_SEARCH_LIMIT = 10;
    public static final double DEFAULT_SCORE_THRESHOLD = 0;

    /** Snapshot seen when nothing has been set. */
    public static final SecurityContextSnapshot EMPTY = new SecurityContextSnapshot(
            null, null, List.of(), List.of(), null, DEFAULT_SEARCH_LIMIT, DEFAULT_SCORE_THRESHOLD);

    public SecurityContextSnapshot {
        groups = groups == null ? List.of() : List.copyOf(groups);
        roles = roles == null ? List.of() : List.copyOf(roles);
        // Filters come from JSON and may legitimately hold null values, so no Map.copyOf.
        searchFilters = searchFilters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(searchFilters));
    }

    public SecurityContextSnapshot withIdentity(String newUserId, String newJwtToken,
                                                Collection<String> newGroups, Collection<String> newRoles) {
        return new SecurityContextSnapshot(newUserId, newJwtToken,
                newGroups == null ? List.of() : List.copyOf(newGroups),
                newRoles == null ? List.of() : List.copyOf(newRoles),
                searchFilters, searchLimit, scoreThreshold);
    }

    public SecurityContextSnapshot withSearchFilters(Map<String, Object> filters) {
        return new SecurityContextSnapshot(userId, jwtToken, groups, roles, filters, searchLimit, scoreThreshold);
    }

    public SecurityContextSnapshot withSearchLimit(int limit) {
        return new SecurityContextSnapshot(userId, jwtToken, groups, roles, searchFilters, limit, scoreThreshold);
    }

    public SecurityContextSnapshot withScoreThreshold(double threshold) {
        return new SecurityContextSnapshot(userId, jwtToken, groups, roles, searchFilters, searchLimit, threshold);
    }
}
