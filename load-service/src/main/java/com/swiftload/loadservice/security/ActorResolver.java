package com.swiftload.loadservice.security;

import com.swiftload.common.exception.AccessDeniedException;
import com.swiftload.loadservice.model.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns the bearer token into an {@link Actor}.
 *
 * Roles are read from the identity provider's client roles:
 * {@code resource_access.swiftload-backend.roles}. Exactly one of SHIPPER,
 * TRUCKER or ADMIN must be present; other client roles are ignored.
 */
@Component
@Slf4j
public class ActorResolver {

    static final String CLIENT_ID = "swiftload-backend";

    public Actor resolve(Jwt jwt) {
        UUID userId;
        try {
            userId = UUID.fromString(jwt.getSubject());
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Rejected token with malformed subject: {}", jwt.getSubject());
            throw new AccessDeniedException("Access Denied: Token subject is not a valid user id");
        }

        Set<UserRole> roles = EnumSet.noneOf(UserRole.class);
        for (String claimed : extractClientRoles(jwt)) {
            try {
                roles.add(UserRole.valueOf(claimed.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException ignored) {
                log.debug("Ignoring unrelated client role '{}' for user {}", claimed, userId);
            }
        }

        if (roles.size() != 1) {
            log.warn("Access denied: user {} presented roles {} (exactly one marketplace role required)",
                    userId, roles);
            throw new AccessDeniedException(
                    "Access Denied: Exactly one of SHIPPER, TRUCKER or ADMIN role is required");
        }

        return Actor.of(userId, roles.iterator().next());
    }

    private List<String> extractClientRoles(Jwt jwt) {
        return Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> (Map<?, ?>) claim)
                .map(accessMap -> accessMap.get(CLIENT_ID))
                .filter(Map.class::isInstance)
                .map(backend -> (Map<?, ?>) backend)
                .map(backendMap -> backendMap.get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }
}
