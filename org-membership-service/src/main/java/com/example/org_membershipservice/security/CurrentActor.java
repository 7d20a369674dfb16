package com.example.org_membershipservice.security;

import com.example.org_membershipservice.entity.GlobalRole;
import lombok.Value;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Authenticated caller as seen by the services: user id plus global roles.
 * Role strings the engine does not know are dropped.
 */
@Value
public class CurrentActor {

    UUID userId;
    Set<GlobalRole> globalRoles;

    public static CurrentActor of(UUID userId, Collection<String> roleNames) {
        EnumSet<GlobalRole> roles = EnumSet.noneOf(GlobalRole.class);
        roleNames.stream()
                .map(GlobalRole::parse)
                .flatMap(Optional::stream)
                .forEach(roles::add);
        return new CurrentActor(userId, Set.copyOf(roles));
    }

    public static CurrentActor of(UUID userId, GlobalRole... roles) {
        EnumSet<GlobalRole> set = EnumSet.noneOf(GlobalRole.class);
        set.addAll(Arrays.asList(roles));
        return new CurrentActor(userId, Set.copyOf(set));
    }

    public boolean hasRole(GlobalRole role) {
        return globalRoles.contains(role);
    }

    /**
     * DEV or ADMIN.
     */
    public boolean isAdmin() {
        return globalRoles.stream().anyMatch(GlobalRole::isElevated);
    }
}
