package com.example.org_membershipservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables of the org engine, bound from the {@code org.*} block.
 */
@Data
@Component
@ConfigurationProperties(prefix = "org")
public class OrgProperties {

    /**
     * Days a pending invite stays answerable.
     */
    private int inviteExpirationDays = 7;

    /**
     * Deepest level rendered by tree queries (root is level 1).
     */
    private int treeMaxDepth = 5;

    /**
     * Suffixes tried before slug allocation gives up.
     */
    private int slugMaxAttempts = 100;

    private boolean auditEnabled = true;
}
