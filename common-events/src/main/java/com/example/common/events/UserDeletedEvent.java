package com.example.common.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * User Deleted Event
 *
 * Published by: Identity Service when a user account is deleted.
 * Consumed by:
 * - Org Membership Service: cancel pending invites, hand over coordinator
 *   roles and remove the user's memberships
 *
 * Event Flow:
 * 1. Admin deletes a user in Identity Service
 * 2. Identity Service publishes UserDeletedEvent on {@code user.deleted}
 * 3. Consumers clean up their own data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserDeletedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Deleted user ID
     */
    private UUID userId;

    /**
     * Email of the user (for logging only)
     */
    private String email;

    /**
     * Global role of the user (for logging only)
     */
    private String role;

    /**
     * When the user was deleted
     */
    private Instant deletedAt;

    /**
     * Admin who performed the delete (for audit)
     */
    private UUID deletedBy;

    /**
     * Event ID used to deduplicate deliveries
     */
    private String eventId;

    private Instant eventTimestamp;
}
