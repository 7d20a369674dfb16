package com.example.org_membershipservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Invitation of a user into a unit with a proposed role.
 *
 * Business Rules:
 * - UNIQUE: one PENDING invite per (org_unit_id, invited_user_id)
 * - PENDING is the only state that can transition; every other state is final
 * - respondedAt is stamped when the invitee accepts or rejects
 */
@Entity
@Table(name = "org_invites")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgInvite {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "org_unit_id", nullable = false)
    private UUID orgUnitId;

    @Column(name = "invited_user_id", nullable = false)
    private UUID invitedUserId;

    @Column(name = "invited_by_user_id", nullable = false)
    private UUID invitedByUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private OrgRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private InviteStatus status = InviteStatus.PENDING;

    @Column(name = "message", length = 1000)
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "responded_at")
    private Instant respondedAt;

    @Version
    @Column(name = "version")
    private Integer version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isPending() {
        return status == InviteStatus.PENDING;
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public void accept(Instant now) {
        transitionTo(InviteStatus.ACCEPTED);
        this.respondedAt = now;
    }

    public void reject(Instant now) {
        transitionTo(InviteStatus.REJECTED);
        this.respondedAt = now;
    }

    public void expire() {
        transitionTo(InviteStatus.EXPIRED);
    }

    public void cancel() {
        transitionTo(InviteStatus.CANCELLED);
    }

    private void transitionTo(InviteStatus target) {
        switch (status) {
            case PENDING -> this.status = target;
            case ACCEPTED, REJECTED, EXPIRED, CANCELLED -> throw new IllegalStateException(
                    String.format("Invite %s is %s and cannot move to %s", id, status, target));
        }
    }
}
