package com.example.org_membershipservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Membership of one user in one unit.
 *
 * Business Rules:
 * - UNIQUE: one ACTIVE row per (org_unit_id, user_id) (partial unique index)
 * - removal is a soft delete: status REMOVED + leftAt, the row is kept
 * - user_id: logical reference to identity-service (NO FK)
 */
@Entity
@Table(name = "org_memberships")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "org_unit_id", nullable = false)
    private UUID orgUnitId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private OrgRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private MembershipStatus status = MembershipStatus.ACTIVE;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    @Column(name = "left_at")
    private Instant leftAt;

    @Column(name = "invite_id")
    private UUID inviteId;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Integer version;

    @PrePersist
    protected void onCreate() {
        if (joinedAt == null) {
            joinedAt = Instant.now();
        }
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == MembershipStatus.ACTIVE;
    }

    public boolean isCoordinator() {
        return isActive() && role == OrgRole.COORDINATOR;
    }

    public void changeRole(OrgRole newRole) {
        this.role = newRole;
        this.updatedAt = Instant.now();
    }

    /**
     * Soft delete the membership.
     */
    public void remove() {
        this.status = MembershipStatus.REMOVED;
        this.leftAt = Instant.now();
        this.updatedAt = Instant.now();
    }
}
