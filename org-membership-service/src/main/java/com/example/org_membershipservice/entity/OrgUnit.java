package com.example.org_membershipservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Node of the organizational tree.
 *
 * Structure is kept as an adjacency list (parentId), there is no
 * children collection. Units are never physically deleted; deactivation
 * sets {@code active=false} and removes the unit from every tree traversal.
 *
 * CRITICAL:
 * - slug is unique and immutable once issued
 * - parentId is null only for the COUNCIL root
 * - createdBy is a logical reference to identity-service (NO FK)
 */
@Entity
@Table(name = "org_units")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrgUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private OrgUnitType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "group_subtype", length = 30)
    private GroupSubtype groupSubtype;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "slug", nullable = false, unique = true, updatable = false, length = 220)
    private String slug;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "parent_id")
    private UUID parentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "visibility", nullable = false, length = 20)
    @Builder.Default
    private Visibility visibility = Visibility.PUBLIC;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Integer version;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean isRestricted() {
        return visibility == Visibility.RESTRICTED;
    }

    /**
     * Soft delete: the row stays, the unit leaves the tree.
     */
    public void deactivate() {
        this.active = false;
        this.updatedAt = Instant.now();
    }
}
