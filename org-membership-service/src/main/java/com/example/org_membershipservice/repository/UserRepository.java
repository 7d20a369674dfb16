package com.example.org_membershipservice.repository;

import com.example.org_membershipservice.entity.User;
import com.example.org_membershipservice.entity.UserStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the local user replica.
 * Note: @SQLRestriction on User filters soft-deleted rows from queries.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    List<User> findAllByIdIn(Collection<UUID> ids);

    /**
     * Case-insensitive "contains" search on the full name.
     * The query must already have %, _ and ! escaped with '!'.
     */
    @Query("SELECT u FROM User u " +
           "WHERE u.status = :status AND u.deletedAt IS NULL " +
           "AND LOWER(u.fullName) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!' " +
           "ORDER BY u.fullName")
    List<User> searchByName(@Param("query") String query,
                            @Param("status") UserStatus status,
                            Pageable pageable);

    /**
     * Same as searchByName() but leaves out the given ids.
     * Kept separate because an empty NOT IN list is not portable.
     */
    @Query("SELECT u FROM User u " +
           "WHERE u.status = :status AND u.deletedAt IS NULL " +
           "AND LOWER(u.fullName) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '!' " +
           "AND u.id NOT IN :excludedIds " +
           "ORDER BY u.fullName")
    List<User> searchByNameExcluding(@Param("query") String query,
                                     @Param("status") UserStatus status,
                                     @Param("excludedIds") Collection<UUID> excludedIds,
                                     Pageable pageable);
}
