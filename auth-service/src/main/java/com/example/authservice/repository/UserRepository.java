package com.example.authservice.repository;

import com.example.authservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for User entity.
 *
 * Note: @SQLRestriction on User automatically filters deleted_at IS NULL
 * for all derived queries, and delete() is a soft delete.
 */
@Repository
public interface UserRepository extends JpaRepository<User, String> {

    /**
     * Find user by email (for login). Case-sensitive, as stored.
     *
     * @param email user email
     * @return Optional<User>
     */
    Optional<User> findByEmail(String email);

    /**
     * Check if email already exists (for registration).
     *
     * @param email user email
     * @return true if email exists
     */
    boolean existsByEmail(String email);
}
