package com.jreinhal.insight.repository;

import com.jreinhal.insight.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.List;

/**
 * Repository for user data access.
 */
@Repository
public interface UserRepository extends MongoRepository<User, String> {

    /**
     * Find user by username.
     */
    Optional<User> findByUsername(String username);

    /**
     * Find all active users.
     */
    List<User> findByActiveTrue();
}
