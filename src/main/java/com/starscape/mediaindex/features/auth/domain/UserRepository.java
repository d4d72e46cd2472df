package com.starscape.mediaindex.features.auth.domain;

import java.time.Instant;
import java.util.Optional;

public interface UserRepository {
    User save(User user);
    Optional<User> findByUserUid(String userUid);
    Optional<User> findByUserName(String userName);
    boolean existsByUserName(String userName);
    int incrementLoginAttempts(String userUid);
    int resetLoginAttempts(String userUid, Instant loginAt);
}
