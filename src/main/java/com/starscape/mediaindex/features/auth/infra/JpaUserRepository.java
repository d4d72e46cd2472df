package com.starscape.mediaindex.features.auth.infra;

import com.starscape.mediaindex.features.auth.domain.User;
import com.starscape.mediaindex.features.auth.domain.UserRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface JpaUserRepository extends JpaRepository<User, Long>, UserRepository {
    
    @Override
    Optional<User> findByUserUid(String userUid);
    
    @Override
    Optional<User> findByUserName(String userName);
    
    @Override
    boolean existsByUserName(String userName);
    
    /**
     * Incremented in the store so concurrent failures are all counted.
     */
    @Override
    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.loginAttempts = u.loginAttempts + 1 WHERE u.userUid = :uid")
    int incrementLoginAttempts(@Param("uid") String userUid);
    
    @Override
    @Modifying
    @Transactional
    @Query("UPDATE User u SET u.loginAttempts = 0, u.loginAt = :loginAt WHERE u.userUid = :uid")
    int resetLoginAttempts(@Param("uid") String userUid, @Param("loginAt") Instant loginAt);
}
