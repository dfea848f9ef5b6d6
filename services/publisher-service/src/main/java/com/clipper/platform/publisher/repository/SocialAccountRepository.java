package com.clipper.platform.publisher.repository;

import com.clipper.platform.publisher.entity.SocialAccount;
import com.clipper.platform.publisher.model.Platform;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

public interface SocialAccountRepository extends JpaRepository<SocialAccount, UUID> {

    Optional<SocialAccount> findByUserIdAndPlatformAndActiveTrue(UUID userId, Platform platform);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE SocialAccount a SET a.active = false WHERE a.id = :id")
    int deactivate(@Param("id") UUID id);
}
