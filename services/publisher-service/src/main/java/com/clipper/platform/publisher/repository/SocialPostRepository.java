package com.clipper.platform.publisher.repository;

import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.model.PostStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.UUID;

public interface SocialPostRepository extends JpaRepository<SocialPost, UUID> {

    /**
     * Moves the post to {@code target} only if it is currently in one of {@code from}.
     *
     * @return 1 when this caller won the transition, 0 otherwise
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE SocialPost p SET p.status = :target, p.errorMessage = null " +
           "WHERE p.id = :id AND p.status IN :from")
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") Collection<PostStatus> from,
                         @Param("target") PostStatus target);

    /**
     * Like {@link #transitionStatus(UUID, Collection, PostStatus)}, recording {@code errorMessage} on the post.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE SocialPost p SET p.status = :target, p.errorMessage = :errorMessage " +
           "WHERE p.id = :id AND p.status IN :from")
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") Collection<PostStatus> from,
                         @Param("target") PostStatus target,
                         @Param("errorMessage") String errorMessage);
}
