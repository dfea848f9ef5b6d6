package com.clipper.platform.publisher.entity;

import com.clipper.platform.publisher.entity.metadata.AccountMetadata;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.model.Platform;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "social_accounts",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "platform"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SocialAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private Platform platform;

    @Column(name = "platform_user_id")
    private String platformUserId;

    @Column(length = 255)
    private String username;

    @ToString.Exclude
    @Column(name = "access_token_enc", columnDefinition = "TEXT")
    private String accessTokenEncrypted;

    @ToString.Exclude
    @Column(name = "refresh_token_enc", columnDefinition = "TEXT")
    private String refreshTokenEncrypted;

    @Column(name = "token_expires_at")
    private OffsetDateTime tokenExpiresAt;

    @Column(name = "is_active")
    @Builder.Default
    private boolean active = true;

    @ToString.Exclude
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private AccountMetadata metadata;

    // Compare-and-swap guard for concurrent token refreshes across instances
    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PostLoad
    void checkMetadataPlatform() {
        if (metadata != null && metadata.getPlatform() != platform) {
            throw new IllegalStateException("Account " + id + " holds " + metadata.getPlatform()
                    + " metadata but is a " + platform + " account");
        }
    }

    public <T extends AccountMetadata> T metadataAs(Class<T> type) {
        if (!type.isInstance(metadata)) {
            throw new ValidationException(platform.getDisplayName() + " account " + id
                    + " is missing its platform metadata; reconnect the account");
        }
        return type.cast(metadata);
    }
}
