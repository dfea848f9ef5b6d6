package com.clipper.platform.publisher.entity.metadata;

import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Platform specific account data stored as JSON next to the account row. The {@code platform}
 * discriminator selects the concrete type, so a row can never carry another platform's fields.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "platform")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InstagramMetadata.class, name = "INSTAGRAM"),
        @JsonSubTypes.Type(value = YouTubeMetadata.class, name = "YOUTUBE"),
        @JsonSubTypes.Type(value = TikTokMetadata.class, name = "TIKTOK"),
        @JsonSubTypes.Type(value = LinkedInMetadata.class, name = "LINKEDIN")
})
public abstract class AccountMetadata {

    @JsonIgnore
    public abstract Platform getPlatform();

    /**
     * Encrypted token to call the platform with when it differs from the account's own access
     * token, or {@code null}.
     */
    @JsonIgnore
    public String getPublishingTokenEncrypted() {
        return null;
    }

    /**
     * Copy of this metadata carrying a freshly derived publishing token.
     */
    public AccountMetadata withPublishingToken(String encryptedToken) {
        return this;
    }
}
