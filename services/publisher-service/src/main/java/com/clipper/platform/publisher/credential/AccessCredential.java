package com.clipper.platform.publisher.credential;

import com.clipper.platform.publisher.entity.metadata.AccountMetadata;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.model.Platform;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.UUID;

/**
 * Decrypted, currently valid credential for one publish call. Never persisted.
 */
@Value
@Builder
public class AccessCredential {
    UUID accountId;
    Platform platform;

    @ToString.Exclude
    String accessToken;

    String username;
    AccountMetadata metadata;

    public <T extends AccountMetadata> T metadataAs(Class<T> type) {
        if (!type.isInstance(metadata)) {
            throw new ValidationException(platform.getDisplayName() + " account " + accountId
                    + " is missing its platform metadata; reconnect the account");
        }
        return type.cast(metadata);
    }
}
