package com.clipper.platform.publisher.credential;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Plaintext result of a provider refresh, encrypted by the vault before it is stored.
 */
@Value
@Builder
public class RefreshedTokens {
    @ToString.Exclude
    String accessToken;

    // Null when the provider does not rotate refresh tokens
    @ToString.Exclude
    String refreshToken;

    long expiresInSeconds;

    // Page-level token re-derived for platforms that publish with one
    @ToString.Exclude
    String publishingToken;
}
