package com.clipper.platform.publisher.credential;

import com.clipper.platform.publisher.connector.instagram.InstagramGraphClient;
import com.clipper.platform.publisher.entity.SocialAccount;
import com.clipper.platform.publisher.entity.metadata.InstagramMetadata;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Instagram has no refresh token: a still valid long-lived user token is exchanged for a new one,
 * and the page token used for publishing is derived again from the new user token.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InstagramTokenRefresher implements TokenRefresher {

    // Graph long-lived user tokens last about 60 days
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 60L * 24 * 3600;

    private final InstagramGraphClient graphClient;

    @Value("${instagram.app-id:}")
    private String appId;

    @Value("${instagram.app-secret:}")
    private String appSecret;

    @Override
    public Platform getPlatform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public Mono<RefreshedTokens> refresh(SocialAccount account, String accessToken, String refreshToken) {
        return Mono.defer(() -> {
            if (accessToken == null || accessToken.isBlank()) {
                return Mono.error(new AuthException("No Instagram access token stored; reconnect the account"));
            }
            String pageId = account.metadataAs(InstagramMetadata.class).getFacebookPageId();

            return graphClient.exchangeLongLivedToken(accessToken, appId, appSecret)
                    .flatMap(token -> {
                        if (token.getAccessToken() == null || token.getAccessToken().isBlank()) {
                            return Mono.error(new AuthException("Instagram token exchange returned no access token"));
                        }
                        long expiresIn = token.getExpiresIn() != null ? token.getExpiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
                        return derivePageToken(token.getAccessToken(), pageId)
                                .map(pageToken -> tokens(token.getAccessToken(), expiresIn, pageToken))
                                .switchIfEmpty(Mono.fromSupplier(() -> tokens(token.getAccessToken(), expiresIn, null)));
                    });
        });
    }

    private Mono<String> derivePageToken(String userToken, String pageId) {
        if (pageId == null) {
            return Mono.empty();
        }
        return graphClient.pageAccessToken(userToken, pageId)
                .switchIfEmpty(Mono.fromRunnable(() ->
                        log.warn("Facebook page {} not among the user's pages; keeping the stored page token", pageId)));
    }

    private RefreshedTokens tokens(String accessToken, long expiresIn, String pageToken) {
        return RefreshedTokens.builder()
                .accessToken(accessToken)
                .expiresInSeconds(expiresIn)
                .publishingToken(pageToken)
                .build();
    }
}
