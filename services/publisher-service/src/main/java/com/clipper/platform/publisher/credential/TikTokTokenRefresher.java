package com.clipper.platform.publisher.credential;

import com.clipper.platform.publisher.entity.SocialAccount;
import com.clipper.platform.publisher.model.Platform;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

/**
 * TikTok rotates the refresh token on every refresh, so the new one must always be stored.
 */
@Component
@RequiredArgsConstructor
public class TikTokTokenRefresher implements TokenRefresher {

    static final String TOKEN_URL = "https://open.tiktokapis.com/v2/oauth/token/";

    private final RefreshTokenGrantClient grantClient;

    @Value("${tiktok.client-key:}")
    private String clientKey;

    @Value("${tiktok.client-secret:}")
    private String clientSecret;

    @Override
    public Platform getPlatform() {
        return Platform.TIKTOK;
    }

    @Override
    public Mono<RefreshedTokens> refresh(SocialAccount account, String accessToken, String refreshToken) {
        MultiValueMap<String, String> client = new LinkedMultiValueMap<>();
        client.add("client_key", clientKey);
        client.add("client_secret", clientSecret);
        return grantClient.refresh(Platform.TIKTOK, TOKEN_URL, refreshToken, client);
    }
}
