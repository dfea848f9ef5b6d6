package com.clipper.platform.publisher.credential;

import com.clipper.platform.publisher.entity.SocialAccount;
import com.clipper.platform.publisher.model.Platform;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class YouTubeTokenRefresher implements TokenRefresher {

    static final String TOKEN_URL = "https://oauth2.googleapis.com/token";

    private final RefreshTokenGrantClient grantClient;

    @Value("${youtube.client-id:}")
    private String clientId;

    @Value("${youtube.client-secret:}")
    private String clientSecret;

    @Override
    public Platform getPlatform() {
        return Platform.YOUTUBE;
    }

    @Override
    public Mono<RefreshedTokens> refresh(SocialAccount account, String accessToken, String refreshToken) {
        MultiValueMap<String, String> client = new LinkedMultiValueMap<>();
        client.add("client_id", clientId);
        client.add("client_secret", clientSecret);
        return grantClient.refresh(Platform.YOUTUBE, TOKEN_URL, refreshToken, client);
    }
}
