package com.clipper.platform.publisher.credential;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.connector.instagram.InstagramGraphClient;
import com.clipper.platform.publisher.entity.SocialAccount;
import com.clipper.platform.publisher.entity.metadata.InstagramMetadata;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.GatewayException;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.support.Fixtures;
import com.clipper.platform.publisher.support.StubExchange;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class TokenRefresherTest {

    private final StubExchange http = new StubExchange();
    private final PublishingProperties properties = Fixtures.fastProperties();
    private final RefreshTokenGrantClient grantClient =
            new RefreshTokenGrantClient(http.builder(), Fixtures.objectMapper(), properties);

    private TikTokTokenRefresher tiktok() {
        TikTokTokenRefresher refresher = new TikTokTokenRefresher(grantClient);
        ReflectionTestUtils.setField(refresher, "clientKey", "ck-123");
        ReflectionTestUtils.setField(refresher, "clientSecret", "cs-456");
        return refresher;
    }

    private static SocialAccount account(Platform platform) {
        return SocialAccount.builder().id(UUID.randomUUID()).platform(platform).build();
    }

    @Test
    void refreshTokenGrantIsPostedAsAForm() {
        http.json("{\"access_token\":\"at-2\",\"refresh_token\":\"rt-2\",\"expires_in\":86400,\"token_type\":\"Bearer\"}");

        StepVerifier.create(tiktok().refresh(account(Platform.TIKTOK), "at-1", "rt-1"))
                .assertNext(tokens -> {
                    assertThat(tokens.getAccessToken()).isEqualTo("at-2");
                    assertThat(tokens.getRefreshToken()).isEqualTo("rt-2");
                    assertThat(tokens.getExpiresInSeconds()).isEqualTo(86400);
                    assertThat(tokens.getPublishingToken()).isNull();
                })
                .verifyComplete();

        StubExchange.Recorded request = http.request(0);
        assertThat(request.getMethod()).isEqualTo(HttpMethod.POST);
        assertThat(request.getUrl().toString()).isEqualTo(TikTokTokenRefresher.TOKEN_URL);
        assertThat(request.bodyAsString())
                .contains("grant_type=refresh_token")
                .contains("refresh_token=rt-1")
                .contains("client_key=ck-123")
                .contains("client_secret=cs-456");
    }

    @Test
    void tokenPayloadWrappedInDataIsAccepted() {
        http.json("{\"data\":{\"access_token\":\"at-3\",\"expires_in\":3600}}");
        LinkedInTokenRefresher refresher = new LinkedInTokenRefresher(grantClient);

        StepVerifier.create(refresher.refresh(account(Platform.LINKEDIN), "at-1", "rt-1"))
                .assertNext(tokens -> {
                    assertThat(tokens.getAccessToken()).isEqualTo("at-3");
                    assertThat(tokens.getRefreshToken()).isNull();
                })
                .verifyComplete();
        assertThat(http.request(0).getUrl().toString()).isEqualTo(LinkedInTokenRefresher.TOKEN_URL);
    }

    @Test
    void revokedGrantIsAnAuthError() {
        http.json(HttpStatus.BAD_REQUEST, "{\"error\":\"invalid_grant\",\"error_description\":\"Token has been expired or revoked.\"}");
        YouTubeTokenRefresher refresher = new YouTubeTokenRefresher(grantClient);

        StepVerifier.create(refresher.refresh(account(Platform.YOUTUBE), "at-1", "rt-1"))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(AuthException.class)
                        .hasMessageContaining("invalid_grant"))
                .verify();
    }

    @Test
    void unavailableTokenEndpointStaysRetryable() {
        http.json(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"temporarily_unavailable\"}");

        StepVerifier.create(tiktok().refresh(account(Platform.TIKTOK), "at-1", "rt-1"))
                .expectError(GatewayException.class)
                .verify();
    }

    @Test
    void missingRefreshTokenFailsWithoutACall() {
        StepVerifier.create(tiktok().refresh(account(Platform.TIKTOK), "at-1", null))
                .expectError(AuthException.class)
                .verify();

        assertThat(http.count()).isZero();
    }

    @Test
    void responseWithoutAccessTokenIsAnAuthError() {
        http.json("{\"error\":\"invalid_request\",\"error_description\":\"refresh_token is invalid\"}");

        StepVerifier.create(tiktok().refresh(account(Platform.TIKTOK), "at-1", "rt-1"))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(AuthException.class)
                        .hasMessageContaining("refresh_token is invalid"))
                .verify();
    }

    @Test
    void instagramExchangesTheUserTokenAndDerivesThePageTokenAgain() {
        http.json("{\"access_token\":\"long-lived-2\",\"token_type\":\"bearer\",\"expires_in\":5183944}")
                .json("{\"data\":[{\"id\":\"page-9\",\"access_token\":\"other-page\"},"
                        + "{\"id\":\"page-1\",\"access_token\":\"page-token-2\"}]}");
        InstagramTokenRefresher refresher = new InstagramTokenRefresher(
                new InstagramGraphClient(http.builder(), Fixtures.objectMapper(), properties));
        ReflectionTestUtils.setField(refresher, "appId", "app-1");
        ReflectionTestUtils.setField(refresher, "appSecret", "secret-1");
        SocialAccount account = account(Platform.INSTAGRAM);
        account.setMetadata(InstagramMetadata.builder().facebookPageId("page-1").instagramBusinessAccountId("ig-1").build());

        StepVerifier.create(refresher.refresh(account, "long-lived-1", null))
                .assertNext(tokens -> {
                    assertThat(tokens.getAccessToken()).isEqualTo("long-lived-2");
                    assertThat(tokens.getExpiresInSeconds()).isEqualTo(5183944);
                    assertThat(tokens.getPublishingToken()).isEqualTo("page-token-2");
                })
                .verifyComplete();

        assertThat(http.request(0).getUrl().getPath()).isEqualTo("/v18.0/oauth/access_token");
        assertThat(http.request(0).getUrl().getQuery())
                .contains("grant_type=fb_exchange_token")
                .contains("fb_exchange_token=long-lived-1")
                .contains("client_id=app-1");
        assertThat(http.request(1).getUrl().getPath()).isEqualTo("/v18.0/me/accounts");
    }

    @Test
    void instagramKeepsThePageTokenWhenThePageIsGone() {
        http.json("{\"access_token\":\"long-lived-2\",\"expires_in\":5183944}")
                .json("{\"data\":[]}");
        InstagramTokenRefresher refresher = new InstagramTokenRefresher(
                new InstagramGraphClient(http.builder(), Fixtures.objectMapper(), properties));
        SocialAccount account = account(Platform.INSTAGRAM);
        account.setMetadata(InstagramMetadata.builder().facebookPageId("page-1").build());

        StepVerifier.create(refresher.refresh(account, "long-lived-1", null))
                .assertNext(tokens -> {
                    assertThat(tokens.getAccessToken()).isEqualTo("long-lived-2");
                    assertThat(tokens.getPublishingToken()).isNull();
                })
                .verifyComplete();
    }
}
