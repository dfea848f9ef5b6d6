package com.clipper.platform.publisher.credential;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.PublishException;
import com.clipper.platform.publisher.exception.RemoteErrors;
import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Standard OAuth 2.0 refresh-token grant, posted form-encoded. Some providers wrap the token
 * payload in a {@code data} object; both shapes are accepted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RefreshTokenGrantClient {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final PublishingProperties properties;

    public Mono<RefreshedTokens> refresh(Platform platform, String tokenUrl, String refreshToken,
                                         MultiValueMap<String, String> clientCredentials) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return Mono.error(new AuthException("No " + platform.getDisplayName()
                    + " refresh token stored; reconnect the account"));
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>(clientCredentials);
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);

        Mono<JsonNode> call = webClientBuilder.build()
                .post()
                .uri(tokenUrl)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> rejected(platform, response.statusCode().value(), body)))
                .bodyToMono(JsonNode.class);

        return RemoteErrors.guard(platform, properties.getCallTimeout(), call)
                .flatMap(node -> Mono.fromCallable(() -> objectMapper.treeToValue(unwrap(node), OAuthTokenResponse.class)))
                .flatMap(token -> toRefreshedTokens(platform, token));
    }

    private JsonNode unwrap(JsonNode node) {
        JsonNode data = node.get("data");
        return data != null && data.isObject() ? data : node;
    }

    private Mono<RefreshedTokens> toRefreshedTokens(Platform platform, OAuthTokenResponse token) {
        if (token.getAccessToken() == null || token.getAccessToken().isBlank()) {
            String reason = token.getErrorDescription() != null ? token.getErrorDescription() : token.getError();
            return Mono.error(new AuthException(platform.getDisplayName() + " refresh returned no access token: " + reason));
        }
        log.info("Refreshed {} access token, expires in {}s", platform.getDisplayName(), token.getExpiresIn());
        return Mono.just(RefreshedTokens.builder()
                .accessToken(token.getAccessToken())
                .refreshToken(token.getRefreshToken())
                .expiresInSeconds(token.getExpiresIn() != null ? token.getExpiresIn() : DEFAULT_EXPIRES_IN_SECONDS)
                .build());
    }

    private PublishException rejected(Platform platform, int status, String body) {
        if (status == 429 || status >= 500) {
            return RemoteErrors.fromStatus(platform, status, body);
        }
        // Any 4xx from the token endpoint means the stored grant is no longer usable
        return new AuthException(platform.getDisplayName() + " rejected the token refresh (" + status + "): " + body);
    }
}
