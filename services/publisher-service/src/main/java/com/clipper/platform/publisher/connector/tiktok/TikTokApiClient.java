package com.clipper.platform.publisher.connector.tiktok;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.connector.tiktok.dto.CreatorInfo;
import com.clipper.platform.publisher.connector.tiktok.dto.CreatorInfoResponse;
import com.clipper.platform.publisher.connector.tiktok.dto.PublishInitData;
import com.clipper.platform.publisher.connector.tiktok.dto.PublishInitResponse;
import com.clipper.platform.publisher.connector.tiktok.dto.PublishStatusData;
import com.clipper.platform.publisher.connector.tiktok.dto.PublishStatusResponse;
import com.clipper.platform.publisher.connector.tiktok.dto.TikTokError;
import com.clipper.platform.publisher.connector.tiktok.dto.TikTokResponse;
import com.clipper.platform.publisher.exception.ApiException;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.GatewayException;
import com.clipper.platform.publisher.exception.PublishException;
import com.clipper.platform.publisher.exception.RemoteErrors;
import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/**
 * TikTok Content Posting API v2 calls.
 *
 * API Documentation: https://developers.tiktok.com/doc/content-posting-api-reference-direct-post
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TikTokApiClient {

    static final String TIKTOK_API_BASE = "https://open.tiktokapis.com/v2/post/publish";

    private static final Set<String> AUTH_ERROR_CODES =
            Set.of("access_token_invalid", "access_token_expired", "token_not_authorized", "scope_not_authorized");
    private static final Set<String> THROTTLE_ERROR_CODES = Set.of("rate_limit_exceeded", "spam_risk_too_many_posts");

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final PublishingProperties properties;

    /**
     * Query creator info. Must precede every post: it returns the privacy levels the creator may
     * use, interaction locks and the maximum video duration.
     */
    Mono<CreatorInfo> queryCreatorInfo(String accessToken) {
        return post("/creator_info/query/", accessToken, Map.of(), CreatorInfoResponse.class);
    }

    /**
     * Initialize a direct video post, either FILE_UPLOAD or PULL_FROM_URL depending on source_info
     */
    Mono<PublishInitData> initVideo(String accessToken, Map<String, Object> body) {
        return post("/video/init/", accessToken, body, PublishInitResponse.class)
                .flatMap(this::requirePublishId);
    }

    /**
     * Initialize a photo post; TikTok pulls the images itself
     */
    Mono<PublishInitData> initContent(String accessToken, Map<String, Object> body) {
        return post("/content/init/", accessToken, body, PublishInitResponse.class)
                .flatMap(this::requirePublishId);
    }

    Mono<PublishStatusData> fetchStatus(String accessToken, String publishId) {
        return post("/status/fetch/", accessToken, Map.of("publish_id", publishId), PublishStatusResponse.class);
    }

    private <T, R extends TikTokResponse<T>> Mono<T> post(String path, String accessToken, Object body,
                                                           Class<R> type) {
        Mono<R> call = webClientBuilder.build().post()
                .uri(TIKTOK_API_BASE + path)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .contentType(new MediaType(MediaType.APPLICATION_JSON, StandardCharsets.UTF_8))
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> translateError(response.statusCode().value(), parseError(text), text)))
                .bodyToMono(type);

        return RemoteErrors.guard(Platform.TIKTOK, properties.getCallTimeout(), call)
                .flatMap(response -> {
                    TikTokError error = response.getError();
                    if (error != null && !error.isOk()) {
                        return Mono.error(translateError(200, error, error.getMessage()));
                    }
                    if (response.getData() == null) {
                        return Mono.error(new ApiException("TikTok returned no data for " + path));
                    }
                    return Mono.just(response.getData());
                });
    }

    private Mono<PublishInitData> requirePublishId(PublishInitData data) {
        if (data.getPublishId() == null) {
            return Mono.error(new ApiException("TikTok returned no publish_id"));
        }
        return Mono.just(data);
    }

    PublishException translateError(int status, TikTokError error, String fallback) {
        String code = error != null ? error.getCode() : null;
        String message = error != null && error.getMessage() != null && !error.getMessage().isBlank()
                ? error.getMessage()
                : fallback;
        if (error != null && error.getLogId() != null) {
            log.warn("TikTok error {} (log_id {}): {}", code, error.getLogId(), message);
        }
        if (status == 401 || (code != null && AUTH_ERROR_CODES.contains(code))) {
            return new AuthException("TikTok rejected the access token: " + message);
        }
        if (code != null && THROTTLE_ERROR_CODES.contains(code)) {
            return new GatewayException("TikTok throttled the request: " + message);
        }
        if (status == 200) {
            return new ApiException("TikTok API error " + code + ": " + message);
        }
        return RemoteErrors.fromStatus(Platform.TIKTOK, status, message);
    }

    private TikTokError parseError(String body) {
        try {
            return objectMapper.readValue(body, ErrorEnvelope.class).getError();
        } catch (JsonProcessingException e) {
            log.debug("TikTok error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorEnvelope {
        private TikTokError error;
    }
}
