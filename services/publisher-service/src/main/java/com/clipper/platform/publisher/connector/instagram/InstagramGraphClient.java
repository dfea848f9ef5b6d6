package com.clipper.platform.publisher.connector.instagram;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.credential.OAuthTokenResponse;
import com.clipper.platform.publisher.exception.ApiException;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.PublishException;
import com.clipper.platform.publisher.exception.RemoteErrors;
import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Instagram Graph API calls used for content publishing and token upkeep.
 * Requires a Facebook Page with an Instagram Professional account linked.
 *
 * API Documentation: https://developers.facebook.com/docs/instagram-api/guides/content-publishing
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InstagramGraphClient {

    static final String GRAPH_API_BASE = "https://graph.facebook.com/v18.0";

    // OAuthException and API session errors
    private static final Set<Integer> AUTH_ERROR_CODES = Set.of(102, 190);

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final PublishingProperties properties;

    /**
     * Create a media container; the caller decides which params (image_url, video_url, media_type,
     * children, caption) apply
     */
    Mono<String> createContainer(String igUserId, String accessToken, MultiValueMap<String, String> params) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>(params);
        form.add("access_token", accessToken);

        return send(webClientBuilder.build().post()
                        .uri(GRAPH_API_BASE + "/{igUserId}/media", igUserId)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .body(BodyInserters.fromFormData(form)),
                GraphIdResponse.class)
                .flatMap(response -> requireId(response, "media container"));
    }

    Mono<GraphContainerStatus> containerStatus(String containerId, String accessToken) {
        return send(webClientBuilder.build().get()
                        .uri(GRAPH_API_BASE + "/{containerId}?fields=id,status_code,status&access_token={token}",
                                containerId, accessToken),
                GraphContainerStatus.class);
    }

    Mono<String> publishContainer(String igUserId, String creationId, String accessToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("creation_id", creationId);
        form.add("access_token", accessToken);

        return send(webClientBuilder.build().post()
                        .uri(GRAPH_API_BASE + "/{igUserId}/media_publish", igUserId)
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .body(BodyInserters.fromFormData(form)),
                GraphIdResponse.class)
                .flatMap(response -> requireId(response, "published media"));
    }

    Mono<String> permalink(String mediaId, String accessToken) {
        return send(webClientBuilder.build().get()
                        .uri(GRAPH_API_BASE + "/{mediaId}?fields=permalink&access_token={token}", mediaId, accessToken),
                GraphPermalink.class)
                .flatMap(response -> Mono.justOrEmpty(response.getPermalink()));
    }

    /**
     * Exchange a still valid long-lived user token for a new long-lived one
     */
    public Mono<OAuthTokenResponse> exchangeLongLivedToken(String accessToken, String appId, String appSecret) {
        return send(webClientBuilder.build().get()
                        .uri(GRAPH_API_BASE + "/oauth/access_token?grant_type=fb_exchange_token"
                                        + "&client_id={appId}&client_secret={appSecret}&fb_exchange_token={token}",
                                appId, appSecret, accessToken),
                OAuthTokenResponse.class);
    }

    /**
     * Page access token for {@code pageId} as seen by the given user token, or empty when the user
     * no longer manages that page
     */
    public Mono<String> pageAccessToken(String userAccessToken, String pageId) {
        return send(webClientBuilder.build().get()
                        .uri(GRAPH_API_BASE + "/me/accounts?fields=id,access_token&access_token={token}", userAccessToken),
                FacebookPagesResponse.class)
                .flatMap(response -> Mono.justOrEmpty(response.getData() == null ? null : response.getData().stream()
                        .filter(page -> Objects.equals(pageId, page.getId()))
                        .map(FacebookPage::getAccessToken)
                        .filter(Objects::nonNull)
                        .findFirst()
                        .orElse(null)));
    }

    private <T> Mono<T> send(WebClient.RequestHeadersSpec<?> request, Class<T> type) {
        Mono<T> call = request.retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> translateError(response.statusCode().value(), body)))
                .bodyToMono(type);
        return RemoteErrors.guard(Platform.INSTAGRAM, properties.getCallTimeout(), call);
    }

    private Mono<String> requireId(GraphIdResponse response, String what) {
        if (response.getId() == null) {
            return Mono.error(new ApiException("Instagram returned no id for the " + what));
        }
        return Mono.just(response.getId());
    }

    PublishException translateError(int status, String body) {
        GraphError error = parseError(body);
        String message = error != null && error.getMessage() != null ? error.getMessage() : body;
        if (status == 401 || (error != null && error.getCode() != null && AUTH_ERROR_CODES.contains(error.getCode()))) {
            return new AuthException("Instagram rejected the access token: " + message);
        }
        return RemoteErrors.fromStatus(Platform.INSTAGRAM, status, message);
    }

    private GraphError parseError(String body) {
        try {
            GraphErrorResponse response = objectMapper.readValue(body, GraphErrorResponse.class);
            return response.getError();
        } catch (JsonProcessingException e) {
            log.debug("Graph error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}

// Graph API DTOs

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class GraphIdResponse {
    private String id;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class GraphContainerStatus {
    private String id;

    @JsonProperty("status_code")
    private String statusCode;

    private String status;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class GraphPermalink {
    private String id;
    private String permalink;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class GraphErrorResponse {
    private GraphError error;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class GraphError {
    private String message;
    private String type;
    private Integer code;

    @JsonProperty("error_subcode")
    private Integer errorSubcode;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class FacebookPagesResponse {
    private List<FacebookPage> data;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class FacebookPage {
    private String id;
    private String name;

    @ToString.Exclude
    @JsonProperty("access_token")
    private String accessToken;
}
