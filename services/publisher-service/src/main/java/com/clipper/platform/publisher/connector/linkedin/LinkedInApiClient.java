package com.clipper.platform.publisher.connector.linkedin;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.exception.ApiException;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.PublishException;
import com.clipper.platform.publisher.exception.RemoteErrors;
import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LinkedIn versioned REST API calls: image and video uploads and post creation.
 *
 * API Documentation: https://learn.microsoft.com/en-us/linkedin/marketing/community-management/shares/posts-api
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LinkedInApiClient {

    static final String LINKEDIN_API_BASE = "https://api.linkedin.com/rest";
    static final String LINKEDIN_VERSION = "202401";
    static final String RESTLI_ID_HEADER = "x-restli-id";

    private static final Set<String> AUTH_ERROR_CODES =
            Set.of("INVALID_ACCESS_TOKEN", "EXPIRED_ACCESS_TOKEN", "REVOKED_ACCESS_TOKEN");

    private final WebClient.Builder webClientBuilder;
    private final ObjectMapper objectMapper;
    private final PublishingProperties properties;

    Mono<ImageUpload> initializeImageUpload(String accessToken, String ownerUrn) {
        Map<String, Object> body = Map.of("initializeUploadRequest", Map.of("owner", ownerUrn));
        return send(post(accessToken, "/images?action=initializeUpload", body), ImageUploadResponse.class)
                .flatMap(response -> response.getValue() == null || response.getValue().getUploadUrl() == null
                        ? Mono.error(new ApiException("LinkedIn returned no image upload URL"))
                        : Mono.just(response.getValue()));
    }

    Mono<VideoUpload> initializeVideoUpload(String accessToken, String ownerUrn, long fileSizeBytes) {
        Map<String, Object> request = Map.of(
                "owner", ownerUrn,
                "fileSizeBytes", fileSizeBytes,
                "uploadCaptions", false,
                "uploadThumbnail", false);
        return send(post(accessToken, "/videos?action=initializeUpload", Map.of("initializeUploadRequest", request)),
                VideoUploadResponse.class)
                .flatMap(response -> response.getValue() == null || response.getValue().getUploadInstructions() == null
                        || response.getValue().getUploadInstructions().isEmpty()
                        ? Mono.error(new ApiException("LinkedIn returned no video upload instructions"))
                        : Mono.just(response.getValue()));
    }

    /**
     * Commit the uploaded parts; {@code partIds} are the ETags of the part uploads, in order
     */
    Mono<Void> finalizeVideoUpload(String accessToken, String videoUrn, String uploadToken, List<String> partIds) {
        Map<String, Object> request = Map.of(
                "video", videoUrn,
                "uploadToken", uploadToken != null ? uploadToken : "",
                "uploadedPartIds", partIds);
        return send(post(accessToken, "/videos?action=finalizeUpload", Map.of("finalizeUploadRequest", request)),
                String.class)
                .then();
    }

    Mono<VideoStatus> videoStatus(String accessToken, String videoUrn) {
        return send(webClientBuilder.build().get()
                        .uri(URI.create(LINKEDIN_API_BASE + "/videos/" + encodeUrn(videoUrn)))
                        .headers(headers -> apiHeaders(headers, accessToken)),
                VideoStatus.class);
    }

    /**
     * Create the post and return its URN from the {@code x-restli-id} header
     */
    Mono<String> createPost(String accessToken, Map<String, Object> body) {
        Mono<String> call = post(accessToken, "/posts", body).exchangeToMono(this::postUrn);
        return RemoteErrors.guard(Platform.LINKEDIN, properties.getCallTimeout(), call);
    }

    private Mono<String> postUrn(ClientResponse response) {
        if (response.statusCode().is2xxSuccessful()) {
            String urn = response.headers().asHttpHeaders().getFirst(RESTLI_ID_HEADER);
            return response.releaseBody().then(urn != null
                    ? Mono.just(urn)
                    : Mono.error(new ApiException("LinkedIn did not return the post URN")));
        }
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(text -> Mono.error(translateError(response.statusCode().value(), text)));
    }

    static String encodeUrn(String urn) {
        return URLEncoder.encode(urn, StandardCharsets.UTF_8);
    }

    private WebClient.RequestHeadersSpec<?> post(String accessToken, String path, Object body) {
        return webClientBuilder.build().post()
                .uri(URI.create(LINKEDIN_API_BASE + path))
                .headers(headers -> apiHeaders(headers, accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body);
    }

    private void apiHeaders(HttpHeaders headers, String accessToken) {
        headers.setBearerAuth(accessToken);
        headers.set("LinkedIn-Version", LINKEDIN_VERSION);
        headers.set("X-Restli-Protocol-Version", "2.0.0");
    }

    private <T> Mono<T> send(WebClient.RequestHeadersSpec<?> request, Class<T> type) {
        Mono<T> call = request.retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> translateError(response.statusCode().value(), text)))
                .bodyToMono(type);
        return RemoteErrors.guard(Platform.LINKEDIN, properties.getCallTimeout(), call);
    }

    PublishException translateError(int status, String body) {
        LinkedInError error = parseError(body);
        String message = error != null && error.getMessage() != null ? error.getMessage() : body;
        if (status == 401 || (error != null && error.getCode() != null && AUTH_ERROR_CODES.contains(error.getCode()))) {
            return new AuthException("LinkedIn rejected the access token: " + message);
        }
        return RemoteErrors.fromStatus(Platform.LINKEDIN, status, message);
    }

    private LinkedInError parseError(String body) {
        try {
            return objectMapper.readValue(body, LinkedInError.class);
        } catch (JsonProcessingException e) {
            log.debug("LinkedIn error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}

// REST API DTOs

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class ImageUploadResponse {
    private ImageUpload value;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class ImageUpload {
    private String uploadUrl;
    private String image;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class VideoUploadResponse {
    private VideoUpload value;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class VideoUpload {
    private String video;
    private String uploadToken;
    private List<UploadInstruction> uploadInstructions = new ArrayList<>();
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class UploadInstruction {
    private String uploadUrl;
    private long firstByte;
    private long lastByte;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class VideoStatus {
    private String id;
    private String status;
    private String processingFailureReason;
}

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class LinkedInError {
    private Integer status;
    private Integer serviceErrorCode;
    private String code;
    private String message;
}
