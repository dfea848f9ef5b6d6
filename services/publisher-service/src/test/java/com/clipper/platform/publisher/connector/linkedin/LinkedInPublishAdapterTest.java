package com.clipper.platform.publisher.connector.linkedin;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.connector.PublishContext;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.entity.metadata.LinkedInMetadata;
import com.clipper.platform.publisher.exception.AuthException;
import com.clipper.platform.publisher.exception.ProcessingFailureException;
import com.clipper.platform.publisher.exception.ValidationException;
import com.clipper.platform.publisher.model.MediaKind;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.model.Visibility;
import com.clipper.platform.publisher.polling.AsyncJobPoller;
import com.clipper.platform.publisher.storage.ObjectStorage;
import com.clipper.platform.publisher.support.BytesMediaSource;
import com.clipper.platform.publisher.support.Fixtures;
import com.clipper.platform.publisher.support.StubExchange;
import com.clipper.platform.publisher.transport.UploadTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LinkedInPublishAdapterTest {

    private static final String PERSON = "urn:li:person:abc123";
    private static final String POST_URN = "urn:li:share:7100000000000000001";
    private static final String VIDEO_URN = "urn:li:video:C5F10AQGKQg";

    private final StubExchange http = new StubExchange();
    private final ObjectStorage storage = mock(ObjectStorage.class);
    private final ObjectMapper objectMapper = Fixtures.objectMapper();
    private LinkedInPublishAdapter adapter;

    @BeforeEach
    void setUp() {
        PublishingProperties properties = Fixtures.fastProperties();
        LinkedInApiClient apiClient = new LinkedInApiClient(http.builder(), objectMapper, properties);
        UploadTransport transport = new UploadTransport(http.builder(), Duration.ofSeconds(5), Schedulers.immediate());
        adapter = new LinkedInPublishAdapter(apiClient, transport, Fixtures.mediaLocator(storage), new AsyncJobPoller(),
                properties);
    }

    private PublishContext context(SocialPost post, MediaAsset media) {
        return Fixtures.context(post, media, Fixtures.credential(Platform.LINKEDIN,
                LinkedInMetadata.builder().personUrn(PERSON).build()));
    }

    private JsonNode json(int request) throws Exception {
        return objectMapper.readTree(http.request(request).bodyAsString());
    }

    @Test
    void imageIsRegisteredUploadedAndPosted() throws Exception {
        when(storage.openStream(anyString())).thenAnswer(invocation -> BytesMediaSource.ofSize(1024).openStream());
        http.json("{\"value\":{\"uploadUrl\":\"https://www.linkedin.com/dms-uploads/img-1\",\"image\":\"urn:li:image:D4E22\"}}")
                .status(201)
                .withHeaders(HttpStatus.CREATED, Map.of("x-restli-id", POST_URN));

        StepVerifier.create(Fixtures.publish(adapter, context(Fixtures.post(Platform.LINKEDIN),
                        Fixtures.image("media/photo.jpg"))))
                .assertNext(ref -> {
                    assertThat(ref.getPostId()).isEqualTo(POST_URN);
                    assertThat(ref.getUrl()).isEqualTo("https://www.linkedin.com/feed/update/" + POST_URN + "/");
                })
                .verifyComplete();

        assertThat(http.request(0).getUrl().toString())
                .isEqualTo("https://api.linkedin.com/rest/images?action=initializeUpload");
        assertThat(http.request(0).header("LinkedIn-Version")).isEqualTo("202401");
        assertThat(http.request(0).header("X-Restli-Protocol-Version")).isEqualTo("2.0.0");
        assertThat(json(0).at("/initializeUploadRequest/owner").asText()).isEqualTo(PERSON);

        StubExchange.Recorded upload = http.request(1);
        assertThat(upload.getMethod()).isEqualTo(HttpMethod.PUT);
        assertThat(upload.getUrl().toString()).isEqualTo("https://www.linkedin.com/dms-uploads/img-1");
        assertThat(upload.header(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer token-linkedin");
        assertThat(upload.header(HttpHeaders.CONTENT_TYPE)).isEqualTo("image/jpeg");
        assertThat(upload.getBody()).hasSize(1024);

        JsonNode post = json(2);
        assertThat(http.request(2).getUrl().getPath()).isEqualTo("/rest/posts");
        assertThat(post.get("author").asText()).isEqualTo(PERSON);
        assertThat(post.get("commentary").asText()).isEqualTo("We shipped it\n\n#launch #clipper");
        assertThat(post.get("visibility").asText()).isEqualTo("PUBLIC");
        assertThat(post.get("lifecycleState").asText()).isEqualTo("PUBLISHED");
        assertThat(post.at("/distribution/feedDistribution").asText()).isEqualTo("MAIN_FEED");
        assertThat(post.at("/content/media/id").asText()).isEqualTo("urn:li:image:D4E22");
        assertThat(post.at("/content/media/title").asText()).isEqualTo("Launch day");
    }

    @Test
    void videoPartsAreCommittedWithTheirEtagsBeforePolling() throws Exception {
        when(storage.openStream(anyString())).thenAnswer(invocation -> BytesMediaSource.ofSize(25).openStream());
        http.json("{\"value\":{\"video\":\"" + VIDEO_URN + "\",\"uploadToken\":\"tok-1\",\"uploadInstructions\":["
                        + "{\"uploadUrl\":\"https://www.linkedin.com/dms-uploads/part-1\",\"firstByte\":0,\"lastByte\":14},"
                        + "{\"uploadUrl\":\"https://www.linkedin.com/dms-uploads/part-2\",\"firstByte\":15,\"lastByte\":24}]}}")
                .withHeaders(HttpStatus.OK, Map.of(HttpHeaders.ETAG, "\"etag-1\""))
                .withHeaders(HttpStatus.OK, Map.of(HttpHeaders.ETAG, "\"etag-2\""))
                .status(200)
                .json("{\"id\":\"" + VIDEO_URN + "\",\"status\":\"PROCESSING\"}")
                .json("{\"id\":\"" + VIDEO_URN + "\",\"status\":\"AVAILABLE\"}")
                .withHeaders(HttpStatus.CREATED, Map.of("x-restli-id", POST_URN));
        SocialPost post = Fixtures.post(Platform.LINKEDIN);
        post.setVisibility(Visibility.FOLLOWERS);

        StepVerifier.create(Fixtures.publish(adapter, context(post, Fixtures.video("media/v.mp4", 25, 30, 1920, 1080))))
                .assertNext(ref -> assertThat(ref.getPostId()).isEqualTo(POST_URN))
                .verifyComplete();

        assertThat(http.count()).isEqualTo(7);
        assertThat(json(0).at("/initializeUploadRequest/fileSizeBytes").asLong()).isEqualTo(25);

        StubExchange.Recorded secondPart = http.request(2);
        assertThat(secondPart.getUrl().toString()).isEqualTo("https://www.linkedin.com/dms-uploads/part-2");
        assertThat(secondPart.getBody()).hasSize(10);
        assertThat(secondPart.header(HttpHeaders.AUTHORIZATION)).isNull();
        assertThat(secondPart.header(HttpHeaders.CONTENT_TYPE)).isEqualTo("application/octet-stream");

        JsonNode finalize = json(3).get("finalizeUploadRequest");
        assertThat(finalize.get("video").asText()).isEqualTo(VIDEO_URN);
        assertThat(finalize.get("uploadToken").asText()).isEqualTo("tok-1");
        assertThat(finalize.get("uploadedPartIds")).extracting(JsonNode::asText)
                .containsExactly("\"etag-1\"", "\"etag-2\"");

        assertThat(http.request(4).getMethod()).isEqualTo(HttpMethod.GET);
        assertThat(http.request(4).getUrl().getRawPath()).isEqualTo("/rest/videos/urn%3Ali%3Avideo%3AC5F10AQGKQg");
        assertThat(json(6).get("visibility").asText()).isEqualTo("CONNECTIONS");
        assertThat(json(6).at("/content/media/id").asText()).isEqualTo(VIDEO_URN);
    }

    @Test
    void failedVideoProcessingStopsBeforeThePost() {
        when(storage.openStream(anyString())).thenAnswer(invocation -> BytesMediaSource.ofSize(25).openStream());
        http.json("{\"value\":{\"video\":\"" + VIDEO_URN + "\",\"uploadToken\":\"\",\"uploadInstructions\":["
                        + "{\"uploadUrl\":\"https://www.linkedin.com/dms-uploads/part-1\",\"firstByte\":0,\"lastByte\":24}]}}")
                .withHeaders(HttpStatus.OK, Map.of(HttpHeaders.ETAG, "\"etag-1\""))
                .status(200)
                .json("{\"id\":\"" + VIDEO_URN + "\",\"status\":\"PROCESSING_FAILED\","
                        + "\"processingFailureReason\":\"unsupported codec\"}");

        StepVerifier.create(Fixtures.publish(adapter, context(Fixtures.post(Platform.LINKEDIN),
                        Fixtures.video("media/v.mp4", 25, 30, 1920, 1080))))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(ProcessingFailureException.class)
                        .hasMessageContaining("unsupported codec"))
                .verify();

        assertThat(http.pending()).isZero();
        assertThat(http.paths()).doesNotContain("/rest/posts");
    }

    @Test
    void onlySingleStoredImagesAndVideosAreAccepted() {
        MediaAsset story = Fixtures.video("media/s.mp4", 25, 10, 1080, 1920);
        story.setKind(MediaKind.STORY);
        MediaAsset remote = Fixtures.image(null);
        remote.setSourceUrl("https://cdn.example.com/p.jpg");

        assertThatThrownBy(() -> adapter.validate(Fixtures.carousel(Fixtures.imageItems(3)), null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> adapter.validate(story, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> adapter.validate(remote, null)).isInstanceOf(ValidationException.class);
        assertThat(http.count()).isZero();
    }

    @Test
    void accountWithoutAuthorUrnIsRejectedBeforeAnyCall() {
        PublishContext context = Fixtures.context(Fixtures.post(Platform.LINKEDIN), Fixtures.image("media/photo.jpg"),
                Fixtures.credential(Platform.LINKEDIN, LinkedInMetadata.builder().build()));

        assertThatThrownBy(() -> adapter.initiate(context)).isInstanceOf(ValidationException.class);
        assertThat(http.count()).isZero();
    }

    @Test
    void revokedTokenIsAnAuthError() {
        when(storage.openStream(anyString())).thenAnswer(invocation -> BytesMediaSource.ofSize(1024).openStream());
        http.json(HttpStatus.UNAUTHORIZED,
                "{\"status\":401,\"serviceErrorCode\":65601,\"code\":\"REVOKED_ACCESS_TOKEN\",\"message\":\"The token used in the request has been revoked by the user\"}");

        StepVerifier.create(Fixtures.publish(adapter, context(Fixtures.post(Platform.LINKEDIN),
                        Fixtures.image("media/photo.jpg"))))
                .expectError(AuthException.class)
                .verify();
    }
}
