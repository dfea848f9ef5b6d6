package com.clipper.platform.publisher.transport;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.exception.ApiException;
import com.clipper.platform.publisher.exception.GatewayException;
import com.clipper.platform.publisher.exception.RemoteErrors;
import com.clipper.platform.publisher.model.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends a media payload to one or more upload URLs as sequential byte-range PUTs.
 * <p>
 * The payload is streamed from its {@link MediaSource}; only the chunk in flight is buffered.
 * Each response is classified as continue (308/206), complete (2xx) or a typed error, and a
 * chunk that fails with a {@link GatewayException} is resent according to the request's
 * {@link RetryPolicy}.
 */
@Component
@Slf4j
public class UploadTransport {

    private final WebClient.Builder webClientBuilder;
    private final Duration chunkTimeout;
    private final Scheduler ioScheduler;

    @Autowired
    public UploadTransport(WebClient.Builder webClientBuilder, PublishingProperties properties) {
        this(webClientBuilder, properties.getChunkTimeout(), Schedulers.boundedElastic());
    }

    public UploadTransport(WebClient.Builder webClientBuilder, Duration chunkTimeout, Scheduler ioScheduler) {
        this.webClientBuilder = webClientBuilder;
        this.chunkTimeout = chunkTimeout;
        this.ioScheduler = ioScheduler;
    }

    public Mono<UploadReceipt> upload(UploadRequest request) {
        WebClient client = webClientBuilder.build();
        long total = request.getSource().size();
        int chunkCount = request.getTargets().size();
        AtomicLong sent = new AtomicLong();

        log.info("Uploading {} bytes to {} in {} chunk(s)", total, request.getPlatform().getDisplayName(), chunkCount);

        return Flux.using(
                        () -> new ChunkReader(request.getSource().openStream()),
                        reader -> Flux.range(0, chunkCount).concatMap(index -> {
                            UploadTarget target = request.getTargets().get(index);
                            return Mono.fromCallable(() -> reader.read(target.getRange()))
                                    .subscribeOn(ioScheduler)
                                    .onErrorMap(IOException.class, e -> new GatewayException(
                                            "Failed to read media for chunk " + index + ": " + e.getMessage(), e))
                                    .flatMap(bytes -> sendChunk(client, request, index, target, bytes, total)
                                            .retryWhen(request.getRetryPolicy().toRetrySpec()))
                                    .doOnNext(response -> request.getProgressListener()
                                            .onProgress(sent.addAndGet(target.getRange().length()), total));
                        }),
                        this::closeReader)
                .collectList()
                .map(UploadReceipt::new)
                .flatMap(receipt -> {
                    if (request.isRequireCompletion() && !receipt.isComplete()) {
                        return Mono.error(new ApiException(request.getPlatform().getDisplayName()
                                + " did not acknowledge the upload as complete"));
                    }
                    return Mono.just(receipt);
                });
    }

    private Mono<ChunkResponse> sendChunk(WebClient client, UploadRequest request, int index,
                                          UploadTarget target, byte[] bytes, long total) {
        Mono<ChunkResponse> call = client.put()
                .uri(URI.create(target.getUrl()))
                .headers(headers -> {
                    request.getHeaders().forEach(headers::set);
                    if (request.getContentType() != null) {
                        headers.set(HttpHeaders.CONTENT_TYPE, request.getContentType());
                    }
                    if (request.isContentRange()) {
                        headers.set(HttpHeaders.CONTENT_RANGE, target.getRange().contentRange(total));
                    }
                    headers.setContentLength(bytes.length);
                })
                .bodyValue(bytes)
                .exchangeToMono(response -> classify(request.getPlatform(), index, response));

        return RemoteErrors.guard(request.getPlatform(), chunkTimeout, call)
                .doOnError(GatewayException.class, e -> log.warn("Chunk {} of {} upload to {} failed: {}",
                        index + 1, request.getTargets().size(), request.getPlatform().getDisplayName(), e.getMessage()));
    }

    private Mono<ChunkResponse> classify(Platform platform, int index, ClientResponse response) {
        int status = response.statusCode().value();
        String etag = response.headers().asHttpHeaders().getETag();

        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    if (status == 308 || status == 206) {
                        return Mono.just(chunkResponse(index, status, ChunkResponse.Outcome.CONTINUE, etag, body));
                    }
                    if (response.statusCode().is2xxSuccessful()) {
                        return Mono.just(chunkResponse(index, status, ChunkResponse.Outcome.COMPLETE, etag, body));
                    }
                    return Mono.error(RemoteErrors.fromStatus(platform, status, body));
                });
    }

    private ChunkResponse chunkResponse(int index, int status, ChunkResponse.Outcome outcome, String etag, String body) {
        return ChunkResponse.builder()
                .index(index)
                .statusCode(status)
                .outcome(outcome)
                .etag(etag)
                .body(body)
                .build();
    }

    private void closeReader(ChunkReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Failed to close media stream: {}", e.getMessage());
        }
    }
}
