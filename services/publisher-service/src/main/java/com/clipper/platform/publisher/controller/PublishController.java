package com.clipper.platform.publisher.controller;

import com.clipper.platform.publisher.dto.PublishOutcome;
import com.clipper.platform.publisher.service.PublishOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/posts")
@RequiredArgsConstructor
public class PublishController {

    private final PublishOrchestrator publishOrchestrator;

    /**
     * Publish a post now. Failures are reported in the body with a 200, like successes; the post's
     * stored status tells the same story.
     */
    @PostMapping("/{postId}/publish")
    public Mono<ResponseEntity<PublishOutcome>> publish(@PathVariable UUID postId) {
        return publishOrchestrator.publish(postId)
                .map(ResponseEntity::ok);
    }
}
