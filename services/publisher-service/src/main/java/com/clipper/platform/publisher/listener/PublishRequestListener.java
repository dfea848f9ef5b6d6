package com.clipper.platform.publisher.listener;

import com.clipper.platform.publisher.dto.PublishOutcome;
import com.clipper.platform.publisher.service.PublishOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Consumes post ids that the scheduler enqueues when a post is due.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PublishRequestListener {

    private final PublishOrchestrator publishOrchestrator;

    @RabbitListener(queues = "${publisher.queue:post.publish}")
    public void onPublishRequest(String message) {
        UUID postId = parsePostId(message);
        log.info("Received publish request for post {}", postId);

        PublishOutcome outcome = publishOrchestrator.publish(postId).block();
        if (outcome == null || !outcome.isSuccess()) {
            log.warn("Publish request for post {} ended without success: {}", postId,
                    outcome != null ? outcome.getError() : "no outcome");
        }
    }

    UUID parsePostId(String message) {
        String value = message == null ? "" : message.trim();
        // The scheduler sends the bare id, possibly JSON-quoted
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new AmqpRejectAndDontRequeueException("Not a post id: " + message, e);
        }
    }
}
