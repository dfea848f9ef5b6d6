package com.clipper.platform.publisher.listener;

import com.clipper.platform.publisher.dto.PublishOutcome;
import com.clipper.platform.publisher.service.PublishOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PublishRequestListenerTest {

    private final PublishOrchestrator orchestrator = mock(PublishOrchestrator.class);
    private final PublishRequestListener listener = new PublishRequestListener(orchestrator);

    @Test
    void acceptsBareAndQuotedIds() {
        UUID id = UUID.randomUUID();

        assertThat(listener.parsePostId(id.toString())).isEqualTo(id);
        assertThat(listener.parsePostId("\"" + id + "\"\n")).isEqualTo(id);
    }

    @Test
    void publishesTheRequestedPost() {
        UUID id = UUID.randomUUID();
        when(orchestrator.publish(id)).thenReturn(Mono.just(PublishOutcome.builder().success(false)
                .postId(id).error("Instagram returned 503").build()));

        listener.onPublishRequest(id.toString());

        verify(orchestrator).publish(id);
    }

    @Test
    void malformedMessageIsDeadLettered() {
        assertThatThrownBy(() -> listener.onPublishRequest("post-42"))
                .isInstanceOf(AmqpRejectAndDontRequeueException.class);
        verify(orchestrator, never()).publish(any(UUID.class));
    }
}
