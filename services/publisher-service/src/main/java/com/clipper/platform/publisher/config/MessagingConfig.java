package com.clipper.platform.publisher.config;

import org.springframework.amqp.core.Queue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MessagingConfig {

    @Bean
    public Queue publishQueue(@Value("${publisher.queue:post.publish}") String queueName) {
        return new Queue(queueName, true);
    }
}
