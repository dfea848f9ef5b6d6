package com.clipper.platform.publisher;

import com.clipper.platform.publisher.config.PublishingProperties;
import com.clipper.platform.publisher.config.StorageProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PublishingProperties.class,
        StorageProperties.class
})
public class PublisherServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PublisherServiceApplication.class, args);
    }
}
