package com.clipper.platform.publisher.dto;

import com.clipper.platform.publisher.model.Platform;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Post text shaped for one platform: limits applied and hashtags placed where the platform
 * expects them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComposedContent {
    private Platform platform;

    private String title;

    // Caption with hashtags appended for platforms that carry them inline
    private String caption;

    @Builder.Default
    private List<String> hashtags = new ArrayList<>();

    // YouTube specific
    private String description;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
