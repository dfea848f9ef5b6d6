package com.clipper.platform.publisher.entity;

import com.clipper.platform.publisher.model.MediaKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MediaAssetTest {

    @Test
    void storedContentTypeWins() {
        MediaAsset asset = MediaAsset.builder()
                .kind(MediaKind.STORY)
                .storageKey("stories/clip.bin")
                .contentType("video/quicktime")
                .build();

        assertThat(asset.asItem().getContentType()).isEqualTo("video/quicktime");
    }

    @Test
    void storyVideoWithoutContentTypeIsRecognisedByExtension() {
        MediaAsset asset = MediaAsset.builder()
                .kind(MediaKind.STORY)
                .storageKey("stories/clip.mp4")
                .build();

        assertThat(asset.asItem().isVideo()).isTrue();
        assertThat(asset.asItem().getContentType()).isEqualTo("video/mp4");
    }

    @Test
    void remoteStoryImageIsRecognisedDespiteTheQueryString() {
        MediaAsset asset = MediaAsset.builder()
                .kind(MediaKind.STORY)
                .sourceUrl("https://cdn.example.com/stories/frame.png?sig=abc")
                .build();

        assertThat(asset.asItem().getContentType()).isEqualTo("image/png");
    }

    @Test
    void storyWithADurationAndNoExtensionIsAVideo() {
        MediaAsset asset = MediaAsset.builder()
                .kind(MediaKind.STORY)
                .storageKey("stories/upload-7f3a")
                .durationSeconds(12.5)
                .build();

        assertThat(asset.asItem().isVideo()).isTrue();
    }

    @Test
    void storyWithoutAnyHintStaysUntyped() {
        MediaAsset asset = MediaAsset.builder()
                .kind(MediaKind.STORY)
                .storageKey("stories/upload-7f3a")
                .build();

        assertThat(asset.asItem().getContentType()).isNull();
        assertThat(asset.asItem().isVideo()).isFalse();
    }
}
