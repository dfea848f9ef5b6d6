package com.clipper.platform.publisher.storage;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PublicUrlRewriterTest {

    private static final String INTERNAL = "http://minio:9000/clipper-media/clips/a.mp4"
            + "?X-Amz-Algorithm=AWS4-HMAC-SHA256&X-Amz-Signature=ab%2Fcd";

    @Test
    void movesThePresignedUrlOntoThePublicHost() {
        assertThat(PublicUrlRewriter.rewrite(INTERNAL, "https://media.clipper.app"))
                .isEqualTo("https://media.clipper.app/clipper-media/clips/a.mp4"
                        + "?X-Amz-Algorithm=AWS4-HMAC-SHA256&X-Amz-Signature=ab%2Fcd");
    }

    @Test
    void keepsThePublicPathPrefix() {
        assertThat(PublicUrlRewriter.rewrite(INTERNAL, "https://cdn.clipper.app/storage/"))
                .startsWith("https://cdn.clipper.app/storage/clipper-media/clips/a.mp4?");
    }

    @Test
    void takesThePortFromThePublicBase() {
        assertThat(PublicUrlRewriter.rewrite(INTERNAL, "http://localhost:9443/media"))
                .isEqualTo("http://localhost:9443/media/clipper-media/clips/a.mp4"
                        + "?X-Amz-Algorithm=AWS4-HMAC-SHA256&X-Amz-Signature=ab%2Fcd");
        assertThat(PublicUrlRewriter.rewrite(INTERNAL, "https://media.clipper.app"))
                .doesNotContain(":9000");
    }

    @Test
    void leavesTheUrlAloneWithoutPublicBase() {
        assertThat(PublicUrlRewriter.rewrite(INTERNAL, null)).isEqualTo(INTERNAL);
    }
}
