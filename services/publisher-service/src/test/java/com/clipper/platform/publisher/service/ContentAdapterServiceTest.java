package com.clipper.platform.publisher.service;

import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.model.Platform;
import com.clipper.platform.publisher.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentAdapterServiceTest {

    private final ContentAdapterService service = new ContentAdapterService();

    @Test
    void appendsNormalizedHashtagsToTheCaption() {
        ComposedContent content = service.compose(Fixtures.post(Platform.INSTAGRAM));

        assertThat(content.getCaption()).isEqualTo("We shipped it\n\n#launch #clipper");
        assertThat(content.getHashtags()).containsExactly("#launch", "#clipper");
    }

    @Test
    void cutsTheCaptionBeforeTheHashtags() {
        String caption = "x".repeat(300);
        String result = service.captionWithHashtags(caption, List.of("#one", "#two"), 120);

        assertThat(result).hasSize(120).endsWith("...\n\n#one #two");
    }

    @Test
    void limitsHashtagCountPerPlatform() {
        SocialPost post = Fixtures.post(Platform.TIKTOK);
        List<String> many = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            many.add("tag" + i);
        }
        post.setHashtags(many);

        assertThat(service.compose(post).getHashtags()).hasSize(Platform.TIKTOK.getMaxHashtags());
    }

    @Test
    void youtubeTurnsHashtagsIntoTagsAndKeepsTitleShort() {
        SocialPost post = Fixtures.post(Platform.YOUTUBE);
        post.setTitle("word ".repeat(40));

        ComposedContent content = service.compose(post);

        assertThat(content.getTitle().length()).isLessThanOrEqualTo(100);
        assertThat(content.getTags()).containsExactly("launch", "clipper");
        assertThat(content.getDescription()).isEqualTo("We shipped it\n\n#launch #clipper");
        assertThat(content.getCaption()).isNull();
    }

    @Test
    void longTitleIsCutAtTheLastWholeWord() {
        SocialPost post = Fixtures.post(Platform.YOUTUBE);
        post.setTitle("word ".repeat(40));

        assertThat(service.compose(post).getTitle()).isEqualTo("word ".repeat(20).trim());
    }

    @Test
    void youtubeTagsStopAtTheCharacterBudget() {
        SocialPost post = Fixtures.post(Platform.YOUTUBE);
        List<String> hashtags = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            hashtags.add(String.format("#tag%017d", i));
        }
        post.setHashtags(hashtags);

        List<String> tags = service.compose(post).getTags();

        // 20 characters plus a separator each, against a 500 character budget
        assertThat(tags).hasSize(23);
        assertThat(tags.get(0)).isEqualTo("tag00000000000000000");
    }

    @Test
    void youtubeFallsBackToTheFirstCaptionLineForTheTitle() {
        SocialPost post = Fixtures.post(Platform.YOUTUBE);
        post.setTitle(null);
        post.setCaption("First line\nsecond line");

        assertThat(service.compose(post).getTitle()).isEqualTo("First line");
    }

    @Test
    void shortsTagIsAddedOnceAndFitsTheLimit() {
        assertThat(service.ensureShortsTag("Morning routine", 100)).isEqualTo("Morning routine #Shorts");
        assertThat(service.ensureShortsTag("Already #shorts", 100)).isEqualTo("Already #shorts");
        assertThat(service.ensureShortsTag("a".repeat(100), 100)).hasSize(100).endsWith(" #Shorts");
    }
}
