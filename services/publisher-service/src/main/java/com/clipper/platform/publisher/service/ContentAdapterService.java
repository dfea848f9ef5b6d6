package com.clipper.platform.publisher.service;

import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.model.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shapes a post's title, caption and hashtags to the target platform's limits.
 */
@Service
@Slf4j
public class ContentAdapterService {

    static final String SHORTS_TAG = "#Shorts";
    private static final String ELLIPSIS = "...";

    public ComposedContent compose(SocialPost post) {
        Platform platform = post.getPlatform();
        List<String> hashtags = normalizeHashtags(post.getHashtags(), platform.getMaxHashtags());

        return switch (platform) {
            case YOUTUBE -> composeForYouTube(post, hashtags);
            case INSTAGRAM, TIKTOK, LINKEDIN -> ComposedContent.builder()
                    .platform(platform)
                    .title(fitTitle(post.getTitle(), platform.getMaxTitleLength()))
                    .caption(captionWithHashtags(post.getCaption(), hashtags, platform.getMaxCaptionLength()))
                    .hashtags(hashtags)
                    .build();
        };
    }

    /**
     * YouTube keeps hashtags out of the title: they become tags, and the first few are repeated at
     * the end of the description for discoverability.
     */
    private ComposedContent composeForYouTube(SocialPost post, List<String> hashtags) {
        Platform youtube = Platform.YOUTUBE;

        String title = post.getTitle();
        if (title == null || title.isBlank()) {
            title = firstLine(post.getCaption());
        }

        StringBuilder description = new StringBuilder();
        if (post.getCaption() != null && !post.getCaption().isEmpty()) {
            description.append(post.getCaption());
        }
        if (!hashtags.isEmpty()) {
            description.append("\n\n").append(String.join(" ", hashtags.subList(0, Math.min(5, hashtags.size()))));
        }

        return ComposedContent.builder()
                .platform(youtube)
                .title(fitTitle(title, youtube.getMaxTitleLength()))
                .description(ellipsize(description.toString().trim(), youtube.getMaxCaptionLength()))
                .hashtags(hashtags)
                .tags(toYouTubeTags(hashtags, youtube.getMaxHashtags()))
                .build();
    }

    /**
     * Ensure a YouTube title carries #Shorts, truncating the title to make room when needed
     */
    public String ensureShortsTag(String title, int maxLength) {
        if (title == null || title.isEmpty()) {
            return SHORTS_TAG;
        }

        if (title.toLowerCase().contains(SHORTS_TAG.toLowerCase())) {
            return fitTitle(title, maxLength);
        }

        String withShorts = title + " " + SHORTS_TAG;
        if (withShorts.length() <= maxLength) {
            return withShorts;
        }

        int availableLength = maxLength - (SHORTS_TAG.length() + 1);
        return fitTitle(title, availableLength) + " " + SHORTS_TAG;
    }

    public boolean hasShortsMarker(String text) {
        return text != null && text.toLowerCase().contains(SHORTS_TAG.toLowerCase());
    }

    List<String> normalizeHashtags(List<String> hashtags, int maxHashtags) {
        if (hashtags == null) {
            return new ArrayList<>();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String hashtag : hashtags) {
            if (hashtag == null || hashtag.isBlank()) {
                continue;
            }
            String tag = hashtag.trim().replace(" ", "");
            normalized.add(tag.startsWith("#") ? tag : "#" + tag);
        }
        List<String> result = new ArrayList<>(normalized);
        if (maxHashtags > 0 && result.size() > maxHashtags) {
            log.info("Reduced hashtags from {} to {}", result.size(), maxHashtags);
            return new ArrayList<>(result.subList(0, maxHashtags));
        }
        return result;
    }

    /**
     * Caption followed by a blank line and the hashtags. When over the limit the caption is cut
     * first so the hashtags survive.
     */
    String captionWithHashtags(String caption, List<String> hashtags, int maxLength) {
        String tags = String.join(" ", hashtags);
        String text = caption == null ? "" : caption.trim();

        if (tags.isEmpty()) {
            return ellipsize(text, maxLength);
        }
        if (text.isEmpty()) {
            return ellipsize(tags, maxLength);
        }

        String full = text + "\n\n" + tags;
        if (full.length() <= maxLength) {
            return full;
        }

        int availableForCaption = maxLength - tags.length() - 2;
        if (availableForCaption < 50) {
            // Not enough room, keep the caption and drop what does not fit
            return ellipsize(full, maxLength);
        }
        return ellipsize(text, availableForCaption) + "\n\n" + tags;
    }

    /**
     * Tags go without the leading '#'. YouTube counts one separator per tag against the budget.
     */
    private List<String> toYouTubeTags(List<String> hashtags, int budget) {
        List<String> tags = new ArrayList<>();
        int used = 0;
        for (String hashtag : hashtags) {
            String tag = StringUtils.trimLeadingCharacter(hashtag, '#');
            used += tag.length() + 1;
            if (used > budget) {
                break;
            }
            tags.add(tag);
        }
        return tags;
    }

    /**
     * Whole words are kept unless the last word boundary falls in the first 70% of the limit.
     */
    private String fitTitle(String title, int maxLength) {
        if (title == null || maxLength <= 0 || title.length() <= maxLength) {
            return title;
        }
        String head = title.substring(0, maxLength);
        int boundary = head.lastIndexOf(' ');
        return (boundary * 10 > maxLength * 7 ? head.substring(0, boundary) : head).trim();
    }

    private String ellipsize(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    private String firstLine(String text) {
        if (text == null) {
            return null;
        }
        int newline = text.indexOf('\n');
        return newline >= 0 ? text.substring(0, newline).trim() : text.trim();
    }
}
