package com.clipper.platform.publisher.entity;

import com.clipper.platform.publisher.model.MediaKind;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Entity
@Table(name = "media_assets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaAsset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MediaKind kind;

    @Column(name = "storage_key", length = 512)
    private String storageKey;

    @Column(name = "source_url", columnDefinition = "TEXT")
    private String sourceUrl;

    @Column(name = "content_type", length = 100)
    private String contentType;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    private Integer width;

    private Integer height;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "carousel_items", columnDefinition = "jsonb")
    @Builder.Default
    private List<MediaItem> carouselItems = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at")
    private OffsetDateTime createdAt;

    /**
     * The asset viewed as a single transferable item. Without a stored content type, the type is
     * taken from the file extension; failing that, a video or an asset with a duration is MP4.
     */
    public MediaItem asItem() {
        return MediaItem.builder()
                .storageKey(storageKey)
                .sourceUrl(sourceUrl)
                .contentType(contentType != null ? contentType : inferContentType())
                .sizeBytes(sizeBytes)
                .durationSeconds(durationSeconds)
                .width(width)
                .height(height)
                .build();
    }

    private String inferContentType() {
        for (String location : new String[]{storageKey, sourceUrl}) {
            if (location == null) {
                continue;
            }
            Optional<MediaType> byName = MediaTypeFactory.getMediaType(
                    UriComponentsBuilder.fromUriString(location).build().getPath());
            if (byName.isPresent()) {
                return byName.get().toString();
            }
        }
        if (kind == MediaKind.VIDEO || durationSeconds != null) {
            return "video/mp4";
        }
        return null;
    }

    public int carouselSize() {
        return carouselItems == null ? 0 : carouselItems.size();
    }

    public boolean isPortrait() {
        return width != null && height != null && height > width;
    }
}
