package com.clipper.platform.publisher.connector;

import com.clipper.platform.publisher.credential.AccessCredential;
import com.clipper.platform.publisher.dto.ComposedContent;
import com.clipper.platform.publisher.entity.MediaAsset;
import com.clipper.platform.publisher.entity.SocialPost;
import com.clipper.platform.publisher.transport.UploadProgressListener;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PublishContext {
    SocialPost post;
    MediaAsset media;
    ComposedContent content;
    AccessCredential credential;

    @Builder.Default
    UploadProgressListener progressListener = UploadProgressListener.NONE;

    public String accessToken() {
        return credential.getAccessToken();
    }
}
