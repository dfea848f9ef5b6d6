package com.clipper.platform.publisher.entity.metadata;

import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonIgnoreProperties(ignoreUnknown = true)
public class InstagramMetadata extends AccountMetadata {

    @JsonProperty("facebook_page_id")
    private String facebookPageId;

    @JsonProperty("instagram_business_account_id")
    private String instagramBusinessAccountId;

    @ToString.Exclude
    @JsonProperty("page_access_token_enc")
    private String pageAccessTokenEncrypted;

    @Override
    public Platform getPlatform() {
        return Platform.INSTAGRAM;
    }

    @Override
    public String getPublishingTokenEncrypted() {
        return pageAccessTokenEncrypted;
    }

    @Override
    public AccountMetadata withPublishingToken(String encryptedToken) {
        return toBuilder().pageAccessTokenEncrypted(encryptedToken).build();
    }
}
