package com.clipper.platform.publisher.entity.metadata;

import com.clipper.platform.publisher.model.Platform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinkedInMetadata extends AccountMetadata {

    @JsonProperty("person_urn")
    private String personUrn;

    // Set when posting on behalf of a company page
    @JsonProperty("organization_urn")
    private String organizationUrn;

    @Override
    public Platform getPlatform() {
        return Platform.LINKEDIN;
    }

    public String authorUrn() {
        return organizationUrn != null && !organizationUrn.isBlank() ? organizationUrn : personUrn;
    }
}
