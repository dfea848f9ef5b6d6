package com.clipper.platform.publisher.credential;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OAuthTokenResponse {
    @ToString.Exclude
    @JsonProperty("access_token")
    private String accessToken;

    @ToString.Exclude
    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonProperty("expires_in")
    private Long expiresIn;

    @JsonProperty("refresh_expires_in")
    private Long refreshExpiresIn;

    private String scope;

    @JsonProperty("token_type")
    private String tokenType;

    private String error;

    @JsonProperty("error_description")
    private String errorDescription;
}
