package com.clipper.platform.publisher.connector.tiktok.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TikTokError {
    private String code;
    private String message;
    @JsonProperty("log_id")
    private String logId;

    public boolean isOk() {
        return code == null || "ok".equals(code);
    }
}
