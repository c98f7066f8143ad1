package com.media.anomaly.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Event routing metadata")
public class EventMetadata {

    @Schema(description = "Article identifier", example = "7b0c2f4e-5a7d-4a39-8d8c-1f2b3c4d5e6f")
    private String id;

    @Schema(description = "Ingestion method that produced the article", example = "TelegramListener")
    private String method;

    @Schema(description = "Destination index or indices; a single string is accepted", example = "[\"dm_8_countries_tg\"]")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> destination;

    /**
     * First destination index, or null when the event has none.
     */
    public String primaryDestination() {
        if (destination == null || destination.isEmpty()) return null;
        return destination.get(0);
    }
}
