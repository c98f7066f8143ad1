package com.media.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Envelope delivered by the ingestion pipeline: routing metadata plus the article payload")
public class ArticleEvent {

    @Schema(description = "Routing metadata")
    private EventMetadata metadata;

    @Schema(description = "Article payload with engagement metrics")
    private Article payload;
}
