package com.media.anomaly.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Schema(description = "Article payload. Only source and date are always present.")
public class Article {

    public static final String DATE_PATTERN = "yyyy-MM-dd'T'HH:mm:ss";

    @Schema(description = "Channel or site the article came from", example = "#BEZNAHUBKU")
    private String source;

    @Schema(description = "Publication date", example = "2023-10-25T13:56:37")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DATE_PATTERN)
    private LocalDateTime date;

    @Schema(description = "Date the metrics were collected", example = "2023-10-25T14:56:37")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DATE_PATTERN)
    private LocalDateTime loadingDate;

    @Schema(description = "Seconds between publication and metric collection", example = "3600")
    private Integer delta;

    @Schema(description = "Telegram chat id of the source", example = "-1001234567890")
    private Long chatId;

    @Schema(description = "View count", example = "5000")
    private Long views;

    @Schema(description = "Forward count", example = "120")
    private Long forwards;

    @Schema(description = "Total reaction count", example = "300")
    private Long reactionCount;

    @Schema(description = "Country code of the source", example = "ua")
    private String country;

    @Schema(description = "Chat id of the original post when this one is a repost", example = "-1009876543210")
    private Long forwardFromChatId;

    /**
     * Date the anomaly is attributed to: loading date when present, else publication date.
     */
    public LocalDateTime effectiveDate() {
        return loadingDate != null ? loadingDate : date;
    }
}
