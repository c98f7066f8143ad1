package com.media.anomaly.service;

import com.media.anomaly.config.DetectorConfig;
import com.media.anomaly.config.MetricsConfig;
import com.media.anomaly.engine.DetectorEngine;
import com.media.anomaly.link.LinkGenerator;
import com.media.anomaly.model.Alert;
import com.media.anomaly.model.Anomaly;
import com.media.anomaly.model.Article;
import com.media.anomaly.model.ArticleEvent;
import com.media.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.media.anomaly.testutil.TestDataFactory.LOADING_DATE;
import static com.media.anomaly.testutil.TestDataFactory.createAnomaly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyAggregationServiceTest {

    @Mock
    private DetectorEngine detectorEngine;

    @Mock
    private LinkGenerator linkGenerator;

    private SimpleMeterRegistry registry;
    private AnomalyAggregationService service;
    private Article article;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        DetectorConfig config = new DetectorConfig();
        service = new AnomalyAggregationService(detectorEngine, new AlertDescriptionBuilder(config),
                linkGenerator, config, new MetricsConfig(registry));
        article = TestDataFactory.createTelegramArticle(500, 10, 10);
    }

    @Test
    void run_noAnomalies_returnsNull() {
        ArticleEvent event = TestDataFactory.createEvent("article-1", "TelegramListener", article);
        when(detectorEngine.runAll(article, "article-1")).thenReturn(List.of());

        assertThat(service.run(event)).isNull();
        verifyNoInteractions(linkGenerator);
        assertThat(registry.counter("detection.count", "outcome", "CLEAN").count()).isEqualTo(1.0);
    }

    @Test
    void run_ranksByScoreAndSumsWithoutClamping() {
        ArticleEvent event = TestDataFactory.createEvent("article-1", "TelegramListener", article);
        Anomaly low = createAnomaly("forwards_by_views", 0.2, 0.1, 0.3);
        Anomaly high = createAnomaly("views", 500L, 100.0, 0.9);
        Anomaly tie = createAnomaly("reaction_count_by_views", 0.3, 0.1, 0.3);
        when(detectorEngine.runAll(article, "article-1")).thenReturn(List.of(low, high, tie));
        when(linkGenerator.generate(anyString(), anyMap(), any())).thenReturn(List.of("http://kibana/link"));

        Alert alert = service.run(event);

        assertThat(alert.getAllAnomalies()).containsExactly(high, low, tie);
        assertThat(alert.getScore()).isCloseTo(1.5, within(1e-9));
        assertThat(alert.getFieldName()).isEqualTo("views");
        assertThat(alert.getAnomalyValue()).isEqualTo(500L);
        assertThat(alert.getExpectedValue()).isEqualTo(100.0);
        assertThat(alert.getDomain()).isEqualTo("Telegram");
        assertThat(alert.getSource()).isEqualTo("#BEZNAHUBKU");
        assertThat(alert.getDate()).isEqualTo(LOADING_DATE);
        assertThat(alert.getArticleId()).isEqualTo("article-1");
        assertThat(alert.getUrl()).isEqualTo("http://kibana/link");
        assertThat(alert.getId()).isNotBlank();
        assertThat(alert.getDescription()).startsWith("Critical anomaly in views (5.0x higher), ");
    }

    @Test
    void run_passesSourceAndDeltaMappingToLinkGenerator() {
        ArticleEvent event = TestDataFactory.createEvent("article-1", "TelegramListener", article);
        when(detectorEngine.runAll(article, "article-1"))
                .thenReturn(List.of(createAnomaly("views", 500L, 100.0, 0.9)));
        when(linkGenerator.generate(anyString(), anyMap(), any())).thenReturn(List.of());

        Alert alert = service.run(event);

        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("source", "\"#BEZNAHUBKU\"");
        mapping.put("delta", "3600");
        verify(linkGenerator).generate("dm_8_countries_tg", mapping, LOADING_DATE);
        assertThat(alert.getUrl()).isNull();
    }

    @Test
    void run_linkFailureStillProducesAlert() {
        ArticleEvent event = TestDataFactory.createEvent("article-1", "opoint", article);
        when(detectorEngine.runAll(article, "article-1"))
                .thenReturn(List.of(createAnomaly("views", 500L, 100.0, 0.9)));
        when(linkGenerator.generate(anyString(), anyMap(), any()))
                .thenThrow(new IllegalStateException("kibana unreachable"));

        Alert alert = service.run(event);

        assertThat(alert).isNotNull();
        assertThat(alert.getUrl()).isNull();
        assertThat(alert.getDomain()).isEqualTo("Web");
        assertThat(registry.counter("link.failure.count").count()).isEqualTo(1.0);
    }

    @Test
    void run_unknownMethodMapsToUnknownDomain() {
        ArticleEvent event = TestDataFactory.createEvent("article-1", "RssCrawler", article);
        event.getMetadata().setDestination(null);
        when(detectorEngine.runAll(article, "article-1"))
                .thenReturn(List.of(createAnomaly("views", 500L, 100.0, 0.9)));

        Alert alert = service.run(event);

        assertThat(alert.getDomain()).isEqualTo("Unknown");
        verifyNoInteractions(linkGenerator);
    }

    @Test
    void run_missingPayloadIsRejected() {
        ArticleEvent event = TestDataFactory.createEvent("article-1", "TelegramListener", null);

        assertThatThrownBy(() -> service.run(event)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(detectorEngine);
    }
}
