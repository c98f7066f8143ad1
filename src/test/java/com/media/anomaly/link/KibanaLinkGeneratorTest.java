package com.media.anomaly.link;

import com.media.anomaly.config.DetectorConfig;
import com.media.anomaly.config.KibanaConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KibanaLinkGeneratorTest {

    private static final LocalDateTime DATE = LocalDateTime.of(2023, 10, 25, 14, 56, 37);

    @Mock
    private KibanaObjectCache objectCache;

    private KibanaLinkGenerator generator;
    private Map<String, String> mapping;

    @BeforeEach
    void setUp() {
        KibanaConfig kibanaConfig = new KibanaConfig();
        kibanaConfig.setBaseUrl("http://kibana.local");
        generator = new KibanaLinkGenerator(objectCache, kibanaConfig, new DetectorConfig());

        mapping = new LinkedHashMap<>();
        mapping.put("source", "\"#BEZNAHUBKU\"");
        mapping.put("delta", "3600");
    }

    @Test
    void generate_buildsDiscoverLinkPerDataview() {
        Map<String, String> dataviews = new LinkedHashMap<>();
        dataviews.put("dv-1", "default");
        dataviews.put("dv-2", "ops");
        when(objectCache.getDataviewsByIndex("dm_8_countries_tg")).thenReturn(dataviews);

        List<String> links = generator.generate("dm_8_countries_tg", mapping, DATE);

        assertThat(links).containsExactly(
                "http://kibana.local/s/default/app/discover#/"
                        + "?_g=(time:(from:'2023-10-25T14:51:37.000Z',to:'2023-10-25T15:01:37.000Z'))"
                        + "&_a=(index:dv-1,query:(language:kuery,"
                        + "query:'source+%3A+%22%23BEZNAHUBKU%22+and+delta+%3A+3600'))",
                "http://kibana.local/s/ops/app/discover#/"
                        + "?_g=(time:(from:'2023-10-25T14:51:37.000Z',to:'2023-10-25T15:01:37.000Z'))"
                        + "&_a=(index:dv-2,query:(language:kuery,"
                        + "query:'source+%3A+%22%23BEZNAHUBKU%22+and+delta+%3A+3600'))");
    }

    @Test
    void generate_unknownIndexYieldsNoLinks() {
        when(objectCache.getDataviewsByIndex("unknown")).thenReturn(Map.of());

        assertThat(generator.generate("unknown", mapping, DATE)).isEmpty();
    }

    @Test
    void buildQuery_joinsPairsWithAnd() {
        assertThat(KibanaLinkGenerator.buildQuery(mapping)).isEqualTo("source : \"#BEZNAHUBKU\" and delta : 3600");
    }
}
