package com.postintel.parser.config;

import com.postintel.parser.gazetteer.GazetteerIndex;
import com.postintel.parser.gazetteer.GazetteerLoader;
import com.postintel.parser.gazetteer.LandmarkTable;
import com.postintel.parser.semantic.DisabledLocationSearchClient;
import com.postintel.parser.semantic.HttpLocationSearchClient;
import com.postintel.parser.semantic.LocationSearchClient;
import com.postintel.parser.semantic.NgramLocationSearchIndex;
import com.postintel.parser.taxonomy.KeywordTaxonomy;
import com.postintel.parser.taxonomy.TaxonomyLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Loads the read-only reference data once at startup and exposes it as beans.
 * Components receive it by injection and never reach for globals.
 */
@Configuration
@Slf4j
public class ReferenceDataConfig {

    @Bean
    public KeywordTaxonomy keywordTaxonomy(TaxonomyLoader loader, PostParserProperties properties) {
        return loader.load(properties.getTaxonomy().getPath());
    }

    @Bean
    public GazetteerIndex gazetteerIndex(GazetteerLoader loader) {
        return loader.loadIndex();
    }

    @Bean
    public LandmarkTable landmarkTable(GazetteerLoader loader) {
        return loader.loadLandmarks();
    }

    @Bean
    public RestTemplate locationSearchRestTemplate(RestTemplateBuilder builder, PostParserProperties properties) {
        PostParserProperties.Semantic.Http http = properties.getSemantic().getHttp();
        return builder
                .setConnectTimeout(Duration.ofMillis(http.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(http.getReadTimeoutMs()))
                .build();
    }

    @Bean
    public LocationSearchClient locationSearchClient(PostParserProperties properties,
                                                     GazetteerIndex gazetteerIndex,
                                                     RestTemplate locationSearchRestTemplate) {
        PostParserProperties.Semantic semantic = properties.getSemantic();
        log.info("Semantic location search mode: {}", semantic.getMode());
        return switch (semantic.getMode()) {
            case NGRAM -> new NgramLocationSearchIndex(gazetteerIndex, semantic.getNgramSize());
            case HTTP -> new HttpLocationSearchClient(locationSearchRestTemplate, semantic.getHttp().getBaseUrl());
            case DISABLED -> new DisabledLocationSearchClient();
        };
    }
}
