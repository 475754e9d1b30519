package com.herzen.prereq.config;

import com.herzen.prereq.cache.CacheStore;
import com.herzen.prereq.cache.CaffeineCacheStore;
import com.herzen.prereq.graph.PrerequisiteGraphModels.PrerequisiteEdge;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
@EnableConfigurationProperties(PrerequisiteProperties.class)
public class PrerequisiteConfig {

    @Bean
    public CacheStore<List<PrerequisiteEdge>> prerequisiteListCache(PrerequisiteProperties properties) {
        return new CaffeineCacheStore<>(properties.cacheMaximumSize(), properties.cacheTtl());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
