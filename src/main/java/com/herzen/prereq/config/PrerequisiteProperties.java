package com.herzen.prereq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "prerequisites")
public record PrerequisiteProperties(@DefaultValue("PT1H") Duration cacheTtl,
                                     @DefaultValue("10000") long cacheMaximumSize) {}
