package com.tallybook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "tallybook.app")
public record AppProperties(String frontendUrl) {}
