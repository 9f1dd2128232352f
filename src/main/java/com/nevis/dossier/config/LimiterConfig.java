package com.nevis.dossier.config;

import com.nevis.dossier.infra.InMemoryDualRateLimiter;
import com.nevis.dossier.infra.InMemoryRpmRateLimiter;
import com.nevis.dossier.infra.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class LimiterConfig {

    private final GeminiProperties geminiProperties;

    @Bean("classificationLimiter")
    public RateLimiter classificationLimiter() {
        return new InMemoryRpmRateLimiter(geminiProperties.requestsPerMinute());
    }

    @Bean("extractionLimiter")
    public RateLimiter extractionLimiter() {
        return new InMemoryDualRateLimiter(geminiProperties.requestsPerMinute(), geminiProperties.tokensPerMinute());
    }
}
