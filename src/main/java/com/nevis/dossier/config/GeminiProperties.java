package com.nevis.dossier.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.gemini")
public record GeminiProperties(
	@NotBlank String apiKey,
	@NotBlank String modelName,
	@NotNull Duration timeout,
	@NotNull @Min(0) Integer maxRetries,
	@NotNull @Min(1) Integer requestsPerMinute,
	@NotNull @Min(1) Integer tokensPerMinute
) {}
