package com.nevis.dossier.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.ingestion")
public record IngestionProperties(
	@NotNull @Min(1) @Max(500) Integer maxBatchSize,
	@NotNull @Min(1) @Max(200) Integer maxConcurrentDocuments,
	@NotNull @Min(1) @Max(64) Integer preparationThreads,
	@NotNull @Min(1) Integer batchQueueCapacity
) {}
