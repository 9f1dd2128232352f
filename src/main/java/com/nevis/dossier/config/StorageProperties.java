package com.nevis.dossier.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * S3-compatible object store settings. {@code endpoint} is only set for non-AWS stores (MinIO, GCS interop).
 */
@Validated
@ConfigurationProperties(prefix = "app.storage")
public record StorageProperties(
	@NotBlank String bucket,
	@NotBlank String region,
	String endpoint,
	boolean pathStyleAccess
) {}
