package com.nevis.dossier.repository;

import com.nevis.dossier.inference.InferenceClient;
import com.nevis.dossier.storage.BlobStore;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest(properties = {
    "app.gemini.api-key=fake-key-value-for-testing",
    "app.storage.retry.initial-delay-ms=1"
})
@Testcontainers(disabledWithoutDocker = true)
public abstract class BaseIntegrationTest {

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @MockitoBean
    protected BlobStore blobStore;

    @MockitoBean
    protected InferenceClient inferenceClient;
}
