package com.nevis.dossier.storage;

import com.nevis.dossier.config.StorageProperties;
import com.nevis.dossier.exception.BlobNotFoundException;
import com.nevis.dossier.exception.BlobStoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class S3BlobStoreTest {

    private final S3Client s3Client = mock(S3Client.class);
    private final S3Presigner s3Presigner = mock(S3Presigner.class);

    private S3BlobStore blobStore;

    @BeforeEach
    void setUp() {
        blobStore = new S3BlobStore(s3Client, s3Presigner,
            new StorageProperties("case-documents", "eu-west-3", null, false));
    }

    @Test
    @DisplayName("Should return the object bytes from the configured bucket")
    void shouldGetObject() {
        byte[] content = "%PDF-1.7".getBytes(StandardCharsets.US_ASCII);
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), content));

        assertThat(blobStore.get("cases/1/pv.pdf")).isEqualTo(content);

        ArgumentCaptor<GetObjectRequest> request = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(request.capture());
        assertThat(request.getValue().bucket()).isEqualTo("case-documents");
        assertThat(request.getValue().key()).isEqualTo("cases/1/pv.pdf");
    }

    @Test
    @DisplayName("Should report a missing object as not found")
    void shouldMapMissingObject() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        assertThatThrownBy(() -> blobStore.get("cases/1/missing.pdf"))
            .isInstanceOf(BlobNotFoundException.class)
            .hasMessageContaining("cases/1/missing.pdf");
    }

    @Test
    @DisplayName("Should report transport failures as unavailable")
    void shouldMapTransportFailure() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(SdkClientException.create("Connection refused"));

        assertThatThrownBy(() -> blobStore.get("cases/1/pv.pdf"))
            .isInstanceOf(BlobStoreUnavailableException.class)
            .hasMessageContaining("Connection refused");
    }

    @Test
    @DisplayName("Should store content with its type and metadata")
    void shouldPutObject() {
        String key = blobStore.put("cases/1/tf.pdf", new byte[] {1, 2}, "application/pdf", Map.of("case", "1"));

        assertThat(key).isEqualTo("cases/1/tf.pdf");
        ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(request.capture(), any(RequestBody.class));
        assertThat(request.getValue().contentType()).isEqualTo("application/pdf");
        assertThat(request.getValue().metadata()).containsEntry("case", "1");
    }

    @Test
    @DisplayName("Should delete an existing object")
    void shouldDeleteExistingObject() {
        when(s3Client.headObject(any(HeadObjectRequest.class))).thenReturn(HeadObjectResponse.builder().build());

        assertThat(blobStore.delete("cases/1/pv.pdf")).isTrue();
        verify(s3Client).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    @DisplayName("Should report an already missing object on delete")
    void shouldReportMissingObjectOnDelete() {
        when(s3Client.headObject(any(HeadObjectRequest.class)))
            .thenThrow((S3Exception) S3Exception.builder().statusCode(404).message("Not Found").build());

        assertThat(blobStore.delete("cases/1/gone.pdf")).isFalse();
        verify(s3Client, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    @DisplayName("Should list keys under a prefix across pages")
    void shouldListKeys() {
        when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
            .thenAnswer(invocation -> new ListObjectsV2Iterable(s3Client, invocation.getArgument(0)));
        when(s3Client.listObjectsV2(any(ListObjectsV2Request.class))).thenReturn(ListObjectsV2Response.builder()
            .contents(S3Object.builder().key("cases/1/a.pdf").build(), S3Object.builder().key("cases/1/b.pdf").build())
            .isTruncated(false)
            .build());

        assertThat(blobStore.list("cases/1/")).containsExactly("cases/1/a.pdf", "cases/1/b.pdf");
    }

    @Test
    @DisplayName("Should return a presigned URL")
    @SuppressWarnings("unchecked")
    void shouldSignObject() throws Exception {
        PresignedGetObjectRequest presigned = mock(PresignedGetObjectRequest.class);
        when(presigned.url()).thenReturn(new URL("https://case-documents.s3.eu-west-3.amazonaws.com/cases/1/pv.pdf?X-Amz-Signature=abc"));
        when(s3Presigner.presignGetObject(any(Consumer.class))).thenReturn(presigned);

        String url = blobStore.sign("cases/1/pv.pdf", Duration.ofMinutes(15));

        assertThat(url).startsWith("https://case-documents.s3.eu-west-3.amazonaws.com/cases/1/pv.pdf");
    }
}
