package com.image.ai.pipeline.service;

import com.image.ai.pipeline.exception.DuplicateImageException;
import com.image.ai.pipeline.exception.ImageValidationException;
import com.image.ai.pipeline.exception.PipelineUnavailableException;
import com.image.ai.pipeline.model.ImageItem;
import com.image.ai.pipeline.model.ImageStatus;
import com.image.ai.pipeline.model.ItemCompletion;
import com.image.ai.pipeline.repository.ImageItemStore;
import com.image.ai.pipeline.storage.BlobStore;
import com.image.ai.shared.constant.APIMessages;
import com.image.ai.shared.model.ImageCreateResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ImageIngestionService Unit Tests")
class ImageIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final byte[] PAYLOAD = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00};

    @Mock
    private ImageItemStore mockItemStore;
    @Mock
    private BlobStore mockBlobStore;
    @Mock
    private ImageJobDispatcher mockDispatcher;

    private ImageIngestionService service;

    @BeforeEach
    void setUp() {
        service = new ImageIngestionService(mockItemStore, mockBlobStore, mockDispatcher,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("accept: stores blob, inserts PROCESSING row, then submits the job")
    void accept_happyPath() {
        when(mockBlobStore.storeOriginal(anyString(), eq("jpg"), eq(PAYLOAD)))
                .thenAnswer(inv -> "originals/" + inv.getArgument(0) + ".jpg");
        when(mockItemStore.insert(any(ImageItem.class))).thenAnswer(inv -> inv.getArgument(0));

        ImageCreateResponse response = service.accept("cat.jpg", "image/jpeg", PAYLOAD);

        assertThat(response.imageId()).isNotBlank();
        assertThat(response.status()).isEqualTo("processing");

        InOrder order = inOrder(mockBlobStore, mockItemStore, mockDispatcher);
        order.verify(mockBlobStore).storeOriginal(response.imageId(), "jpg", PAYLOAD);
        ArgumentCaptor<ImageItem> inserted = ArgumentCaptor.forClass(ImageItem.class);
        order.verify(mockItemStore).insert(inserted.capture());
        order.verify(mockDispatcher).submit(response.imageId());

        ImageItem row = inserted.getValue();
        assertThat(row.getId()).isEqualTo(response.imageId());
        assertThat(row.getStatus()).isEqualTo(ImageStatus.PROCESSING);
        assertThat(row.getOriginalName()).isEqualTo("cat.jpg");
        assertThat(row.getMimeType()).isEqualTo("image/jpeg");
        assertThat(row.getSizeBytes()).isEqualTo(PAYLOAD.length);
        assertThat(row.getStoredRef()).isEqualTo("originals/" + response.imageId() + ".jpg");
        assertThat(row.getCreatedAt()).isEqualTo(NOW);
        assertThat(row.getCompletedAt()).isNull();
        assertThat(row.getError()).isNull();
        assertThat(row.getCaption()).isNull();
        assertThat(row.getThumbnailRefs()).isNull();
    }

    @Test
    @DisplayName("accept: PNG uploads are stored with a .png extension")
    void accept_png_extension() {
        when(mockBlobStore.storeOriginal(anyString(), eq("png"), eq(PAYLOAD))).thenReturn("originals/x.png");

        service.accept("shot.png", "image/png", PAYLOAD);

        verify(mockBlobStore).storeOriginal(anyString(), eq("png"), eq(PAYLOAD));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"text/plain", "image/gif", "application/octet-stream"})
    @DisplayName("accept: content types outside the allow-list are rejected before anything is written")
    void accept_disallowedType_rejected(String contentType) {
        assertThatThrownBy(() -> service.accept("file", contentType, PAYLOAD))
                .isInstanceOf(ImageValidationException.class)
                .hasMessage(APIMessages.ERROR_UNSUPPORTED_TYPE);

        verifyNoInteractions(mockBlobStore, mockItemStore, mockDispatcher);
    }

    @Test
    @DisplayName("accept: empty payload is rejected before anything is written")
    void accept_emptyPayload_rejected() {
        assertThatThrownBy(() -> service.accept("empty.png", "image/png", new byte[0]))
                .isInstanceOf(ImageValidationException.class)
                .hasMessage(APIMessages.ERROR_EMPTY_UPLOAD);

        verifyNoInteractions(mockBlobStore, mockItemStore, mockDispatcher);
    }

    @Test
    @DisplayName("accept: failed insert removes the stored original and submits nothing")
    void accept_insertFails_cleansUp() {
        when(mockBlobStore.storeOriginal(anyString(), eq("jpg"), eq(PAYLOAD))).thenReturn("originals/x.jpg");
        when(mockItemStore.insert(any(ImageItem.class)))
                .thenThrow(new DuplicateImageException("Image id already exists: x", null));

        assertThatThrownBy(() -> service.accept("cat.jpg", "image/jpeg", PAYLOAD))
                .isInstanceOf(DuplicateImageException.class);

        verify(mockBlobStore).delete("originals/x.jpg");
        verify(mockDispatcher, never()).submit(anyString());
    }

    @Test
    @DisplayName("accept: a run refused by the executor is recorded as FAILED and surfaced, not left PROCESSING")
    void accept_dispatcherRejects_failsItemAndThrows() {
        when(mockBlobStore.storeOriginal(anyString(), eq("jpg"), eq(PAYLOAD))).thenReturn("originals/x.jpg");
        doThrow(new TaskRejectedException("executor shut down")).when(mockDispatcher).submit(anyString());

        assertThatThrownBy(() -> service.accept("cat.jpg", "IMAGE/JPEG", PAYLOAD))
                .isInstanceOf(PipelineUnavailableException.class)
                .hasMessage(APIMessages.ERROR_PIPELINE_UNAVAILABLE)
                .hasCauseInstanceOf(TaskRejectedException.class);

        ArgumentCaptor<ImageItem> inserted = ArgumentCaptor.forClass(ImageItem.class);
        verify(mockItemStore).insert(inserted.capture());
        ArgumentCaptor<ItemCompletion> completion = ArgumentCaptor.forClass(ItemCompletion.class);
        verify(mockItemStore).complete(eq(inserted.getValue().getId()), completion.capture());
        assertThat(completion.getValue().status()).isEqualTo(ImageStatus.FAILED);
        assertThat(completion.getValue().error()).isEqualTo("scheduling failed: executor shut down");
        assertThat(completion.getValue().completedAt()).isEqualTo(NOW);
    }
}
