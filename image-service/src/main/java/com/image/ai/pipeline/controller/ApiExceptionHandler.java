package com.image.ai.pipeline.controller;

import com.image.ai.pipeline.exception.BlobStoreException;
import com.image.ai.pipeline.exception.ImageNotFoundException;
import com.image.ai.pipeline.exception.ImageStoreException;
import com.image.ai.pipeline.exception.ImageValidationException;
import com.image.ai.pipeline.exception.PipelineUnavailableException;
import com.image.ai.pipeline.exception.ThumbnailNotReadyException;
import com.image.ai.shared.constant.APIMessages;
import com.image.ai.shared.model.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ImageValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(ImageValidationException e) {
        log.warn("Rejected request [{}]: {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiResponse<Void>> handleMissingPart(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ApiResponse.error(APIMessages.ERROR_UPLOAD_TOO_LARGE));
    }

    @ExceptionHandler(ImageNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ImageNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(ThumbnailNotReadyException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReady(ThumbnailNotReadyException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler(PipelineUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnavailable(PipelineUnavailableException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error(e.getMessage()));
    }

    @ExceptionHandler({ImageStoreException.class, BlobStoreException.class, IOException.class})
    public ResponseEntity<ApiResponse<Void>> handleStorage(Exception e) {
        log.error("Storage failure while handling request", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error(APIMessages.ERROR_STORAGE));
    }
}
