package com.dnobretech.jarvisepubconverter.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // 400 - nenhum arquivo no upload
    @ExceptionHandler(EmptyBatchException.class)
    public ResponseEntity<ApiError> handleEmptyBatch(EmptyBatchException ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    // 422 - EPUB ilegível ou entrada que não converte
    @ExceptionHandler({ArchiveException.class, EntryException.class})
    public ResponseEntity<ApiError> handleBadArchive(ConversionException ex, HttpServletRequest req) {
        log.warn("Conversão abortada: {}", ex.getMessage());
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(ApiError.of(status, ex, req.getRequestURI()));
    }

    // 413 - limite do multipart
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest req) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, "Upload excede o tamanho máximo permitido.", req);
    }

    // 500 - falha ao montar o zip final
    @ExceptionHandler(BundleException.class)
    public ResponseEntity<ApiError> handleBundle(BundleException ex, HttpServletRequest req) {
        log.error("Falha ao gerar o pacote final", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), req);
    }

    // 500 - fallback único
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Erro não tratado", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Ocorreu um erro durante a conversão.", req);
    }

    private static ResponseEntity<ApiError> build(HttpStatus status, String message, HttpServletRequest req) {
        return ResponseEntity.status(status).body(ApiError.of(status, message, req.getRequestURI()));
    }
}
