package com.example.skillsmatrix.web;

import com.example.skillsmatrix.bullhorn.BullhornException;
import com.example.skillsmatrix.service.staging.MissingHeaderException;
import com.example.skillsmatrix.service.staging.StagingConfigurationException;
import com.example.skillsmatrix.service.staging.UnorderedHeadersException;
import com.example.skillsmatrix.service.workbook.WorkbookReadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(StagingConfigurationException.class)
    public ResponseEntity<ApiError> handleStagingConfiguration(StagingConfigurationException ex) {
        log.warn("Survey headers rejected: {}", ex.getMessage());
        List<String> details = List.of();
        if (ex instanceof MissingHeaderException missing) {
            details = missing.getMissingHeaders();
        } else if (ex instanceof UnorderedHeadersException unordered) {
            details = unordered.getViolations();
        }
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), details);
    }

    @ExceptionHandler({WorkbookReadException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadInput(RuntimeException ex) {
        log.warn("Bad survey upload: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of());
    }

    @ExceptionHandler(BullhornException.class)
    public ResponseEntity<ApiError> handleBullhorn(BullhornException ex) {
        log.error("Bullhorn call failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, ex.getMessage(), List.of());
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String message, List<String> details) {
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), message, details, LocalDateTime.now()));
    }
}
