package com.unisync.reminder.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Map;

@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String errorCode;
    private final String errorMessage;
    private final Map<String, String> errors;
    private final LocalDateTime timestamp;

    public ErrorResponse(String errorCode, String errorMessage) {
        this(errorCode, errorMessage, null, LocalDateTime.now());
    }

    public ErrorResponse(String errorCode, String errorMessage, Map<String, String> errors) {
        this(errorCode, errorMessage, errors, LocalDateTime.now());
    }
}
