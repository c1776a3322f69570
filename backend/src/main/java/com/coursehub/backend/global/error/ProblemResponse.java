package com.coursehub.backend.global.error;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        List<FieldViolation> errors,
        Long retryAfter
) {

    private static final String DEFAULT_TYPE_PREFIX = "https://coursehub.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        String type = DEFAULT_TYPE_PREFIX + normalized;
        return new ProblemResponse(type, httpStatus.getReasonPhrase(), httpStatus.value(), safeDetail, instance, safeCode, null, null);
    }

    public ProblemResponse withErrors(List<FieldViolation> fieldErrors) {
        return new ProblemResponse(type, title, status, detail, instance, code, List.copyOf(fieldErrors), retryAfter);
    }

    public ProblemResponse withRetryAfter(long seconds) {
        return new ProblemResponse(type, title, status, detail, instance, code, errors, seconds);
    }
}
