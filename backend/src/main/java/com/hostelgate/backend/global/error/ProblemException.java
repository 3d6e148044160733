package com.hostelgate.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Business failure rendered by {@link RestExceptionHandler} as a problem document.
 * The machine-readable {@code code} is what clients branch on; the detail is for people.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detailMessage;

    public ProblemException(HttpStatus status, String code, String detailMessage) {
        super(status, requireCode(code));
        this.code = code;
        this.detailMessage = detailMessage == null || detailMessage.isBlank() ? code : detailMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detailMessage;
    }

    private static String requireCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("problem code must not be blank");
        }
        return code;
    }
}
