package org.nowstart.overlay.data.exception;

import org.springframework.http.HttpStatus;

public class InvalidInputException extends RiskOverlayException {

    public InvalidInputException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_input", message);
    }
}
