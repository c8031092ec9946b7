package org.nowstart.overlay.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class RiskOverlayException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public RiskOverlayException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

}
