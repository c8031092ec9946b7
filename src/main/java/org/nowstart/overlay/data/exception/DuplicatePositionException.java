package org.nowstart.overlay.data.exception;

import org.springframework.http.HttpStatus;

public class DuplicatePositionException extends RiskOverlayException {

    public DuplicatePositionException(String symbol) {
        super(HttpStatus.CONFLICT, "duplicate_position", "Position already exists. symbol=" + symbol);
    }
}
