package org.nowstart.overlay.data.exception;

import org.springframework.http.HttpStatus;

public class PositionNotFoundException extends RiskOverlayException {

    public PositionNotFoundException(String symbol) {
        super(HttpStatus.NOT_FOUND, "position_not_found", "Active position not found. symbol=" + symbol);
    }
}
