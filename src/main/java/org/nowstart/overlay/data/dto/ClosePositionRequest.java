package org.nowstart.overlay.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ClosePositionRequest(
        @NotNull(message = "price is required")
        @Positive(message = "price must be greater than zero")
        Double price,
        String reason
) {
}
