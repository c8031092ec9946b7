package org.nowstart.overlay.data.dto;

import jakarta.validation.constraints.Positive;

/**
 * One historical trading day.
 *
 * @param vix closing VIX of the day, null when the data source has none
 */
public record DailyBar(
        @Positive(message = "high must be greater than zero")
        double high,
        @Positive(message = "low must be greater than zero")
        double low,
        @Positive(message = "close must be greater than zero")
        double close,
        Double vix
) {
}
