package org.nowstart.overlay.data.dto;

import org.nowstart.overlay.data.type.RegimeType;

public record RegimeBreakdown(
        RegimeType regime,
        int trades,
        double avgReturn,
        double winRate,
        double totalReturn
) {
}
