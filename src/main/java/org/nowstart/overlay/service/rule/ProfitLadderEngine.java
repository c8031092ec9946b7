package org.nowstart.overlay.service.rule;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.overlay.data.dto.ProfitTarget;
import org.nowstart.overlay.data.exception.InvalidInputException;
import org.nowstart.overlay.data.model.RegimeConfig;
import org.nowstart.overlay.data.type.LevelMethod;
import org.springframework.stereotype.Component;

/**
 * Three-level profit schedule. Each level takes the more optimistic of the percentage target and the
 * True-Range target.
 */
@Component
public class ProfitLadderEngine {

    public List<ProfitTarget> compute(double entryPrice, RegimeConfig config, double currentTrueRange) {
        if (!Double.isFinite(entryPrice) || entryPrice <= 0.0) {
            throw new InvalidInputException("entryPrice must be a finite positive number, got " + entryPrice);
        }
        if (!Double.isFinite(currentTrueRange) || currentTrueRange < 0.0) {
            throw new InvalidInputException("trueRange must be a finite non-negative number, got " + currentTrueRange);
        }

        List<ProfitTarget> targets = new ArrayList<>(RegimeConfig.LEVELS);
        double previousScaling = 0.0;
        for (int level = 0; level < RegimeConfig.LEVELS; level++) {
            double basePrice = entryPrice * (1.0 + config.profitLevelPct(level) / 100.0);
            double trPrice = entryPrice + currentTrueRange * config.trProfitMultiplier(level);
            double finalPrice = Math.max(basePrice, trPrice);
            double scaling = config.positionScaling(level);

            targets.add(new ProfitTarget(
                    level,
                    finalPrice,
                    (finalPrice - entryPrice) / entryPrice * 100.0,
                    scaling - previousScaling,
                    scaling,
                    trPrice > basePrice ? LevelMethod.TR_BASED : LevelMethod.PCT_BASED
            ));
            previousScaling = scaling;
        }
        return List.copyOf(targets);
    }
}
