package org.nowstart.overlay.service.lifecycle;

import org.nowstart.overlay.data.exception.InvalidInputException;
import org.nowstart.overlay.data.model.MarketSnapshot;
import org.springframework.stereotype.Component;

/**
 * Input checks run before any lifecycle state is touched. The realistic VIX range is not enforced
 * here; only values no rule can work with are rejected.
 */
@Component
public class PositionInputValidator {

    public void validateOpen(String symbol, double entryPrice, MarketSnapshot snapshot, Double positionSizePct, Double trueRange) {
        validateSymbol(symbol);
        validatePrice("entryPrice", entryPrice);
        validateSnapshot(snapshot);
        if (positionSizePct != null
                && (!Double.isFinite(positionSizePct) || positionSizePct <= 0.0 || positionSizePct > 100.0)) {
            throw new InvalidInputException("positionSizePct must be in (0, 100], got " + positionSizePct);
        }
        if (trueRange != null && (!Double.isFinite(trueRange) || trueRange < 0.0)) {
            throw new InvalidInputException("trueRange must be a finite non-negative number, got " + trueRange);
        }
    }

    public void validateSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidInputException("symbol is required");
        }
    }

    public void validatePrice(String field, double price) {
        if (!Double.isFinite(price) || price <= 0.0) {
            throw new InvalidInputException(field + " must be a finite positive number, got " + price);
        }
    }

    public void validateSnapshot(MarketSnapshot snapshot) {
        if (snapshot == null) {
            throw new InvalidInputException("market snapshot is required");
        }
        if (!Double.isFinite(snapshot.vix()) || snapshot.vix() < 0.0) {
            throw new InvalidInputException("vix must be a finite non-negative number, got " + snapshot.vix());
        }
        Double t2108 = snapshot.t2108();
        if (t2108 != null && (!Double.isFinite(t2108) || t2108 < 0.0 || t2108 > 100.0)) {
            throw new InvalidInputException("t2108 must be in [0, 100], got " + t2108);
        }
        Double momentum = snapshot.momentumRatio();
        if (momentum != null && (!Double.isFinite(momentum) || momentum <= 0.0)) {
            throw new InvalidInputException("momentumRatio must be a finite positive number, got " + momentum);
        }
    }

    public void validateBar(double high, double low, double close) {
        validatePrice("high", high);
        validatePrice("low", low);
        validatePrice("close", close);
        if (high < low) {
            throw new InvalidInputException("high must be >= low, got high=" + high + ", low=" + low);
        }
    }
}
