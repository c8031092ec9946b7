package org.nowstart.overlay.service.backtest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.overlay.data.dto.BacktestOverrides;
import org.nowstart.overlay.data.dto.BacktestReport;
import org.nowstart.overlay.data.dto.DailyBar;
import org.nowstart.overlay.data.dto.GridSearchRow;
import org.nowstart.overlay.data.dto.HistoricalTrade;
import org.nowstart.overlay.data.dto.LayerReport;
import org.nowstart.overlay.data.dto.RegimeBreakdown;
import org.nowstart.overlay.data.dto.TradeOutcome;
import org.nowstart.overlay.data.exception.InvalidInputException;
import org.nowstart.overlay.data.model.MarketSnapshot;
import org.nowstart.overlay.data.model.RegimeBands;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.property.BacktestProperties;
import org.nowstart.overlay.data.type.BacktestLayer;
import org.nowstart.overlay.data.type.RegimeType;
import org.nowstart.overlay.service.lifecycle.LifecycleRules;
import org.nowstart.overlay.service.lifecycle.PositionInputValidator;
import org.nowstart.overlay.service.lifecycle.PositionLifecycleFactory;
import org.nowstart.overlay.service.regime.RegimeClassifier;
import org.springframework.stereotype.Service;

/**
 * Runs the baseline, stop-only, profit-only and combined layers over the same trade set and compares
 * them. Every trade replays on a fresh lifecycle, so neither layers nor trades share state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MultiLayerBacktestService {

    private final LayerReplayService layerReplayService;
    private final BacktestGridSearchService backtestGridSearchService;
    private final PositionLifecycleFactory positionLifecycleFactory;
    private final PositionInputValidator positionInputValidator;
    private final BacktestProperties backtestProperties;

    public BacktestReport run(List<HistoricalTrade> trades, BacktestOverrides overrides) {
        BacktestOverrides resolved = overrides != null ? overrides : BacktestOverrides.none();
        validateTrades(trades);
        int holdDays = resolveHoldDays(resolved);
        RegimeClassifier classifier = resolveClassifier(resolved);
        RegimeRuleBook ruleBook = resolveRuleBook(resolved);

        Map<BacktestLayer, LayerReport> layers = new EnumMap<>(BacktestLayer.class);
        layers.put(BacktestLayer.BASELINE, layerReplayService.replay(
                BacktestLayer.BASELINE, trades, LifecycleRules.baseline(holdDays), classifier, ruleBook));
        layers.put(BacktestLayer.STOP_LOSS_ONLY, layerReplayService.replay(
                BacktestLayer.STOP_LOSS_ONLY, trades, LifecycleRules.stopLossOnly(holdDays), classifier, ruleBook));
        layers.put(BacktestLayer.PROFIT_TAKING_ONLY, layerReplayService.replay(
                BacktestLayer.PROFIT_TAKING_ONLY, trades, LifecycleRules.profitTakingOnly(holdDays), classifier, ruleBook));
        layers.put(BacktestLayer.COMBINED, layerReplayService.replay(
                BacktestLayer.COMBINED, trades, LifecycleRules.full(), classifier, ruleBook));

        LayerReport baseline = layers.get(BacktestLayer.BASELINE);
        LayerReport combined = layers.get(BacktestLayer.COMBINED);
        BacktestLayer bestLayer = bestLayer(layers);
        double roiImprovement = combined.roiAnnualized() - baseline.roiAnnualized();
        double drawdownReduction = Math.abs(baseline.performance().maxDrawdown())
                - Math.abs(combined.performance().maxDrawdown());

        List<GridSearchRow> grid = resolved.gridSearchEnabled()
                ? backtestGridSearchService.search(trades, ruleBook)
                : List.of();

        log.info(
                "Backtest finished. trades={}, bestLayer={}, baselineRoi={}, combinedRoi={}, drawdownReduction={}, gridRows={}",
                trades.size(),
                bestLayer.code(),
                baseline.roiAnnualized(),
                combined.roiAnnualized(),
                drawdownReduction,
                grid.size()
        );

        return new BacktestReport(
                trades.size(),
                Collections.unmodifiableMap(layers),
                bestLayer,
                roiImprovement,
                drawdownReduction,
                regimeBreakdown(combined.trades()),
                grid
        );
    }

    private void validateTrades(List<HistoricalTrade> trades) {
        if (trades == null || trades.isEmpty()) {
            throw new InvalidInputException("at least one historical trade is required");
        }
        for (int i = 0; i < trades.size(); i++) {
            HistoricalTrade trade = trades.get(i);
            if (trade == null) {
                throw new InvalidInputException("trades[" + i + "] is null");
            }
            try {
                positionInputValidator.validateOpen(
                        trade.symbol(),
                        trade.entryPrice(),
                        new MarketSnapshot(trade.vixAtEntry(), trade.t2108(), trade.momentumRatio(), 0),
                        null,
                        trade.trueRange()
                );
                for (DailyBar bar : trade.bars()) {
                    positionInputValidator.validateBar(bar.high(), bar.low(), bar.close());
                    if (bar.vix() != null && (!Double.isFinite(bar.vix()) || bar.vix() < 0.0)) {
                        throw new InvalidInputException("bar vix must be a finite non-negative number, got " + bar.vix());
                    }
                }
            } catch (InvalidInputException e) {
                throw new InvalidInputException("trades[" + i + "]: " + e.getMessage());
            }
        }
    }

    private int resolveHoldDays(BacktestOverrides overrides) {
        Integer holdDays = overrides.baselineHoldDays();
        if (holdDays == null) {
            return backtestProperties.baselineHoldDays();
        }
        if (holdDays < 1) {
            throw new InvalidInputException("baselineHoldDays must be >= 1, got " + holdDays);
        }
        return holdDays;
    }

    private RegimeClassifier resolveClassifier(BacktestOverrides overrides) {
        List<Double> bands = overrides.vixBands();
        if (bands == null) {
            return positionLifecycleFactory.regimeClassifier();
        }
        if (bands.size() != 3 || bands.contains(null)) {
            throw new InvalidInputException("vixBands must contain exactly 3 values");
        }
        try {
            return new RegimeClassifier(new RegimeBands(bands.get(0), bands.get(1), bands.get(2)));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(e.getMessage());
        }
    }

    private RegimeRuleBook resolveRuleBook(BacktestOverrides overrides) {
        RegimeRuleBook ruleBook = positionLifecycleFactory.regimeRuleBook();
        if (overrides.stopScalar() == null && overrides.profitScalar() == null) {
            return ruleBook;
        }
        double stopScalar = overrides.stopScalar() != null ? overrides.stopScalar() : 1.0;
        double profitScalar = overrides.profitScalar() != null ? overrides.profitScalar() : 1.0;
        try {
            return ruleBook.scaled(stopScalar, profitScalar);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(e.getMessage());
        }
    }

    private BacktestLayer bestLayer(Map<BacktestLayer, LayerReport> layers) {
        BacktestLayer best = BacktestLayer.BASELINE;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<BacktestLayer, LayerReport> entry : layers.entrySet()) {
            double score = entry.getValue().compositeScore();
            double rank = Double.isFinite(score) ? score : Double.NEGATIVE_INFINITY;
            if (rank > bestScore) {
                bestScore = rank;
                best = entry.getKey();
            }
        }
        return best;
    }

    private Map<RegimeType, RegimeBreakdown> regimeBreakdown(List<TradeOutcome> outcomes) {
        Map<RegimeType, List<Double>> returnsByRegime = new EnumMap<>(RegimeType.class);
        for (TradeOutcome outcome : outcomes) {
            returnsByRegime.computeIfAbsent(outcome.regime(), ignored -> new ArrayList<>()).add(outcome.realizedReturn());
        }

        Map<RegimeType, RegimeBreakdown> breakdown = new EnumMap<>(RegimeType.class);
        for (Map.Entry<RegimeType, List<Double>> entry : returnsByRegime.entrySet()) {
            List<Double> returns = entry.getValue();
            double total = returns.stream().mapToDouble(Double::doubleValue).sum();
            long wins = returns.stream().filter(value -> value > 0.0).count();
            breakdown.put(entry.getKey(), new RegimeBreakdown(
                    entry.getKey(),
                    returns.size(),
                    total / returns.size(),
                    (double) wins / returns.size(),
                    total
            ));
        }
        return Collections.unmodifiableMap(breakdown);
    }
}
