package org.nowstart.overlay.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.overlay.data.dto.BacktestOverrides;
import org.nowstart.overlay.data.dto.BacktestReport;
import org.nowstart.overlay.data.dto.HistoricalTrade;
import org.nowstart.overlay.data.dto.PortfolioPerformance;
import org.nowstart.overlay.data.dto.PositionAction;
import org.nowstart.overlay.data.dto.PositionOpenResult;
import org.nowstart.overlay.data.dto.PositionUpdateResult;
import org.nowstart.overlay.data.dto.PositionView;
import org.nowstart.overlay.data.dto.TradeRecord;
import org.nowstart.overlay.data.exception.PositionNotFoundException;
import org.nowstart.overlay.data.model.MarketSnapshot;
import org.nowstart.overlay.data.model.TransitionLogEntry;
import org.nowstart.overlay.data.type.PositionActionType;
import org.nowstart.overlay.service.backtest.MultiLayerBacktestService;
import org.nowstart.overlay.service.lifecycle.LifecycleRules;
import org.nowstart.overlay.service.lifecycle.PositionLifecycle;
import org.nowstart.overlay.service.lifecycle.PositionLifecycleFactory;
import org.nowstart.overlay.service.performance.PerformanceAggregator;
import org.springframework.stereotype.Service;

/**
 * Entry point for live positions and backtests. Calls for one symbol are serialised on a per-symbol
 * lock; different symbols proceed in parallel.
 */
@Slf4j
@Service
public class RiskOverlayService {

    private final PositionLifecycle positionLifecycle;
    private final PerformanceAggregator performanceAggregator;
    private final MultiLayerBacktestService multiLayerBacktestService;
    private final Map<String, Object> symbolLocks = new ConcurrentHashMap<>();

    public RiskOverlayService(
            PositionLifecycleFactory positionLifecycleFactory,
            PerformanceAggregator performanceAggregator,
            MultiLayerBacktestService multiLayerBacktestService
    ) {
        this.positionLifecycle = positionLifecycleFactory.create(LifecycleRules.full());
        this.performanceAggregator = performanceAggregator;
        this.multiLayerBacktestService = multiLayerBacktestService;
    }

    public PositionOpenResult openPosition(
            String symbol,
            double entryPrice,
            MarketSnapshot snapshot,
            Double positionSizePct,
            Double trueRange
    ) {
        synchronized (lockFor(symbol)) {
            PositionOpenResult result = positionLifecycle.open(symbol, entryPrice, snapshot, positionSizePct, trueRange);
            log.info(
                    "Position opened. symbol={}, regime={}, entry={}, stop={}, expectedHoldDays={}, transition={}",
                    symbol,
                    result.regime().code(),
                    entryPrice,
                    result.stopLevel(),
                    result.expectedHoldDays(),
                    result.transitionDetected()
            );
            return result;
        }
    }

    public PositionUpdateResult updatePosition(String symbol, double high, double low, double close, MarketSnapshot snapshot) {
        synchronized (lockFor(symbol)) {
            PositionUpdateResult result = positionLifecycle.update(symbol, high, low, close, snapshot);
            for (PositionAction action : result.actions()) {
                log.info(
                        "Position action executed. symbol={}, action={}, price={}, closedPct={}, remainingPct={}, reason={}",
                        symbol,
                        action.type(),
                        action.price(),
                        action.positionClosedPct(),
                        result.remainingPct(),
                        action.reason()
                );
            }
            return result;
        }
    }

    public PositionUpdateResult closePosition(String symbol, double price) {
        synchronized (lockFor(symbol)) {
            PositionUpdateResult result = positionLifecycle.close(symbol, price, PositionActionType.MANUAL_CLOSE);
            log.info("Position closed manually. symbol={}, price={}, realizedPnl={}", symbol, price, result.realizedPnl());
            return result;
        }
    }

    public List<PositionView> getActivePositions() {
        return positionLifecycle.activePositions();
    }

    public PositionView getPosition(String symbol) {
        return positionLifecycle.position(symbol)
                .orElseThrow(() -> new PositionNotFoundException(symbol));
    }

    public List<TradeRecord> getTradeHistory() {
        return positionLifecycle.tradeHistory();
    }

    public List<TransitionLogEntry> getTransitionHistory() {
        return positionLifecycle.transitionLog();
    }

    public PortfolioPerformance getPortfolioPerformance() {
        return performanceAggregator.aggregate(positionLifecycle.closedReturns());
    }

    public BacktestReport runBacktest(List<HistoricalTrade> trades, BacktestOverrides overrides) {
        return multiLayerBacktestService.run(trades, overrides);
    }

    private Object lockFor(String symbol) {
        return symbolLocks.computeIfAbsent(symbol == null ? "" : symbol, ignored -> new Object());
    }
}
