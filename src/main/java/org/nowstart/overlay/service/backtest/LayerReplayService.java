package org.nowstart.overlay.service.backtest;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.nowstart.overlay.data.dto.DailyBar;
import org.nowstart.overlay.data.dto.HistoricalTrade;
import org.nowstart.overlay.data.dto.LayerReport;
import org.nowstart.overlay.data.dto.PortfolioPerformance;
import org.nowstart.overlay.data.dto.PositionUpdateResult;
import org.nowstart.overlay.data.dto.TradeOutcome;
import org.nowstart.overlay.data.dto.TradeRecord;
import org.nowstart.overlay.data.model.MarketSnapshot;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.type.BacktestLayer;
import org.nowstart.overlay.data.type.PositionActionType;
import org.nowstart.overlay.data.type.PositionState;
import org.nowstart.overlay.service.lifecycle.LifecycleRules;
import org.nowstart.overlay.service.lifecycle.PositionLifecycle;
import org.nowstart.overlay.service.lifecycle.PositionLifecycleFactory;
import org.nowstart.overlay.service.performance.PerformanceAggregator;
import org.nowstart.overlay.service.regime.RegimeClassifier;
import org.springframework.stereotype.Service;

/**
 * Replays a trade set, each trade on its own fresh lifecycle so no trade sees another's state. Every
 * trade ends with a defined exit: a rule exit while bars remain, otherwise {@code END_OF_DATA_EXIT}
 * at the last close.
 */
@Service
@RequiredArgsConstructor
public class LayerReplayService {

    private final PositionLifecycleFactory positionLifecycleFactory;
    private final PerformanceAggregator performanceAggregator;

    public LayerReport replay(
            BacktestLayer layer,
            List<HistoricalTrade> trades,
            LifecycleRules rules,
            RegimeClassifier classifier,
            RegimeRuleBook ruleBook
    ) {
        List<TradeOutcome> outcomes = new ArrayList<>(trades.size());
        for (HistoricalTrade trade : trades) {
            outcomes.add(replayTrade(positionLifecycleFactory.create(rules, classifier, ruleBook), trade));
        }

        PortfolioPerformance performance = performanceAggregator.aggregate(
                outcomes.stream().map(TradeOutcome::realizedReturn).toList()
        );
        double roi = performance.annualizedRoi();
        return new LayerReport(
                layer,
                performance,
                roi,
                performanceAggregator.compositeScore(roi, performance.maxDrawdown(), performance.sharpeRatio()),
                (int) outcomes.stream().filter(TradeOutcome::stopTriggered).count(),
                outcomes.stream().mapToInt(TradeOutcome::profitLevelsHit).sum(),
                countExits(outcomes, PositionActionType.TIME_BASED_EXIT),
                countExits(outcomes, PositionActionType.END_OF_DATA_EXIT),
                outcomes
        );
    }

    private TradeOutcome replayTrade(PositionLifecycle lifecycle, HistoricalTrade trade) {
        MarketSnapshot entrySnapshot = new MarketSnapshot(trade.vixAtEntry(), trade.t2108(), trade.momentumRatio(), 0);
        lifecycle.open(trade.symbol(), trade.entryPrice(), entrySnapshot, null, trade.trueRange());

        PositionUpdateResult last = null;
        double vix = trade.vixAtEntry();
        double lastClose = trade.entryPrice();
        int day = 0;
        for (DailyBar bar : trade.bars()) {
            day++;
            if (bar.vix() != null) {
                vix = bar.vix();
            }
            MarketSnapshot snapshot = new MarketSnapshot(vix, trade.t2108(), trade.momentumRatio(), day);
            last = lifecycle.update(trade.symbol(), bar.high(), bar.low(), bar.close(), snapshot);
            lastClose = bar.close();
            if (last.status() == PositionState.CLOSED) {
                break;
            }
        }
        if (last == null || last.status() != PositionState.CLOSED) {
            last = lifecycle.close(trade.symbol(), lastClose, PositionActionType.END_OF_DATA_EXIT);
        }

        List<TradeRecord> history = lifecycle.tradeHistory();
        TradeRecord record = history.get(history.size() - 1);
        return new TradeOutcome(
                record.symbol(),
                record.regimeAtEntry(),
                record.realizedReturn(),
                record.daysHeld(),
                record.exitReason(),
                record.profitLevelsHit(),
                record.stopTriggered(),
                last.remainingPct()
        );
    }

    private int countExits(List<TradeOutcome> outcomes, PositionActionType type) {
        return (int) outcomes.stream().filter(outcome -> outcome.exitReason() == type).count();
    }
}
