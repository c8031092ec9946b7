package org.nowstart.overlay.service.lifecycle;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.overlay.data.dto.PositionAction;
import org.nowstart.overlay.data.dto.PositionOpenResult;
import org.nowstart.overlay.data.dto.PositionUpdateResult;
import org.nowstart.overlay.data.dto.PositionView;
import org.nowstart.overlay.data.dto.ProfitTarget;
import org.nowstart.overlay.data.dto.StopLossResult;
import org.nowstart.overlay.data.dto.TradeRecord;
import org.nowstart.overlay.data.exception.DuplicatePositionException;
import org.nowstart.overlay.data.exception.PositionNotFoundException;
import org.nowstart.overlay.data.model.MarketSnapshot;
import org.nowstart.overlay.data.model.RegimeConfig;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.model.RuleAdjustment;
import org.nowstart.overlay.data.model.TradePosition;
import org.nowstart.overlay.data.model.TransitionLogEntry;
import org.nowstart.overlay.data.model.TransitionResult;
import org.nowstart.overlay.data.type.PositionActionType;
import org.nowstart.overlay.data.type.PositionState;
import org.nowstart.overlay.data.type.RegimeType;
import org.nowstart.overlay.service.regime.RegimeTransitionLog;
import org.nowstart.overlay.service.regime.RegimeTransitionManager;
import org.nowstart.overlay.service.rule.AdaptiveStopEngine;
import org.nowstart.overlay.service.rule.ProfitLadderEngine;
import org.nowstart.overlay.service.rule.TrueRangeHistory;

/**
 * Owns the active positions and drives each through {@code OPEN -> ACTIVE -> CLOSED}.
 *
 * <p>Each daily update runs at most one rule, in priority order: stop-loss, one profit level, regime
 * re-adjustment, time exit. Calls for the same symbol must be serialised by the caller; distinct
 * symbols may be updated concurrently.
 */
@Slf4j
public class PositionLifecycle {

    private final RegimeTransitionManager transitionManager;
    private final RegimeRuleBook ruleBook;
    private final AdaptiveStopEngine stopEngine;
    private final ProfitLadderEngine profitEngine;
    private final PositionInputValidator validator;
    private final LifecycleSettings settings;
    private final LifecycleRules rules;
    private final Clock clock;

    private final Map<String, TradePosition> activePositions = new ConcurrentHashMap<>();
    private final Map<String, TrueRangeHistory> trueRangeHistories = new ConcurrentHashMap<>();
    private final List<TradeRecord> tradeHistory = new CopyOnWriteArrayList<>();
    private final Map<String, MarketSnapshot> lastOpenSnapshots = new ConcurrentHashMap<>();
    private final RegimeTransitionLog transitionLog = new RegimeTransitionLog();

    public PositionLifecycle(
            RegimeTransitionManager transitionManager,
            RegimeRuleBook ruleBook,
            AdaptiveStopEngine stopEngine,
            ProfitLadderEngine profitEngine,
            PositionInputValidator validator,
            LifecycleSettings settings,
            LifecycleRules rules,
            Clock clock
    ) {
        this.transitionManager = transitionManager;
        this.ruleBook = ruleBook;
        this.stopEngine = stopEngine;
        this.profitEngine = profitEngine;
        this.validator = validator;
        this.settings = settings;
        this.rules = rules;
        this.clock = clock;
    }

    public PositionOpenResult open(String symbol, double entryPrice, MarketSnapshot snapshot) {
        return open(symbol, entryPrice, snapshot, null, null);
    }

    /**
     * Opens a position. The entry snapshot is compared with the snapshot of this symbol's previous
     * open, so other symbols never influence the entry rules.
     *
     * @param trueRange True Range at entry; null falls back to a fraction of the entry price
     */
    public PositionOpenResult open(
            String symbol,
            double entryPrice,
            MarketSnapshot snapshot,
            Double positionSizePct,
            Double trueRange
    ) {
        validator.validateOpen(symbol, entryPrice, snapshot, positionSizePct, trueRange);
        if (activePositions.containsKey(symbol)) {
            throw new DuplicatePositionException(symbol);
        }

        TransitionResult transition = rules.regimeAdjustment()
                ? transitionManager.detect(snapshot, lastOpenSnapshots.get(symbol), transitionLog)
                : TransitionResult.initial(transitionManager.classifier().classify(snapshot));
        RegimeType regime = transition.currentRegime();
        RegimeConfig config = transitionManager.applyTo(ruleBook.get(regime), transition.adjustment());

        StopLossResult stop;
        double currentTrueRange;
        if (trueRange != null) {
            currentTrueRange = trueRange;
            TrueRangeHistory history = trueRangeHistory(symbol);
            history.record(currentTrueRange);
            stop = stopEngine.compute(entryPrice, config, currentTrueRange, snapshot.t2108(), history);
        } else {
            // fallback range is not an observation: kept out of the window and never normalised
            currentTrueRange = entryPrice * settings.defaultTrueRangeFraction();
            stop = stopEngine.compute(entryPrice, config, currentTrueRange, snapshot.t2108());
        }
        List<ProfitTarget> targets = profitEngine.compute(entryPrice, config, currentTrueRange);
        int maxHoldDays = rules.fixedHoldDays() != null ? rules.fixedHoldDays() : config.maxHoldDays();

        TradePosition position = TradePosition.builder()
                .symbol(symbol)
                .entryPrice(entryPrice)
                .entryDate(clock.instant())
                .positionSizePct(positionSizePct != null ? positionSizePct : settings.defaultPositionSizePct())
                .regimeAtEntry(regime)
                .vixAtEntry(snapshot.vix())
                .stopLevel(stop.price())
                .profitLevels(targets.stream().map(ProfitTarget::price).toList())
                .profitScales(config.positionScalingPct())
                .maxHoldDays(maxHoldDays)
                .referenceSnapshot(snapshot)
                .lastClose(entryPrice)
                .build();
        position.setState(PositionState.ACTIVE);

        activePositions.put(symbol, position);
        lastOpenSnapshots.put(symbol, snapshot);

        log.debug(
                "Position opened. symbol={}, regime={}, entry={}, stop={}, stopPct={}, method={}, maxHoldDays={}",
                symbol,
                regime.code(),
                entryPrice,
                stop.price(),
                stop.pct(),
                stop.method().code(),
                maxHoldDays
        );

        return new PositionOpenResult(
                symbol,
                entryPrice,
                regime,
                stop.price(),
                stop.pct(),
                stop.method(),
                targets,
                maxHoldDays,
                transition.transitionDetected(),
                transition.adjustment().reason()
        );
    }

    public PositionUpdateResult update(String symbol, double high, double low, double close, MarketSnapshot snapshot) {
        validator.validateSymbol(symbol);
        validator.validateBar(high, low, close);
        validator.validateSnapshot(snapshot);
        TradePosition position = activePositions.get(symbol);
        if (position == null) {
            throw new PositionNotFoundException(symbol);
        }

        position.setDaysHeld(position.getDaysHeld() + 1);
        position.trackExcursion(high, low);
        trueRangeHistory(symbol).record(TrueRangeHistory.trueRange(high, low, position.getLastClose()));

        PositionAction action = checkStopLoss(position, low);
        if (action == null) {
            action = checkProfitTaking(position, high);
        }
        if (action == null) {
            action = checkRegimeAdjustment(position, snapshot);
        }
        if (action == null) {
            action = checkTimeExit(position, close);
        }
        position.setLastClose(close);

        List<PositionAction> actions = new ArrayList<>(1);
        if (action != null) {
            actions.add(action);
            if (position.getRemainingPositionPct() <= 0.0) {
                finish(position, action);
            }
        }
        return toUpdateResult(position, actions, close);
    }

    /**
     * Exits whatever remains of the position at {@code price}.
     *
     * @param reason {@code MANUAL_CLOSE} or {@code END_OF_DATA_EXIT}; null means manual
     */
    public PositionUpdateResult close(String symbol, double price, PositionActionType reason) {
        validator.validateSymbol(symbol);
        validator.validatePrice("price", price);
        TradePosition position = activePositions.get(symbol);
        if (position == null) {
            throw new PositionNotFoundException(symbol);
        }

        PositionActionType type = reason != null ? reason : PositionActionType.MANUAL_CLOSE;
        double closedPct = position.getRemainingPositionPct();
        double pnl = position.realize(price, closedPct);
        PositionAction action = new PositionAction(type, -1, price, closedPct, pnl, type.name().toLowerCase(Locale.ROOT));
        position.setLastClose(price);
        finish(position, action);
        return toUpdateResult(position, List.of(action), price);
    }

    public List<PositionView> activePositions() {
        return activePositions.values()
                .stream()
                .sorted(Comparator.comparing(TradePosition::getSymbol))
                .map(PositionView::from)
                .toList();
    }

    public Optional<PositionView> position(String symbol) {
        TradePosition position = symbol == null ? null : activePositions.get(symbol);
        return Optional.ofNullable(position).map(PositionView::from);
    }

    public List<TradeRecord> tradeHistory() {
        return List.copyOf(tradeHistory);
    }

    public List<Double> closedReturns() {
        return tradeHistory.stream().map(TradeRecord::realizedReturn).toList();
    }

    public List<TransitionLogEntry> transitionLog() {
        return transitionLog.entries();
    }

    private PositionAction checkStopLoss(TradePosition position, double low) {
        if (!rules.stopLoss() || position.isStopTriggered() || position.getRemainingPositionPct() <= 0.0) {
            return null;
        }
        if (low > position.getStopLevel()) {
            return null;
        }

        double closedPct = position.getRemainingPositionPct();
        double pnl = position.realize(position.getStopLevel(), closedPct);
        position.setStopTriggered(true);
        return new PositionAction(
                PositionActionType.STOP_LOSS_EXECUTED,
                -1,
                position.getStopLevel(),
                closedPct,
                pnl,
                "low " + low + " <= stop " + position.getStopLevel()
        );
    }

    private PositionAction checkProfitTaking(TradePosition position, double high) {
        if (!rules.profitTaking() || position.getRemainingPositionPct() <= 0.0) {
            return null;
        }
        List<Double> levels = position.getProfitLevels();
        for (int level = 0; level < levels.size(); level++) {
            double target = levels.get(level);
            if (position.getProfitLevelsHit().contains(level) || target > high) {
                continue;
            }

            double closedPct = Math.min(position.positionToClose(level), position.getRemainingPositionPct());
            double pnl = position.realize(target, closedPct);
            position.getProfitLevelsHit().add(level);
            return new PositionAction(
                    PositionActionType.PROFIT_TAKING,
                    level,
                    target,
                    closedPct,
                    pnl,
                    "level " + (level + 1) + " target " + target + " <= high " + high
            );
        }
        return null;
    }

    private PositionAction checkRegimeAdjustment(TradePosition position, MarketSnapshot snapshot) {
        if (!rules.regimeAdjustment()) {
            return null;
        }
        if (Math.abs(snapshot.vix() - position.getVixAtEntry()) <= settings.regimeCheckVixDelta()) {
            return null;
        }

        TransitionResult transition = transitionManager.detect(snapshot, position.getReferenceSnapshot(), transitionLog);
        RuleAdjustment adjustment = transition.adjustment();
        if (adjustment.isTrivial()) {
            return null;
        }

        double entryPrice = position.getEntryPrice();
        double currentPct = (position.getStopLevel() - entryPrice) / entryPrice * 100.0;
        double adjustedPct = AdaptiveStopEngine.clamp(currentPct * adjustment.stopMultiplier());
        double adjustedStop = entryPrice * (1.0 + adjustedPct / 100.0);

        position.setStopLevel(adjustedStop);
        position.setReferenceSnapshot(snapshot);
        if (rules.fixedHoldDays() == null) {
            position.setMaxHoldDays(adjustment.adjustHoldDays(position.getMaxHoldDays()));
        }

        log.debug(
                "Position stop re-adjusted. symbol={}, regime={}, stopPct={}, stop={}, maxHoldDays={}, reason={}",
                position.getSymbol(),
                transition.currentRegime().code(),
                adjustedPct,
                adjustedStop,
                position.getMaxHoldDays(),
                adjustment.reason()
        );
        return new PositionAction(PositionActionType.REGIME_ADJUSTMENT, -1, adjustedStop, 0.0, 0.0, adjustment.reason());
    }

    private PositionAction checkTimeExit(TradePosition position, double close) {
        if (position.getRemainingPositionPct() <= 0.0 || position.getDaysHeld() < position.getMaxHoldDays()) {
            return null;
        }
        double closedPct = position.getRemainingPositionPct();
        double pnl = position.realize(close, closedPct);
        return new PositionAction(
                PositionActionType.TIME_BASED_EXIT,
                -1,
                close,
                closedPct,
                pnl,
                "held " + position.getDaysHeld() + " of " + position.getMaxHoldDays() + " days"
        );
    }

    private void finish(TradePosition position, PositionAction exit) {
        position.setState(PositionState.CLOSED);
        activePositions.remove(position.getSymbol());
        tradeHistory.add(new TradeRecord(
                position.getSymbol(),
                position.getEntryPrice(),
                exit.price(),
                position.getEntryDate(),
                clock.instant(),
                position.getRegimeAtEntry(),
                position.getRealizedPnl(),
                position.getDaysHeld(),
                exit.type(),
                position.getProfitLevelsHit().size(),
                position.isStopTriggered(),
                position.getMaxProfitSeen(),
                position.getMaxLossSeen()
        ));
        log.debug(
                "Position closed. symbol={}, exit={}, price={}, realizedPnl={}, daysHeld={}",
                position.getSymbol(),
                exit.type(),
                exit.price(),
                position.getRealizedPnl(),
                position.getDaysHeld()
        );
    }

    private PositionUpdateResult toUpdateResult(TradePosition position, List<PositionAction> actions, double close) {
        return new PositionUpdateResult(
                position.getSymbol(),
                actions,
                position.getState(),
                position.isClosed() ? null : position.returnAt(close),
                position.getRealizedPnl(),
                position.getRemainingPositionPct(),
                position.getDaysHeld(),
                position.getMaxProfitSeen(),
                position.getMaxLossSeen()
        );
    }

    private TrueRangeHistory trueRangeHistory(String symbol) {
        return trueRangeHistories.computeIfAbsent(symbol, ignored -> new TrueRangeHistory(settings.trueRangeWindow()));
    }
}
