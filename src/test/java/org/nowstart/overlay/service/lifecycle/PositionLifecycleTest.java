package org.nowstart.overlay.service.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.nowstart.overlay.data.dto.PositionAction;
import org.nowstart.overlay.data.dto.PositionOpenResult;
import org.nowstart.overlay.data.dto.PositionUpdateResult;
import org.nowstart.overlay.data.dto.PositionView;
import org.nowstart.overlay.data.dto.ProfitTarget;
import org.nowstart.overlay.data.dto.TradeRecord;
import org.nowstart.overlay.data.exception.DuplicatePositionException;
import org.nowstart.overlay.data.exception.InvalidInputException;
import org.nowstart.overlay.data.exception.PositionNotFoundException;
import org.nowstart.overlay.data.model.MarketSnapshot;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.type.LevelMethod;
import org.nowstart.overlay.data.type.PositionActionType;
import org.nowstart.overlay.data.type.PositionState;
import org.nowstart.overlay.data.type.RegimeType;
import org.nowstart.overlay.service.regime.RegimeClassifier;
import org.nowstart.overlay.service.regime.RegimeTransitionManager;
import org.nowstart.overlay.service.rule.AdaptiveStopEngine;
import org.nowstart.overlay.service.rule.ProfitLadderEngine;

class PositionLifecycleTest {

    private static final Instant NOW = Instant.parse("2024-03-01T21:00:00Z");

    @Test
    void open_bullEntryComputesStopAndLadder() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());

        PositionOpenResult result = lifecycle.open("XYZ", 45.66, MarketSnapshot.of(15.43), null, 1.35);

        assertThat(result.regime()).isEqualTo(RegimeType.BULL_NORMAL);
        assertThat(result.stopLevel()).isCloseTo(42.01, within(0.005));
        assertThat(result.stopDistancePct()).isEqualTo(-8.0);
        assertThat(result.profitTargets()).extracting(ProfitTarget::positionToClose).containsExactly(25.0, 25.0, 50.0);
        assertThat(result.profitTargets()).extracting(ProfitTarget::price).isSorted();
        assertThat(result.profitTargets().get(0).price()).isGreaterThan(45.66);
        assertThat(result.expectedHoldDays()).isEqualTo(3);
        assertThat(result.transitionDetected()).isFalse();
        assertThat(result.adjustmentReason()).isEmpty();

        PositionView view = lifecycle.position("XYZ").orElseThrow();
        assertThat(view.state()).isEqualTo(PositionState.ACTIVE);
        assertThat(view.remainingPositionPct()).isEqualTo(100.0);
        assertThat(view.positionSizePct()).isEqualTo(100.0);
        assertThat(view.entryDate()).isEqualTo(NOW);
    }

    @Test
    void open_rejectsDuplicateSymbolAndKeepsExistingPosition() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));

        assertThatThrownBy(() -> lifecycle.open("XYZ", 50.0, MarketSnapshot.of(18.0)))
                .isInstanceOf(DuplicatePositionException.class);

        assertThat(lifecycle.position("XYZ").orElseThrow().entryPrice()).isEqualTo(100.0);
    }

    @Test
    void open_rejectsInvalidInputWithoutCreatingPosition() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());

        assertThatThrownBy(() -> lifecycle.open("XYZ", 0.0, MarketSnapshot.of(18.0)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0, 140.0, 1.0)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0), 0.0, null))
                .isInstanceOf(InvalidInputException.class);

        assertThat(lifecycle.activePositions()).isEmpty();
    }

    @Test
    void open_detectsTransitionAgainstPreviousEntryOfSameSymbol() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("AAA", 100.0, MarketSnapshot.of(18.0));
        lifecycle.close("AAA", 100.0, null);

        PositionOpenResult result = lifecycle.open("AAA", 100.0, MarketSnapshot.of(38.0));

        assertThat(result.transitionDetected()).isTrue();
        assertThat(result.regime()).isEqualTo(RegimeType.HIGH_VOL_STRESS);
        assertThat(result.adjustmentReason()).contains("VIX spike");
        assertThat(result.stopDistancePct()).isCloseTo(-19.2, within(1e-9));
        assertThat(result.profitTargets().get(0).price()).isCloseTo(119.5, within(1e-9));
        assertThat(lifecycle.transitionLog()).hasSize(1);
    }

    @Test
    void open_ignoresEntriesOfOtherSymbols() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("AAA", 100.0, MarketSnapshot.of(18.0));

        PositionOpenResult result = lifecycle.open("BBB", 100.0, MarketSnapshot.of(38.0));

        assertThat(result.transitionDetected()).isFalse();
        assertThat(result.adjustmentReason()).isEmpty();
        assertThat(result.stopDistancePct()).isEqualTo(-12.0);
        assertThat(lifecycle.transitionLog()).isEmpty();
    }

    @Test
    void open_keepsFallbackTrueRangeOutOfVolatilityWindow() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        holdThroughQuietBars(lifecycle);

        PositionOpenResult result = lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));

        assertThat(result.stopDistancePct()).isEqualTo(-8.0);
        assertThat(result.stopMethod()).isEqualTo(LevelMethod.PCT_BASED);
    }

    @Test
    void open_normalisesSuppliedTrueRangeAgainstRecentBars() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        holdThroughQuietBars(lifecycle);

        PositionOpenResult result = lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0), null, 2.0);

        // window [0.5, 0.5, 0.5, 0.5, 2.0]: factor 2.5
        assertThat(result.stopDistancePct()).isCloseTo(-9.0, within(1e-9));
        assertThat(result.stopMethod()).isEqualTo(LevelMethod.TR_BASED);
    }

    @Test
    void update_stopLossClosesWholePosition() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        PositionOpenResult opened = lifecycle.open("XYZ", 45.66, MarketSnapshot.of(15.43), null, 1.35);

        PositionUpdateResult result = lifecycle.update("XYZ", 46.0, 41.5, 42.0, MarketSnapshot.of(16.0));

        assertThat(result.actions()).extracting(PositionAction::type).containsExactly(PositionActionType.STOP_LOSS_EXECUTED);
        assertThat(result.actions().get(0).price()).isEqualTo(opened.stopLevel());
        assertThat(result.status()).isEqualTo(PositionState.CLOSED);
        assertThat(result.remainingPct()).isEqualTo(0.0);
        assertThat(result.currentPnl()).isNull();
        assertThat(result.realizedPnl()).isCloseTo((opened.stopLevel() - 45.66) / 45.66, within(1e-12));
        assertThat(lifecycle.activePositions()).isEmpty();

        TradeRecord record = lifecycle.tradeHistory().get(0);
        assertThat(record.exitReason()).isEqualTo(PositionActionType.STOP_LOSS_EXECUTED);
        assertThat(record.stopTriggered()).isTrue();
        assertThat(record.closedAt()).isEqualTo(NOW);
    }

    @Test
    void update_afterCloseIsRejectedWithoutDoubleRealizing() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));
        lifecycle.update("XYZ", 100.0, 90.0, 91.0, MarketSnapshot.of(18.0));

        assertThatThrownBy(() -> lifecycle.update("XYZ", 100.0, 90.0, 91.0, MarketSnapshot.of(18.0)))
                .isInstanceOf(PositionNotFoundException.class);

        assertThat(lifecycle.tradeHistory()).hasSize(1);
        assertThat(lifecycle.closedReturns()).containsExactly(lifecycle.tradeHistory().get(0).realizedReturn());
    }

    @Test
    void update_takesOneProfitLevelPerDay() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));

        PositionUpdateResult first = lifecycle.update("XYZ", 113.0, 101.0, 112.0, MarketSnapshot.of(18.0));
        assertThat(first.actions()).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(PositionActionType.PROFIT_TAKING);
            assertThat(action.level()).isZero();
            assertThat(action.price()).isCloseTo(112.0, within(1e-9));
            assertThat(action.positionClosedPct()).isEqualTo(25.0);
        });
        assertThat(first.remainingPct()).isEqualTo(75.0);
        assertThat(first.realizedPnl()).isCloseTo(0.03, within(1e-9));
        assertThat(first.status()).isEqualTo(PositionState.ACTIVE);
        assertThat(lifecycle.position("XYZ").orElseThrow().profitLevelsHit()).containsExactly(0);

        PositionUpdateResult second = lifecycle.update("XYZ", 141.0, 120.0, 139.0, MarketSnapshot.of(18.0));
        assertThat(second.actions()).singleElement().extracting(PositionAction::level).isEqualTo(1);
        assertThat(second.remainingPct()).isEqualTo(50.0);
        assertThat(second.realizedPnl()).isCloseTo(0.0925, within(1e-9));

        PositionUpdateResult third = lifecycle.update("XYZ", 141.0, 130.0, 138.0, MarketSnapshot.of(18.0));
        assertThat(third.actions()).singleElement().extracting(PositionAction::level).isEqualTo(2);
        assertThat(third.remainingPct()).isEqualTo(0.0);
        assertThat(third.status()).isEqualTo(PositionState.CLOSED);
        assertThat(third.realizedPnl()).isCloseTo(0.2925, within(1e-9));
        assertThat(lifecycle.tradeHistory().get(0).profitLevelsHit()).isEqualTo(3);
    }

    @Test
    void update_stopLossTakesPriorityOverProfitTaking() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));

        PositionUpdateResult result = lifecycle.update("XYZ", 115.0, 91.0, 95.0, MarketSnapshot.of(18.0));

        assertThat(result.actions()).extracting(PositionAction::type).containsExactly(PositionActionType.STOP_LOSS_EXECUTED);
        assertThat(result.realizedPnl()).isCloseTo(-0.08, within(1e-9));
    }

    @Test
    void update_exitsOnHoldHorizon() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));

        PositionUpdateResult first = lifecycle.update("XYZ", 101.0, 99.0, 100.5, MarketSnapshot.of(18.0));
        lifecycle.update("XYZ", 101.0, 99.0, 100.5, MarketSnapshot.of(18.0));
        PositionUpdateResult third = lifecycle.update("XYZ", 101.0, 99.0, 100.5, MarketSnapshot.of(18.0));

        assertThat(first.actions()).isEmpty();
        assertThat(first.currentPnl()).isCloseTo(0.005, within(1e-12));
        assertThat(first.daysHeld()).isEqualTo(1);
        assertThat(third.actions()).extracting(PositionAction::type).containsExactly(PositionActionType.TIME_BASED_EXIT);
        assertThat(third.daysHeld()).isEqualTo(3);
        assertThat(third.realizedPnl()).isCloseTo(0.005, within(1e-12));
        assertThat(third.status()).isEqualTo(PositionState.CLOSED);
    }

    @Test
    void update_rescalesStopOnLargeVixMove() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));

        PositionUpdateResult adjusted = lifecycle.update("XYZ", 101.0, 99.0, 100.0, MarketSnapshot.of(38.0));
        PositionUpdateResult nextDay = lifecycle.update("XYZ", 101.0, 99.0, 100.0, MarketSnapshot.of(38.0));

        assertThat(adjusted.actions()).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(PositionActionType.REGIME_ADJUSTMENT);
            assertThat(action.price()).isCloseTo(87.2, within(1e-9));
            assertThat(action.positionClosedPct()).isZero();
        });
        assertThat(lifecycle.position("XYZ").orElseThrow().stopLevel()).isCloseTo(87.2, within(1e-9));
        assertThat(nextDay.actions()).isEmpty();
        assertThat(lifecycle.transitionLog()).hasSize(1);
    }

    @Test
    void update_emergencyShortensHoldAndExitsNextDay() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0, 40.0, 1.5));

        PositionUpdateResult adjusted = lifecycle.update("XYZ", 101.0, 97.0, 98.0, MarketSnapshot.of(36.0, 40.0, 0.05));

        assertThat(adjusted.actions()).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(PositionActionType.REGIME_ADJUSTMENT);
            assertThat(action.price()).isCloseTo(96.0, within(1e-9));
            assertThat(action.reason()).startsWith("EMERGENCY");
        });
        assertThat(adjusted.status()).isEqualTo(PositionState.ACTIVE);
        assertThat(lifecycle.position("XYZ").orElseThrow().maxHoldDays()).isEqualTo(1);

        PositionUpdateResult exit = lifecycle.update("XYZ", 99.0, 97.0, 98.0, MarketSnapshot.of(36.0, 40.0, 0.05));

        assertThat(exit.actions()).extracting(PositionAction::type).containsExactly(PositionActionType.TIME_BASED_EXIT);
        assertThat(exit.realizedPnl()).isCloseTo(-0.02, within(1e-12));
    }

    @Test
    void update_rejectsInvalidBarWithoutMutation() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));

        assertThatThrownBy(() -> lifecycle.update("XYZ", 99.0, 101.0, 100.0, MarketSnapshot.of(18.0)))
                .isInstanceOf(InvalidInputException.class);

        assertThat(lifecycle.position("XYZ").orElseThrow().daysHeld()).isZero();
    }

    @Test
    void update_unknownSymbolIsRejected() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());

        assertThatThrownBy(() -> lifecycle.update("NONE", 101.0, 99.0, 100.0, MarketSnapshot.of(18.0)))
                .isInstanceOf(PositionNotFoundException.class);
    }

    @Test
    void update_ignoresDisabledStopAndUsesFixedHorizon() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.baseline(2));
        PositionOpenResult opened = lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));

        PositionUpdateResult first = lifecycle.update("XYZ", 100.0, 85.0, 88.0, MarketSnapshot.of(40.0));
        PositionUpdateResult second = lifecycle.update("XYZ", 120.0, 86.0, 90.0, MarketSnapshot.of(40.0));

        assertThat(opened.expectedHoldDays()).isEqualTo(2);
        assertThat(first.actions()).isEmpty();
        assertThat(second.actions()).extracting(PositionAction::type).containsExactly(PositionActionType.TIME_BASED_EXIT);
        assertThat(second.realizedPnl()).isCloseTo(-0.10, within(1e-12));
    }

    @Test
    void close_exitsRemainderAtGivenPrice() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0));
        lifecycle.update("XYZ", 113.0, 101.0, 112.0, MarketSnapshot.of(18.0));

        PositionUpdateResult result = lifecycle.close("XYZ", 105.0, null);

        assertThat(result.actions()).singleElement().satisfies(action -> {
            assertThat(action.type()).isEqualTo(PositionActionType.MANUAL_CLOSE);
            assertThat(action.positionClosedPct()).isEqualTo(75.0);
        });
        assertThat(result.realizedPnl()).isCloseTo(0.03 + 0.0375, within(1e-12));
        assertThat(result.status()).isEqualTo(PositionState.CLOSED);
        assertThat(lifecycle.tradeHistory().get(0).exitPrice()).isEqualTo(105.0);
    }

    @Test
    void activePositions_areSortedBySymbol() {
        PositionLifecycle lifecycle = lifecycle(LifecycleRules.full());
        lifecycle.open("MSFT", 100.0, MarketSnapshot.of(18.0));
        lifecycle.open("AAPL", 100.0, MarketSnapshot.of(18.0));

        assertThat(lifecycle.activePositions()).extracting(PositionView::symbol).containsExactly("AAPL", "MSFT");
        assertThat(lifecycle.position("GOOG")).isEmpty();
    }

    private void holdThroughQuietBars(PositionLifecycle lifecycle) {
        lifecycle.open("XYZ", 100.0, MarketSnapshot.of(18.0), null, 0.5);
        for (int day = 0; day < 3; day++) {
            lifecycle.update("XYZ", 100.25, 99.75, 100.0, MarketSnapshot.of(18.0));
        }
        assertThat(lifecycle.position("XYZ")).isEmpty();
    }

    private PositionLifecycle lifecycle(LifecycleRules rules) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        return new PositionLifecycle(
                new RegimeTransitionManager(new RegimeClassifier(), clock),
                RegimeRuleBook.defaults(),
                new AdaptiveStopEngine(),
                new ProfitLadderEngine(),
                new PositionInputValidator(),
                LifecycleSettings.defaults(),
                rules,
                clock
        );
    }
}
