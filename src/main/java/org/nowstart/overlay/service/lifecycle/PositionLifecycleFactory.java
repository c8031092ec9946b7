package org.nowstart.overlay.service.lifecycle;

import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.property.RiskOverlayProperties;
import org.nowstart.overlay.service.regime.RegimeClassifier;
import org.nowstart.overlay.service.regime.RegimeTransitionManager;
import org.nowstart.overlay.service.rule.AdaptiveStopEngine;
import org.nowstart.overlay.service.rule.ProfitLadderEngine;
import org.springframework.stereotype.Component;

/**
 * Creates independent lifecycles: one for live positions and one per backtest pass.
 */
@Component
@RequiredArgsConstructor
public class PositionLifecycleFactory {

    private final RegimeClassifier regimeClassifier;
    private final RegimeRuleBook regimeRuleBook;
    private final AdaptiveStopEngine adaptiveStopEngine;
    private final ProfitLadderEngine profitLadderEngine;
    private final PositionInputValidator positionInputValidator;
    private final RiskOverlayProperties riskOverlayProperties;
    private final Clock clock;

    public PositionLifecycle create(LifecycleRules rules) {
        return create(rules, regimeClassifier, regimeRuleBook);
    }

    public PositionLifecycle create(LifecycleRules rules, RegimeClassifier classifier, RegimeRuleBook ruleBook) {
        return new PositionLifecycle(
                new RegimeTransitionManager(classifier, clock),
                ruleBook,
                adaptiveStopEngine,
                profitLadderEngine,
                positionInputValidator,
                LifecycleSettings.from(riskOverlayProperties),
                rules,
                clock
        );
    }

    public RegimeClassifier regimeClassifier() {
        return regimeClassifier;
    }

    public RegimeRuleBook regimeRuleBook() {
        return regimeRuleBook;
    }
}
