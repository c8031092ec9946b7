package org.nowstart.overlay.config;

import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.overlay.data.model.RegimeRuleBook;
import org.nowstart.overlay.data.property.RegimeRuleProperties;
import org.nowstart.overlay.data.property.RiskOverlayProperties;
import org.nowstart.overlay.service.regime.RegimeClassifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RiskOverlayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegimeRuleBook regimeRuleBook(RegimeRuleProperties regimeRuleProperties) {
        RegimeRuleBook ruleBook = regimeRuleProperties.toRuleBook();
        ruleBook.asMap().forEach((regime, config) -> log.info(
                "Regime rules loaded. regime={}, stopLossPct={}, profitLevelsPct={}, scalingPct={}, maxHoldDays={}",
                regime.code(),
                config.stopLossPct(),
                config.profitLevelsPct(),
                config.positionScalingPct(),
                config.maxHoldDays()
        ));
        return ruleBook;
    }

    @Bean
    public RegimeClassifier regimeClassifier(RiskOverlayProperties riskOverlayProperties) {
        RegimeClassifier classifier = new RegimeClassifier(riskOverlayProperties.regimeBands());
        log.info(
                "Regime bands loaded. lowVolUpper={}, bullNormalUpper={}, highVolUpper={}",
                classifier.bands().lowVolUpper(),
                classifier.bands().bullNormalUpper(),
                classifier.bands().highVolUpper()
        );
        return classifier;
    }
}
