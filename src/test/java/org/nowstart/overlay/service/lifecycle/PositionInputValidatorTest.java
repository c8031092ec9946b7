package org.nowstart.overlay.service.lifecycle;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.nowstart.overlay.data.exception.InvalidInputException;
import org.nowstart.overlay.data.model.MarketSnapshot;

class PositionInputValidatorTest {

    private final PositionInputValidator validator = new PositionInputValidator();

    @Test
    void validateOpen_acceptsMinimalInput() {
        assertThatCode(() -> validator.validateOpen("XYZ", 10.0, MarketSnapshot.of(18.0), null, null))
                .doesNotThrowAnyException();
    }

    @Test
    void validateOpen_acceptsVixOutsideRealisticRange() {
        assertThatCode(() -> validator.validateOpen("XYZ", 10.0, MarketSnapshot.of(150.0), 50.0, 0.0))
                .doesNotThrowAnyException();
    }

    @Test
    void validateOpen_rejectsBlankSymbol() {
        assertThatThrownBy(() -> validator.validateOpen(" ", 10.0, MarketSnapshot.of(18.0), null, null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("symbol is required");
    }

    @Test
    void validateOpen_rejectsNonFiniteEntryPrice() {
        assertThatThrownBy(() -> validator.validateOpen("XYZ", Double.NaN, MarketSnapshot.of(18.0), null, null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("entryPrice");
    }

    @Test
    void validateOpen_rejectsPositionSizeAboveFullPosition() {
        assertThatThrownBy(() -> validator.validateOpen("XYZ", 10.0, MarketSnapshot.of(18.0), 120.0, null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("positionSizePct");
    }

    @Test
    void validateOpen_rejectsNegativeTrueRange() {
        assertThatThrownBy(() -> validator.validateOpen("XYZ", 10.0, MarketSnapshot.of(18.0), null, -1.0))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("trueRange");
    }

    @Test
    void validateSnapshot_rejectsMissingOrBrokenFields() {
        assertThatThrownBy(() -> validator.validateSnapshot(null))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> validator.validateSnapshot(MarketSnapshot.of(-1.0)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("vix");
        assertThatThrownBy(() -> validator.validateSnapshot(MarketSnapshot.of(18.0, -5.0, null)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("t2108");
        assertThatThrownBy(() -> validator.validateSnapshot(MarketSnapshot.of(18.0, null, 0.0)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("momentumRatio");
    }

    @Test
    void validateBar_rejectsHighBelowLow() {
        assertThatThrownBy(() -> validator.validateBar(9.0, 10.0, 9.5))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("high must be >= low");
        assertThatCode(() -> validator.validateBar(10.0, 10.0, 10.0)).doesNotThrowAnyException();
    }
}
