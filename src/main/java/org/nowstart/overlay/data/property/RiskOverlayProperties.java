package org.nowstart.overlay.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.nowstart.overlay.data.model.RegimeBands;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "overlay.risk")
public record RiskOverlayProperties(
        // 포지션 크기 미지정 시 기본값(%)
        @DecimalMin(value = "0", inclusive = false) @DecimalMax("100") @DefaultValue("100") double defaultPositionSizePct,
        // True Range 미지정 시 진입가 대비 기본 비율(0.02 = 2%)
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.02") double defaultTrueRangeFraction,
        // 변동성 계수 계산용 True Range 이동 구간 길이
        @Positive @DefaultValue("5") int trueRangeWindow,
        // 보유 중 레짐 재평가를 트리거하는 VIX 변화폭
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("15") double regimeCheckVixDelta,
        // 레짐 VIX 밴드 경계(저변동/강세/고변동 상한)
        @NotNull @Size(min = 3, max = 3) @DefaultValue({"15", "30", "50"}) List<Double> vixBands
) {

    public RegimeBands regimeBands() {
        return new RegimeBands(vixBands.get(0), vixBands.get(1), vixBands.get(2));
    }
}
