package org.nowstart.overlay.data.type;

public enum PositionActionType {
    STOP_LOSS_EXECUTED,
    PROFIT_TAKING,
    REGIME_ADJUSTMENT,
    TIME_BASED_EXIT,
    MANUAL_CLOSE,
    END_OF_DATA_EXIT
}
