package org.nowstart.overlay.data.type;

public enum PositionState {
    OPEN,
    ACTIVE,
    CLOSED
}
