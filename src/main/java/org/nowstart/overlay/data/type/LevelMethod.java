package org.nowstart.overlay.data.type;

import java.util.Locale;

public enum LevelMethod {
    PCT_BASED,
    TR_BASED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
