package org.nowstart.overlay.service.regime;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.overlay.data.model.TransitionLogEntry;

/**
 * Append-only history of detected transitions. One instance per orchestrator.
 */
public class RegimeTransitionLog {

    private final List<TransitionLogEntry> entries = new ArrayList<>();

    public synchronized void append(TransitionLogEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry is required");
        }
        entries.add(entry);
    }

    public synchronized List<TransitionLogEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
