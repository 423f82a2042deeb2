package com.conversionlog.sdk.monitoring;

import com.conversionlog.sdk.model.Alert;

import java.util.List;

/**
 * Persists the alert state of an {@link AlertService} so it survives a restart.
 */
public interface AlertRepository {

    /**
     * @return the last saved state, or an empty snapshot when nothing was saved
     */
    Snapshot load();

    void save(Snapshot snapshot);

    /**
     * Active alerts plus the full history, both oldest first
     */
    record Snapshot(List<Alert> active, List<Alert> history) {

        public Snapshot {
            active = active != null ? List.copyOf(active) : List.of();
            history = history != null ? List.copyOf(history) : List.of();
        }

        public static Snapshot empty() {
            return new Snapshot(List.of(), List.of());
        }
    }
}
