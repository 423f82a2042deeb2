package com.conversionlog.sdk.monitoring;

import java.util.concurrent.atomic.AtomicReference;

public class InMemoryAlertRepository implements AlertRepository {

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.empty());

    @Override
    public Snapshot load() {
        return current.get();
    }

    @Override
    public void save(Snapshot snapshot) {
        current.set(snapshot != null ? snapshot : Snapshot.empty());
    }
}
