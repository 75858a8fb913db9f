package com.scriptohio.orchestrator.service;

import lombok.Getter;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class ExecutionControl {

    @Getter
    private final String requestId;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Runnable> cancellers = ConcurrentHashMap.newKeySet();

    public ExecutionControl(String requestId) {
        this.requestId = requestId;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    AtomicBoolean flag() {
        return cancelled;
    }

    // runs immediately when already cancelled
    void onCancel(Runnable canceller) {
        cancellers.add(canceller);
        if (cancelled.get() && cancellers.remove(canceller)) {
            canceller.run();
        }
    }

    void forget(Runnable canceller) {
        cancellers.remove(canceller);
    }

    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable canceller : cancellers) {
            if (cancellers.remove(canceller)) {
                canceller.run();
            }
        }
        return true;
    }
}
