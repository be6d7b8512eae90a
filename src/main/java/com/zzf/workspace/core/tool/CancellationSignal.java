package com.zzf.workspace.core.tool;

import com.zzf.workspace.core.workspace.error.OperationCancelledException;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Liveness flag shared by the caller and the running tool. Once cancelled it stays
 * cancelled.
 */
public final class CancellationSignal {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationSignal active() {
        return new CancellationSignal();
    }

    public void cancel(String why) {
        reason.compareAndSet(null, why == null || why.isBlank() ? "Operation has been cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public void throwIfCancelled() {
        String why = reason.get();
        if (why != null) {
            throw new OperationCancelledException(why);
        }
    }
}
