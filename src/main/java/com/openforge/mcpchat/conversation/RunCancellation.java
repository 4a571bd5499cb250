package com.openforge.mcpchat.conversation;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token for one run.
 *
 * Components holding something that blocks (the open completion stream, an
 * in-flight tool call) register a hook; {@link #cancel()} flips the flag and
 * fires every hook once, from the cancelling thread. A hook registered after
 * cancellation fires immediately.
 */
@Slf4j
public final class RunCancellation {

    private final AtomicBoolean  cancelled = new AtomicBoolean();
    private final List<Runnable> hooks     = new CopyOnWriteArrayList<>();

    public static RunCancellation none() {
        return new RunCancellation();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new RunCancelledException("Run cancelled");
        }
    }

    /** Returns true if this call performed the cancellation. */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) return false;
        for (Runnable hook : hooks) {
            runHook(hook);
        }
        hooks.clear();
        return true;
    }

    /** Registers a hook for the duration of a try-with-resources block. */
    public Registration onCancel(Runnable hook) {
        hooks.add(hook);
        if (cancelled.get() && hooks.remove(hook)) {
            runHook(hook);
        }
        return () -> hooks.remove(hook);
    }

    private static void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            log.warn("[Cancellation] Cancel hook failed: {}", e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
