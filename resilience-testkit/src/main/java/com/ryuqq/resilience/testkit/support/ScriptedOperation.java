package com.ryuqq.resilience.testkit.support;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Call-counting {@link Callable} that follows a fixed script of results.
 *
 * <p>Each call consumes the next step; once the script is used up the last step repeats.
 * An optional hook runs at the start of every call (e.g. to advance a {@link ManualTimeSource}).</p>
 *
 * <pre>
 * ScriptedOperation&lt;String&gt; op = ScriptedOperation.&lt;String&gt;create()
 *     .thenFail(new IOException("reset"))
 *     .thenFail(new IOException("reset"))
 *     .thenReturn("ok");
 *
 * manager.executeWithResilience(op, "svc.call", config, CancellationToken.none());
 * assertEquals(3, op.calls());
 * </pre>
 *
 * @param <T> result type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedOperation<T> implements Callable<T> {

    private final List<Step<T>> steps = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Runnable onCall = () -> { };

    public static <T> ScriptedOperation<T> create() {
        return new ScriptedOperation<>();
    }

    /**
     * Operation that always throws the given error.
     */
    public static <T> ScriptedOperation<T> alwaysFailing(Throwable error) {
        return ScriptedOperation.<T>create().thenFail(error);
    }

    /**
     * Operation that always returns the given value.
     */
    public static <T> ScriptedOperation<T> alwaysReturning(T value) {
        return ScriptedOperation.<T>create().thenReturn(value);
    }

    public synchronized ScriptedOperation<T> thenFail(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        steps.add(new Step<>(null, error));
        return this;
    }

    public synchronized ScriptedOperation<T> thenReturn(T value) {
        steps.add(new Step<>(value, null));
        return this;
    }

    public ScriptedOperation<T> onCall(Runnable onCall) {
        if (onCall == null) {
            throw new IllegalArgumentException("onCall cannot be null");
        }
        this.onCall = onCall;
        return this;
    }

    @Override
    public T call() throws Exception {
        int index = calls.getAndIncrement();
        onCall.run();
        Step<T> step = stepAt(index);
        if (step.error() == null) {
            return step.value();
        }
        if (step.error() instanceof Exception exception) {
            throw exception;
        }
        if (step.error() instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Unsupported throwable: " + step.error());
    }

    /**
     * Number of times the operation has been invoked.
     *
     * @return call count
     */
    public int calls() {
        return calls.get();
    }

    private synchronized Step<T> stepAt(int index) {
        if (steps.isEmpty()) {
            throw new IllegalStateException("ScriptedOperation has no steps");
        }
        return steps.get(Math.min(index, steps.size() - 1));
    }

    private record Step<T>(T value, Throwable error) {
    }
}
