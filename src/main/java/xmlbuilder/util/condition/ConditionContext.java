// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util.condition;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import xmlbuilder.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of condition handlers and restart points.
 * <p>
 * Instances are never exposed; the static methods operate on the calling thread's context, so handlers and restarts
 * established on one thread are invisible to every other.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Signals a non-fatal condition.
     * <p>
     * Handlers run from the newest to the oldest until one of them transfers control elsewhere. If all of them return
     * normally, so does this method.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().offer(new SignaledCondition(condition, false));
    }

    /**
     * Signals a fatal condition.
     * <p>
     * Behaves like {@link #signal(Condition)}, except that when every handler returns normally an
     * {@link UnhandledErrorError} is thrown. Never returns normally; the return type lets call sites write
     * {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().offer(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs {@code callback} with a restart point named {@code restartName} around it.
     *
     * @return The value returned by {@code callback}, or {@code null} if a handler unwound to this restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var context = localContext();
        final var restart = new Restart(restartName);
        context.restarts.push(restart);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            final var popped = context.restarts.pop();
            assert popped == restart : "Restart stack corrupt";
        }
    }

    /**
     * Returns a snapshot of the calling thread's active restart points, newest first.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        return List.copyOf(localContext().restarts);
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    void register(final @NotNull Handler handler) {
        handlers.push(handler);
    }

    void unregister(final @NotNull Handler handler) {
        assert handlers.peek() == handler : "Handlers closed out of order";
        handlers.pop();
    }

    private void offer(final @NotNull SignaledCondition condition) {
        final var snapshot = handlers.toArray(new Handler[0]);
        // Signaling from inside a handler only reaches the handlers older than it, so nothing sees its own signal.
        final var start = (runningHandler == null) ? 0 : Arrays.asList(snapshot).indexOf(runningHandler) + 1;
        for (int i = start; i < snapshot.length; i += 1) {
            final var previous = runningHandler;
            runningHandler = snapshot[i];
            try {
                snapshot[i].handle(condition);
            } finally {
                runningHandler = previous;
            }
        }
    }

    // Both stacks keep the newest entry first.
    private final ArrayDeque<@NotNull Handler> handlers = new ArrayDeque<>();
    private final ArrayDeque<@NotNull Restart> restarts = new ArrayDeque<>();
    private @Nullable Handler runningHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);
}
