// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util.condition;

import xmlbuilder.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;

/**
 * A registered condition handler, established with try-with-resources.
 * <p>
 * A handler sees every condition signaled on its thread while it is open, unless a newer handler transfers control
 * first. Handlers must be closed in reverse order of creation.
 */
public final class Handler implements AutoCloseable {
    /**
     * Registers {@code procedure} with the calling thread's condition context until this handler is closed.
     */
    public Handler(final @NotNull HandlerProcedure procedure) {
        this.procedure = procedure;
        ConditionContext.localContext().register(this);
    }

    /**
     * Does nothing. Exists so that try-with-resources blocks don't trigger unused-resource warnings.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters this handler. Called by try-with-resources, never manually.
     */
    @Override
    public void close() {
        ConditionContext.localContext().unregister(this);
    }

    void handle(final @NotNull SignaledCondition condition) {
        try {
            procedure.handle(condition);
        } catch (final Unwind unwind) {
            // Unwind is checked only so that procedures can declare it; let it travel to its restart.
            throw SneakyThrow.doThrow(unwind);
        }
    }

    private final @NotNull HandlerProcedure procedure;
}
