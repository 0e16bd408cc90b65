// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util.condition;

import xmlbuilder.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;

/**
 * A named point that handlers can transfer control to.
 * <p>
 * Only {@link ConditionContext#withRestart(String, RestartCallback)} creates restarts, and a restart is usable only
 * while the callback it was passed to is running.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        this.name = name;
    }

    /**
     * Retrieves the user-readable name of this restart point.
     */
    public @NotNull String name() {
        return name;
    }

    /**
     * Abandons everything between the caller and this restart point, making its
     * {@link ConditionContext#withRestart(String, RestartCallback) withRestart} return {@code null}. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    @Override
    public String toString() {
        return "Restart[" + name + "]";
    }

    private final @NotNull String name;
}
