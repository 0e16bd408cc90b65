// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Carries control flow from {@link Restart#unwindTo()} to the matching
 * {@link ConditionContext#withRestart(String, RestartCallback)} frame.
 * <p>
 * Neither an {@link Exception} nor an {@link Error}: it is not a failure, and must not be caught by code that merely
 * wants to handle failures. Don't catch or throw it manually.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to restart point " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
