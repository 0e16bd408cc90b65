// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when control flow reaches a branch that the type structure rules out, such as an unknown implementation of
 * a sealed interface or a checked exception from an in-memory sink.
 * <p>
 * It's a bug in this library whenever one escapes, hence the {@link AssertionError} superclass.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }

    public UnreachableCodeReachedError(final @NotNull String message, final @NotNull Throwable cause) {
        super(message, cause);
    }
}
