// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util;

import org.jetbrains.annotations.NotNull;

/**
 * Lets a checked throwable travel through code that doesn't declare it.
 * <p>
 * The only legitimate user is the restart mechanism, whose {@link xmlbuilder.util.condition.Unwind} must pass
 * through arbitrary caller frames, including serializer and element code, without every signature declaring it.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} without the compiler knowing it's checked.
     * <p>
     * Never returns; the {@link UnreachableCodeReachedError} return type lets call sites write {@code throw} in front
     * of the call.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    // Erasure turns the cast into a no-op, so the JVM rethrows the original object unchanged.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
