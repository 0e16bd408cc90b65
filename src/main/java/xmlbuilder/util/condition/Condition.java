// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that code further up the call stack may want to react to. Handlers run at the
 * point of signaling, while the signaling frame is still live, so they can inspect its state, including any
 * {@link xmlbuilder.util.Trace traces}, before deciding whether to unwind.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the one-line user-readable message.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves the full user-readable description. Subclasses with more to say override this.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
