// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The body of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Reacts to the given condition.
     * <p>
     * Returning normally declines the condition and lets older handlers see it. Handling it means transferring control
     * elsewhere, usually with {@link Restart#unwindTo()}.
     */
    void handle(@NotNull SignaledCondition condition) throws Unwind;
}
