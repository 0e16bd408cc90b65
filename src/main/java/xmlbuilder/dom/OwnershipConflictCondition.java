// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.dom;

import xmlbuilder.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * A fatal condition signaled when adding a child would break the strict tree shape: the child already belongs to a
 * parent, or the parent is the child itself or one of its descendants.
 */
public final class OwnershipConflictCondition extends Condition {
    OwnershipConflictCondition(
        final @NotNull String parentName,
        final @NotNull String childName,
        final @NotNull Reason reason
    ) {
        super("Cannot add element '" + childName + "' as a child of '" + parentName + "': " + reason);
        this.reason = reason;
    }

    /**
     * Retrieves why the child was rejected.
     */
    public @NotNull Reason reason() {
        return reason;
    }

    private final @NotNull Reason reason;

    /**
     * The ways a child can violate tree ownership.
     */
    public enum Reason {
        ALREADY_ATTACHED("it already has a parent, add a copy instead"),
        SELF("an element cannot contain itself"),
        CYCLE("the parent is a descendant of the child");

        Reason(final String readableName) {
            this.readableName = readableName;
        }

        @Override
        public String toString() {
            return readableName;
        }

        private final String readableName;
    }
}
