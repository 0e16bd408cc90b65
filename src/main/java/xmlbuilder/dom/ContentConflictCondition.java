// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.dom;

import xmlbuilder.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * A fatal condition signaled when a change would give an element both text and child elements, or text twice.
 * <p>
 * The element is left exactly as it was before the offending call.
 */
public final class ContentConflictCondition extends Condition {
    ContentConflictCondition(
        final @NotNull String elementName,
        final @NotNull Content existingContent,
        final @NotNull String attemptedAddition
    ) {
        super("Attempted adding " + attemptedAddition + " to element '" + elementName + "' that already has "
            + existingContent.kind());
        this.elementName = elementName;
        this.existingContent = existingContent;
        this.attemptedAddition = attemptedAddition;
    }

    /**
     * Retrieves the name of the element that rejected the change.
     */
    public @NotNull String elementName() {
        return elementName;
    }

    /**
     * Retrieves the content the element had, and still has.
     */
    public @NotNull Content existingContent() {
        return existingContent;
    }

    @Override
    public @NotNull String detailedMessage() {
        return message()
            + "\n - Element: <" + elementName + ">"
            + "\n - Existing content: " + existingContent.kind()
            + "\n - Attempted addition: " + attemptedAddition
            + "\n   An element holds either child elements or text, and text can be set only once.";
    }

    private final @NotNull String elementName;
    private final @NotNull Content existingContent;
    private final @NotNull String attemptedAddition;
}
