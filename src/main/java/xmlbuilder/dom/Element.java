// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.dom;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import xmlbuilder.util.UnreachableCodeReachedError;
import xmlbuilder.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An XML element: a tag name, attributes in insertion order, and {@link Content content}.
 * <p>
 * Elements are built by the caller and only ever grow: attributes can be added or overwritten, and the content goes
 * from {@linkplain Content.Empty empty} to either {@linkplain Content.Children child elements} or
 * {@linkplain Content.Text text}, never both. Attribute values and text are escaped as they are added.
 * <p>
 * Each element belongs to at most one parent. Breaking any of these rules is a programming error, reported by
 * signaling a fatal {@link ContentConflictCondition} or {@link OwnershipConflictCondition} through
 * {@link ConditionContext#error(xmlbuilder.util.condition.Condition)}; the element is never left half-changed.
 * <p>
 * Elements are not thread-safe, but serialization doesn't modify them, so a finished tree can be written from several
 * threads at once.
 */
public final class Element {
    /**
     * Creates an empty element with the given tag name and no attributes.
     * <p>
     * The name is not checked against XML naming rules; only unpaired surrogates are replaced by U+FFFD.
     */
    public Element(final String name) {
        this.name = Escaping.withPairedSurrogates(Objects.requireNonNull(name, "name"));
    }

    /**
     * Retrieves the tag name.
     */
    public String name() {
        return name;
    }

    /**
     * Returns a read-only view of the attributes, mapping names to escaped values in first-insertion order.
     */
    public Map<String, String> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Retrieves the current content.
     */
    public Content content() {
        return content;
    }

    /**
     * Sets the attribute {@code name} to the escaped string form of {@code value}.
     * <p>
     * Setting an attribute that already exists replaces its value but keeps its original position.
     */
    public void addAttribute(final String name, final Object value) {
        attributes.put(
            Escaping.withPairedSurrogates(Objects.requireNonNull(name, "name")),
            Escaping.escape(value.toString())
        );
    }

    /**
     * Appends {@code child} after the previously added children.
     * <p>
     * Signals a fatal {@link ContentConflictCondition} if this element has text, and a fatal
     * {@link OwnershipConflictCondition} if {@code child} already has a parent or this element is {@code child} or
     * one of its descendants.
     */
    public void addChild(final Element child) {
        if (content instanceof Content.Text) {
            throw ConditionContext.error(
                new ContentConflictCondition(name, content, "a child element <" + child.name + ">"));
        }
        checkOwnership(child);
        if (content instanceof final Content.Children children) {
            children.append(child);
        } else {
            content = new Content.Children(child);
        }
        child.attached = true;
    }

    /**
     * Sets the text of this element to the escaped string form of {@code text}.
     * <p>
     * Only an {@linkplain Content.Empty empty} element accepts text; otherwise a fatal
     * {@link ContentConflictCondition} is signaled.
     */
    public void addText(final Object text) {
        if (!(content instanceof Content.Empty)) {
            throw ConditionContext.error(new ContentConflictCondition(name, content, "text"));
        }
        content = new Content.Text(Escaping.escape(text.toString()));
    }

    /**
     * Writes a UTF-8 XML document with this element as the root element.
     * <p>
     * Output is buffered and flushed before returning; the stream is not closed. Any {@link IOException} thrown by the
     * stream aborts the write and propagates, possibly leaving a truncated document behind.
     */
    @SuppressFBWarnings(value = "OS_OPEN_STREAM", justification = "The stream belongs to the caller")
    public void write(final OutputStream stream) throws IOException {
        final var writer = new BufferedWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
        Serializer.serialize(writer, this);
        writer.flush();
    }

    /**
     * Writes an XML document with this element as the root element to {@code writer}.
     * <p>
     * The writer is neither flushed nor closed. Any {@link IOException} it throws propagates.
     */
    public void write(final Writer writer) throws IOException {
        Serializer.serialize(writer, this);
    }

    /**
     * Returns a deep copy of this element that has no parent, so it can be added to another tree.
     */
    @CheckReturnValue
    public Element copy() {
        final var result = new Element(name);
        result.attributes.putAll(attributes);
        if (content instanceof final Content.Children children) {
            for (final var child : children.elements()) {
                result.addChild(child.copy());
            }
        } else {
            // Empty and Text are immutable.
            result.content = content;
        }
        return result;
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof final Element element
            && name.equals(element.name)
            && attributes.equals(element.attributes)
            && content.equals(element.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes, content);
    }

    /**
     * Returns the whole document, XML declaration included, exactly as {@link #write(OutputStream)} would encode it.
     */
    @Override
    public String toString() {
        final var writer = new StringWriter();
        try {
            Serializer.serialize(writer, this);
        } catch (final IOException e) {
            throw new UnreachableCodeReachedError("StringWriter reported an I/O error", e);
        }
        return writer.toString();
    }

    private void checkOwnership(final Element child) {
        if (child == this) {
            throw ConditionContext.error(
                new OwnershipConflictCondition(name, child.name, OwnershipConflictCondition.Reason.SELF));
        }
        if (child.attached) {
            throw ConditionContext.error(
                new OwnershipConflictCondition(name, child.name, OwnershipConflictCondition.Reason.ALREADY_ATTACHED));
        }
        // A detached element can only be reached from the child if it is the child, handled above.
        if (attached && isDescendantOf(child)) {
            throw ConditionContext.error(
                new OwnershipConflictCondition(name, child.name, OwnershipConflictCondition.Reason.CYCLE));
        }
    }

    private boolean isDescendantOf(final Element ancestor) {
        final var pending = new ArrayDeque<Element>();
        pending.push(ancestor);
        while (!pending.isEmpty()) {
            final var element = pending.pop();
            if (element.content instanceof final Content.Children children) {
                for (final var child : children.elements()) {
                    if (child == this) {
                        return true;
                    }
                    pending.push(child);
                }
            }
        }
        return false;
    }

    private final String name;
    private final LinkedHashMap<String, String> attributes = new LinkedHashMap<>();
    private Content content = Content.empty();
    private boolean attached = false;
}
