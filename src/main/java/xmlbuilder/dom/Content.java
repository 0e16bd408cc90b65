// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What an {@link Element} holds between its tags: nothing, child elements, or text, never a mix.
 * <p>
 * An element starts out {@link Empty} and may move to {@link Children} or {@link Text} exactly once. Instances are
 * owned by their element; the views they hand out are read-only.
 */
public sealed interface Content permits Content.Empty, Content.Children, Content.Text {
    /**
     * Returns the content of an element with no children and no text, serialized as a self-closing tag.
     */
    static Empty empty() {
        return Empty.instance;
    }

    /**
     * Returns a short name of this kind of content, for diagnostics.
     */
    String kind();

    /**
     * No children and no text.
     */
    final class Empty implements Content {
        private Empty() {
        }

        @Override
        public String kind() {
            return "empty";
        }

        @Override
        public String toString() {
            return "Empty";
        }

        private static final Empty instance = new Empty();
    }

    /**
     * A non-empty sequence of child elements, in insertion order.
     */
    final class Children implements Content {
        Children(final Element first) {
            elements.add(first);
        }

        /**
         * Returns a read-only view of the child elements.
         */
        public List<Element> elements() {
            return Collections.unmodifiableList(elements);
        }

        @Override
        public String kind() {
            return "child elements";
        }

        void append(final Element child) {
            elements.add(child);
        }

        @Override
        public boolean equals(final @Nullable Object other) {
            return other instanceof final Children children && elements.equals(children.elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode();
        }

        @Override
        public String toString() {
            return "Children(" + elements.size() + ")";
        }

        private final ArrayList<Element> elements = new ArrayList<>();
    }

    /**
     * A text payload, stored escaped.
     *
     * @param escapedText The text with XML reserved characters already replaced by entity references.
     */
    record Text(String escapedText) implements Content {
        @Override
        public String kind() {
            return "text";
        }
    }
}
