// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.dom;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import xmlbuilder.util.Trace;
import xmlbuilder.util.UnreachableCodeReachedError;

/**
 * The element-tree-to-XML serializer.
 * <p>
 * Output is one tag per line, each nesting level indented by one tab, preceded by a fixed XML declaration. Stored
 * attribute values and text are already escaped, so they are written verbatim.
 */
public final class Serializer {
    private Serializer(final Writer writer) {
        this.writer = writer;
    }

    /**
     * Serializes the document rooted at {@code root} to {@code writer}.
     * <p>
     * Any {@link IOException} thrown by the writer is allowed to propagate; what was written until then stays written.
     */
    public static void serialize(final Writer writer, final Element root) throws IOException {
        try (final var trace = new Trace(() -> "Serializing XML document with root element <" + root.name() + ">")) {
            trace.use();
            final var serializer = new Serializer(writer);
            writer.write(xmlDeclaration);
            writer.write(lineTerminator);
            serializer.serializeElement(root, 0);
        }
    }

    private void serializeElement(final Element element, final int depth) throws IOException {
        final var content = element.content();
        writeIndentation(depth);
        writeStartTag(element);
        if (content instanceof Content.Empty) {
            writer.write(" />");
            writer.write(lineTerminator);
        } else if (content instanceof final Content.Children children) {
            writer.write('>');
            writer.write(lineTerminator);
            for (final var child : children.elements()) {
                serializeElement(child, depth + 1);
            }
            writeIndentation(depth);
            writeEndTag(element);
        } else if (content instanceof final Content.Text text) {
            writer.write('>');
            writer.write(text.escapedText());
            writeEndTag(element);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private void writeStartTag(final Element element) throws IOException {
        writer.write('<');
        writer.write(element.name());
        serializeAttributes(element.attributes());
    }

    private void writeEndTag(final Element element) throws IOException {
        writer.write("</");
        writer.write(element.name());
        writer.write('>');
        writer.write(lineTerminator);
    }

    private void serializeAttributes(final Map<String, String> attributes) throws IOException {
        for (final var attribute : attributes.entrySet()) {
            writer.write(' ');
            writer.write(attribute.getKey());
            writer.write("=\"");
            writer.write(attribute.getValue());
            writer.write('"');
        }
    }

    private void writeIndentation(final int depth) throws IOException {
        for (int i = 0; i < depth; i += 1) {
            writer.write(indentation);
        }
    }

    private final Writer writer;

    private static final String xmlDeclaration = "<?xml version = \"1.0\" encoding = \"UTF-8\"?>";
    private static final char indentation = '\t';
    private static final char lineTerminator = '\n';
}
