// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import xmlbuilder.dom.Element;
import xmlbuilder.dom.Serializer;
import xmlbuilder.util.Trace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class SerializerTest {
    @Test
    void writesReferenceDocument() throws IOException {
        final var root = buildReferenceTree();
        assertThat(root.toString()).isEqualTo(referenceDocument);

        final var stream = new ByteArrayOutputStream();
        root.write(stream);
        assertThat(stream.toByteArray()).isEqualTo(referenceDocument.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void writesUsageExample() {
        final var person = new Element("person");
        person.addAttribute("id", "232");
        final var name = new Element("name");
        name.addText("Joe Schmoe");
        person.addChild(name);
        final var age = new Element("age");
        age.addText(24);
        person.addChild(age);
        person.addChild(new Element("hobbies"));

        assertThat(person).asString().isEqualTo("""
            <?xml version = "1.0" encoding = "UTF-8"?>
            <person id="232">
            \t<name>Joe Schmoe</name>
            \t<age>24</age>
            \t<hobbies />
            </person>
            """);
    }

    @Test
    void emptyElementsSelfClose() {
        final var bare = new Element("empty");
        assertThat(bare).asString().endsWith("?>\n<empty />\n");

        final var withAttribute = new Element("name");
        withAttribute.addAttribute("attr", "v");
        assertThat(withAttribute).asString().endsWith("?>\n<name attr=\"v\" />\n");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 5, 16})
    void indentsOneTabPerLevel(final int depth) {
        final var root = new Element("level0");
        var parent = root;
        for (int i = 1; i <= depth; i += 1) {
            final var child = new Element("level" + i);
            parent.addChild(child);
            parent = child;
        }
        parent.addText("leaf");

        final var lines = root.toString().split("\n");
        assertThat(lines).hasSize(2 + 2 * depth);
        for (int i = 0; i <= depth; i += 1) {
            final var tail = (i == depth) ? ">leaf</level" + i + ">" : ">";
            assertThat(lines[1 + i]).isEqualTo("\t".repeat(i) + "<level" + i + tail);
        }
        for (int i = depth - 1; i >= 0; i -= 1) {
            assertThat(lines[lines.length - 1 - i]).isEqualTo("\t".repeat(i) + "</level" + i + ">");
        }
    }

    @Test
    void attributesAppearInFirstInsertionOrder() {
        final var element = new Element("e");
        element.addAttribute("z", 1);
        element.addAttribute("a", 2);
        element.addAttribute("m", 3);
        element.addAttribute("z", "last");
        assertThat(element).asString().endsWith("<e z=\"last\" a=\"2\" m=\"3\" />\n");
    }

    @Test
    void writesNonAsciiTextAsUtf8() throws IOException {
        final var element = new Element("text");
        element.addText("zażółć 😀");
        final var stream = new ByteArrayOutputStream();
        element.write(stream);
        assertThat(stream.toString(StandardCharsets.UTF_8)).isEqualTo(element.toString());
    }

    @Test
    void unpairedSurrogatesWriteIdenticallyToEverySink() throws IOException {
        final var element = new Element("text\uDC00");
        element.addAttribute("note\uD800", "half \uD83D");
        element.addText("broken \uD800 text");

        final var stream = new ByteArrayOutputStream();
        element.write(stream);
        final var expected = """
            <?xml version = "1.0" encoding = "UTF-8"?>
            <text\uFFFD note\uFFFD="half \uFFFD">broken \uFFFD text</text\uFFFD>
            """;
        assertThat(element).asString().isEqualTo(expected);
        assertThat(stream.toString(StandardCharsets.UTF_8)).isEqualTo(expected);
        final var writer = new StringWriter();
        element.write(writer);
        assertThat(writer.toString()).isEqualTo(expected);
    }

    @Test
    void streamFailurePropagates() {
        final var root = buildReferenceTree();
        assertThatIOException()
            .isThrownBy(() -> root.write(new FailingOutputStream()))
            .withMessage("sink closed");
    }

    @Test
    void writerFailureAbortsTraversal() {
        final var root = buildReferenceTree();
        final var writer = new FailingWriter(60);
        assertThatIOException()
            .isThrownBy(() -> root.write(writer))
            .withMessage("sink closed");
        assertThat(referenceDocument).startsWith(writer.written.toString());
        assertThat(writer.written.length()).isEqualTo(60);
    }

    @Test
    void serializationIsRepeatable() throws IOException {
        final var root = buildReferenceTree();
        final var first = new StringWriter();
        final var second = new StringWriter();
        root.write(first);
        Serializer.serialize(second, root);
        assertThat(first.toString()).isEqualTo(second.toString()).isEqualTo(referenceDocument);
    }

    @Test
    void serializationFromSeveralThreadsAgrees() throws Exception {
        final var root = buildReferenceTree();
        final var executor = Executors.newFixedThreadPool(4);
        try {
            final var tasks = new ArrayList<Callable<String>>();
            for (int i = 0; i < 16; i += 1) {
                tasks.add(root::toString);
            }
            for (final var future : executor.invokeAll(tasks)) {
                assertThat(future.get()).isEqualTo(referenceDocument);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void traceNamesDocumentBeingWritten() throws IOException {
        final var root = new Element("root");
        final var branch = new Element("branch");
        root.addChild(branch);
        branch.addChild(new Element("leaf"));

        final var writer = new TraceRecordingWriter("leaf");
        try (final var trace = new Trace("Writing test document")) {
            trace.use();
            root.write(writer);
        }
        assertThat(writer.recorded).singleElement().isEqualTo(List.of(
            "Serializing XML document with root element <root>",
            "Writing test document"
        ));
        assertThat(Trace.snapshot()).isEmpty();
    }

    private static Element buildReferenceTree() {
        final var root = new Element("root");
        final var child1 = new Element("child1");
        child1.addChild(new Element("inner"));
        final var inner2 = new Element("inner");
        inner2.addText("Example Text\nNew line");
        child1.addChild(inner2);
        root.addChild(child1);
        final var child2 = new Element("child2");
        child2.addAttribute("at1", "test &");
        child2.addAttribute("at2", "test <");
        child2.addAttribute("at3", "test \"");
        final var inner3 = new Element("inner");
        inner3.addAttribute("test", "example");
        child2.addChild(inner3);
        root.addChild(child2);
        final var child3 = new Element("child3");
        child3.addText("&< &");
        root.addChild(child3);
        final var child4 = new Element("child4");
        child4.addAttribute("non-str-attribute", 5);
        child4.addText(6);
        root.addChild(child4);
        return root;
    }

    private static final String referenceDocument = """
        <?xml version = "1.0" encoding = "UTF-8"?>
        <root>
        \t<child1>
        \t\t<inner />
        \t\t<inner>Example Text
        New line</inner>
        \t</child1>
        \t<child2 at1="test &amp;" at2="test &lt;" at3="test &quot;">
        \t\t<inner test="example" />
        \t</child2>
        \t<child3>&amp;&lt; &amp;</child3>
        \t<child4 non-str-attribute="5">6</child4>
        </root>
        """;

    private static final class FailingOutputStream extends OutputStream {
        @Override
        public void write(final int b) throws IOException {
            throw new IOException("sink closed");
        }

        @Override
        public void write(final byte[] bytes, final int offset, final int length) throws IOException {
            throw new IOException("sink closed");
        }
    }

    private static final class FailingWriter extends Writer {
        private FailingWriter(final int capacity) {
            this.capacity = capacity;
        }

        @Override
        public void write(final char[] buffer, final int offset, final int length) throws IOException {
            for (int i = 0; i < length; i += 1) {
                if (written.length() == capacity) {
                    throw new IOException("sink closed");
                }
                written.append(buffer[offset + i]);
            }
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }

        private final int capacity;
        private final StringBuilder written = new StringBuilder();
    }

    private static final class TraceRecordingWriter extends StringWriter {
        private TraceRecordingWriter(final String trigger) {
            this.trigger = trigger;
        }

        @Override
        public void write(final String string) {
            if (trigger.equals(string)) {
                recorded.add(Trace.snapshot());
            }
            super.write(string);
        }

        private final String trigger;
        private final List<List<String>> recorded = new ArrayList<>();
    }
}
