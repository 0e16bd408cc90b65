// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.test;

import java.util.stream.Stream;
import xmlbuilder.dom.Escaping;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class EscapingTest {
    static Stream<Arguments> provideEscapes() {
        return Stream.of(
            Arguments.of("test &", "test &amp;"),
            Arguments.of("test <", "test &lt;"),
            Arguments.of("test \"", "test &quot;"),
            Arguments.of("it's", "it&apos;s"),
            Arguments.of("a > b", "a &gt; b"),
            Arguments.of("&< &", "&amp;&lt; &amp;"),
            Arguments.of("<a href=\"x\">'&'</a>", "&lt;a href=&quot;x&quot;&gt;&apos;&amp;&apos;&lt;/a&gt;"),
            Arguments.of("", "")
        );
    }

    @ParameterizedTest
    @MethodSource("provideEscapes")
    void replacesReservedCharacters(final String input, final String expected) {
        assertThat(Escaping.escape(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @MethodSource("provideEscapes")
    void matchesOrderedReplacement(final String input, final String ignored) {
        final var expected = input
            .replace("&", "&amp;")
            .replace("\"", "&quot;")
            .replace("'", "&apos;")
            .replace("<", "&lt;")
            .replace(">", "&gt;");
        assertThat(Escaping.escape(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"&", "\"", "'", "<", ">", "x&y\"z'w<v>u", "&&&&"})
    void leavesNoReservedCharacterOutsideEntities(final String input) {
        final var withoutEntities = Escaping.escape(input)
            .replace("&amp;", "")
            .replace("&quot;", "")
            .replace("&apos;", "")
            .replace("&lt;", "")
            .replace("&gt;", "");
        assertThat(withoutEntities).doesNotContain("&", "\"", "'", "<", ">");
    }

    @Test
    void escapesAlreadyEscapedInputAgain() {
        assertThat(Escaping.escape("&amp;")).isEqualTo("&amp;amp;");
        assertThat(Escaping.escape(Escaping.escape("<"))).isEqualTo("&amp;lt;");
    }

    @Test
    void returnsPlainInputUnchanged() {
        final var input = "Example Text\nNew line, ünïcödé and tabs\t";
        assertThat(Escaping.escape(input)).isSameAs(input);
    }

    @Test
    void replacesUnpairedSurrogates() {
        assertThat(Escaping.escape("a\uD800b")).isEqualTo("a\uFFFDb");
        assertThat(Escaping.escape("\uDC00&\uD83D")).isEqualTo("\uFFFD&amp;\uFFFD");
        assertThat(Escaping.escape("\uDE00\uD83D")).isEqualTo("\uFFFD\uFFFD");
        assertThat(Escaping.withPairedSurrogates("tag\uD800<")).isEqualTo("tag\uFFFD<");
    }

    @Test
    void keepsSurrogatePairs() {
        final var input = "smile \uD83D\uDE00 & laugh";
        assertThat(Escaping.escape(input)).isEqualTo("smile \uD83D\uDE00 &amp; laugh");
        assertThat(Escaping.withPairedSurrogates("\uD83D\uDE00")).isEqualTo("\uD83D\uDE00");
    }
}
