// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package xmlbuilder.dom;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Replacement of the characters XML reserves in text and attribute values with entity references.
 * <p>
 * Elements escape their input when it is added, never when it is written, so what an {@link Element} stores is always
 * the escaped form. Unpaired UTF-16 surrogates, which have no UTF-8 encoding, are replaced by U+FFFD at the same
 * time, so every stored string encodes cleanly to any sink.
 */
public final class Escaping {
    private Escaping() {
    }

    /**
     * Returns {@code string} with {@code &}, {@code "}, {@code '}, {@code <} and {@code >} replaced by
     * {@code &amp;}, {@code &quot;}, {@code &apos;}, {@code &lt;} and {@code &gt;} respectively, and every unpaired
     * surrogate replaced by U+FFFD.
     * <p>
     * Input that is already escaped gets escaped again: {@code "&amp;"} becomes {@code "&amp;amp;"}.
     */
    public static String escape(final String string) {
        return replace(string, true);
    }

    /**
     * Returns {@code string} with every unpaired surrogate replaced by U+FFFD and nothing else changed.
     * <p>
     * Used for tag and attribute names, which are written as given.
     */
    public static String withPairedSurrogates(final String string) {
        return replace(string, false);
    }

    private static String replace(final String string, final boolean escapeReserved) {
        var index = findCharacterToReplace(string, 0, escapeReserved);
        if (index < 0) {
            return string;
        }
        final var builder = new StringBuilder(string.length() + 16);
        var start = 0;
        do {
            builder.append(string, start, index);
            final var entity = escapeReserved ? entityFor(string.charAt(index)) : null;
            if (entity != null) {
                builder.append(entity);
            } else {
                builder.append(replacementCharacter);
            }
            start = index + 1;
            index = findCharacterToReplace(string, start, escapeReserved);
        } while (index >= 0);
        builder.append(string, start, string.length());
        return builder.toString();
    }

    private static int findCharacterToReplace(
        final String string,
        final int startIndex,
        final boolean escapeReserved
    ) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            final var character = string.charAt(i);
            if (escapeReserved && entityFor(character) != null) {
                return i;
            }
            if (Character.isHighSurrogate(character)
                && i + 1 < length
                && Character.isLowSurrogate(string.charAt(i + 1))) {
                i += 1;
            } else if (Character.isSurrogate(character)) {
                return i;
            }
        }
        return -1;
    }

    private static @Nullable String entityFor(final char character) {
        return switch (character) {
            case '&' -> "&amp;";
            case '"' -> "&quot;";
            case '\'' -> "&apos;";
            case '<' -> "&lt;";
            case '>' -> "&gt;";
            default -> null;
        };
    }

    private static final char replacementCharacter = '\uFFFD';
}
