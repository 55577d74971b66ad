package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Non-semantic text attached to a token: whitespace, newlines, comments and stray backslashes.
 * <p>
 * Trivia is stored verbatim; the byte length is measured in UTF-8, like every other position in the tree.
 */
public final class Trivia {

    public static final Trivia EMPTY = new Trivia("");

    private static final Trivia SPACE = new Trivia(" ");

    private final String text;

    private Trivia(String text) {
        this.text = text;
    }

    @NotNull
    public static Trivia of(@NotNull String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) return EMPTY;
        if (text.equals(" ")) return SPACE;
        return new Trivia(text);
    }

    @NotNull
    public static Trivia space() {
        return SPACE;
    }

    @NotNull
    public String getText() {
        return text;
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public int getByteLength() {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    public boolean containsBackslash() {
        return text.indexOf('\\') >= 0;
    }

    public boolean containsNewline() {
        return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }

    /**
     * True if this trivia is nothing but spaces and tabs.
     */
    public boolean isSpacesOrTabs() {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') return false;
        }
        return true;
    }

    /**
     * Appends {@code other}, dropping the longest suffix of this trivia that {@code other} starts with,
     * so that merging {@code " "} into {@code " "} yields a single space.
     */
    @NotNull
    public Trivia merging(@NotNull Trivia other) {
        if (isEmpty()) return other;
        if (other.isEmpty()) return this;
        String rhs = other.text;
        int max = Math.min(text.length(), rhs.length());
        for (int overlap = max; overlap > 0; overlap--) {
            if (text.endsWith(rhs.substring(0, overlap))) {
                return Trivia.of(text + rhs.substring(overlap));
            }
        }
        return Trivia.of(text + rhs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trivia)) return false;
        return text.equals(((Trivia) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
