package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A lexical problem the lexer attached to a single token.
 * <p>
 * The offset is measured in UTF-8 bytes from the start of the token's leading trivia.
 */
public final class TokenDiagnostic {

    public enum Severity {
        ERROR,
        WARNING
    }

    public enum Kind {
        EDITOR_PLACEHOLDER(Severity.ERROR),
        EQUAL_MUST_HAVE_CONSISTENT_WHITESPACE(Severity.ERROR),
        EXPECTED_DIGIT_IN_FLOAT_LITERAL(Severity.ERROR),
        EXPECTED_HEX_DIGIT_IN_HEX_LITERAL(Severity.ERROR),
        INSUFFICIENT_INDENTATION_IN_MULTILINE_STRING_LITERAL(Severity.ERROR),
        INVALID_BINARY_DIGIT_IN_INTEGER_LITERAL(Severity.ERROR),
        INVALID_CHARACTER(Severity.ERROR),
        INVALID_DECIMAL_DIGIT_IN_INTEGER_LITERAL(Severity.ERROR),
        INVALID_ESCAPE_SEQUENCE_IN_STRING_LITERAL(Severity.ERROR),
        INVALID_IDENTIFIER_START_CHARACTER(Severity.ERROR),
        INVALID_UTF8(Severity.ERROR),
        NON_BREAKING_SPACE(Severity.WARNING),
        NUL_CHARACTER(Severity.WARNING),
        SOURCE_CONFLICT_MARKER(Severity.ERROR),
        UNEXPECTED_BLOCK_COMMENT_END(Severity.ERROR),
        UNICODE_CURLY_QUOTE(Severity.ERROR),
        UNPRINTABLE_ASCII_CHARACTER(Severity.ERROR);

        private final Severity defaultSeverity;

        Kind(Severity defaultSeverity) {
            this.defaultSeverity = defaultSeverity;
        }

        public Severity getDefaultSeverity() {
            return defaultSeverity;
        }
    }

    private final Kind kind;
    private final Severity severity;
    private final int byteOffset;

    public TokenDiagnostic(@NotNull Kind kind, int byteOffset) {
        this(kind, kind.getDefaultSeverity(), byteOffset);
    }

    public TokenDiagnostic(@NotNull Kind kind, @NotNull Severity severity, int byteOffset) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.severity = Objects.requireNonNull(severity, "severity");
        if (byteOffset < 0) {
            throw new IllegalArgumentException("byteOffset must not be negative: " + byteOffset);
        }
        this.byteOffset = byteOffset;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    @NotNull
    public Severity getSeverity() {
        return severity;
    }

    public int getByteOffset() {
        return byteOffset;
    }

    @Override
    public String toString() {
        return "TokenDiagnostic{" + kind + ", " + severity + ", offset=" + byteOffset + '}';
    }
}
