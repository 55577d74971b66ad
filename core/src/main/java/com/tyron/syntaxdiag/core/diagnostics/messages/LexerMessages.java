package com.tyron.syntaxdiag.core.diagnostics.messages;

import com.tyron.syntaxdiag.api.diagnostics.DiagnosticMessage;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticSeverity;
import com.tyron.syntaxdiag.api.syntax.TokenDiagnostic;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;

/**
 * Messages for diagnostics the lexer attached to single tokens.
 */
public final class LexerMessages {

    private LexerMessages() {
    }

    /**
     * The message for {@code diagnostic}, which was found inside {@code token}. The severity is taken from the
     * lexer diagnostic.
     */
    @NotNull
    public static DiagnosticMessage forTokenDiagnostic(@NotNull TokenDiagnostic diagnostic, @NotNull TokenSyntax token) {
        String message;
        switch (diagnostic.getKind()) {
            case EDITOR_PLACEHOLDER:
                message = "editor placeholder in source file";
                break;
            case EQUAL_MUST_HAVE_CONSISTENT_WHITESPACE:
                message = "'=' must have consistent whitespace on both sides";
                break;
            case EXPECTED_DIGIT_IN_FLOAT_LITERAL:
                message = "expected a digit in floating point exponent";
                break;
            case EXPECTED_HEX_DIGIT_IN_HEX_LITERAL:
                message = "'" + characterAt(token, diagnostic) + "' is not a valid hexadecimal digit (0-9, A-F) in integer literal";
                break;
            case INSUFFICIENT_INDENTATION_IN_MULTILINE_STRING_LITERAL:
                message = "insufficient indentation of line in multi-line string literal";
                break;
            case INVALID_BINARY_DIGIT_IN_INTEGER_LITERAL:
                message = "'" + characterAt(token, diagnostic) + "' is not a valid binary digit (0 or 1) in integer literal";
                break;
            case INVALID_CHARACTER:
                message = "invalid character in source file";
                break;
            case INVALID_DECIMAL_DIGIT_IN_INTEGER_LITERAL:
                message = "'" + characterAt(token, diagnostic) + "' is not a valid digit in integer literal";
                break;
            case INVALID_ESCAPE_SEQUENCE_IN_STRING_LITERAL:
                message = "invalid escape sequence in literal";
                break;
            case INVALID_IDENTIFIER_START_CHARACTER:
                message = "an identifier cannot begin with this character";
                break;
            case INVALID_UTF8:
                message = "invalid UTF-8 found in source file";
                break;
            case NON_BREAKING_SPACE:
                message = "non-breaking space (U+00A0) used instead of regular space";
                break;
            case NUL_CHARACTER:
                message = "nul character embedded in middle of file";
                break;
            case SOURCE_CONFLICT_MARKER:
                message = "source control conflict marker in source file";
                break;
            case UNEXPECTED_BLOCK_COMMENT_END:
                message = "unexpected end of block comment";
                break;
            case UNICODE_CURLY_QUOTE:
                message = "unicode curly quote found; use '\"' instead";
                break;
            case UNPRINTABLE_ASCII_CHARACTER:
                message = "unprintable ASCII character found in source file";
                break;
            default:
                throw new IllegalStateException("Unhandled lexer diagnostic " + diagnostic.getKind());
        }
        DiagnosticSeverity severity = diagnostic.getSeverity() == TokenDiagnostic.Severity.WARNING
                ? DiagnosticSeverity.WARNING
                : DiagnosticSeverity.ERROR;
        return new ParserMessages.Message(diagnostic.getKind().name(), message, severity);
    }

    /**
     * The character the diagnostic points at. Offsets are UTF-8 bytes relative to the start of the token's
     * leading trivia.
     */
    static String characterAt(TokenSyntax token, TokenDiagnostic diagnostic) {
        byte[] leading = token.getLeadingTrivia().getText().getBytes(StandardCharsets.UTF_8);
        byte[] text = token.getText().getBytes(StandardCharsets.UTF_8);
        int offset = diagnostic.getByteOffset() - leading.length;
        if (offset < 0 || offset >= text.length) {
            return "?";
        }
        String prefix = new String(text, 0, offset, StandardCharsets.UTF_8);
        String rest = token.getText().substring(Math.min(prefix.length(), token.getText().length()));
        if (rest.isEmpty()) {
            return "?";
        }
        return rest.substring(0, Character.charCount(rest.codePointAt(0)));
    }
}
