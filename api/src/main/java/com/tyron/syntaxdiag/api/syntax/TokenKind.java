package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.Nullable;

/**
 * Lexical category of a token.
 * <p>
 * Punctuators carry their fixed text; kinds whose text varies (identifiers, operators, literals, keywords)
 * carry {@code null} and take their text from the token.
 */
public enum TokenKind {
    ARROW("->", true),
    AT_SIGN("@", true),
    BACKSLASH("\\", true),
    BINARY_OPERATOR(null, false),
    COLON(":", true),
    COMMA(",", true),
    DOLLAR_IDENTIFIER(null, false),
    ELLIPSIS("...", true),
    END_OF_FILE("", false),
    EQUAL("=", true),
    EXCLAMATION_MARK("!", true),
    FLOATING_LITERAL(null, false),
    IDENTIFIER(null, false),
    INFIX_QUESTION_MARK("?", true),
    INTEGER_LITERAL(null, false),
    KEYWORD(null, false),
    LEFT_ANGLE("<", true),
    LEFT_BRACE("{", true),
    LEFT_PAREN("(", true),
    LEFT_SQUARE("[", true),
    MULTILINE_STRING_QUOTE("\"\"\"", true),
    PERIOD(".", true),
    POSTFIX_OPERATOR(null, false),
    POUND("#", true),
    POUND_AVAILABLE("#available", false),
    POUND_ELSE("#else", false),
    POUND_ELSEIF("#elseif", false),
    POUND_ENDIF("#endif", false),
    POUND_IF("#if", false),
    POUND_UNAVAILABLE("#unavailable", false),
    PREFIX_OPERATOR(null, false),
    RAW_STRING_DELIMITER(null, false),
    RIGHT_ANGLE(">", true),
    RIGHT_BRACE("}", true),
    RIGHT_PAREN(")", true),
    RIGHT_SQUARE("]", true),
    SEMICOLON(";", true),
    SINGLE_QUOTE("'", true),
    STRING_QUOTE("\"", true),
    STRING_SEGMENT(null, false);

    private final String defaultText;
    private final boolean punctuation;

    TokenKind(String defaultText, boolean punctuation) {
        this.defaultText = defaultText;
        this.punctuation = punctuation;
    }

    /**
     * The fixed text of this kind, or {@code null} if tokens of this kind spell themselves.
     */
    @Nullable
    public String getDefaultText() {
        return defaultText;
    }

    public boolean isPunctuation() {
        return punctuation;
    }
}
