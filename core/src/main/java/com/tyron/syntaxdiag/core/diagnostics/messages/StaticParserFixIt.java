package com.tyron.syntaxdiag.core.diagnostics.messages;

import com.tyron.syntaxdiag.api.diagnostics.FixItMessage;
import org.jetbrains.annotations.NotNull;

public enum StaticParserFixIt implements FixItMessage {
    CHANGE_INDENTATION_TO_MATCH_CLOSING_DELIMITER("change indentation of this line to match closing delimiter"),
    INSERT_ATTRIBUTE_ARGUMENTS("insert attribute argument"),
    INSERT_SEMICOLON("insert ';'"),
    JOIN_IDENTIFIERS("join the identifiers together"),
    JOIN_IDENTIFIERS_WITH_CAMEL_CASE("join the identifiers together with camel-case"),
    REMOVE_BACKSLASH("remove '\\'"),
    REMOVE_EXTRANEOUS_WHITESPACE("remove whitespace"),
    REMOVE_OPERATOR_BODY("remove operator body");

    private final String message;

    StaticParserFixIt(String message) {
        this.message = message;
    }

    @NotNull
    @Override
    public String getMessage() {
        return message;
    }

    @NotNull
    @Override
    public String getFixItId() {
        return name();
    }
}
