package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Keywords of the language.
 * <p>
 * A lexer-classified keyword is reserved everywhere and is always lexed as a keyword.
 * The others are contextual and only act as keywords in specific grammar positions.
 */
public enum Keyword {
    ANY("Any", true),
    AS("as", true),
    ASSOCIATEDTYPE("associatedtype", true),
    ASYNC("async", false),
    AWAIT("await", false),
    BORROWING("borrowing", false),
    BREAK("break", true),
    CASE("case", true),
    CATCH("catch", true),
    CLASS("class", true),
    CONSUMING("consuming", false),
    CONTINUE("continue", true),
    DEFAULT("default", true),
    DEFER("defer", true),
    DEINIT("deinit", true),
    DO("do", true),
    EACH("each", false),
    ELSE("else", true),
    ENUM("enum", true),
    EXTENSION("extension", true),
    FALLTHROUGH("fallthrough", true),
    FALSE("false", true),
    FILEPRIVATE("fileprivate", true),
    FOR("for", true),
    FUNC("func", true),
    GET("get", false),
    GUARD("guard", true),
    IF("if", true),
    IMPORT("import", true),
    IN("in", true),
    INFIX("infix", false),
    INIT("init", true),
    INOUT("inout", true),
    INTERNAL("internal", true),
    IS("is", true),
    LET("let", true),
    NIL("nil", true),
    OPERATOR("operator", true),
    POSTFIX("postfix", false),
    PRECEDENCEGROUP("precedencegroup", true),
    PREFIX("prefix", false),
    PRIVATE("private", true),
    PROTOCOL("protocol", true),
    PUBLIC("public", true),
    REASYNC("reasync", false),
    REPEAT("repeat", true),
    RETHROWS("rethrows", true),
    RETURN("return", true),
    SELF("self", true),
    SELF_TYPE("Self", true),
    SET("set", false),
    SHARED("__shared", false),
    OWNED("__owned", false),
    STATIC("static", true),
    STRUCT("struct", true),
    SUBSCRIPT("subscript", true),
    SUPER("super", true),
    SWITCH("switch", true),
    THROW("throw", true),
    THROWS("throws", true),
    TRUE("true", true),
    TRY("try", true),
    TYPEALIAS("typealias", true),
    UNKNOWN("unknown", false),
    VAR("var", true),
    WHERE("where", true),
    WHILE("while", true);

    private static final Map<String, Keyword> BY_TEXT = new HashMap<>();

    static {
        for (Keyword keyword : values()) {
            BY_TEXT.put(keyword.text, keyword);
        }
    }

    private final String text;
    private final boolean lexerClassified;

    Keyword(String text, boolean lexerClassified) {
        this.text = text;
        this.lexerClassified = lexerClassified;
    }

    public String getText() {
        return text;
    }

    public boolean isLexerClassified() {
        return lexerClassified;
    }

    @Nullable
    public static Keyword fromText(String text) {
        return BY_TEXT.get(text);
    }
}
