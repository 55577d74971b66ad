package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A leaf of the tree.
 * <p>
 * A missing token keeps the text the parser expected (so messages can name it) but occupies no source bytes.
 */
public final class TokenSyntax extends SyntaxNode {

    TokenSyntax(RawSyntax raw, SyntaxNode parent, int indexInParent, int offset, SyntaxIdentifier id) {
        super(raw, parent, indexInParent, offset, id);
    }

    @NotNull
    public TokenKind getTokenKind() {
        return getRaw().getTokenKind();
    }

    @NotNull
    public String getText() {
        return getRaw().getText();
    }

    @NotNull
    public SourcePresence getPresence() {
        return getRaw().getPresence();
    }

    public boolean isMissing() {
        return getPresence() == SourcePresence.MISSING;
    }

    public boolean isPresent() {
        return getPresence() == SourcePresence.PRESENT;
    }

    @NotNull
    public Trivia getLeadingTrivia() {
        return getRaw().getLeadingTrivia();
    }

    @NotNull
    public Trivia getTrailingTrivia() {
        return getRaw().getTrailingTrivia();
    }

    @Nullable
    public TokenDiagnostic getTokenDiagnostic() {
        return getRaw().getTokenDiagnostic();
    }

    /**
     * The keyword this token spells, if it is a keyword token.
     */
    @Nullable
    public Keyword getKeyword() {
        return getTokenKind() == TokenKind.KEYWORD ? Keyword.fromText(getText()) : null;
    }

    public boolean is(@NotNull Keyword keyword) {
        return getKeyword() == keyword;
    }

    public boolean is(@NotNull TokenKind kind) {
        return getTokenKind() == kind;
    }

    /**
     * True for a token of {@code kind} spelled {@code text}, e.g. the binary operator {@code ==}.
     */
    public boolean is(@NotNull TokenKind kind, @NotNull String text) {
        return getTokenKind() == kind && getText().equals(text);
    }

    public boolean isIdentifier() {
        return getTokenKind() == TokenKind.IDENTIFIER;
    }

    public boolean isLexerClassifiedKeyword() {
        Keyword keyword = getKeyword();
        return keyword != null && keyword.isLexerClassified();
    }

    @Override
    public int getPositionAfterSkippingLeadingTrivia() {
        return isPresent() ? getPosition() + getLeadingTrivia().getByteLength() : getPosition();
    }

    @Override
    public int getEndPositionBeforeTrailingTrivia() {
        return isPresent() ? getEndPosition() - getTrailingTrivia().getByteLength() : getPosition();
    }

    // ---- detached copies ----

    /**
     * A detached present token of {@code kind} spelled {@code text}, without trivia.
     */
    @NotNull
    public static TokenSyntax make(@NotNull TokenKind kind, @NotNull String text) {
        return make(kind, text, Trivia.EMPTY, Trivia.EMPTY, SourcePresence.PRESENT);
    }

    @NotNull
    public static TokenSyntax make(@NotNull TokenKind kind,
                                   @NotNull String text,
                                   @NotNull Trivia leadingTrivia,
                                   @NotNull Trivia trailingTrivia,
                                   @NotNull SourcePresence presence) {
        RawSyntax raw = RawSyntax.makeToken(kind, text, leadingTrivia, trailingTrivia, presence, null);
        return (TokenSyntax) makeRoot(raw);
    }

    @NotNull
    public static TokenSyntax keyword(@NotNull Keyword keyword) {
        return make(TokenKind.KEYWORD, keyword.getText());
    }

    /**
     * A detached copy of this token with a different kind and text, keeping trivia and presence.
     */
    @NotNull
    public TokenSyntax withKind(@NotNull TokenKind kind, @NotNull String text) {
        return make(kind, text, getLeadingTrivia(), getTrailingTrivia(), getPresence());
    }

    @NotNull
    public TokenSyntax withPresence(@NotNull SourcePresence presence) {
        return make(getTokenKind(), getText(), getLeadingTrivia(), getTrailingTrivia(), presence);
    }

    @Override
    public String toString() {
        return "Token" + getId() + "'" + getText() + "'" + (isMissing() ? "(missing)" : "");
    }
}
