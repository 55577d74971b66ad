package com.tyron.syntaxdiag.core.diagnostics.messages;

import com.tyron.syntaxdiag.api.diagnostics.FixItMessage;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import org.jetbrains.annotations.NotNull;

import java.util.List;

import static com.tyron.syntaxdiag.core.diagnostics.messages.NodesDescription.describe;
import static com.tyron.syntaxdiag.core.diagnostics.messages.NodesDescription.quote;

/**
 * Fix-it messages built from the tokens they move, insert or remove.
 */
public final class ParserFixIts {

    private ParserFixIts() {
    }

    record Message(String fixItId, String message) implements FixItMessage {
        @NotNull
        @Override
        public String getMessage() {
            return message;
        }

        @NotNull
        @Override
        public String getFixItId() {
            return fixItId;
        }
    }

    @NotNull
    public static FixItMessage insert(@NotNull TokenSyntax tokenToBeInserted) {
        return new Message("INSERT", "insert " + quote(tokenToBeInserted.getText()));
    }

    @NotNull
    public static FixItMessage insertTokens(@NotNull List<? extends SyntaxNode> missingNodes) {
        return new Message("INSERT_TOKENS", "insert " + describe(missingNodes));
    }

    @NotNull
    public static FixItMessage moveTokensAfter(@NotNull List<TokenSyntax> movedTokens, @NotNull String after) {
        return new Message("MOVE_TOKENS_AFTER", "move " + describe(movedTokens) + " after " + quote(after));
    }

    @NotNull
    public static FixItMessage moveTokensInFrontOf(@NotNull List<TokenSyntax> movedTokens, @NotNull String inFrontOf) {
        return new Message("MOVE_TOKENS_IN_FRONT_OF",
                "move " + describe(movedTokens) + " in front of " + quote(inFrontOf));
    }

    @NotNull
    public static FixItMessage moveTokensInFrontOfType(@NotNull List<TokenSyntax> movedTokens) {
        return new Message("MOVE_TOKENS_IN_FRONT_OF_TYPE", "move " + describe(movedTokens) + " in front of type");
    }

    @NotNull
    public static FixItMessage removeNodes(@NotNull List<? extends SyntaxNode> nodes) {
        return new Message("REMOVE_NODES", "remove " + describe(nodes));
    }

    @NotNull
    public static FixItMessage removeNodes(@NotNull SyntaxNode node) {
        return removeNodes(List.of(node));
    }

    @NotNull
    public static FixItMessage removeRedundant(@NotNull List<TokenSyntax> removeTokens) {
        return new Message("REMOVE_REDUNDANT", "remove redundant " + describe(removeTokens));
    }

    @NotNull
    public static FixItMessage replaceTokens(@NotNull List<TokenSyntax> replaceTokens,
                                             @NotNull List<TokenSyntax> replacements) {
        return new Message("REPLACE_TOKENS", "replace " + describe(replaceTokens) + " with " + describe(replacements));
    }

    @NotNull
    public static FixItMessage replace(@NotNull String description) {
        return new Message("REPLACE", description);
    }
}
