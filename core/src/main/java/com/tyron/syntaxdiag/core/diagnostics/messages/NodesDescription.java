package com.tyron.syntaxdiag.core.diagnostics.messages;

import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.UnexpectedNodesSyntax;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders nodes for use inside diagnostic and fix-it messages.
 */
public final class NodesDescription {

    private static final int MAX_INLINE_LENGTH = 100;

    private NodesDescription() {
    }

    /**
     * Describes {@code nodes} as they would read in a message, e.g. {@code 'async throws'} for two tokens or
     * {@code expression and ':'} for a missing expression followed by a missing colon.
     */
    @NotNull
    public static String describe(@NotNull List<? extends SyntaxNode> nodes) {
        if (nodes.isEmpty()) {
            return "";
        }
        if (nodes.stream().allMatch(node -> node.isToken() && !isUnspelled(node))) {
            List<TokenSyntax> tokens = new ArrayList<>(nodes.size());
            for (SyntaxNode node : nodes) {
                tokens.add((TokenSyntax) node);
            }
            return quote(joinTokens(tokens));
        }
        List<String> parts = new ArrayList<>(nodes.size());
        for (SyntaxNode node : nodes) {
            parts.add(describe(node));
        }
        return joinWithAnd(parts);
    }

    @NotNull
    public static String describe(@NotNull SyntaxNode node) {
        TokenSyntax token = node.as(TokenSyntax.class);
        if (token != null) {
            return isUnspelled(token) ? describeTokenKind(token.getTokenKind()) : quote(token.getText());
        }
        String missingKind = describeMissingKind(node.getKind());
        if (missingKind != null) {
            return missingKind;
        }
        if (node.isMissingAllTokens()) {
            String name = node.getKind().getNameForDiagnostics();
            if (name != null) {
                return name;
            }
            return quote(joinTokens(node.getTokens(SyntaxViewMode.ALL)));
        }
        return quote(node.getTrimmedText());
    }

    /**
     * {@code code 'text'} for short single-line content, {@code code} for anything longer, and
     * {@code brace}/{@code braces} for stray closing braces.
     */
    @NotNull
    public static String shortSingleLineContent(@NotNull SyntaxNode node) {
        List<SyntaxNode> children = node.getChildren(SyntaxViewMode.SOURCE_ACCURATE);
        boolean onlyRightBraces = !children.isEmpty() && children.stream().allMatch(child -> {
            TokenSyntax token = child.as(TokenSyntax.class);
            return token != null && token.getTokenKind() == TokenKind.RIGHT_BRACE;
        });
        if (onlyRightBraces) {
            return children.size() == 1 ? "brace" : "braces";
        }
        String text = node.getTrimmedText();
        if (text.contains("\n") || text.length() > MAX_INLINE_LENGTH) {
            return "code";
        }
        return "code " + quote(text);
    }

    /**
     * The diagnostic name of {@code node} or of its closest ancestor that has one.
     */
    @Nullable
    public static String nameOfClosestAncestorOrSelf(@Nullable SyntaxNode node) {
        while (node != null) {
            String name = node.getKind().getNameForDiagnostics();
            if (name != null) {
                return name;
            }
            node = node.getParent();
        }
        return null;
    }

    /**
     * Where an unexpected cluster sits: {@code before <parent>} if it opens its parent, otherwise
     * {@code in <closest named ancestor>}. Empty if nothing around it has a name.
     */
    @NotNull
    public static String unexpectedContext(@NotNull UnexpectedNodesSyntax unexpected) {
        SyntaxNode parent = unexpected.getParent();
        if (parent == null) {
            return "";
        }
        String parentName = parent.getKind().getNameForDiagnostics();
        List<SyntaxNode> siblings = parent.getChildren(SyntaxViewMode.SOURCE_ACCURATE);
        if (parentName != null && !siblings.isEmpty() && siblings.get(0).equals(unexpected)) {
            return " before " + parentName;
        }
        String ancestorName = nameOfClosestAncestorOrSelf(parent);
        return ancestorName != null ? " in " + ancestorName : "";
    }

    /**
     * A missing token whose kind has no fixed spelling, e.g. a missing identifier.
     */
    private static boolean isUnspelled(SyntaxNode node) {
        TokenSyntax token = node.as(TokenSyntax.class);
        return token != null && token.isMissing() && token.getText().isEmpty();
    }

    static String describeTokenKind(TokenKind kind) {
        return kind.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    @Nullable
    static String describeMissingKind(SyntaxKind kind) {
        switch (kind) {
            case MISSING_DECL:
                return "declaration";
            case MISSING_EXPR:
                return "expression";
            case MISSING_PATTERN:
                return "pattern";
            case MISSING_STMT:
                return "statement";
            case MISSING_TYPE:
                return "type";
            case MISSING:
                return "syntax";
            default:
                return null;
        }
    }

    private static String joinTokens(List<TokenSyntax> tokens) {
        StringBuilder sb = new StringBuilder();
        TokenSyntax previous = null;
        for (TokenSyntax token : tokens) {
            if (previous != null && needsSeparator(previous, token)) {
                sb.append(' ');
            }
            sb.append(token.getText());
            previous = token;
        }
        return sb.toString();
    }

    private static boolean needsSeparator(TokenSyntax previous, TokenSyntax next) {
        if (previous.isPresent() && next.isPresent()) {
            return !previous.getTrailingTrivia().isEmpty() || !next.getLeadingTrivia().isEmpty();
        }
        return !previous.getTokenKind().isPunctuation() && !next.getTokenKind().isPunctuation();
    }

    private static String joinWithAnd(List<String> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        if (parts.size() == 2) {
            return parts.get(0) + " and " + parts.get(1);
        }
        return String.join(", ", parts.subList(0, parts.size() - 1)) + ", and " + parts.get(parts.size() - 1);
    }

    static String quote(String text) {
        return "'" + text + "'";
    }
}
