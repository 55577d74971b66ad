package com.tyron.syntaxdiag.testFramework;

import com.tyron.syntaxdiag.api.syntax.Keyword;
import com.tyron.syntaxdiag.api.syntax.RawSyntax;
import com.tyron.syntaxdiag.api.syntax.SourcePresence;
import com.tyron.syntaxdiag.api.syntax.SyntaxKind;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenDiagnostic;
import com.tyron.syntaxdiag.api.syntax.TokenKind;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.Trivia;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Hand-assembles the trees a recovering parser would produce, so diagnostics can be tested without one.
 * <p>
 * Layout children are set by slot name; unset slots stay absent. Tokens are built without trivia unless
 * given, so {@code func f()} needs {@code keyword(Keyword.FUNC, " ")} to render with its space.
 *
 * <pre>{@code
 * RawSyntax tree = layout(SyntaxKind.RETURN_STMT)
 *         .set("returnKeyword", keyword(Keyword.RETURN))
 *         .build();
 * }</pre>
 */
public final class SyntaxBuilder {

    private SyntaxBuilder() {
    }

    public static Layout layout(@NotNull SyntaxKind kind) {
        return new Layout(kind);
    }

    /**
     * Fills the slots of one layout node.
     */
    public static final class Layout {

        private final SyntaxKind kind;
        private final RawSyntax[] slots;

        private Layout(SyntaxKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
            if (kind.getShape() != SyntaxKind.Shape.LAYOUT) {
                throw new IllegalArgumentException(kind + " is not a layout kind");
            }
            this.slots = new RawSyntax[kind.getSlots().size()];
        }

        public Layout set(@NotNull String slot, @Nullable RawSyntax child) {
            slots[kind.indexOf(slot)] = child;
            return this;
        }

        public Layout set(@NotNull String slot, @NotNull Layout child) {
            return set(slot, child.build());
        }

        public Layout unexpectedBefore(@NotNull String child, RawSyntax... nodes) {
            return set(SyntaxKind.unexpectedBefore(child), unexpected(nodes));
        }

        public Layout unexpectedBetween(@NotNull String first, @NotNull String second, RawSyntax... nodes) {
            return set(SyntaxKind.unexpectedBetween(first, second), unexpected(nodes));
        }

        public Layout unexpectedAfter(@NotNull String child, RawSyntax... nodes) {
            return set(SyntaxKind.unexpectedAfter(child), unexpected(nodes));
        }

        @NotNull
        public RawSyntax build() {
            return RawSyntax.makeLayout(kind, Arrays.asList(slots));
        }
    }

    // ---- collections ----

    @NotNull
    public static RawSyntax collection(@NotNull SyntaxKind kind, RawSyntax... elements) {
        return RawSyntax.makeCollection(kind, Arrays.asList(elements));
    }

    @NotNull
    public static RawSyntax unexpected(RawSyntax... nodes) {
        return RawSyntax.makeUnexpected(Arrays.asList(nodes), false);
    }

    /**
     * An unexpected cluster marking where the parser stopped descending into deeply nested input.
     */
    @NotNull
    public static RawSyntax nestingOverflow(RawSyntax... nodes) {
        return RawSyntax.makeUnexpected(Arrays.asList(nodes), true);
    }

    // ---- tokens ----

    @NotNull
    public static RawSyntax token(@NotNull TokenKind kind, @NotNull String text) {
        return token(kind, text, "", "");
    }

    @NotNull
    public static RawSyntax token(@NotNull TokenKind kind, @NotNull String text, @NotNull String leading, @NotNull String trailing) {
        return RawSyntax.makeToken(kind, text, Trivia.of(leading), Trivia.of(trailing), SourcePresence.PRESENT, null);
    }

    /**
     * A present token carrying a diagnostic from the lexer.
     */
    @NotNull
    public static RawSyntax token(@NotNull TokenKind kind,
                                  @NotNull String text,
                                  @NotNull String leading,
                                  @NotNull String trailing,
                                  @NotNull TokenDiagnostic diagnostic) {
        return RawSyntax.makeToken(kind, text, Trivia.of(leading), Trivia.of(trailing), SourcePresence.PRESENT, diagnostic);
    }

    /**
     * A punctuator spelled with its fixed text.
     */
    @NotNull
    public static RawSyntax punct(@NotNull TokenKind kind) {
        return punct(kind, "");
    }

    @NotNull
    public static RawSyntax punct(@NotNull TokenKind kind, @NotNull String trailing) {
        return token(kind, fixedText(kind), "", trailing);
    }

    @NotNull
    public static RawSyntax keyword(@NotNull Keyword keyword) {
        return keyword(keyword, "");
    }

    @NotNull
    public static RawSyntax keyword(@NotNull Keyword keyword, @NotNull String trailing) {
        return keyword(keyword, "", trailing);
    }

    @NotNull
    public static RawSyntax keyword(@NotNull Keyword keyword, @NotNull String leading, @NotNull String trailing) {
        return token(TokenKind.KEYWORD, keyword.getText(), leading, trailing);
    }

    @NotNull
    public static RawSyntax identifier(@NotNull String text) {
        return identifier(text, "");
    }

    @NotNull
    public static RawSyntax identifier(@NotNull String text, @NotNull String trailing) {
        return token(TokenKind.IDENTIFIER, text, "", trailing);
    }

    @NotNull
    public static RawSyntax integer(@NotNull String digits) {
        return token(TokenKind.INTEGER_LITERAL, digits);
    }

    // ---- missing ----

    /**
     * A token the parser synthesized. Kinds without fixed text are missing with empty text.
     */
    @NotNull
    public static RawSyntax missing(@NotNull TokenKind kind) {
        String text = kind.getDefaultText();
        return missing(kind, text != null ? text : "");
    }

    @NotNull
    public static RawSyntax missing(@NotNull TokenKind kind, @NotNull String text) {
        return RawSyntax.makeToken(kind, text, Trivia.EMPTY, Trivia.EMPTY, SourcePresence.MISSING, null);
    }

    @NotNull
    public static RawSyntax missingKeyword(@NotNull Keyword keyword) {
        return missing(TokenKind.KEYWORD, keyword.getText());
    }

    @NotNull
    public static RawSyntax missingIdentifier() {
        return missing(TokenKind.IDENTIFIER, "");
    }

    @NotNull
    public static RawSyntax missingExpr() {
        return missingNode(SyntaxKind.MISSING_EXPR, "<#expression#>");
    }

    @NotNull
    public static RawSyntax missingType() {
        return missingNode(SyntaxKind.MISSING_TYPE, "<#type#>");
    }

    @NotNull
    public static RawSyntax missingPattern() {
        return missingNode(SyntaxKind.MISSING_PATTERN, "<#pattern#>");
    }

    @NotNull
    public static RawSyntax missingDecl() {
        return missingNode(SyntaxKind.MISSING_DECL, "<#declaration#>");
    }

    private static RawSyntax missingNode(SyntaxKind kind, String placeholder) {
        return layout(kind).set("placeholder", missing(TokenKind.IDENTIFIER, placeholder)).build();
    }

    private static String fixedText(TokenKind kind) {
        String text = kind.getDefaultText();
        if (text == null) {
            throw new IllegalArgumentException(kind + " has no fixed text");
        }
        return text;
    }

    // ---- red tree ----

    @NotNull
    public static SyntaxNode root(@NotNull RawSyntax raw) {
        return SyntaxNode.makeRoot(raw);
    }

    @NotNull
    public static SyntaxNode root(@NotNull Layout layout) {
        return SyntaxNode.makeRoot(layout.build());
    }

    /**
     * All nodes of {@code kind} under {@code root}, including {@code root}, in pre-order.
     */
    @NotNull
    public static List<SyntaxNode> findAll(@NotNull SyntaxNode root, @NotNull SyntaxKind kind) {
        List<SyntaxNode> result = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.is(kind)) {
                result.add(node);
            }
            List<SyntaxNode> children = node.getChildren(SyntaxViewMode.ALL);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * @throws AssertionError if there is no node of {@code kind}
     */
    @NotNull
    public static SyntaxNode find(@NotNull SyntaxNode root, @NotNull SyntaxKind kind) {
        List<SyntaxNode> found = findAll(root, kind);
        if (found.isEmpty()) {
            throw new AssertionError("No " + kind + " in " + root);
        }
        return found.get(0);
    }

    /**
     * The first token, present or missing, spelled {@code text}.
     *
     * @throws AssertionError if there is none
     */
    @NotNull
    public static TokenSyntax findToken(@NotNull SyntaxNode root, @NotNull String text) {
        for (TokenSyntax token : root.getTokens(SyntaxViewMode.ALL)) {
            if (token.getText().equals(text)) {
                return token;
            }
        }
        throw new AssertionError("No token '" + text + "' in " + root);
    }
}
