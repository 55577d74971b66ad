package com.tyron.syntaxdiag.testFramework;

import com.tyron.syntaxdiag.api.diagnostics.Diagnostic;
import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.syntax.SyntaxIdentifier;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.Trivia;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Renders the source text a tree would have after applying a fix-it.
 * <p>
 * Tokens made present without explicit trivia are separated by a single space from a neighbouring word,
 * so {@code async} inserted before {@code throws} renders as {@code async throws}.
 */
public final class FixItApplier {

    private final SyntaxNode tree;

    private final Map<SyntaxIdentifier, Boolean> removed = new HashMap<>();
    private final Set<SyntaxIdentifier> madePresent = new HashSet<>();
    private final Map<SyntaxIdentifier, Trivia> leadingOverrides = new HashMap<>();
    private final Map<SyntaxIdentifier, Trivia> trailingOverrides = new HashMap<>();
    private final Map<SyntaxIdentifier, SyntaxNode> replacements = new HashMap<>();

    private final List<Piece> pieces = new ArrayList<>();
    private Trivia pendingTrivia = Trivia.EMPTY;

    private FixItApplier(SyntaxNode tree) {
        this.tree = tree;
    }

    /**
     * The source of {@code tree} with the first fix-it of {@code diagnostic} applied.
     *
     * @throws AssertionError if the diagnostic has no fix-it
     */
    @NotNull
    public static String applyFirst(@NotNull Diagnostic diagnostic, @NotNull SyntaxNode tree) {
        if (diagnostic.getFixIts().isEmpty()) {
            throw new AssertionError("Diagnostic has no fix-it: " + diagnostic.getMessage());
        }
        return apply(diagnostic.getFixIts().get(0), tree);
    }

    @NotNull
    public static String apply(@NotNull FixIt fixIt, @NotNull SyntaxNode tree) {
        Objects.requireNonNull(fixIt, "fixIt");
        FixItApplier applier = new FixItApplier(Objects.requireNonNull(tree, "tree"));
        for (FixIt.Change change : fixIt.getChanges()) {
            applier.record(change);
        }
        return applier.render();
    }

    private void record(FixIt.Change change) {
        if (change instanceof FixIt.MakeMissing) {
            FixIt.MakeMissing makeMissing = (FixIt.MakeMissing) change;
            for (TokenSyntax token : makeMissing.node().getTokens(SyntaxViewMode.SOURCE_ACCURATE)) {
                removed.put(token.getId(), makeMissing.transferTrivia());
            }
        } else if (change instanceof FixIt.MakePresent) {
            FixIt.MakePresent makePresent = (FixIt.MakePresent) change;
            List<TokenSyntax> tokens = makePresent.node().getTokens(SyntaxViewMode.ALL);
            for (TokenSyntax token : tokens) {
                if (token.isMissing()) {
                    madePresent.add(token.getId());
                }
            }
            if (!tokens.isEmpty()) {
                if (makePresent.leadingTrivia() != null) {
                    leadingOverrides.put(tokens.get(0).getId(), makePresent.leadingTrivia());
                }
                if (makePresent.trailingTrivia() != null) {
                    trailingOverrides.put(tokens.get(tokens.size() - 1).getId(), makePresent.trailingTrivia());
                }
            }
        } else if (change instanceof FixIt.Replace) {
            FixIt.Replace replace = (FixIt.Replace) change;
            replacements.put(replace.oldNode().getId(), replace.newNode());
        } else if (change instanceof FixIt.ReplaceTrailingTrivia) {
            FixIt.ReplaceTrailingTrivia replaceTrivia = (FixIt.ReplaceTrailingTrivia) change;
            trailingOverrides.put(replaceTrivia.token().getId(), replaceTrivia.newTrivia());
        } else {
            throw new IllegalArgumentException("Unknown change " + change);
        }
    }

    private String render() {
        visit(tree);
        flushPendingTrivia();
        StringBuilder out = new StringBuilder();
        Piece previous = null;
        for (Piece piece : pieces) {
            if (previous != null && (previous.inserted || piece.inserted) && needsSpace(previous, piece)) {
                out.append(' ');
            }
            out.append(piece.leading.getText()).append(piece.text).append(piece.trailing.getText());
            previous = piece;
        }
        return out.toString();
    }

    private void visit(SyntaxNode node) {
        SyntaxNode replacement = replacements.get(node.getId());
        if (replacement != null) {
            for (TokenSyntax token : replacement.getTokens(SyntaxViewMode.SOURCE_ACCURATE)) {
                add(new Piece(token, token.getLeadingTrivia(), token.getTrailingTrivia(), true));
            }
            return;
        }
        TokenSyntax token = node.as(TokenSyntax.class);
        if (token == null) {
            for (SyntaxNode child : node.getChildren(SyntaxViewMode.ALL)) {
                visit(child);
            }
            return;
        }

        SyntaxIdentifier id = token.getId();
        Boolean transferTrivia = removed.get(id);
        if (transferTrivia != null) {
            if (transferTrivia) {
                pendingTrivia = pendingTrivia.merging(token.getLeadingTrivia().merging(token.getTrailingTrivia()));
            }
            return;
        }
        boolean inserted = token.isMissing() && madePresent.contains(id);
        if (token.isMissing() && !inserted) {
            return;
        }
        Trivia leading = leadingOverrides.getOrDefault(id, token.getLeadingTrivia());
        Trivia trailing = trailingOverrides.getOrDefault(id, token.getTrailingTrivia());
        add(new Piece(token, leading, trailing, inserted));
    }

    /**
     * Trivia of removed tokens goes to a token inserted in their place, otherwise to the token before them.
     */
    private void add(Piece piece) {
        if (!pendingTrivia.isEmpty() && piece.inserted && piece.trailing.isEmpty()) {
            piece.trailing = pendingTrivia;
            pendingTrivia = Trivia.EMPTY;
        } else {
            flushPendingTrivia();
        }
        pieces.add(piece);
    }

    private void flushPendingTrivia() {
        Trivia trivia = pendingTrivia;
        pendingTrivia = Trivia.EMPTY;
        if (trivia.isEmpty() || pieces.isEmpty()) {
            return;
        }
        Piece previous = pieces.get(pieces.size() - 1);
        // punctuation keeps its own spacing
        if (previous.token.getTokenKind().isPunctuation() && trivia.isSpacesOrTabs()) {
            return;
        }
        previous.trailing = previous.trailing.merging(trivia);
    }

    private static boolean needsSpace(Piece previous, Piece next) {
        if (!previous.trailing.isEmpty() || !next.leading.isEmpty()) {
            return false;
        }
        if (previous.text.isEmpty() || next.text.isEmpty()) {
            return false;
        }
        return isWordChar(previous.text.charAt(previous.text.length() - 1)) && isWordChar(next.text.charAt(0));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static final class Piece {
        final TokenSyntax token;
        final String text;
        final Trivia leading;
        Trivia trailing;
        final boolean inserted;

        Piece(TokenSyntax token, Trivia leading, Trivia trailing, boolean inserted) {
            this.token = token;
            this.text = token.getText();
            this.leading = leading;
            this.trailing = trailing;
            this.inserted = inserted;
        }
    }
}
