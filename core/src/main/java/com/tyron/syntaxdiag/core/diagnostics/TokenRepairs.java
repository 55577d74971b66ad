package com.tyron.syntaxdiag.core.diagnostics;

import com.tyron.syntaxdiag.api.diagnostics.DiagnosticMessage;
import com.tyron.syntaxdiag.api.diagnostics.FixIt;
import com.tyron.syntaxdiag.api.diagnostics.FixItMessage;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.SyntaxViewMode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.Trivia;
import com.tyron.syntaxdiag.api.syntax.UnexpectedNodesSyntax;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserFixIts;
import com.tyron.syntaxdiag.core.diagnostics.messages.ParserMessages;
import com.tyron.syntaxdiag.core.diagnostics.messages.StaticParserFixIt;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reusable repairs for tokens the parser found in the wrong place.
 */
public final class TokenRepairs {

    private TokenRepairs() {
    }

    /**
     * If {@code unexpected} consists only of present tokens satisfying {@code condition}, reports them as
     * misplaced. The fix-it removes them and inserts those {@code correctTokens} that are missing.
     * <p>
     * When a single misplaced token sits right next to the single missing token that replaces it, its trivia is
     * moved over so the source keeps its spacing. A fix-it is only offered when something is actually moved;
     * if all correct tokens are already present, {@code removeRedundantFixIt} (if any) offers to drop the
     * misplaced ones instead. {@code null} entries of {@code correctTokens} are ignored.
     */
    public static void exchangeTokens(@NotNull DiagnosticContext context,
                                      @Nullable UnexpectedNodesSyntax unexpected,
                                      @NotNull Predicate<TokenSyntax> condition,
                                      @NotNull List<TokenSyntax> correctTokens,
                                      @NotNull Function<List<TokenSyntax>, DiagnosticMessage> message,
                                      @NotNull Function<List<TokenSyntax>, FixItMessage> moveFixIt,
                                      @Nullable Function<List<TokenSyntax>, FixItMessage> removeRedundantFixIt) {
        if (unexpected == null) {
            return;
        }
        List<TokenSyntax> misplacedTokens = unexpected.onlyPresentTokens(condition);
        if (misplacedTokens == null) {
            return;
        }

        List<TokenSyntax> correct = new ArrayList<>();
        for (TokenSyntax token : correctTokens) {
            if (token != null) {
                correct.add(token);
            }
        }
        List<TokenSyntax> correctAndMissing = new ArrayList<>();
        for (TokenSyntax token : correct) {
            if (token.isMissing()) {
                correctAndMissing.add(token);
            }
        }

        List<FixIt.Change> changes = new ArrayList<>();
        if (misplacedTokens.size() == 1 && correct.size() == 1
                && correct.get(0).isMissing()
                && isAdjacent(misplacedTokens.get(0), correct.get(0))) {
            TokenSyntax misplaced = misplacedTokens.get(0);
            changes.add(FixIt.makeMissing(misplaced, false));
            changes.add(FixIt.makePresent(correct.get(0),
                    emptyToNull(misplaced.getLeadingTrivia()),
                    emptyToNull(misplaced.getTrailingTrivia())));
        } else {
            changes.addAll(FixIt.makeMissing(misplacedTokens));
            for (TokenSyntax token : correctAndMissing) {
                changes.add(FixIt.makePresent(token));
            }
        }

        List<FixIt> fixIts = new ArrayList<>();
        if (changes.size() > 1) {
            fixIts.add(new FixIt(moveFixIt.apply(misplacedTokens), changes));
        } else if (!correct.isEmpty() && removeRedundantFixIt != null) {
            FixItMessage removeMessage = removeRedundantFixIt.apply(misplacedTokens);
            if (removeMessage != null) {
                fixIts.add(new FixIt(removeMessage, changes));
            }
        }

        context.report(unexpected, message.apply(misplacedTokens))
                .fixIts(fixIts)
                .handles(unexpected)
                .handles(correctAndMissing)
                .emit();
    }

    public static void exchangeTokens(@NotNull DiagnosticContext context,
                                      @Nullable UnexpectedNodesSyntax unexpected,
                                      @NotNull Predicate<TokenSyntax> condition,
                                      @NotNull List<TokenSyntax> correctTokens,
                                      @NotNull Function<List<TokenSyntax>, DiagnosticMessage> message,
                                      @NotNull Function<List<TokenSyntax>, FixItMessage> moveFixIt) {
        exchangeTokens(context, unexpected, condition, correctTokens, message, moveFixIt, null);
    }

    /**
     * If {@code unexpected} is a single present token satisfying {@code predicate}, reports it with a fix-it
     * removing the whole cluster.
     */
    public static void removeToken(@NotNull DiagnosticContext context,
                                   @Nullable UnexpectedNodesSyntax unexpected,
                                   @NotNull Predicate<TokenSyntax> predicate,
                                   @NotNull Function<TokenSyntax, DiagnosticMessage> message) {
        if (unexpected == null) {
            return;
        }
        TokenSyntax misplaced = unexpected.onlyPresentToken(predicate);
        if (misplaced == null) {
            return;
        }
        context.report(unexpected, message.apply(misplaced))
                .fixIt(new FixIt(ParserFixIts.removeNodes(unexpected), FixIt.makeMissing(unexpected)))
                .handles(unexpected)
                .emit();
    }

    /**
     * Handles a token written with whitespace after it where none is allowed, e.g. {@code # foo} for
     * {@code #foo}: {@code unexpectedBefore} holds the written token, {@code token} is its missing counterpart.
     * If the token after {@code token} is missing too, that token is reported instead, at the end of the
     * written token, with the whitespace repair folded into its fix-it.
     */
    public static void handleExtraneousWhitespace(@NotNull DiagnosticContext context,
                                                  @Nullable UnexpectedNodesSyntax unexpectedBefore,
                                                  @Nullable TokenSyntax token) {
        if (unexpectedBefore == null || token == null) {
            return;
        }
        TokenSyntax written = unexpectedBefore.onlyPresentToken(t -> t.getTokenKind() == token.getTokenKind());
        if (written == null || written.getTrailingTrivia().isEmpty() || !token.isMissing()) {
            return;
        }
        // trivia is the problem here, so it is not transferred
        List<FixIt.Change> changes = List.of(
                FixIt.makeMissing(written, false),
                FixIt.makePresent(token, written.getLeadingTrivia(), null));

        TokenSyntax nextToken = token.nextToken(SyntaxViewMode.ALL);
        if (nextToken != null && nextToken.isMissing()) {
            MissingNodeDiagnostics.handleMissingSyntax(context, nextToken,
                    written.getEndPositionBeforeTrailingTrivia(), changes, List.of(unexpectedBefore, token));
        } else {
            context.report(token, ParserMessages.extraneousWhitespace(written))
                    .position(written.getEndPositionBeforeTrailingTrivia())
                    .fixIt(new FixIt(StaticParserFixIt.REMOVE_EXTRANEOUS_WHITESPACE, changes))
                    .handles(token, unexpectedBefore)
                    .emit();
        }
    }

    private static boolean isAdjacent(TokenSyntax misplaced, TokenSyntax correct) {
        SyntaxNode next = misplaced.nextToken(SyntaxViewMode.ALL);
        SyntaxNode previous = misplaced.previousToken(SyntaxViewMode.ALL);
        return correct.equals(next) || correct.equals(previous);
    }

    @Nullable
    private static Trivia emptyToNull(Trivia trivia) {
        return trivia.isEmpty() ? null : trivia;
    }
}
