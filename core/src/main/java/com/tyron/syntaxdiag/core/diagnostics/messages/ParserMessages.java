package com.tyron.syntaxdiag.core.diagnostics.messages;

import com.tyron.syntaxdiag.api.diagnostics.DiagnosticMessage;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticSeverity;
import com.tyron.syntaxdiag.api.diagnostics.NoteMessage;
import com.tyron.syntaxdiag.api.syntax.SyntaxNode;
import com.tyron.syntaxdiag.api.syntax.TokenSyntax;
import com.tyron.syntaxdiag.api.syntax.UnexpectedNodesSyntax;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static com.tyron.syntaxdiag.core.diagnostics.messages.NodesDescription.describe;
import static com.tyron.syntaxdiag.core.diagnostics.messages.NodesDescription.quote;

/**
 * Parser errors and notes whose text is built from the nodes involved.
 */
public final class ParserMessages {

    private ParserMessages() {
    }

    record Message(String diagnosticId, String message, DiagnosticSeverity severity) implements DiagnosticMessage {
        @NotNull
        @Override
        public String getMessage() {
            return message;
        }

        @NotNull
        @Override
        public String getDiagnosticId() {
            return diagnosticId;
        }

        @NotNull
        @Override
        public DiagnosticSeverity getSeverity() {
            return severity;
        }
    }

    record Note(String noteId, String message) implements NoteMessage {
        @NotNull
        @Override
        public String getMessage() {
            return message;
        }

        @NotNull
        @Override
        public String getNoteId() {
            return noteId;
        }
    }

    private static DiagnosticMessage error(String id, String message) {
        return new Message(id, message, DiagnosticSeverity.ERROR);
    }

    // ---- generic ----

    @NotNull
    public static DiagnosticMessage unexpectedNodes(@NotNull UnexpectedNodesSyntax unexpected) {
        return error("UNEXPECTED_NODES",
                "unexpected " + NodesDescription.shortSingleLineContent(unexpected)
                        + NodesDescription.unexpectedContext(unexpected));
    }

    @NotNull
    public static DiagnosticMessage extraneousCodeAtTopLevel(@NotNull UnexpectedNodesSyntax extraneous) {
        return error("EXTRANEOUS_CODE_AT_TOP_LEVEL",
                "extraneous " + NodesDescription.shortSingleLineContent(extraneous) + " at top level");
    }

    @NotNull
    public static DiagnosticMessage tryCannotBeUsed(@NotNull TokenSyntax nextToken) {
        return error("TRY_CANNOT_BE_USED", "'try' cannot be used with " + quote(nextToken.getText()));
    }

    @NotNull
    public static DiagnosticMessage spaceSeparatedIdentifiers(@NotNull TokenSyntax firstToken) {
        String name = NodesDescription.nameOfClosestAncestorOrSelf(firstToken.getParent());
        if (name != null) {
            return error("SPACE_SEPARATED_IDENTIFIERS", "found an unexpected second identifier in " + name);
        }
        return error("SPACE_SEPARATED_IDENTIFIERS", "found an unexpected second identifier");
    }

    /**
     * {@code expected <nodes>} followed by where they were expected, e.g. {@code expected ')' in parameter clause}.
     */
    @NotNull
    public static DiagnosticMessage missingNodes(@NotNull List<? extends SyntaxNode> missingNodes) {
        if (missingNodes.isEmpty()) {
            throw new IllegalArgumentException("missingNodes is empty");
        }
        String context = NodesDescription.nameOfClosestAncestorOrSelf(missingNodes.get(0).getParent());
        String message = "expected " + describe(missingNodes);
        if (context != null) {
            message += " in " + context;
        }
        return error("MISSING_NODES", message);
    }

    // ---- effect specifiers ----

    @NotNull
    public static DiagnosticMessage effectsSpecifierAfterArrow(@NotNull List<TokenSyntax> specifiers) {
        return error("EFFECTS_SPECIFIER_AFTER_ARROW", describe(specifiers) + " must precede '->'");
    }

    @NotNull
    public static DiagnosticMessage asyncMustPrecedeThrows(@NotNull List<TokenSyntax> asyncKeywords,
                                                           @NotNull TokenSyntax throwsKeyword) {
        return error("ASYNC_MUST_PRECEDE_THROWS",
                describe(asyncKeywords) + " must precede " + quote(throwsKeyword.getText()));
    }

    @NotNull
    public static DiagnosticMessage duplicateEffectSpecifiers(@NotNull TokenSyntax duplicate) {
        return error("DUPLICATE_EFFECT_SPECIFIERS", quote(duplicate.getText()) + " has already been specified");
    }

    @NotNull
    public static NoteMessage effectSpecifierDeclaredHere(@NotNull TokenSyntax specifier) {
        return new Note("EFFECT_SPECIFIER_DECLARED_HERE", quote(specifier.getText()) + " declared here");
    }

    // ---- declarations ----

    @NotNull
    public static DiagnosticMessage missingAttributeArgument(@NotNull SyntaxNode attributeName) {
        return error("MISSING_ATTRIBUTE_ARGUMENT",
                "expected argument for '@" + attributeName.getTrimmedText() + "' attribute");
    }

    @NotNull
    public static DiagnosticMessage specifierOnParameterName(@NotNull List<TokenSyntax> misplacedSpecifiers) {
        return error("SPECIFIER_ON_PARAMETER_NAME",
                describe(misplacedSpecifiers) + " before a parameter name is not allowed");
    }

    @NotNull
    public static DiagnosticMessage identifierNotAllowedInOperatorName(@NotNull TokenSyntax identifier) {
        return error("IDENTIFIER_NOT_ALLOWED_IN_OPERATOR_NAME",
                quote(identifier.getText()) + " is considered an identifier and must not appear within an operator name");
    }

    @NotNull
    public static DiagnosticMessage tokensNotAllowedInOperatorName(@NotNull List<TokenSyntax> tokens) {
        return error("TOKENS_NOT_ALLOWED_IN_OPERATOR_NAME",
                describe(tokens) + " is not allowed in operator names");
    }

    // ---- expressions & statements ----

    @NotNull
    public static DiagnosticMessage unknownDirective(@NotNull UnexpectedNodesSyntax unexpected) {
        return error("UNKNOWN_DIRECTIVE", "use of unknown directive " + quote(unexpected.getTrimmedText()));
    }

    @NotNull
    public static DiagnosticMessage missingConditionInStatement(@NotNull SyntaxNode statement) {
        return error("MISSING_CONDITION_IN_STATEMENT", "missing condition in " + nameOf(statement));
    }

    @NotNull
    public static DiagnosticMessage missingExpressionInStatement(@NotNull SyntaxNode statement) {
        return error("MISSING_EXPRESSION_IN_STATEMENT", "expected expression in " + nameOf(statement));
    }

    @NotNull
    public static DiagnosticMessage invalidFloatLiteralMissingLeadingZero(@NotNull TokenSyntax decimalDigits) {
        String digits = decimalDigits.getText();
        return error("INVALID_FLOAT_LITERAL_MISSING_LEADING_ZERO",
                "'." + digits + "' is not a valid floating point literal; it must be written '0." + digits + "'");
    }

    @NotNull
    public static DiagnosticMessage missingBothStringQuotes(@NotNull SyntaxNode segments) {
        return error("MISSING_BOTH_STRING_QUOTES",
                "expected " + NodesDescription.shortSingleLineContent(segments) + " to be surrounded by '\"'");
    }

    // ---- availability & versions ----

    @NotNull
    public static DiagnosticMessage availabilityConditionAsExpression(@NotNull TokenSyntax availabilityToken,
                                                                      @NotNull TokenSyntax negatedAvailabilityToken) {
        return error("AVAILABILITY_CONDITION_AS_EXPRESSION",
                availabilityToken.getText() + " cannot be used as an expression, did you mean to use "
                        + quote(negatedAvailabilityToken.getText()) + "?");
    }

    @NotNull
    public static DiagnosticMessage negatedAvailabilityCondition(@NotNull SyntaxNode availabilityCondition,
                                                                 @NotNull TokenSyntax negatedAvailabilityToken) {
        return error("NEGATED_AVAILABILITY_CONDITION",
                quote(availabilityCondition.getTrimmedText()) + " cannot be negated, did you mean to use "
                        + quote(negatedAvailabilityToken.getText()) + "?");
    }

    @NotNull
    public static DiagnosticMessage availabilityConditionInExpression(@NotNull SyntaxNode availabilityCondition) {
        return error("AVAILABILITY_CONDITION_IN_EXPRESSION",
                quote(availabilityCondition.getTrimmedText())
                        + " cannot be used in an expression, only as a condition of 'if' or 'guard'");
    }

    @NotNull
    public static DiagnosticMessage cannotParseVersionTuple(@NotNull UnexpectedNodesSyntax versionTuple) {
        return error("CANNOT_PARSE_VERSION_TUPLE", "cannot parse version " + versionTuple.getTrimmedText());
    }

    @NotNull
    public static DiagnosticMessage trailingVersionAreIgnored(@NotNull TokenSyntax major, @NotNull SyntaxNode components) {
        return error("TRAILING_VERSION_ARE_IGNORED",
                "trailing components of version " + quote(major.getText() + components.getTrimmedText()) + " are ignored");
    }

    // ---- lexical ----

    @NotNull
    public static DiagnosticMessage extraneousWhitespace(@NotNull TokenSyntax tokenWithWhitespace) {
        return error("EXTRANEOUS_WHITESPACE",
                "extraneous whitespace after " + quote(tokenWithWhitespace.getText()) + " is not permitted");
    }

    @NotNull
    public static DiagnosticMessage insufficientIndentationInMultilineStringLiteral(int lineCount) {
        String lines = lineCount == 1 ? "line" : "next " + lineCount + " lines";
        return error("INSUFFICIENT_INDENTATION_IN_MULTILINE_STRING_LITERAL",
                "insufficient indentation of " + lines + " in multi-line string literal");
    }

    @NotNull
    public static NoteMessage shouldMatchIndentationOfClosingQuote(@NotNull String indentationKind) {
        return new Note("SHOULD_MATCH_INDENTATION_OF_CLOSING_QUOTE", "should match " + indentationKind + " here");
    }

    private static String nameOf(@Nullable SyntaxNode node) {
        String name = NodesDescription.nameOfClosestAncestorOrSelf(node);
        return name != null ? name : "statement";
    }
}
