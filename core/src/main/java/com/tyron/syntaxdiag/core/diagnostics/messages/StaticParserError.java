package com.tyron.syntaxdiag.core.diagnostics.messages;

import com.tyron.syntaxdiag.api.diagnostics.DiagnosticMessage;
import com.tyron.syntaxdiag.api.diagnostics.DiagnosticSeverity;
import org.jetbrains.annotations.NotNull;

/**
 * Parser errors whose text does not depend on the offending source.
 */
public enum StaticParserError implements DiagnosticMessage {
    ALL_STATEMENTS_IN_SWITCH_MUST_BE_COVERED_BY_CASE("all statements inside a switch must be covered by a 'case' or 'default' label"),
    ASSOCIATED_TYPE_CANNOT_USE_PACK("associated types cannot be variadic"),
    CAN_IMPORT_WRONG_NUMBER_OF_PARAMETERS("#canImport can take only two parameters"),
    CAN_IMPORT_WRONG_SECOND_PARAMETER_LABEL("2nd parameter of canImport should be labeled as _version or _underlyingVersion"),
    CASE_OUTSIDE_OF_SWITCH_OR_ENUM("'case' can only appear inside a 'switch' statement or 'enum' declaration"),
    CLASS_CONSTRAINT_CAN_ONLY_BE_USED_IN_PROTOCOL("'class' constraint can only appear on protocol declarations"),
    CONSECUTIVE_DECLARATIONS_ON_SAME_LINE("consecutive declarations on a line must be separated by ';'"),
    CONSECUTIVE_STATEMENTS_ON_SAME_LINE("consecutive statements on a line must be separated by ';'"),
    C_STYLE_FOR_LOOP("C-style for statement is not allowed, use a for-in loop over a range instead"),
    DEFAULT_CANNOT_BE_USED_WITH_WHERE("'default' cannot be used with a 'where' guard expression"),
    DEFAULT_OUTSIDE_OF_SWITCH("'default' label can only appear inside a 'switch' statement"),
    DEINIT_CANNOT_HAVE_NAME("deinitializers cannot have a name"),
    DEINIT_CANNOT_HAVE_PARAMETERS("deinitializers cannot have parameters"),
    DEINIT_CANNOT_THROW("deinitializers cannot throw"),
    EDITOR_PLACEHOLDER_IN_SOURCE_FILE("editor placeholder in source file"),
    ESCAPED_NEWLINE_AT_LAST_LINE_OF_MULTILINE_STRING_LITERAL("escaped newline at the last line of a multi-line string literal is not allowed"),
    EXPECTED_ASSIGNMENT_INSTEAD_OF_COMPARISON_OPERATOR("expected '=' instead of '==' to assign default value for parameter"),
    EXPECTED_COLON_CLASS("expected ':' to begin inheritance clause"),
    EXPECTED_COMMA_IN_WHERE_CLAUSE("expected ',' to separate the requirements of this 'where' clause"),
    EXPECTED_EXPRESSION_AFTER_TRY("expected expression after 'try'"),
    EXPECTED_LEFT_BRACE_OR_IF_AFTER_ELSE("expected '{' or 'if' after 'else'"),
    EXPECTED_SEQUENCE_EXPRESSION_IN_FOR_EACH_LOOP("expected Sequence expression for for-each loop"),
    EXTRA_RIGHT_BRACKET("unexpected ']' in type; did you mean to write an array type?"),
    INITIALIZER_CANNOT_HAVE_NAME("initializers cannot have a name"),
    INITIALIZER_CANNOT_HAVE_RESULT_TYPE("initializers cannot have a result type"),
    INITIALIZER_IN_PATTERN("unexpected initializer in pattern; did you mean to use '='?"),
    INVALID_FLAG_AFTER_PRECEDENCE_GROUP_ASSIGNMENT("expected 'true' or 'false' after 'assignment'"),
    INVALID_PRECEDENCE_GROUP_ASSOCIATIVITY("expected 'none', 'left', or 'right' after 'associativity'"),
    JOIN_CONDITIONS_USING_COMMA("expected ',' joining parts of a multi-clause condition"),
    JOIN_PLATFORMS_USING_COMMA("expected ',' joining platforms in availability condition"),
    MAXIMUM_NESTING_LEVEL_OVERFLOW("parsing has exceeded the maximum nesting level"),
    MISSING_COLON_AND_EXPR_IN_TERNARY_EXPR("expected ':' and expression after '? ...' in ternary expression"),
    MISSING_COLON_IN_TERNARY_EXPR("expected ':' after '? ...' in ternary expression"),
    MISSING_CONFORMANCE_REQUIREMENT("expected ':' or '==' to indicate a conformance or same-type requirement"),
    MISSING_FIXITY_IN_OPERATOR_DECLARATION("operator must be declared as 'prefix', 'postfix', or 'infix'"),
    MISSPELLED_ASYNC("expected async specifier; did you mean 'async'?"),
    MISSPELLED_THROWS("expected throwing specifier; did you mean 'throws'?"),
    OPERATOR_SHOULD_BE_DECLARED_WITHOUT_BODY("operator should not be declared with body"),
    SINGLE_QUOTE_STRING_LITERAL("single-quoted string literal found, use '\"'"),
    STANDALONE_SEMICOLON_STATEMENT("standalone ';' statements are not allowed"),
    STRING_LITERAL_AT_SIGN("string literals are not preceded by an '@' sign"),
    SUBSCRIPTS_CANNOT_HAVE_NAMES("subscripts cannot have a name"),
    TRY_MUST_BE_PLACED_ON_RETURNED_EXPR("'try' must be placed on the returned expression"),
    TRY_MUST_BE_PLACED_ON_THROWN_EXPR("'try' must be placed on the thrown expression"),
    TRY_ON_INITIAL_VALUE_EXPRESSION("'try' must be placed on the initial value expression"),
    TYPE_PARAMETER_PACK_ELLIPSIS("ellipsis operator cannot be used with a type parameter pack"),
    UNEXPECTED_POUND_ELSE_SPACE_IF("unexpected space in '#else if'"),
    UNEXPECTED_SEMICOLON("unexpected ';' separator"),
    VERSION_COMPARISON_NOT_NEEDED("version comparison not needed");

    private final String message;

    StaticParserError(String message) {
        this.message = message;
    }

    @NotNull
    @Override
    public String getMessage() {
        return message;
    }

    @NotNull
    @Override
    public String getDiagnosticId() {
        return name();
    }

    @NotNull
    @Override
    public DiagnosticSeverity getSeverity() {
        return DiagnosticSeverity.ERROR;
    }
}
