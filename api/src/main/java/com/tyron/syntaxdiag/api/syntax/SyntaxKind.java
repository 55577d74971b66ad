package com.tyron.syntaxdiag.api.syntax;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The grammatical constructs of the tree.
 * <p>
 * A {@link Shape#LAYOUT} kind lists its named children. Every layout is interleaved with
 * unexpected-node slots, so {@code (asyncSpecifier, throwsSpecifier)} becomes
 * {@code unexpectedBeforeAsyncSpecifier, asyncSpecifier, unexpectedBetweenAsyncSpecifierAndThrowsSpecifier,
 * throwsSpecifier, unexpectedAfterThrowsSpecifier}.
 * {@link Shape#COLLECTION} kinds hold any number of elements.
 */
public enum SyntaxKind {
    ACCESSOR_EFFECT_SPECIFIERS(Shape.LAYOUT, Category.OTHER, "effect specifiers", "asyncSpecifier", "throwsSpecifier"),
    ARRAY_TYPE(Shape.LAYOUT, Category.TYPE, "array type", "leftSquareBracket", "elementType", "rightSquareBracket"),
    ARROW_EXPR(Shape.LAYOUT, Category.EXPR, null, "effectSpecifiers", "arrowToken"),
    ASSOCIATEDTYPE_DECL(Shape.LAYOUT, Category.DECL, "associatedtype declaration",
            "attributes", "modifiers", "associatedtypeKeyword", "identifier", "inheritanceClause", "initializer", "genericWhereClause"),
    ATTRIBUTE(Shape.LAYOUT, Category.OTHER, "attribute", "atSignToken", "attributeName", "leftParen", "argument", "rightParen"),
    ATTRIBUTE_LIST(Shape.COLLECTION, Category.OTHER, null),
    ATTRIBUTED_TYPE(Shape.LAYOUT, Category.TYPE, null, "specifier", "attributes", "baseType"),
    AVAILABILITY_ARGUMENT(Shape.LAYOUT, Category.OTHER, null, "entry", "trailingComma"),
    AVAILABILITY_CONDITION(Shape.LAYOUT, Category.OTHER, "availability condition",
            "availabilityKeyword", "leftParen", "availabilitySpec", "rightParen"),
    AVAILABILITY_SPEC_LIST(Shape.COLLECTION, Category.OTHER, null),
    AVAILABILITY_VERSION_RESTRICTION(Shape.LAYOUT, Category.OTHER, "version restriction", "platform", "version"),
    BINARY_OPERATOR_EXPR(Shape.LAYOUT, Category.EXPR, null, "operatorToken"),
    BOOLEAN_LITERAL_EXPR(Shape.LAYOUT, Category.EXPR, null, "booleanLiteral"),
    CAN_IMPORT_EXPR(Shape.LAYOUT, Category.EXPR, "'canImport' expression",
            "canImportKeyword", "leftParen", "importPath", "versionInfo", "rightParen"),
    CAN_IMPORT_VERSION_INFO(Shape.LAYOUT, Category.OTHER, null, "comma", "label", "colon", "versionTuple"),
    CLASS_DECL(Shape.LAYOUT, Category.DECL, "class",
            "attributes", "modifiers", "classKeyword", "identifier", "genericParameterClause", "inheritanceClause",
            "genericWhereClause", "memberBlock"),
    CLOSURE_EXPR(Shape.LAYOUT, Category.EXPR, "closure", "leftBrace", "signature", "statements", "rightBrace"),
    CLOSURE_SIGNATURE(Shape.LAYOUT, Category.OTHER, "closure signature",
            "attributes", "capture", "input", "effectSpecifiers", "output", "inTok"),
    CODE_BLOCK(Shape.LAYOUT, Category.OTHER, "code block", "leftBrace", "statements", "rightBrace"),
    CODE_BLOCK_ITEM(Shape.LAYOUT, Category.OTHER, null, "item", "semicolon"),
    CODE_BLOCK_ITEM_LIST(Shape.COLLECTION, Category.OTHER, null),
    CONDITION_ELEMENT(Shape.LAYOUT, Category.OTHER, null, "condition", "trailingComma"),
    CONDITION_ELEMENT_LIST(Shape.COLLECTION, Category.OTHER, null),
    DECL_MODIFIER(Shape.LAYOUT, Category.OTHER, "modifier", "name", "detail"),
    DECL_MODIFIER_DETAIL(Shape.LAYOUT, Category.OTHER, null, "leftParen", "detail", "rightParen"),
    DEINITIALIZER_DECL(Shape.LAYOUT, Category.DECL, "deinitializer",
            "attributes", "modifiers", "deinitKeyword", "asyncKeyword", "body"),
    EDITOR_PLACEHOLDER_EXPR(Shape.LAYOUT, Category.EXPR, null, "identifier"),
    EXPR_LIST(Shape.COLLECTION, Category.OTHER, null),
    FLOAT_LITERAL_EXPR(Shape.LAYOUT, Category.EXPR, "floating literal", "floatingDigits"),
    FOR_IN_STMT(Shape.LAYOUT, Category.STMT, "'for' statement",
            "forKeyword", "tryKeyword", "awaitKeyword", "caseKeyword", "pattern", "typeAnnotation", "inKeyword",
            "sequenceExpr", "whereClause", "body"),
    FUNCTION_DECL(Shape.LAYOUT, Category.DECL, "function",
            "attributes", "modifiers", "funcKeyword", "identifier", "genericParameterClause", "signature",
            "genericWhereClause", "body"),
    FUNCTION_EFFECT_SPECIFIERS(Shape.LAYOUT, Category.OTHER, "effect specifiers", "asyncSpecifier", "throwsSpecifier"),
    FUNCTION_PARAMETER(Shape.LAYOUT, Category.OTHER, "parameter",
            "attributes", "modifiers", "firstName", "secondName", "colon", "type", "ellipsis", "defaultArgument",
            "trailingComma"),
    FUNCTION_PARAMETER_LIST(Shape.COLLECTION, Category.OTHER, null),
    FUNCTION_SIGNATURE(Shape.LAYOUT, Category.OTHER, "function signature", "input", "effectSpecifiers", "output"),
    FUNCTION_TYPE(Shape.LAYOUT, Category.TYPE, "function type",
            "leftParen", "arguments", "rightParen", "effectSpecifiers", "output"),
    GENERIC_PARAMETER(Shape.LAYOUT, Category.OTHER, "generic parameter",
            "attributes", "each", "name", "colon", "inheritedType", "trailingComma"),
    GENERIC_PARAMETER_CLAUSE(Shape.LAYOUT, Category.OTHER, "generic parameter clause",
            "leftAngleBracket", "genericParameterList", "rightAngleBracket"),
    GENERIC_PARAMETER_LIST(Shape.COLLECTION, Category.OTHER, null),
    GENERIC_REQUIREMENT(Shape.LAYOUT, Category.OTHER, null, "body", "trailingComma"),
    GENERIC_REQUIREMENT_LIST(Shape.COLLECTION, Category.OTHER, null),
    GENERIC_WHERE_CLAUSE(Shape.LAYOUT, Category.OTHER, "'where' clause", "whereKeyword", "requirementList"),
    IDENTIFIER_EXPR(Shape.LAYOUT, Category.EXPR, null, "identifier", "declNameArguments"),
    IDENTIFIER_PATTERN(Shape.LAYOUT, Category.PATTERN, null, "identifier"),
    IF_CONFIG_CLAUSE(Shape.LAYOUT, Category.OTHER, "conditional compilation clause", "poundKeyword", "condition", "elements"),
    IF_CONFIG_CLAUSE_LIST(Shape.COLLECTION, Category.OTHER, null),
    IF_CONFIG_DECL(Shape.LAYOUT, Category.DECL, "conditional compilation block", "clauses", "poundEndif"),
    IF_EXPR(Shape.LAYOUT, Category.EXPR, "'if' statement", "ifKeyword", "conditions", "body", "elseKeyword", "elseBody"),
    INHERITED_TYPE(Shape.LAYOUT, Category.OTHER, null, "typeName", "trailingComma"),
    INHERITED_TYPE_LIST(Shape.COLLECTION, Category.OTHER, null),
    INITIALIZER_CLAUSE(Shape.LAYOUT, Category.OTHER, null, "equal", "value"),
    INITIALIZER_DECL(Shape.LAYOUT, Category.DECL, "initializer",
            "attributes", "modifiers", "initKeyword", "optionalMark", "genericParameterClause", "signature",
            "genericWhereClause", "body"),
    INTEGER_LITERAL_EXPR(Shape.LAYOUT, Category.EXPR, null, "digits"),
    MACRO_EXPANSION_DECL(Shape.LAYOUT, Category.DECL, "macro expansion",
            "attributes", "modifiers", "poundToken", "macro", "leftParen", "argumentList", "rightParen"),
    MACRO_EXPANSION_EXPR(Shape.LAYOUT, Category.EXPR, "macro expansion",
            "poundToken", "macro", "leftParen", "argumentList", "rightParen"),
    MEMBER_DECL_BLOCK(Shape.LAYOUT, Category.OTHER, "member block", "leftBrace", "members", "rightBrace"),
    MEMBER_DECL_LIST(Shape.COLLECTION, Category.OTHER, null),
    MEMBER_DECL_LIST_ITEM(Shape.LAYOUT, Category.OTHER, null, "decl", "semicolon"),
    MISSING(Shape.LAYOUT, Category.OTHER, null, "placeholder"),
    MISSING_DECL(Shape.LAYOUT, Category.DECL, null, "attributes", "modifiers", "placeholder"),
    MISSING_EXPR(Shape.LAYOUT, Category.EXPR, null, "placeholder"),
    MISSING_PATTERN(Shape.LAYOUT, Category.PATTERN, null, "placeholder"),
    MISSING_STMT(Shape.LAYOUT, Category.STMT, null, "placeholder"),
    MISSING_TYPE(Shape.LAYOUT, Category.TYPE, null, "placeholder"),
    MODIFIER_LIST(Shape.COLLECTION, Category.OTHER, null),
    OPERATOR_DECL(Shape.LAYOUT, Category.DECL, "operator declaration",
            "fixity", "operatorKeyword", "identifier", "operatorPrecedenceAndTypes"),
    OPERATOR_PRECEDENCE_AND_TYPES(Shape.LAYOUT, Category.OTHER, null, "colon", "precedenceGroup"),
    ORIGINALLY_DEFINED_IN_ARGUMENTS(Shape.LAYOUT, Category.OTHER, "@_originallyDefinedIn arguments",
            "moduleLabel", "colon", "moduleName", "comma", "platforms"),
    PARAMETER_CLAUSE(Shape.LAYOUT, Category.OTHER, "parameter clause", "leftParen", "parameterList", "rightParen"),
    PATTERN_BINDING(Shape.LAYOUT, Category.OTHER, null, "pattern", "typeAnnotation", "initializer", "accessor", "trailingComma"),
    PATTERN_BINDING_LIST(Shape.COLLECTION, Category.OTHER, null),
    PRECEDENCE_GROUP_ASSIGNMENT(Shape.LAYOUT, Category.OTHER, "'assignment' property of precedencegroup",
            "assignmentKeyword", "colon", "flag"),
    PRECEDENCE_GROUP_ASSOCIATIVITY(Shape.LAYOUT, Category.OTHER, "'associativity' property of precedencegroup",
            "associativityKeyword", "colon", "value"),
    PRECEDENCE_GROUP_ATTRIBUTE_LIST(Shape.COLLECTION, Category.OTHER, null),
    PREFIX_OPERATOR_EXPR(Shape.LAYOUT, Category.EXPR, null, "operatorToken", "postfixExpression"),
    RETURN_CLAUSE(Shape.LAYOUT, Category.OTHER, "return clause", "arrow", "returnType"),
    RETURN_STMT(Shape.LAYOUT, Category.STMT, "'return' statement", "returnKeyword", "expression"),
    SAME_TYPE_REQUIREMENT(Shape.LAYOUT, Category.OTHER, "same type requirement",
            "leftTypeIdentifier", "equalityToken", "rightTypeIdentifier"),
    SEQUENCE_EXPR(Shape.LAYOUT, Category.EXPR, null, "elements"),
    SIMPLE_TYPE_IDENTIFIER(Shape.LAYOUT, Category.TYPE, null, "name", "genericArgumentClause"),
    SOURCE_FILE(Shape.LAYOUT, Category.OTHER, "source file", "statements", "eofToken"),
    STRING_LITERAL_EXPR(Shape.LAYOUT, Category.EXPR, "string literal",
            "openDelimiter", "openQuote", "segments", "closeQuote", "closeDelimiter"),
    STRING_LITERAL_SEGMENTS(Shape.COLLECTION, Category.OTHER, null),
    STRING_SEGMENT(Shape.LAYOUT, Category.OTHER, null, "content"),
    SUBSCRIPT_DECL(Shape.LAYOUT, Category.DECL, "subscript",
            "attributes", "modifiers", "subscriptKeyword", "genericParameterClause", "indices", "result",
            "genericWhereClause", "accessor"),
    SWITCH_CASE(Shape.LAYOUT, Category.OTHER, "switch case", "unknownAttr", "label", "statements"),
    SWITCH_CASE_LABEL(Shape.LAYOUT, Category.OTHER, null, "caseKeyword", "caseItems", "colon"),
    SWITCH_CASE_LIST(Shape.COLLECTION, Category.OTHER, null),
    SWITCH_DEFAULT_LABEL(Shape.LAYOUT, Category.OTHER, null, "defaultKeyword", "colon"),
    SWITCH_EXPR(Shape.LAYOUT, Category.EXPR, "'switch' statement", "switchKeyword", "expression", "leftBrace", "cases", "rightBrace"),
    THROW_STMT(Shape.LAYOUT, Category.STMT, "'throw' statement", "throwKeyword", "expression"),
    TOKEN(Shape.TOKEN, Category.OTHER, null),
    TRY_EXPR(Shape.LAYOUT, Category.EXPR, "'try' expression", "tryKeyword", "questionOrExclamationMark", "expression"),
    TUPLE_TYPE_ELEMENT(Shape.LAYOUT, Category.OTHER, null,
            "inOut", "name", "secondName", "colon", "type", "ellipsis", "initializer", "trailingComma"),
    TUPLE_TYPE_ELEMENT_LIST(Shape.COLLECTION, Category.OTHER, null),
    TYPE_ANNOTATION(Shape.LAYOUT, Category.OTHER, "type annotation", "colon", "type"),
    TYPE_EFFECT_SPECIFIERS(Shape.LAYOUT, Category.OTHER, "effect specifiers", "asyncSpecifier", "throwsSpecifier"),
    TYPE_INHERITANCE_CLAUSE(Shape.LAYOUT, Category.OTHER, "inheritance clause", "colon", "inheritedTypeCollection"),
    TYPE_INITIALIZER_CLAUSE(Shape.LAYOUT, Category.OTHER, null, "equal", "value"),
    TYPEALIAS_DECL(Shape.LAYOUT, Category.DECL, "typealias declaration",
            "attributes", "modifiers", "typealiasKeyword", "identifier", "genericParameterClause", "initializer",
            "genericWhereClause"),
    UNAVAILABLE_FROM_ASYNC_ARGUMENTS(Shape.LAYOUT, Category.OTHER, "@_unavailableFromAsync argument",
            "messageLabel", "colon", "message"),
    UNEXPECTED_NODES(Shape.COLLECTION, Category.OTHER, null),
    UNRESOLVED_TERNARY_EXPR(Shape.LAYOUT, Category.EXPR, "ternary expression", "questionMark", "firstChoice", "colonMark"),
    VARIABLE_DECL(Shape.LAYOUT, Category.DECL, "variable", "attributes", "modifiers", "bindingKeyword", "bindings"),
    VERSION_COMPONENT(Shape.LAYOUT, Category.OTHER, null, "period", "number"),
    VERSION_COMPONENT_LIST(Shape.COLLECTION, Category.OTHER, null),
    VERSION_TUPLE(Shape.LAYOUT, Category.OTHER, "version tuple", "major", "components"),
    WHERE_CLAUSE(Shape.LAYOUT, Category.OTHER, "'where' clause", "whereKeyword", "guardResult"),
    WHILE_STMT(Shape.LAYOUT, Category.STMT, "'while' statement", "whileKeyword", "conditions", "body");

    public enum Shape {
        TOKEN,
        LAYOUT,
        COLLECTION
    }

    public enum Category {
        DECL,
        EXPR,
        STMT,
        TYPE,
        PATTERN,
        OTHER
    }

    private final Shape shape;
    private final Category category;
    private final String nameForDiagnostics;
    private final List<String> children;
    private final List<String> slots;
    private final Map<String, Integer> slotIndex;

    SyntaxKind(Shape shape, Category category, String nameForDiagnostics, String... children) {
        this.shape = shape;
        this.category = category;
        this.nameForDiagnostics = nameForDiagnostics;
        this.children = List.of(children);

        List<String> slots = new ArrayList<>();
        if (shape == Shape.LAYOUT) {
            for (int i = 0; i < children.length; i++) {
                if (i == 0) {
                    slots.add("unexpectedBefore" + capitalize(children[0]));
                } else {
                    slots.add("unexpectedBetween" + capitalize(children[i - 1]) + "And" + capitalize(children[i]));
                }
                slots.add(children[i]);
            }
            slots.add("unexpectedAfter" + capitalize(children[children.length - 1]));
        }
        this.slots = Collections.unmodifiableList(slots);

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < slots.size(); i++) {
            index.put(slots.get(i), i);
        }
        this.slotIndex = Collections.unmodifiableMap(index);
    }

    private static String capitalize(String name) {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    public Shape getShape() {
        return shape;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isCollection() {
        return shape == Shape.COLLECTION;
    }

    public boolean isMissing() {
        return this == MISSING || this == MISSING_DECL || this == MISSING_EXPR || this == MISSING_PATTERN
                || this == MISSING_STMT || this == MISSING_TYPE;
    }

    /**
     * Short human readable name used in messages ("function", "'if' statement"), or {@code null}.
     */
    @Nullable
    public String getNameForDiagnostics() {
        return nameForDiagnostics;
    }

    /**
     * The named, non-unexpected children of a layout kind in source order.
     */
    public List<String> getChildren() {
        return children;
    }

    /**
     * All slots of a layout kind including the interleaved unexpected slots.
     */
    public List<String> getSlots() {
        return slots;
    }

    /**
     * @return the raw slot index of {@code slot}
     * @throws IllegalArgumentException if this kind has no such slot
     */
    public int indexOf(String slot) {
        Integer index = slotIndex.get(slot);
        if (index == null) {
            throw new IllegalArgumentException(name() + " has no slot '" + slot + "', slots: " + slots);
        }
        return index;
    }

    public boolean hasSlot(String slot) {
        return slotIndex.containsKey(slot);
    }

    public static String unexpectedBefore(String child) {
        return "unexpectedBefore" + capitalize(child);
    }

    public static String unexpectedBetween(String first, String second) {
        return "unexpectedBetween" + capitalize(first) + "And" + capitalize(second);
    }

    public static String unexpectedAfter(String child) {
        return "unexpectedAfter" + capitalize(child);
    }
}
