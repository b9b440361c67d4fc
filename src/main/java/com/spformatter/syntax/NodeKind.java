package com.spformatter.syntax;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of grammar productions the formatter knows about. Anonymous tokens
 * map to {@link #TOKEN}; named productions without a constant map to {@link #UNKNOWN}.
 */
public enum NodeKind {
    SOURCE_FILE("source_file"),
    COMMENT("comment"),

    PREPROC_INCLUDE("preproc_include"),
    PREPROC_TRYINCLUDE("preproc_tryinclude"),
    PREPROC_DEFINE("preproc_define"),
    PREPROC_UNDEFINE("preproc_undefine"),
    PREPROC_PRAGMA("preproc_pragma"),
    PREPROC_IF("preproc_if"),
    PREPROC_ELSEIF("preproc_elseif"),
    PREPROC_ELSE("preproc_else"),
    PREPROC_ENDIF("preproc_endif"),
    PREPROC_DIRECTIVE("preproc_directive"),
    PREPROC_ARG("preproc_arg"),

    FUNCTION_DEFINITION("function_definition"),
    FUNCTION_DECLARATION("function_declaration"),
    VISIBILITY("visibility"),
    TYPE("type"),
    BUILTIN_TYPE("builtin_type"),
    DIMENSION("dimension"),
    FIXED_DIMENSION("fixed_dimension"),
    PARAMETER_DECLARATIONS("parameter_declarations"),
    PARAMETER_DECLARATION("parameter_declaration"),
    REST_PARAMETER("rest_parameter"),

    GLOBAL_VARIABLE_DECLARATION("global_variable_declaration"),
    OLD_GLOBAL_VARIABLE_DECLARATION("old_global_variable_declaration"),
    VARIABLE_DECLARATION_STATEMENT("variable_declaration_statement"),
    OLD_VARIABLE_DECLARATION_STATEMENT("old_variable_declaration_statement"),
    VARIABLE_DECLARATION("variable_declaration"),
    OLD_VARIABLE_DECLARATION("old_variable_declaration"),

    ENUM("enum"),
    ENUM_ENTRIES("enum_entries"),
    ENUM_ENTRY("enum_entry"),
    ENUM_STRUCT("enum_struct"),
    METHODMAP("methodmap"),
    TYPEDEF("typedef"),
    TYPESET("typeset"),
    FUNCTAG("functag"),
    FUNCENUM("funcenum"),
    STRUCT("struct"),

    BLOCK("block"),
    EXPRESSION_STATEMENT("expression_statement"),
    CONDITION_STATEMENT("condition_statement"),
    FOR_STATEMENT("for_statement"),
    WHILE_STATEMENT("while_statement"),
    DO_WHILE_STATEMENT("do_while_statement"),
    SWITCH_STATEMENT("switch_statement"),
    SWITCH_CASE("switch_case"),
    RETURN_STATEMENT("return_statement"),
    BREAK_STATEMENT("break_statement"),
    CONTINUE_STATEMENT("continue_statement"),
    DELETE_STATEMENT("delete_statement"),

    ASSIGNMENT_EXPRESSION("assignment_expression"),
    BINARY_EXPRESSION("binary_expression"),
    UNARY_EXPRESSION("unary_expression"),
    UPDATE_EXPRESSION("update_expression"),
    TERNARY_EXPRESSION("ternary_expression"),
    CALL_EXPRESSION("call_expression"),
    CALL_ARGUMENTS("call_arguments"),
    ARRAY_INDEXED_ACCESS("array_indexed_access"),
    FIELD_ACCESS("field_access"),
    SCOPE_ACCESS("scope_access"),
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    COMMA_EXPRESSION("comma_expression"),
    VIEW_AS("view_as"),
    SIZEOF_EXPRESSION("sizeof_expression"),
    NEW_EXPRESSION("new_expression"),
    ARRAY_LITERAL("array_literal"),

    IDENTIFIER("identifier"),
    NUMBER_LITERAL("number_literal"),
    STRING_LITERAL("string_literal"),
    CHAR_LITERAL("char_literal"),
    BOOL_LITERAL("bool_literal"),
    NULL("null"),
    THIS("this"),

    ERROR("ERROR"),
    TOKEN(""),
    UNKNOWN("");

    private static final Map<String, NodeKind> BY_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (!kind.grammarName.isEmpty()) {
                BY_NAME.put(kind.grammarName, kind);
            }
        }
    }

    private final String grammarName;

    NodeKind(String grammarName) {
        this.grammarName = grammarName;
    }

    public String getGrammarName() {
        return grammarName;
    }

    public static NodeKind of(String kind, boolean named) {
        if (!named) {
            return "ERROR".equals(kind) ? ERROR : TOKEN;
        }
        return BY_NAME.getOrDefault(kind, UNKNOWN);
    }

    public boolean isPreprocessor() {
        return grammarName.startsWith("preproc_");
    }

    /**
     * Declarations whose layout the formatter does not own; they are emitted verbatim.
     */
    public boolean isVerbatim() {
        return switch (this) {
            case ENUM_STRUCT, METHODMAP, TYPEDEF, TYPESET, FUNCTAG, FUNCENUM, STRUCT -> true;
            default -> false;
        };
    }
}
