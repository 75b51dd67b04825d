package bigo.parser;

/**
 * Grammar rules that label the inner nodes of a {@link ParseTree}.
 */
public enum Rule {
    PROGRAM,
    CLASS_DEFINITION,
    ALGORITHM,
    SUBROUTINE,
    MAIN_ALGORITHM,

    PARAMETERS,
    SIMPLE_PARAMETER,
    ARRAY_PARAMETER,
    OBJECT_PARAMETER,
    DIMENSION,

    DECLARATIONS,
    ARRAY_DECLARATION,
    OBJECT_DECLARATION,

    BLOCK,
    ASSIGNMENT,
    FOR_LOOP,
    WHILE_LOOP,
    REPEAT_LOOP,
    IF_STATEMENT,
    CALL_STATEMENT,
    RETURN_STATEMENT,
    COMMENT,

    LOGICAL_OR,
    LOGICAL_AND,
    LOGICAL_NOT,
    COMPARISON,
    ARITHMETIC,
    TERM,
    FACTOR,
    POWER,

    VARIABLE,
    INDICES,
    FIELD,
    RANGE,
    FUNCTION_CALL,
    ARGUMENTS,
    LENGTH,
    CEILING,
    FLOOR
}
