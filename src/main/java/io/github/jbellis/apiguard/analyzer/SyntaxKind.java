package io.github.jbellis.apiguard.analyzer;

/**
 * Normalized node kinds. The raw tree-sitter grammar type is kept on every {@link SyntaxNode}; the kind only
 * distinguishes what the serializer has to tell apart.
 */
public enum SyntaxKind {
    SOURCE_FILE,
    /** Anonymous token: keyword, punctuation or operator. */
    TOKEN,
    IDENTIFIER,

    CLASS_DECLARATION,
    INTERFACE_DECLARATION,
    CLASS_BODY,
    INTERFACE_BODY,
    /** Synthetic list holding the members of a class or interface body, separators included. */
    MEMBER_LIST,

    // class and interface members
    PROPERTY_DECLARATION,
    PROPERTY_SIGNATURE,
    GET_ACCESSOR,
    SET_ACCESSOR,
    CALL_SIGNATURE,
    CONSTRUCTOR,
    CONSTRUCT_SIGNATURE,
    INDEX_SIGNATURE,
    METHOD_SIGNATURE,
    METHOD_DECLARATION,
    /** A stray {@code ;} inside a class body. */
    SEMICOLON_ELEMENT,
    /** Class members with no canonical position, e.g. decorators and static blocks. */
    OTHER_MEMBER,

    /** Dotted reference in expression position, e.g. {@code ns.Base} in an extends clause. */
    PROPERTY_ACCESS_EXPRESSION,
    /** Dotted reference in type position, e.g. {@code ns.Options}. */
    QUALIFIED_TYPE_NAME,
    /** Dotted name that is not a reference to check: namespace names, {@code typeof} queries, import aliases. */
    ENTITY_NAME,

    OTHER
}
