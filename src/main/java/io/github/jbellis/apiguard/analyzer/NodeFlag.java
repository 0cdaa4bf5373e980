package io.github.jbellis.apiguard.analyzer;

public enum NodeFlag {
    /** A statement that exports the declaration it carries, e.g. {@code export declare class Foo {}}. */
    EXPORTED,
    /** A member or parameter carrying the {@code private} accessibility modifier. */
    PRIVATE,
    /** A class member carrying the {@code static} keyword. */
    STATIC,
    /** An import or export clause element that names another symbol. */
    ALIAS
}
