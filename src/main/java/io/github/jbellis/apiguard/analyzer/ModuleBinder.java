package io.github.jbellis.apiguard.analyzer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the top-level symbol table of one file: what it declares, what it imports and what it exports.
 */
final class ModuleBinder {
    private static final Logger logger = LogManager.getLogger(ModuleBinder.class);

    static final String DEFAULT_EXPORT = "default";
    static final String EXPORT_EQUALS = "export=";

    private static final Set<String> FUNCTION_EXPRESSIONS =
            Set.of("class", "function", "function_expression", "generator_function");

    private final SourceFile file;
    private final Map<String, SymbolBuilder> locals = new LinkedHashMap<>();
    private final Map<String, SymbolBuilder> exports = new LinkedHashMap<>();
    private final List<String> exportStarSpecifiers = new ArrayList<>();
    private final List<String> moduleSpecifiers = new ArrayList<>();

    private ModuleBinder(SourceFile file) {
        this.file = file;
    }

    static ModuleSymbols bind(SourceFile file) {
        var binder = new ModuleBinder(file);
        for (var statement : file.root().namedChildren()) {
            binder.bindStatement(statement);
        }
        return new ModuleSymbols(file,
                                 build(binder.locals),
                                 build(binder.exports),
                                 binder.exportStarSpecifiers,
                                 binder.moduleSpecifiers);
    }

    private static Map<String, Symbol> build(Map<String, SymbolBuilder> builders) {
        var result = new LinkedHashMap<String, Symbol>();
        builders.forEach((name, builder) -> result.put(name, builder.build()));
        return result;
    }

    private void bindStatement(SyntaxNode statement) {
        switch (statement.type()) {
            case "export_statement" -> bindExportStatement(statement);
            case "import_statement" -> bindImportStatement(statement);
            case "import_alias" -> {
                var alias = importAlias(statement);
                if (alias != null) {
                    local(alias.name()).setAlias(alias);
                }
            }
            default -> {
                for (var declared : declaredNames(statement)) {
                    local(declared.name()).add(declared);
                }
            }
        }
    }

    private void bindExportStatement(SyntaxNode statement) {
        boolean isDefault = statement.childOfType("default") != null;
        var declaration = statement.childByField("declaration");
        if (declaration != null) {
            bindExportedDeclaration(declaration, isDefault);
            return;
        }

        var source = statement.childByField("source");
        String specifier = source == null ? null : unquote(source.text());
        if (specifier != null) {
            moduleSpecifiers.add(specifier);
        }

        var clause = statement.childOfType("export_clause");
        var namespaceExport = statement.childOfType("namespace_export");
        if (clause != null) {
            for (var exportSpecifier : clause.namedChildren()) {
                if (!"export_specifier".equals(exportSpecifier.type())) {
                    continue;
                }
                var nameNode = exportSpecifier.childByField("name");
                if (nameNode == null) {
                    continue;
                }
                var aliasNode = exportSpecifier.childByField("alias");
                var targetName = unquote(nameNode.text());
                var exportedName = aliasNode == null ? targetName : unquote(aliasNode.text());
                export(exportedName).setAlias(
                        new Symbol.Alias(exportedName, targetName, specifier, List.of(exportSpecifier)));
            }
        } else if (namespaceExport != null) {
            var named = namespaceExport.namedChildren();
            if (!named.isEmpty() && specifier != null) {
                var name = unquote(named.get(named.size() - 1).text());
                export(name).setAlias(new Symbol.Alias(name, null, specifier, List.of(namespaceExport)));
            }
        } else if (statement.childOfType("*") != null && specifier != null) {
            exportStarSpecifiers.add(specifier);
        } else if (statement.childOfType("=") != null) {
            bindExportedValue(EXPORT_EQUALS, statement, firstNamedChild(statement));
        } else if (isDefault) {
            var value = statement.childByField("value");
            bindExportedValue(DEFAULT_EXPORT, statement, value == null ? firstNamedChild(statement) : value);
        } else {
            // export as namespace Foo; declares a UMD global, not a module export
            logger.trace("Ignoring export statement {} in {}", statement, file);
        }
    }

    private void bindExportedDeclaration(SyntaxNode declaration, boolean isDefault) {
        if ("import_alias".equals(declaration.type())) {
            var alias = importAlias(declaration);
            if (alias != null) {
                local(alias.name()).setAlias(alias);
                export(alias.name()).setAlias(alias);
            }
            return;
        }

        var declaredNames = declaredNames(declaration);
        for (var declared : declaredNames) {
            local(declared.name()).add(declared);
        }
        if (isDefault) {
            if (declaredNames.isEmpty()) {
                export(DEFAULT_EXPORT).add(new Declared(DEFAULT_EXPORT, declaration, true));
            } else {
                var first = declaredNames.get(0);
                export(DEFAULT_EXPORT).add(new Declared(DEFAULT_EXPORT, first.node(), first.isValue()));
            }
        } else {
            for (var declared : declaredNames) {
                export(declared.name()).add(declared);
            }
        }
    }

    private void bindExportedValue(String name, SyntaxNode statement, @Nullable SyntaxNode value) {
        if (value != null && "identifier".equals(value.type())) {
            export(name).setAlias(new Symbol.Alias(name, value.text(), null, List.of(statement)));
        } else if (value != null && FUNCTION_EXPRESSIONS.contains(value.type())) {
            export(name).add(new Declared(name, value, true));
        } else {
            export(name).add(new Declared(name, statement, false));
        }
    }

    private void bindImportStatement(SyntaxNode statement) {
        var requireClause = statement.childOfType("import_require_clause");
        if (requireClause != null) {
            var source = requireClause.childByField("source");
            var name = requireClause.childOfType("identifier");
            if (source != null && name != null) {
                var specifier = unquote(source.text());
                moduleSpecifiers.add(specifier);
                local(name.text()).setAlias(new Symbol.Alias(name.text(), null, specifier, List.of(requireClause)));
            }
            return;
        }

        var source = statement.childByField("source");
        if (source == null) {
            return;
        }
        var specifier = unquote(source.text());
        moduleSpecifiers.add(specifier);

        var clause = statement.childOfType("import_clause");
        if (clause == null) {
            return;
        }
        for (var part : clause.namedChildren()) {
            switch (part.type()) {
                case "identifier" -> local(part.text()).setAlias(
                        new Symbol.Alias(part.text(), DEFAULT_EXPORT, specifier, List.of(part)));
                case "namespace_import" -> {
                    var name = part.childOfType("identifier");
                    if (name != null) {
                        local(name.text()).setAlias(new Symbol.Alias(name.text(), null, specifier, List.of(part)));
                    }
                }
                case "named_imports" -> {
                    for (var importSpecifier : part.namedChildren()) {
                        var nameNode = importSpecifier.childByField("name");
                        if (!"import_specifier".equals(importSpecifier.type()) || nameNode == null) {
                            continue;
                        }
                        var aliasNode = importSpecifier.childByField("alias");
                        var importedName = unquote(nameNode.text());
                        var localName = aliasNode == null ? importedName : aliasNode.text();
                        local(localName).setAlias(
                                new Symbol.Alias(localName, importedName, specifier, List.of(importSpecifier)));
                    }
                }
                default -> logger.trace("Ignoring import clause part {} in {}", part, file);
            }
        }
    }

    /** {@code import A = B.C;} aliases A to the entity B.C of the local scope. */
    private static @Nullable Symbol.Alias importAlias(SyntaxNode importAlias) {
        var named = importAlias.namedChildren();
        if (named.size() < 2) {
            return null;
        }
        return new Symbol.Alias(named.get(0).text(), named.get(1).text(), null, List.of(importAlias));
    }

    private record Declared(String name, SyntaxNode node, boolean isValue) {
    }

    private List<Declared> declaredNames(SyntaxNode declaration) {
        var result = new ArrayList<Declared>();
        switch (declaration.type()) {
            case "ambient_declaration" -> {
                for (var inner : declaration.namedChildren()) {
                    result.addAll(declaredNames(inner));
                }
            }
            case "class_declaration", "abstract_class_declaration", "enum_declaration", "function_signature",
                 "function_declaration", "generator_function_declaration" -> addNamed(result, declaration, true);
            case "interface_declaration", "type_alias_declaration" -> addNamed(result, declaration, false);
            case "lexical_declaration", "variable_declaration" -> {
                for (var declarator : declaration.namedChildren()) {
                    var name = declarator.childByField("name");
                    if ("variable_declarator".equals(declarator.type()) && name != null
                            && "identifier".equals(name.type())) {
                        result.add(new Declared(name.text(), declarator, true));
                    }
                }
            }
            case "module", "internal_module" -> {
                var name = declaration.childByField("name");
                // declare module "foo" {} describes another module; it declares nothing here
                if (name != null && !"string".equals(name.type())) {
                    result.add(new Declared(leftmostIdentifier(name), declaration, isInstantiated(declaration)));
                }
            }
            default -> {
            }
        }
        return result;
    }

    private static void addNamed(List<Declared> result, SyntaxNode declaration, boolean isValue) {
        var name = declaration.childByField("name");
        if (name != null) {
            result.add(new Declared(name.text(), declaration, isValue));
        }
    }

    private static String leftmostIdentifier(SyntaxNode name) {
        var current = name;
        while (!current.isLeaf() && !current.namedChildren().isEmpty()) {
            current = current.namedChildren().get(0);
        }
        return current.text();
    }

    /** A namespace is a value only if it contains something other than types. */
    private static boolean isInstantiated(SyntaxNode namespace) {
        var body = namespace.childByField("body");
        if (body == null) {
            return false;
        }
        for (var statement : body.namedChildren()) {
            var inner = statement;
            if ("export_statement".equals(inner.type()) && inner.childByField("declaration") != null) {
                inner = inner.childByField("declaration");
            }
            if ("ambient_declaration".equals(inner.type()) && !inner.namedChildren().isEmpty()) {
                inner = inner.namedChildren().get(0);
            }
            switch (inner.type()) {
                case "interface_declaration", "type_alias_declaration" -> {
                }
                case "module", "internal_module" -> {
                    if (isInstantiated(inner)) {
                        return true;
                    }
                }
                default -> {
                    return true;
                }
            }
        }
        return false;
    }

    private static @Nullable SyntaxNode firstNamedChild(SyntaxNode node) {
        var named = node.namedChildren();
        return named.isEmpty() ? null : named.get(0);
    }

    static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'' || first == '`') && last == first) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    private SymbolBuilder local(String name) {
        return locals.computeIfAbsent(name, SymbolBuilder::new);
    }

    private SymbolBuilder export(String name) {
        return exports.computeIfAbsent(name, SymbolBuilder::new);
    }

    private final class SymbolBuilder {
        private final String name;
        private final List<SyntaxNode> declarations = new ArrayList<>();
        private @Nullable SyntaxNode primary;
        private Symbol.@Nullable Alias alias;

        SymbolBuilder(String name) {
            this.name = name;
        }

        void add(Declared declared) {
            if (alias != null) {
                logger.debug("Declaration of {} in {} conflicts with an alias of the same name", name, file);
                return;
            }
            if (!declarations.contains(declared.node())) {
                declarations.add(declared.node());
            }
            if (declared.isValue() && primary == null) {
                primary = declared.node();
            }
        }

        void setAlias(Symbol.Alias alias) {
            if (this.alias != null || !declarations.isEmpty()) {
                logger.debug("Duplicate binding of {} in {}; keeping the first", name, file);
                return;
            }
            this.alias = alias;
        }

        Symbol build() {
            return alias != null ? alias : new Symbol.Direct(name, primary, declarations);
        }
    }
}
