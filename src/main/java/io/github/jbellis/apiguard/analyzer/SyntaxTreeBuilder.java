package io.github.jbellis.apiguard.analyzer;

import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Converts a tree-sitter parse tree into the {@link SyntaxNode} tree the serializer walks.
 *
 * <p>The conversion differs from the raw parse tree in three ways. Comments become {@link CommentRange}s instead
 * of nodes. Every leaf knows where its leading trivia starts, so concatenating all leaves reproduces the text.
 * The members of a class or interface body are grouped under a {@link SyntaxKind#MEMBER_LIST} node, and each
 * member owns the {@code ;} or {@code ,} that terminates it, so members can be reordered as whole units.
 */
final class SyntaxTreeBuilder {
    private static final Set<String> COMMENT_TYPES = Set.of("comment", "html_comment");
    private static final Set<String> IDENTIFIER_TYPES = Set.of("identifier", "type_identifier", "property_identifier",
            "private_property_identifier", "shorthand_property_identifier", "statement_identifier");
    private static final Set<String> ALIAS_TYPES = Set.of("export_specifier", "import_specifier", "namespace_import",
            "namespace_export", "import_alias");
    // a member_expression below one of these names an entity instead of reading a property
    private static final Set<String> ENTITY_NAME_CONTEXTS = Set.of("nested_identifier", "nested_type_identifier",
            "type_query", "module", "internal_module", "import_alias");
    private static final Set<String> EXPORTABLE_DEFAULT_VALUES =
            Set.of("class", "function", "function_expression", "generator_function");

    private final SourceContent content;
    private final SourceFile file;
    private int previousTokenEnd;

    private record RawChild(TSNode node, @Nullable String field) {
    }

    private SyntaxTreeBuilder(SourceContent content, SourceFile file) {
        this.content = content;
        this.file = file;
    }

    static SourceFile build(Path path, SourceContent content, TSNode root) {
        var comments = new ArrayList<CommentRange>();
        collectComments(root, content, comments);
        var file = new SourceFile(path, content.text(), comments);

        var builder = new SyntaxTreeBuilder(content, file);
        var rootNode = builder.convert(root, null, null, List.of(), null);
        file.attachRoot(rootNode, isExternalModule(rootNode));
        return file;
    }

    private static void collectComments(TSNode node, SourceContent content, List<CommentRange> comments) {
        if (COMMENT_TYPES.contains(node.getType())) {
            comments.add(new CommentRange(content.byteOffsetToCharPosition(node.getStartByte()),
                                          content.byteOffsetToCharPosition(node.getEndByte())));
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            collectComments(node.getChild(i), content, comments);
        }
    }

    private static boolean isExternalModule(SyntaxNode root) {
        return root.namedChildren().stream()
                .anyMatch(s -> s.type().equals("export_statement") || s.type().equals("import_statement"));
    }

    private SyntaxNode convert(TSNode ts,
                               @Nullable SyntaxNode parent,
                               @Nullable String field,
                               List<RawChild> leading,
                               @Nullable TSNode trailing)
    {
        var rawChildren = rawChildren(ts);
        int start = charOffset(leading.isEmpty() ? ts.getStartByte() : leading.get(0).node().getStartByte());
        int end = charOffset(trailing == null ? ts.getEndByte() : trailing.getEndByte());
        var node = new SyntaxNode(file, parent, classify(ts, parent), ts.getType(), field, flags(ts, rawChildren),
                                  start, end);

        var children = new ArrayList<SyntaxNode>();
        for (var decorator : leading) {
            children.add(convert(decorator.node(), node, decorator.field(), List.of(), null));
        }
        if (ts.getType().equals("class_body") || ts.getType().equals("interface_body")) {
            children.addAll(convertBody(node, rawChildren));
        } else {
            for (var child : rawChildren) {
                children.add(convert(child.node(), node, child.field(), List.of(), null));
            }
        }
        if (trailing != null) {
            children.add(convert(trailing, node, null, List.of(), null));
        }

        if (children.isEmpty()) {
            int fullStart = Math.min(previousTokenEnd, start);
            previousTokenEnd = Math.max(previousTokenEnd, end);
            node.seal(List.of(), fullStart, end);
        } else {
            node.seal(children, children.get(0).fullStart(), end);
        }
        return node;
    }

    private List<RawChild> rawChildren(TSNode ts) {
        var result = new ArrayList<RawChild>();
        for (int i = 0; i < ts.getChildCount(); i++) {
            var child = ts.getChild(i);
            if (child == null || child.isNull() || COMMENT_TYPES.contains(child.getType())) {
                continue;
            }
            result.add(new RawChild(child, ts.getFieldNameForChild(i)));
        }
        return result;
    }

    /**
     * Splits a body into its opening brace, a member list, and its closing brace. Decorators are attached to the
     * member that follows them; one separator is attached to the member before it, any other separator becomes
     * a member of its own.
     */
    private List<SyntaxNode> convertBody(SyntaxNode body, List<RawChild> raw) {
        int from = 0;
        int to = raw.size();
        var result = new ArrayList<SyntaxNode>();
        if (from < to && isOpenBrace(raw.get(from).node())) {
            result.add(convert(raw.get(from).node(), body, null, List.of(), null));
            from++;
        }
        @Nullable RawChild close = null;
        if (to > from && isCloseBrace(raw.get(to - 1).node())) {
            close = raw.get(to - 1);
            to--;
        }

        var middle = raw.subList(from, to);
        int listStart = middle.isEmpty() ? previousTokenEnd : charOffset(middle.get(0).node().getStartByte());
        int listEnd = middle.isEmpty() ? previousTokenEnd
                                       : charOffset(middle.get(middle.size() - 1).node().getEndByte());
        var list = new SyntaxNode(file, body, SyntaxKind.MEMBER_LIST, "member_list", null, Set.of(),
                                  listStart, listEnd);

        var members = new ArrayList<SyntaxNode>();
        var decorators = new ArrayList<RawChild>();
        for (int i = 0; i < middle.size(); i++) {
            var member = middle.get(i);
            var type = member.node().getType();
            if (type.equals("decorator")) {
                decorators.add(member);
                continue;
            }
            if (isSeparator(member.node())) {
                members.add(convert(member.node(), list, null, List.of(), null));
                continue;
            }
            TSNode separator = null;
            // a method with a body ends at its brace; a following ; is a member of its own
            if (!type.equals("method_definition") && i + 1 < middle.size() && isSeparator(middle.get(i + 1).node())) {
                separator = middle.get(++i).node();
            }
            members.add(convert(member.node(), list, member.field(), List.copyOf(decorators), separator));
            decorators.clear();
        }
        for (var decorator : decorators) {
            members.add(convert(decorator.node(), list, decorator.field(), List.of(), null));
        }

        if (members.isEmpty()) {
            list.seal(List.of(), listStart, listStart);
        } else {
            list.seal(members, members.get(0).fullStart(), members.get(members.size() - 1).end());
        }
        result.add(list);

        if (close != null) {
            result.add(convert(close.node(), body, null, List.of(), null));
        }
        return result;
    }

    private static boolean isOpenBrace(TSNode node) {
        return !node.isNamed() && (node.getType().equals("{") || node.getType().equals("{|"));
    }

    private static boolean isCloseBrace(TSNode node) {
        return !node.isNamed() && (node.getType().equals("}") || node.getType().equals("|}"));
    }

    private static boolean isSeparator(TSNode node) {
        return !node.isNamed() && (node.getType().equals(";") || node.getType().equals(","));
    }

    private SyntaxKind classify(TSNode ts, @Nullable SyntaxNode parent) {
        var type = ts.getType();
        boolean inMemberList = parent != null && parent.kind() == SyntaxKind.MEMBER_LIST;
        if (!ts.isNamed()) {
            return inMemberList && isSeparator(ts) ? SyntaxKind.SEMICOLON_ELEMENT : SyntaxKind.TOKEN;
        }
        if (inMemberList) {
            return classifyMember(ts, parent);
        }
        if (IDENTIFIER_TYPES.contains(type)) {
            return SyntaxKind.IDENTIFIER;
        }
        return switch (type) {
            case "program" -> SyntaxKind.SOURCE_FILE;
            case "class_declaration", "abstract_class_declaration", "class" -> SyntaxKind.CLASS_DECLARATION;
            case "interface_declaration" -> SyntaxKind.INTERFACE_DECLARATION;
            case "class_body" -> SyntaxKind.CLASS_BODY;
            case "interface_body" -> SyntaxKind.INTERFACE_BODY;
            case "nested_type_identifier" -> SyntaxKind.QUALIFIED_TYPE_NAME;
            case "member_expression" -> isEntityName(parent)
                                        ? SyntaxKind.ENTITY_NAME
                                        : SyntaxKind.PROPERTY_ACCESS_EXPRESSION;
            default -> SyntaxKind.OTHER;
        };
    }

    private SyntaxKind classifyMember(TSNode ts, SyntaxNode memberList) {
        return switch (ts.getType()) {
            case "public_field_definition" -> SyntaxKind.PROPERTY_DECLARATION;
            case "property_signature" -> SyntaxKind.PROPERTY_SIGNATURE;
            case "call_signature" -> SyntaxKind.CALL_SIGNATURE;
            case "construct_signature" -> SyntaxKind.CONSTRUCT_SIGNATURE;
            case "index_signature" -> SyntaxKind.INDEX_SIGNATURE;
            case "method_signature", "abstract_method_signature", "method_definition" -> {
                if (hasToken(ts, "get")) {
                    yield SyntaxKind.GET_ACCESSOR;
                }
                if (hasToken(ts, "set")) {
                    yield SyntaxKind.SET_ACCESSOR;
                }
                var body = memberList.parent();
                boolean inClass = body != null && body.kind() == SyntaxKind.CLASS_BODY;
                if (inClass && "constructor".equals(nameText(ts))) {
                    yield SyntaxKind.CONSTRUCTOR;
                }
                yield inClass || !ts.getType().equals("method_signature")
                      ? SyntaxKind.METHOD_DECLARATION
                      : SyntaxKind.METHOD_SIGNATURE;
            }
            default -> SyntaxKind.OTHER_MEMBER;
        };
    }

    private static boolean isEntityName(@Nullable SyntaxNode parent) {
        var ancestor = parent;
        while (ancestor != null && ancestor.type().equals("member_expression")) {
            ancestor = ancestor.parent();
        }
        return ancestor != null && ENTITY_NAME_CONTEXTS.contains(ancestor.type());
    }

    private Set<NodeFlag> flags(TSNode ts, List<RawChild> children) {
        var flags = EnumSet.noneOf(NodeFlag.class);
        var type = ts.getType();
        if (type.equals("export_statement") && isExportedDeclaration(children)) {
            flags.add(NodeFlag.EXPORTED);
        }
        if (ALIAS_TYPES.contains(type)) {
            flags.add(NodeFlag.ALIAS);
        }
        for (var child : children) {
            var node = child.node();
            if (node.getType().equals("accessibility_modifier") && "private".equals(text(node))) {
                flags.add(NodeFlag.PRIVATE);
            } else if (!node.isNamed() && node.getType().equals("static")) {
                flags.add(NodeFlag.STATIC);
            }
        }
        return flags;
    }

    /** {@code export class A {}} and {@code export default class {}} are exported declarations; export lists are not. */
    private static boolean isExportedDeclaration(List<RawChild> children) {
        boolean isDefault = false;
        for (var child : children) {
            if ("declaration".equals(child.field())) {
                return true;
            }
            if (!child.node().isNamed() && child.node().getType().equals("default")) {
                isDefault = true;
            } else if (isDefault && "value".equals(child.field())) {
                return EXPORTABLE_DEFAULT_VALUES.contains(child.node().getType());
            }
        }
        return false;
    }

    private static boolean hasToken(TSNode ts, String token) {
        for (int i = 0; i < ts.getChildCount(); i++) {
            var child = ts.getChild(i);
            if (!child.isNamed() && child.getType().equals(token)) {
                return true;
            }
        }
        return false;
    }

    private @Nullable String nameText(TSNode ts) {
        var name = ts.getChildByFieldName("name");
        return name == null || name.isNull() ? null : text(name);
    }

    private String text(TSNode node) {
        return content.substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    private int charOffset(int byteOffset) {
        return content.byteOffsetToCharPosition(byteOffset);
    }
}
