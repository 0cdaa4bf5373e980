package io.github.jbellis.apiguard.serializer;

import io.github.jbellis.apiguard.analyzer.NodeFlag;
import io.github.jbellis.apiguard.analyzer.SyntaxKind;
import io.github.jbellis.apiguard.analyzer.SyntaxNode;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;

/**
 * Canonical order of class and interface members: static members first, then by kind, then by name.
 */
final class MemberOrder {
    private static final Map<SyntaxKind, Integer> RANKS = new EnumMap<>(SyntaxKind.class);

    static {
        RANKS.put(SyntaxKind.PROPERTY_SIGNATURE, 0);
        RANKS.put(SyntaxKind.PROPERTY_DECLARATION, 0);
        RANKS.put(SyntaxKind.GET_ACCESSOR, 0);
        RANKS.put(SyntaxKind.SET_ACCESSOR, 0);
        RANKS.put(SyntaxKind.CALL_SIGNATURE, 1);
        RANKS.put(SyntaxKind.CONSTRUCTOR, 2);
        RANKS.put(SyntaxKind.CONSTRUCT_SIGNATURE, 2);
        RANKS.put(SyntaxKind.INDEX_SIGNATURE, 3);
        RANKS.put(SyntaxKind.METHOD_SIGNATURE, 4);
        RANKS.put(SyntaxKind.METHOD_DECLARATION, 4);
    }

    static final Comparator<SyntaxNode> COMPARATOR = Comparator
            .comparing((SyntaxNode member) -> !member.hasFlag(NodeFlag.STATIC))
            .thenComparingInt(MemberOrder::rank)
            .thenComparing(MemberOrder::nameText);

    private MemberOrder() {
    }

    static boolean isRanked(SyntaxNode member) {
        return RANKS.containsKey(member.kind());
    }

    static int rank(SyntaxNode member) {
        var rank = RANKS.get(member.kind());
        if (rank == null) {
            throw new IllegalArgumentException("Member has no rank: " + member);
        }
        return rank;
    }

    /** The member's name as written; signatures without a name of their own use their whole text. */
    static String nameText(SyntaxNode member) {
        return switch (member.kind()) {
            case CONSTRUCTOR, INDEX_SIGNATURE, CALL_SIGNATURE, CONSTRUCT_SIGNATURE -> member.text();
            default -> {
                var name = member.childByField("name");
                yield name == null ? member.text() : name.text();
            }
        };
    }
}
