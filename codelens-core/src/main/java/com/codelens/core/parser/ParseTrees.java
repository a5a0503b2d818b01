package com.codelens.core.parser;

import com.codelens.parser.Python3Parser;
import com.codelens.parser.Python3Parser.Atom_exprContext;
import com.codelens.parser.Python3Parser.BlockContext;
import com.codelens.parser.Python3Parser.Case_blockContext;
import com.codelens.parser.Python3Parser.Compound_stmtContext;
import com.codelens.parser.Python3Parser.TrailerContext;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Navigation helpers over the Python 3 parse tree.
 */
final class ParseTrees {

    private ParseTrees() {
    }

    /**
     * Follows single-child links from {@code node} until a node of {@code type} is reached.
     *
     * @return the node, or null when the chain branches first
     */
    static <T extends ParseTree> T singleDescendant(ParseTree node, Class<T> type) {
        ParseTree current = node;
        while (current != null && !type.isInstance(current)) {
            if (current.getChildCount() != 1) {
                return null;
            }
            current = current.getChild(0);
        }
        return type.cast(current);
    }

    /**
     * Returns the dotted name an expression consists of ({@code a}, {@code a.b.c}), or null
     * for anything else (calls, subscripts, literals).
     */
    static String dottedName(ParseTree expression) {
        Atom_exprContext atomExpr = singleDescendant(expression, Atom_exprContext.class);
        if (atomExpr == null || atomExpr.AWAIT() != null || atomExpr.atom().name() == null) {
            return null;
        }
        StringBuilder name = new StringBuilder(atomExpr.atom().name().getText());
        for (TrailerContext trailer : atomExpr.trailer()) {
            if (trailer.getStart().getType() != Python3Parser.DOT) {
                return null;
            }
            name.append('.').append(trailer.name().getText());
        }
        return name.toString();
    }

    /**
     * Returns the statements of a block, whether it is an indented suite or a one-liner.
     */
    static List<ParseTree> statements(BlockContext block) {
        if (block.simple_stmts() != null) {
            return List.of(block.simple_stmts());
        }
        return new ArrayList<>(block.stmt());
    }

    /**
     * Returns the nested blocks of a compound statement that is not a definition.
     */
    static List<BlockContext> nestedBlocks(Compound_stmtContext compound) {
        if (compound.if_stmt() != null) {
            return compound.if_stmt().block();
        }
        if (compound.while_stmt() != null) {
            return compound.while_stmt().block();
        }
        if (compound.for_stmt() != null) {
            return compound.for_stmt().block();
        }
        if (compound.try_stmt() != null) {
            return compound.try_stmt().block();
        }
        if (compound.with_stmt() != null) {
            return List.of(compound.with_stmt().block());
        }
        if (compound.match_stmt() != null) {
            return compound.match_stmt().case_block().stream()
                .map(Case_blockContext::block)
                .toList();
        }
        if (compound.async_stmt() != null) {
            if (compound.async_stmt().with_stmt() != null) {
                return List.of(compound.async_stmt().with_stmt().block());
            }
            if (compound.async_stmt().for_stmt() != null) {
                return compound.async_stmt().for_stmt().block();
            }
        }
        return List.of();
    }

    /**
     * Collects every node of {@code type} below {@code root} in pre-order.
     */
    static <T extends ParseTree> List<T> descendants(ParseTree root, Class<T> type) {
        List<T> found = new ArrayList<>();
        collect(root, type, found);
        return found;
    }

    private static <T extends ParseTree> void collect(ParseTree node, Class<T> type, List<T> found) {
        if (type.isInstance(node)) {
            found.add(type.cast(node));
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            collect(node.getChild(i), type, found);
        }
    }
}
