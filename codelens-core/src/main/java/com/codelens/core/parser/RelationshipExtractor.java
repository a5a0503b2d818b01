package com.codelens.core.parser;

import com.codelens.core.model.Location;
import com.codelens.core.model.Relationship;
import com.codelens.core.model.RelationshipKind;
import com.codelens.parser.Python3Parser;
import com.codelens.parser.Python3Parser.Atom_exprContext;
import com.codelens.parser.Python3Parser.BlockContext;
import com.codelens.parser.Python3Parser.ClassdefContext;
import com.codelens.parser.Python3Parser.Compound_stmtContext;
import com.codelens.parser.Python3Parser.DecoratedContext;
import com.codelens.parser.Python3Parser.DecoratorsContext;
import com.codelens.parser.Python3Parser.FuncdefContext;
import com.codelens.parser.Python3Parser.StmtContext;
import com.codelens.parser.Python3Parser.TrailerContext;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Second pass: extracts call and inheritance relationships.
 *
 * <p>Every call expression anywhere inside a function (default values, decorators, nested
 * functions and lambdas included) yields a {@code CALLS} relationship from the function,
 * qualified as {@code Class.method} inside a class, to the textual name of the callee. Calls
 * outside any function are ignored. Each base class yields one {@code INHERITS} relationship.
 *
 * <p>Callee names are reconstructed from the expression text only: {@code self.repo.save()}
 * targets {@code self.repo.save}, and when the receiver is itself a call or subscript only the
 * trailing attribute is kept ({@code get_db().commit()} targets {@code get_db} and {@code commit}).
 */
final class RelationshipExtractor {

    private final ParsedSource source;

    RelationshipExtractor(ParsedSource source) {
        this.source = source;
    }

    List<Relationship> extract() {
        List<Relationship> relationships = new ArrayList<>();
        for (StmtContext statement : source.tree().stmt()) {
            visitStatement(statement, null, relationships);
        }
        return relationships;
    }

    private void visitStatement(ParseTree node, String currentClass, List<Relationship> out) {
        if (!(node instanceof StmtContext statement) || statement.compound_stmt() == null) {
            return;
        }
        Compound_stmtContext compound = statement.compound_stmt();
        if (compound.funcdef() != null) {
            visitFunction(compound.funcdef(), null, currentClass, out);
        } else if (compound.async_stmt() != null && compound.async_stmt().funcdef() != null) {
            visitFunction(compound.async_stmt().funcdef(), null, currentClass, out);
        } else if (compound.classdef() != null) {
            visitClass(compound.classdef(), out);
        } else if (compound.decorated() != null) {
            DecoratedContext decorated = compound.decorated();
            if (decorated.classdef() != null) {
                visitClass(decorated.classdef(), out);
            } else {
                FuncdefContext funcdef = decorated.funcdef() != null
                    ? decorated.funcdef()
                    : decorated.async_funcdef().funcdef();
                visitFunction(funcdef, decorated.decorators(), currentClass, out);
            }
        } else {
            for (BlockContext block : ParseTrees.nestedBlocks(compound)) {
                visitBlock(block, currentClass, out);
            }
        }
    }

    private void visitBlock(BlockContext block, String currentClass, List<Relationship> out) {
        for (ParseTree statement : ParseTrees.statements(block)) {
            visitStatement(statement, currentClass, out);
        }
    }

    private void visitClass(ClassdefContext classdef, List<Relationship> out) {
        String className = classdef.name().getText();
        Location location = Location.at(source.filePath(), classdef.getStart().getLine());
        for (String base : EntityExtractor.baseClasses(classdef)) {
            out.add(Relationship.of(className, base, RelationshipKind.INHERITS, location));
        }
        visitBlock(classdef.block(), className, out);
    }

    private void visitFunction(FuncdefContext funcdef, DecoratorsContext decorators,
                               String currentClass, List<Relationship> out) {
        String name = funcdef.name().getText();
        String currentFunction = currentClass == null ? name : currentClass + "." + name;

        List<Atom_exprContext> expressions = new ArrayList<>();
        if (decorators != null) {
            expressions.addAll(ParseTrees.descendants(decorators, Atom_exprContext.class));
        }
        expressions.addAll(ParseTrees.descendants(funcdef, Atom_exprContext.class));

        for (Atom_exprContext expression : expressions) {
            recordCalls(expression, currentFunction, out);
        }
    }

    private void recordCalls(Atom_exprContext expression, String currentFunction, List<Relationship> out) {
        if (expression.trailer().isEmpty()) {
            return;
        }
        Location location = Location.at(source.filePath(), expression.getStart().getLine());

        String callee = expression.atom().name() != null ? expression.atom().name().getText() : "";
        for (TrailerContext trailer : expression.trailer()) {
            switch (trailer.getStart().getType()) {
                case Python3Parser.DOT -> {
                    String attribute = trailer.name().getText();
                    callee = callee.isEmpty() ? attribute : callee + "." + attribute;
                }
                case Python3Parser.OPEN_PAREN -> {
                    if (!callee.isEmpty()) {
                        out.add(Relationship.of(currentFunction, callee, RelationshipKind.CALLS, location));
                    }
                    callee = "";
                }
                default -> callee = "";
            }
        }
    }
}
