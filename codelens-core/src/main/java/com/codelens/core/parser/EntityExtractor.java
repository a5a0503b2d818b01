package com.codelens.core.parser;

import com.codelens.core.model.ClassEntity;
import com.codelens.core.model.CodeEntity;
import com.codelens.core.model.EntityKind;
import com.codelens.core.model.FunctionEntity;
import com.codelens.core.model.ImportEntity;
import com.codelens.core.model.Location;
import com.codelens.parser.Python3Parser;
import com.codelens.parser.Python3Parser.ArgumentContext;
import com.codelens.parser.Python3Parser.BlockContext;
import com.codelens.parser.Python3Parser.ClassdefContext;
import com.codelens.parser.Python3Parser.Compound_stmtContext;
import com.codelens.parser.Python3Parser.DecoratedContext;
import com.codelens.parser.Python3Parser.DecoratorContext;
import com.codelens.parser.Python3Parser.Dotted_as_nameContext;
import com.codelens.parser.Python3Parser.FuncdefContext;
import com.codelens.parser.Python3Parser.Import_as_nameContext;
import com.codelens.parser.Python3Parser.Import_fromContext;
import com.codelens.parser.Python3Parser.Import_nameContext;
import com.codelens.parser.Python3Parser.Import_stmtContext;
import com.codelens.parser.Python3Parser.Relative_levelContext;
import com.codelens.parser.Python3Parser.Simple_stmtContext;
import com.codelens.parser.Python3Parser.Simple_stmtsContext;
import com.codelens.parser.Python3Parser.StmtContext;
import com.codelens.parser.Python3Parser.TypedargContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * First pass: extracts functions, classes and imports.
 *
 * <p>The traversal state is an immutable {@link Scope} handed down each call. A function
 * definition met while a class scope is active becomes a method of that class; otherwise it
 * is a standalone function. Function bodies are not descended, so nested functions and
 * classes defined inside functions produce no entities. Classes are emitted once their body
 * has been walked, which puts a nested class before its enclosing class.
 */
final class EntityExtractor {

    private final ParsedSource source;

    EntityExtractor(ParsedSource source) {
        this.source = source;
    }

    List<CodeEntity> extract() {
        List<CodeEntity> entities = new ArrayList<>();
        for (StmtContext statement : source.tree().stmt()) {
            visitStatement(statement, Scope.MODULE, entities);
        }
        return entities;
    }

    private void visitStatement(ParseTree node, Scope scope, List<CodeEntity> out) {
        if (node instanceof StmtContext statement) {
            if (statement.simple_stmts() != null) {
                visitSimpleStatements(statement.simple_stmts(), out);
            } else {
                visitCompound(statement.compound_stmt(), scope, out);
            }
        } else if (node instanceof Simple_stmtsContext simple) {
            visitSimpleStatements(simple, out);
        }
    }

    private void visitBlock(BlockContext block, Scope scope, List<CodeEntity> out) {
        for (ParseTree statement : ParseTrees.statements(block)) {
            visitStatement(statement, scope, out);
        }
    }

    private void visitSimpleStatements(Simple_stmtsContext statements, List<CodeEntity> out) {
        for (Simple_stmtContext statement : statements.simple_stmt()) {
            Import_stmtContext importStatement = statement.import_stmt();
            if (importStatement == null) {
                continue;
            }
            if (importStatement.import_name() != null) {
                addImports(importStatement.import_name(), out);
            } else {
                addFromImports(importStatement.import_from(), out);
            }
        }
    }

    private void visitCompound(Compound_stmtContext compound, Scope scope, List<CodeEntity> out) {
        if (compound.funcdef() != null) {
            addFunction(compound.funcdef(), List.of(), compound.funcdef().getStart(), false, scope, out);
        } else if (compound.async_stmt() != null && compound.async_stmt().funcdef() != null) {
            addFunction(compound.async_stmt().funcdef(), List.of(), compound.async_stmt().getStart(), true, scope, out);
        } else if (compound.classdef() != null) {
            addClass(compound.classdef(), List.of(), scope, out);
        } else if (compound.decorated() != null) {
            visitDecorated(compound.decorated(), scope, out);
        } else {
            for (BlockContext block : ParseTrees.nestedBlocks(compound)) {
                visitBlock(block, scope, out);
            }
        }
    }

    private void visitDecorated(DecoratedContext decorated, Scope scope, List<CodeEntity> out) {
        List<String> decorators = bareDecoratorNames(decorated.decorators().decorator());
        if (decorated.classdef() != null) {
            addClass(decorated.classdef(), decorators, scope, out);
        } else if (decorated.funcdef() != null) {
            addFunction(decorated.funcdef(), decorators, decorated.funcdef().getStart(), false, scope, out);
        } else {
            FuncdefContext funcdef = decorated.async_funcdef().funcdef();
            addFunction(funcdef, decorators, decorated.async_funcdef().getStart(), true, scope, out);
        }
    }

    private void addFunction(FuncdefContext funcdef, List<String> decorators, Token start,
                             boolean async, Scope scope, List<CodeEntity> out) {
        Location location = source.locationOf(start, funcdef);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("is_async", async);
        metadata.put("decorators", decorators);
        metadata.put("args", positionalArguments(funcdef));
        metadata.put("line_count", location.lineEnd() - location.lineStart() + 1);

        FunctionEntity function = new FunctionEntity(
            funcdef.name().getText(),
            async ? EntityKind.ASYNC_FUNCTION : EntityKind.FUNCTION,
            location,
            Docstrings.of(funcdef.block()),
            source.preview(location.lineStart(), location.lineEnd()),
            metadata
        );

        if (scope.inClass()) {
            scope.owner().addMethod(function);
        } else {
            out.add(function);
        }
    }

    private void addClass(ClassdefContext classdef, List<String> decorators, Scope scope, List<CodeEntity> out) {
        Location location = source.locationOf(classdef.getStart(), classdef);

        ClassEntity.Builder builder = ClassEntity.builder(classdef.name().getText(), location)
            .docstring(Docstrings.of(classdef.block()))
            .sourceCode(source.preview(location.lineStart(), location.lineEnd()))
            .baseClasses(baseClasses(classdef))
            .metadata("decorators", decorators);

        visitBlock(classdef.block(), new Scope(builder), out);
        out.add(builder.build());
    }

    private void addImports(Import_nameContext importName, List<CodeEntity> out) {
        Location location = Location.at(source.filePath(), importName.getStart().getLine());
        for (Dotted_as_nameContext dotted : importName.dotted_as_names().dotted_as_name()) {
            String module = dotted.dotted_name().getText();
            String alias = dotted.name() == null ? null : dotted.name().getText();
            out.add(ImportEntity.of(alias != null ? alias : module, location, module, alias, false));
        }
    }

    private void addFromImports(Import_fromContext importFrom, List<CodeEntity> out) {
        Location location = Location.at(source.filePath(), importFrom.getStart().getLine());

        StringBuilder module = new StringBuilder();
        for (Relative_levelContext level : importFrom.relative_level()) {
            module.append(level.getText());
        }
        if (importFrom.dotted_name() != null) {
            module.append(importFrom.dotted_name().getText());
        }

        if (importFrom.import_as_names() == null) {
            out.add(ImportEntity.of("*", location, module.toString(), null, true));
            return;
        }
        for (Import_as_nameContext imported : importFrom.import_as_names().import_as_name()) {
            String name = imported.name(0).getText();
            String alias = imported.name().size() > 1 ? imported.name(1).getText() : null;
            out.add(ImportEntity.of(alias != null ? alias : name, location, module.toString(), alias, true));
        }
    }

    /**
     * Returns dotted base-class names; keyword arguments, star arguments and any base that is
     * not a plain dotted name (subscripts, calls) are dropped.
     */
    static List<String> baseClasses(ClassdefContext classdef) {
        if (classdef.arglist() == null) {
            return List.of();
        }
        List<String> bases = new ArrayList<>();
        for (ArgumentContext argument : classdef.arglist().argument()) {
            if (argument.getChildCount() != 1) {
                continue;
            }
            String name = ParseTrees.dottedName(argument.test(0));
            if (name != null) {
                bases.add(name);
            }
        }
        return bases;
    }

    /**
     * Keeps only decorators that are a bare name, so {@code @staticmethod} is kept while
     * {@code @app.route("/")} and {@code @functools.cache} are dropped.
     */
    private static List<String> bareDecoratorNames(List<DecoratorContext> decorators) {
        List<String> names = new ArrayList<>();
        for (DecoratorContext decorator : decorators) {
            String name = ParseTrees.dottedName(decorator.namedexpr_test());
            if (name != null && name.indexOf('.') < 0) {
                names.add(name);
            }
        }
        return names;
    }

    /**
     * Returns the names of ordinary positional parameters: positional-only parameters,
     * {@code *args}, keyword-only parameters and {@code **kwargs} are excluded.
     */
    private static List<String> positionalArguments(FuncdefContext funcdef) {
        List<String> names = new ArrayList<>();
        if (funcdef.parameters().typedargslist() == null) {
            return names;
        }
        for (TypedargContext argument : funcdef.parameters().typedargslist().typedarg()) {
            int first = argument.getStart().getType();
            if (first == Python3Parser.DIV) {
                names.clear();
            } else if (first == Python3Parser.STAR || first == Python3Parser.POWER) {
                break;
            } else {
                names.add(argument.tfpdef().name().getText());
            }
        }
        return names;
    }

    /**
     * Traversal scope: the class whose body is being walked, if any.
     *
     * @param owner builder of the enclosing class, or null at module level
     */
    record Scope(ClassEntity.Builder owner) {
        static final Scope MODULE = new Scope(null);

        boolean inClass() {
            return owner != null;
        }
    }
}
