package com.raditha.merge.parser;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.raditha.merge.model.Body;
import com.raditha.merge.model.LineRange;
import com.raditha.merge.model.Node;
import com.raditha.merge.model.NodeKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Converts a JavaParser compilation unit into merge {@link Node}s.
 * <p>
 * Top-level nodes are the package declaration, imports and type declarations.
 * Type members and block statements become nested nodes, so that freeze
 * regions can be validated at any depth and class bodies can be merged
 * member by member.
 */
public class JavaNodeConverter {

    private static final String BLOCK_LAMBDA = "{}";

    private final SourceText source;

    public JavaNodeConverter(SourceText source) {
        this.source = source;
    }

    /**
     * Convert every top-level construct of the compilation unit.
     *
     * @param cu parsed compilation unit
     * @return nodes ordered by start line
     */
    public List<Node> convert(CompilationUnit cu) {
        List<Node> nodes = new ArrayList<>();
        cu.getPackageDeclaration().ifPresent(pkg -> nodes.add(
                node(NodeKind.PACKAGE, pkg, "package", pkg.getNameAsString(), null, null, List.of())));
        for (ImportDeclaration imp : cu.getImports()) {
            nodes.add(node(NodeKind.IMPORT, imp, "import", imp.getNameAsString(), importText(imp), null, List.of()));
        }
        for (TypeDeclaration<?> type : cu.getTypes()) {
            nodes.add(convertType(type));
        }
        cu.getModule().ifPresent(module -> nodes.add(
                node(NodeKind.OTHER, module, "module", module.getNameAsString(), module.getNameAsString(), null,
                        List.of())));
        nodes.sort(Comparator.comparingInt(Node::startLine));
        return nodes;
    }

    private static String importText(ImportDeclaration imp) {
        return (imp.isStatic() ? "static " : "") + imp.getNameAsString() + (imp.isAsterisk() ? ".*" : "");
    }

    Node convertType(TypeDeclaration<?> type) {
        boolean implicitConstants = type instanceof AnnotationDeclaration
                || (type instanceof ClassOrInterfaceDeclaration c && c.isInterface());
        List<Node> members = convertMembers(type.getMembers(), implicitConstants);
        String keyword = typeKeyword(type);

        if (type instanceof EnumDeclaration enumDeclaration) {
            // constants are separated by commas, so the body is never split
            List<Node> children = new ArrayList<>();
            for (EnumConstantDeclaration constant : enumDeclaration.getEntries()) {
                children.add(node(NodeKind.CONSTANT, constant, "const_assign", constant.getNameAsString(), null,
                        null, convertMembers(constant.getClassBody(), false)));
            }
            children.addAll(members);
            return node(NodeKind.TYPE_DECLARATION, type, keyword, type.getNameAsString(), null, null, children);
        }

        int openLine = openingBraceLine(type, type.getName());
        Body body = null;
        if (openLine > 0) {
            body = new Body(openLine, rangeOf(type).end.line, members);
        }
        return node(NodeKind.TYPE_DECLARATION, type, keyword, type.getNameAsString(), null, body, members);
    }

    private static String typeKeyword(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration c) {
            return c.isInterface() ? "interface" : "class";
        }
        if (type instanceof EnumDeclaration) {
            return "enum";
        }
        if (type instanceof RecordDeclaration) {
            return "record";
        }
        if (type instanceof AnnotationDeclaration) {
            return "@interface";
        }
        return "type";
    }

    private List<Node> convertMembers(NodeList<BodyDeclaration<?>> members, boolean implicitConstants) {
        List<Node> nodes = new ArrayList<>();
        for (BodyDeclaration<?> member : members) {
            if (member.getRange().isPresent()) {
                nodes.add(convertMember(member, implicitConstants));
            }
        }
        return nodes;
    }

    private Node convertMember(BodyDeclaration<?> member, boolean implicitConstants) {
        if (member instanceof MethodDeclaration method) {
            List<Node> children = method.getBody().map(this::blockChildren).orElse(List.of());
            return definition(method, "method", method.getNameAsString(), parameterNames(method.getParameters()),
                    children);
        }
        if (member instanceof ConstructorDeclaration constructor) {
            return definition(constructor, "constructor", constructor.getNameAsString(),
                    parameterNames(constructor.getParameters()), blockChildren(constructor.getBody()));
        }
        if (member instanceof CompactConstructorDeclaration compact) {
            return definition(compact, "constructor", compact.getNameAsString(), List.of(),
                    blockChildren(compact.getBody()));
        }
        if (member instanceof AnnotationMemberDeclaration annotationMember) {
            return definition(annotationMember, "member", annotationMember.getNameAsString(), List.of(), List.of());
        }
        if (member instanceof FieldDeclaration field) {
            return convertField(field, implicitConstants);
        }
        if (member instanceof InitializerDeclaration initializer) {
            Body body = block(initializer.getBody());
            return node(NodeKind.INITIALIZER, initializer, initializer.isStatic() ? "static" : "instance", null,
                    null, body, body.children());
        }
        if (member instanceof TypeDeclaration<?> type) {
            return convertType(type);
        }
        return node(NodeKind.OTHER, member, member.getClass().getSimpleName(), null, normalized(member), null,
                List.of());
    }

    private Node definition(BodyDeclaration<?> declaration, String keyword, String name, List<String> parameters,
            List<Node> children) {
        Range range = rangeOf(declaration);
        return new Node(NodeKind.DEFINITION, declaration.getClass().getSimpleName(), keyword, LineRange.from(range),
                range.end.column, name, parameters, null, source.slice(range), null, children);
    }

    /**
     * Declared parameter names in order. Receiver parameters are not part of
     * the parameter list in JavaParser and therefore never show up here.
     */
    private static List<String> parameterNames(NodeList<Parameter> parameters) {
        return parameters.stream().map(Parameter::getNameAsString).collect(Collectors.toList());
    }

    private Node convertField(FieldDeclaration field, boolean implicitConstants) {
        String names = field.getVariables().stream()
                .map(VariableDeclarator::getNameAsString)
                .collect(Collectors.joining(","));
        boolean constant = implicitConstants || (field.isStatic() && field.isFinal());
        Body body = valueBlock(field.getVariables());
        List<Node> children = body == null ? List.of() : body.children();
        if (constant) {
            return node(NodeKind.CONSTANT, field, "const_assign", names, null, body, children);
        }
        return node(NodeKind.VARIABLE, field, "field", names, null, body, children);
    }

    private List<Node> convertStatements(NodeList<Statement> statements) {
        List<Node> nodes = new ArrayList<>();
        for (Statement statement : statements) {
            if (statement.getRange().isPresent()) {
                nodes.add(convertStatement(statement));
            }
        }
        return nodes;
    }

    private List<Node> blockChildren(Statement statement) {
        if (statement instanceof BlockStmt block) {
            return convertStatements(block.getStatements());
        }
        return List.of(convertStatement(statement));
    }

    private Body block(BlockStmt block) {
        Range range = rangeOf(block);
        return new Body(range.begin.line, range.end.line, convertStatements(block.getStatements()));
    }

    Node convertStatement(Statement statement) {
        if (statement instanceof ExpressionStmt expressionStmt) {
            return convertExpressionStatement(expressionStmt);
        }
        if (statement instanceof IfStmt ifStmt) {
            List<Node> children = new ArrayList<>(blockChildren(ifStmt.getThenStmt()));
            ifStmt.getElseStmt().ifPresent(elseStmt -> {
                if (elseStmt instanceof IfStmt) {
                    children.add(convertStatement(elseStmt));
                } else {
                    children.addAll(blockChildren(elseStmt));
                }
            });
            return node(NodeKind.CONDITIONAL, statement, "if", null, normalized(ifStmt.getCondition()), null,
                    children);
        }
        if (statement instanceof SwitchStmt switchStmt) {
            List<Node> children = new ArrayList<>();
            for (SwitchEntry entry : switchStmt.getEntries()) {
                children.addAll(convertStatements(entry.getStatements()));
            }
            return node(NodeKind.CONDITIONAL, statement, "switch", null, normalized(switchStmt.getSelector()), null,
                    children);
        }
        if (statement instanceof ForStmt forStmt) {
            String header = joinNormalized(forStmt.getInitialization()) + "; "
                    + forStmt.getCompare().map(this::normalized).orElse("") + "; "
                    + joinNormalized(forStmt.getUpdate());
            return node(NodeKind.LOOP, statement, "for", null, header, null, blockChildren(forStmt.getBody()));
        }
        if (statement instanceof ForEachStmt forEach) {
            String header = normalized(forEach.getVariable()) + " : " + normalized(forEach.getIterable());
            return node(NodeKind.LOOP, statement, "foreach", null, header, null, blockChildren(forEach.getBody()));
        }
        if (statement instanceof WhileStmt whileStmt) {
            return node(NodeKind.LOOP, statement, "while", null, normalized(whileStmt.getCondition()), null,
                    blockChildren(whileStmt.getBody()));
        }
        if (statement instanceof DoStmt doStmt) {
            return node(NodeKind.LOOP, statement, "do", null, normalized(doStmt.getCondition()), null,
                    blockChildren(doStmt.getBody()));
        }
        if (statement instanceof TryStmt tryStmt) {
            return convertTry(tryStmt);
        }
        if (statement instanceof LocalClassDeclarationStmt localClass) {
            return convertType(localClass.getClassDeclaration());
        }
        if (statement instanceof LocalRecordDeclarationStmt localRecord) {
            return convertType(localRecord.getRecordDeclaration());
        }
        if (statement instanceof ReturnStmt) {
            return node(NodeKind.OTHER, statement, "return", null, null, null, List.of());
        }
        if (statement instanceof YieldStmt) {
            return node(NodeKind.OTHER, statement, "yield", null, null, null, List.of());
        }
        if (statement instanceof ExplicitConstructorInvocationStmt invocation) {
            return node(NodeKind.OTHER, statement, invocation.isThis() ? "this" : "super", null, null, null,
                    List.of());
        }
        if (statement instanceof EmptyStmt) {
            return node(NodeKind.LITERAL, statement, "empty", null, null, null, List.of());
        }
        if (statement instanceof BlockStmt blockStmt) {
            return node(NodeKind.OTHER, statement, "block", null, normalized(statement), null,
                    convertStatements(blockStmt.getStatements()));
        }
        if (statement instanceof SynchronizedStmt sync) {
            return node(NodeKind.OTHER, statement, "synchronized", null, normalized(sync.getExpression()), null,
                    blockChildren(sync.getBody()));
        }
        if (statement instanceof LabeledStmt labeled) {
            return node(NodeKind.OTHER, statement, "label", null, labeled.getLabel().asString(), null,
                    blockChildren(labeled.getStatement()));
        }
        return node(NodeKind.OTHER, statement, statement.getClass().getSimpleName(), null, normalized(statement),
                null, List.of());
    }

    private Node convertTry(TryStmt tryStmt) {
        String resources = joinNormalized(tryStmt.getResources());
        Body body = block(tryStmt.getTryBlock());
        List<Node> children = new ArrayList<>(body.children());
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            children.addAll(convertStatements(clause.getBody().getStatements()));
        }
        tryStmt.getFinallyBlock().ifPresent(fin -> children.addAll(convertStatements(fin.getStatements())));
        return node(NodeKind.TRY, tryStmt, "try", null, resources, body, children);
    }

    private Node convertExpressionStatement(ExpressionStmt statement) {
        Expression expression = statement.getExpression();
        if (expression instanceof MethodCallExpr call) {
            String target = call.getScope().map(scope -> normalized(scope) + ".").orElse("") + call.getNameAsString();
            Body body = trailingBlock(call.getArguments());
            return node(NodeKind.CALL, statement, "call", call.getNameAsString(),
                    target + "(" + argumentSummary(call.getArguments()) + ")", body,
                    body == null ? List.of() : body.children());
        }
        if (expression instanceof ObjectCreationExpr creation) {
            List<Node> children = creation.getAnonymousClassBody()
                    .map(members -> convertMembers(members, false))
                    .orElse(List.of());
            return node(NodeKind.CALL, statement, "new", creation.getType().getNameAsString(),
                    "new " + normalized(creation.getType()) + "(" + argumentSummary(creation.getArguments()) + ")",
                    null, children);
        }
        if (expression instanceof AssignExpr assign) {
            Body body = lambdaBlock(assign.getValue());
            return node(NodeKind.VARIABLE, statement, "assign", normalized(assign.getTarget()), null, body,
                    body == null ? List.of() : body.children());
        }
        if (expression instanceof VariableDeclarationExpr declaration) {
            String names = declaration.getVariables().stream()
                    .map(VariableDeclarator::getNameAsString)
                    .collect(Collectors.joining(","));
            Body body = valueBlock(declaration.getVariables());
            return node(NodeKind.VARIABLE, statement, "local", names, null, body,
                    body == null ? List.of() : body.children());
        }
        return node(NodeKind.OTHER, statement, expression.getClass().getSimpleName(), null, normalized(statement),
                null, List.of());
    }

    private Body valueBlock(NodeList<VariableDeclarator> variables) {
        if (variables.size() != 1) {
            return null;
        }
        return variables.get(0).getInitializer().map(this::lambdaBlock).orElse(null);
    }

    private Body trailingBlock(NodeList<Expression> arguments) {
        if (arguments.isEmpty()) {
            return null;
        }
        return lambdaBlock(arguments.get(arguments.size() - 1));
    }

    private Body lambdaBlock(Expression expression) {
        if (expression instanceof LambdaExpr lambda && lambda.getBody() instanceof BlockStmt block
                && block.getRange().isPresent()) {
            return block(block);
        }
        return null;
    }

    /**
     * Arguments as identity text; block lambdas are reduced to their parameters
     * so that a call keeps its identity while its block changes.
     */
    private String argumentSummary(NodeList<Expression> arguments) {
        return arguments.stream().map(argument -> {
            if (argument instanceof LambdaExpr lambda && lambda.getBody() instanceof BlockStmt) {
                String params = lambda.getParameters().stream()
                        .map(Parameter::getNameAsString)
                        .collect(Collectors.joining(", "));
                return "(" + params + ") -> " + BLOCK_LAMBDA;
            }
            return normalized(argument);
        }).collect(Collectors.joining(", "));
    }

    private String joinNormalized(NodeList<? extends com.github.javaparser.ast.Node> nodes) {
        return nodes.stream().map(this::normalized).collect(Collectors.joining(", "));
    }

    private String normalized(com.github.javaparser.ast.Node syntax) {
        return SourceText.normalize(text(syntax));
    }

    private String text(com.github.javaparser.ast.Node syntax) {
        return syntax.getRange().map(source::slice).orElseGet(syntax::toString);
    }

    private Node node(NodeKind kind, com.github.javaparser.ast.Node syntax, String keyword, String name,
            String discriminant, Body body, List<Node> children) {
        Range range = rangeOf(syntax);
        return new Node(kind, syntax.getClass().getSimpleName(), keyword, LineRange.from(range), range.end.column,
                name, List.of(), discriminant, source.slice(range), body, children);
    }

    private static Range rangeOf(com.github.javaparser.ast.Node syntax) {
        return syntax.getRange().orElseThrow(() -> new IllegalStateException(
                "No source position for " + syntax.getClass().getSimpleName()));
    }

    /**
     * Line of the first top-level opening brace after {@code after}, or -1.
     */
    private static int openingBraceLine(com.github.javaparser.ast.Node syntax, com.github.javaparser.ast.Node after) {
        Optional<TokenRange> tokens = syntax.getTokenRange();
        Optional<Range> afterRange = after.getRange();
        if (tokens.isEmpty() || afterRange.isEmpty()) {
            return -1;
        }
        Position afterEnd = afterRange.get().end;
        int parenDepth = 0;
        for (JavaToken token : tokens.get()) {
            Optional<Range> tokenRange = token.getRange();
            if (tokenRange.isEmpty() || !tokenRange.get().begin.isAfter(afterEnd)) {
                continue;
            }
            String text = token.getText();
            if ("(".equals(text)) {
                parenDepth++;
            } else if (")".equals(text)) {
                parenDepth--;
            } else if ("{".equals(text) && parenDepth == 0) {
                return tokenRange.get().begin.line;
            }
        }
        return -1;
    }
}
