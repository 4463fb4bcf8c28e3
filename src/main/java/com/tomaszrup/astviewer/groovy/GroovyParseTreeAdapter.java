////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.astviewer.groovy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.codehaus.groovy.ast.ASTNode;
import org.codehaus.groovy.ast.AnnotatedNode;
import org.codehaus.groovy.ast.AnnotationNode;
import org.codehaus.groovy.ast.ClassNode;
import org.codehaus.groovy.ast.FieldNode;
import org.codehaus.groovy.ast.ImportNode;
import org.codehaus.groovy.ast.InnerClassNode;
import org.codehaus.groovy.ast.MethodNode;
import org.codehaus.groovy.ast.ModuleNode;
import org.codehaus.groovy.ast.PackageNode;
import org.codehaus.groovy.ast.Parameter;
import org.codehaus.groovy.ast.PropertyNode;
import org.codehaus.groovy.ast.expr.ArrayExpression;
import org.codehaus.groovy.ast.expr.BinaryExpression;
import org.codehaus.groovy.ast.expr.BitwiseNegationExpression;
import org.codehaus.groovy.ast.expr.BooleanExpression;
import org.codehaus.groovy.ast.expr.CastExpression;
import org.codehaus.groovy.ast.expr.ClassExpression;
import org.codehaus.groovy.ast.expr.ClosureExpression;
import org.codehaus.groovy.ast.expr.ConstantExpression;
import org.codehaus.groovy.ast.expr.ConstructorCallExpression;
import org.codehaus.groovy.ast.expr.Expression;
import org.codehaus.groovy.ast.expr.FieldExpression;
import org.codehaus.groovy.ast.expr.GStringExpression;
import org.codehaus.groovy.ast.expr.ListExpression;
import org.codehaus.groovy.ast.expr.MapEntryExpression;
import org.codehaus.groovy.ast.expr.MapExpression;
import org.codehaus.groovy.ast.expr.MethodCallExpression;
import org.codehaus.groovy.ast.expr.MethodPointerExpression;
import org.codehaus.groovy.ast.expr.PostfixExpression;
import org.codehaus.groovy.ast.expr.PrefixExpression;
import org.codehaus.groovy.ast.expr.PropertyExpression;
import org.codehaus.groovy.ast.expr.RangeExpression;
import org.codehaus.groovy.ast.expr.SpreadExpression;
import org.codehaus.groovy.ast.expr.SpreadMapExpression;
import org.codehaus.groovy.ast.expr.StaticMethodCallExpression;
import org.codehaus.groovy.ast.expr.TernaryExpression;
import org.codehaus.groovy.ast.expr.TupleExpression;
import org.codehaus.groovy.ast.expr.UnaryMinusExpression;
import org.codehaus.groovy.ast.expr.UnaryPlusExpression;
import org.codehaus.groovy.ast.expr.VariableExpression;
import org.codehaus.groovy.ast.stmt.AssertStatement;
import org.codehaus.groovy.ast.stmt.BlockStatement;
import org.codehaus.groovy.ast.stmt.BreakStatement;
import org.codehaus.groovy.ast.stmt.CaseStatement;
import org.codehaus.groovy.ast.stmt.CatchStatement;
import org.codehaus.groovy.ast.stmt.ContinueStatement;
import org.codehaus.groovy.ast.stmt.DoWhileStatement;
import org.codehaus.groovy.ast.stmt.EmptyStatement;
import org.codehaus.groovy.ast.stmt.ExpressionStatement;
import org.codehaus.groovy.ast.stmt.ForStatement;
import org.codehaus.groovy.ast.stmt.IfStatement;
import org.codehaus.groovy.ast.stmt.ReturnStatement;
import org.codehaus.groovy.ast.stmt.SwitchStatement;
import org.codehaus.groovy.ast.stmt.SynchronizedStatement;
import org.codehaus.groovy.ast.stmt.ThrowStatement;
import org.codehaus.groovy.ast.stmt.TryCatchStatement;
import org.codehaus.groovy.ast.stmt.WhileStatement;

import com.tomaszrup.astviewer.span.SourcePosition;
import com.tomaszrup.astviewer.tree.CompositeNode;
import com.tomaszrup.astviewer.tree.ParseNode;
import com.tomaszrup.astviewer.tree.ScalarNode;
import com.tomaszrup.astviewer.tree.SequenceNode;

/**
 * Converts a Groovy AST into a {@link ParseNode} tree.
 *
 * <p>Every AST node becomes a {@link CompositeNode} named after its class,
 * with its children as named fields in source order. Declarations list their
 * annotations first. Script statements, methods and classes share one
 * {@code body} field, and class members one {@code members} field, each
 * sorted by position. Type references are rendered as scalar names; resolved
 * {@link ClassNode}s are never descended into, so the result is always a
 * finite tree.</p>
 *
 * <p>Groovy columns are 1-based and are converted to 0-based columns. Nodes
 * without line information get no position.</p>
 */
public class GroovyParseTreeAdapter {

	private static final Comparator<ASTNode> SOURCE_ORDER = Comparator
			.comparingInt((ASTNode node) -> node.getLineNumber() > 0 ? node.getLineNumber() : Integer.MAX_VALUE)
			.thenComparingInt(ASTNode::getColumnNumber);

	public ParseNode adapt(ModuleNode module) {
		CompositeNode result = new CompositeNode(ModuleNode.class.getSimpleName(), positionOf(module));
		result.field("package", adapt(module.getPackage()));
		result.field("imports", list(allImports(module)));

		List<ASTNode> body = new ArrayList<>();
		for (ClassNode classNode : module.getClasses()) {
			if (!classNode.isScript() && !(classNode instanceof InnerClassNode)) {
				body.add(classNode);
			}
		}
		body.addAll(module.getMethods());
		body.addAll(module.getStatementBlock().getStatements());
		body.sort(SOURCE_ORDER);
		result.field("body", list(body));
		return result;
	}

	/**
	 * Converts a single AST node and its subtree. {@code null} becomes a
	 * scalar {@code null}.
	 */
	public ParseNode adapt(ASTNode node) {
		if (node == null) {
			return ScalarNode.of(null);
		}
		if (node instanceof ModuleNode) {
			return adapt((ModuleNode) node);
		}
		CompositeNode result = new CompositeNode(node.getClass().getSimpleName(), positionOf(node));
		if (isDeclaration(node)) {
			List<AnnotationNode> annotations = new ArrayList<>(((AnnotatedNode) node).getAnnotations());
			annotations.sort(SOURCE_ORDER);
			result.field("annotations", list(annotations));
		}
		if (node instanceof ClassNode) {
			addClassFields(result, (ClassNode) node);
		} else if (node instanceof MethodNode) {
			MethodNode method = (MethodNode) node;
			result.field("name", ScalarNode.of(method.getName()));
			result.field("returnType", typeName(method.getReturnType()));
			result.field("parameters", parameters(method.getParameters()));
			result.field("code", adapt(method.getCode()));
		} else if (node instanceof PropertyNode) {
			PropertyNode property = (PropertyNode) node;
			result.field("name", ScalarNode.of(property.getName()));
			result.field("type", typeName(property.getType()));
			result.field("initialExpression", adapt(property.getInitialExpression()));
		} else if (node instanceof FieldNode) {
			FieldNode field = (FieldNode) node;
			result.field("name", ScalarNode.of(field.getName()));
			result.field("type", typeName(field.getType()));
			result.field("initialExpression", adapt(field.getInitialExpression()));
		} else if (node instanceof Parameter) {
			Parameter parameter = (Parameter) node;
			result.field("name", ScalarNode.of(parameter.getName()));
			result.field("type", typeName(parameter.getType()));
			result.field("initialExpression", adapt(parameter.getInitialExpression()));
		} else if (node instanceof ImportNode) {
			ImportNode importNode = (ImportNode) node;
			result.field("className", ScalarNode.of(importNode.getClassName()));
			result.field("packageName", ScalarNode.of(importNode.getPackageName()));
			result.field("fieldName", ScalarNode.of(importNode.getFieldName()));
			result.field("alias", ScalarNode.of(importNode.getAlias()));
			result.field("isStatic", ScalarNode.of(importNode.isStatic()));
			result.field("isStar", ScalarNode.of(importNode.isStar()));
		} else if (node instanceof PackageNode) {
			result.field("name", ScalarNode.of(((PackageNode) node).getName()));
		} else if (node instanceof AnnotationNode) {
			AnnotationNode annotation = (AnnotationNode) node;
			result.field("classNode", typeName(annotation.getClassNode()));
			CompositeNode members = new CompositeNode("Members");
			for (Map.Entry<String, Expression> member : annotation.getMembers().entrySet()) {
				members.field(member.getKey(), adapt(member.getValue()));
			}
			result.field("members", members);
		} else if (!addStatementFields(result, node)) {
			addExpressionFields(result, node);
		}
		return result;
	}

	private static boolean isDeclaration(ASTNode node) {
		return node instanceof ClassNode || node instanceof MethodNode || node instanceof FieldNode
				|| node instanceof PropertyNode || node instanceof Parameter || node instanceof PackageNode
				|| node instanceof ImportNode;
	}

	private void addClassFields(CompositeNode result, ClassNode classNode) {
		result.field("name", ScalarNode.of(classNode.getNameWithoutPackage()));
		result.field("superClass", typeName(classNode.getUnresolvedSuperClass(false)));
		List<ParseNode> interfaces = new ArrayList<>();
		for (ClassNode interfaceNode : classNode.getInterfaces()) {
			interfaces.add(typeName(interfaceNode));
		}
		result.field("interfaces", new SequenceNode(SequenceNode.ARRAY, interfaces));

		List<ASTNode> members = new ArrayList<>();
		for (FieldNode field : classNode.getFields()) {
			if (!field.isSynthetic() && classNode.getProperty(field.getName()) == null) {
				members.add(field);
			}
		}
		members.addAll(classNode.getProperties());
		members.addAll(withoutSynthetic(classNode.getDeclaredConstructors()));
		members.addAll(withoutSynthetic(classNode.getMethods()));
		Iterator<InnerClassNode> iterator = classNode.getInnerClasses();
		while (iterator.hasNext()) {
			InnerClassNode innerClass = iterator.next();
			if (!innerClass.isAnonymous()) {
				members.add(innerClass);
			}
		}
		members.sort(SOURCE_ORDER);
		result.field("members", list(members));
	}

	private boolean addStatementFields(CompositeNode result, ASTNode node) {
		if (node instanceof BlockStatement) {
			result.field("statements", list(((BlockStatement) node).getStatements()));
		} else if (node instanceof ExpressionStatement) {
			result.field("expression", adapt(((ExpressionStatement) node).getExpression()));
		} else if (node instanceof ReturnStatement) {
			result.field("expression", adapt(((ReturnStatement) node).getExpression()));
		} else if (node instanceof IfStatement) {
			IfStatement ifStatement = (IfStatement) node;
			result.field("booleanExpression", adapt(ifStatement.getBooleanExpression()));
			result.field("ifBlock", adapt(ifStatement.getIfBlock()));
			result.field("elseBlock", adapt(ifStatement.getElseBlock()));
		} else if (node instanceof ForStatement) {
			ForStatement forStatement = (ForStatement) node;
			result.field("variable", adapt(forStatement.getVariable()));
			result.field("collectionExpression", adapt(forStatement.getCollectionExpression()));
			result.field("loopBlock", adapt(forStatement.getLoopBlock()));
		} else if (node instanceof WhileStatement) {
			WhileStatement whileStatement = (WhileStatement) node;
			result.field("booleanExpression", adapt(whileStatement.getBooleanExpression()));
			result.field("loopBlock", adapt(whileStatement.getLoopBlock()));
		} else if (node instanceof DoWhileStatement) {
			DoWhileStatement doWhileStatement = (DoWhileStatement) node;
			result.field("loopBlock", adapt(doWhileStatement.getLoopBlock()));
			result.field("booleanExpression", adapt(doWhileStatement.getBooleanExpression()));
		} else if (node instanceof TryCatchStatement) {
			TryCatchStatement tryCatch = (TryCatchStatement) node;
			result.field("resourceStatements", list(tryCatch.getResourceStatements()));
			result.field("tryStatement", adapt(tryCatch.getTryStatement()));
			result.field("catchStatements", list(tryCatch.getCatchStatements()));
			result.field("finallyStatement", adapt(tryCatch.getFinallyStatement()));
		} else if (node instanceof CatchStatement) {
			CatchStatement catchStatement = (CatchStatement) node;
			result.field("variable", adapt(catchStatement.getVariable()));
			result.field("code", adapt(catchStatement.getCode()));
		} else if (node instanceof ThrowStatement) {
			result.field("expression", adapt(((ThrowStatement) node).getExpression()));
		} else if (node instanceof SwitchStatement) {
			SwitchStatement switchStatement = (SwitchStatement) node;
			result.field("expression", adapt(switchStatement.getExpression()));
			result.field("caseStatements", list(switchStatement.getCaseStatements()));
			result.field("defaultStatement", adapt(switchStatement.getDefaultStatement()));
		} else if (node instanceof CaseStatement) {
			CaseStatement caseStatement = (CaseStatement) node;
			result.field("expression", adapt(caseStatement.getExpression()));
			result.field("code", adapt(caseStatement.getCode()));
		} else if (node instanceof AssertStatement) {
			AssertStatement assertStatement = (AssertStatement) node;
			result.field("booleanExpression", adapt(assertStatement.getBooleanExpression()));
			result.field("messageExpression", adapt(assertStatement.getMessageExpression()));
		} else if (node instanceof BreakStatement) {
			result.field("label", ScalarNode.of(((BreakStatement) node).getLabel()));
		} else if (node instanceof ContinueStatement) {
			result.field("label", ScalarNode.of(((ContinueStatement) node).getLabel()));
		} else if (node instanceof SynchronizedStatement) {
			SynchronizedStatement synchronizedStatement = (SynchronizedStatement) node;
			result.field("expression", adapt(synchronizedStatement.getExpression()));
			result.field("code", adapt(synchronizedStatement.getCode()));
		} else if (node instanceof EmptyStatement) {
			// no fields
		} else {
			return false;
		}
		return true;
	}

	private void addExpressionFields(CompositeNode result, ASTNode node) {
		// subclasses are tested before their superclasses
		if (node instanceof ConstantExpression) {
			result.field("value", ScalarNode.of(((ConstantExpression) node).getValue()));
		} else if (node instanceof VariableExpression) {
			result.field("name", ScalarNode.of(((VariableExpression) node).getName()));
		} else if (node instanceof BinaryExpression) {
			BinaryExpression binary = (BinaryExpression) node;
			result.field("leftExpression", adapt(binary.getLeftExpression()));
			result.field("operation", ScalarNode.of(binary.getOperation().getText()));
			result.field("rightExpression", adapt(binary.getRightExpression()));
		} else if (node instanceof MethodCallExpression) {
			MethodCallExpression call = (MethodCallExpression) node;
			result.field("objectExpression", adapt(call.getObjectExpression()));
			result.field("method", adapt(call.getMethod()));
			result.field("arguments", adapt(call.getArguments()));
		} else if (node instanceof StaticMethodCallExpression) {
			StaticMethodCallExpression call = (StaticMethodCallExpression) node;
			result.field("ownerType", typeName(call.getOwnerType()));
			result.field("method", ScalarNode.of(call.getMethod()));
			result.field("arguments", adapt(call.getArguments()));
		} else if (node instanceof ConstructorCallExpression) {
			ConstructorCallExpression call = (ConstructorCallExpression) node;
			result.field("type", typeName(call.getType()));
			result.field("arguments", adapt(call.getArguments()));
		} else if (node instanceof PropertyExpression) {
			PropertyExpression property = (PropertyExpression) node;
			result.field("objectExpression", adapt(property.getObjectExpression()));
			result.field("property", adapt(property.getProperty()));
		} else if (node instanceof TupleExpression) {
			result.field("expressions", list(((TupleExpression) node).getExpressions()));
		} else if (node instanceof ListExpression) {
			result.field("expressions", list(((ListExpression) node).getExpressions()));
		} else if (node instanceof MapExpression) {
			result.field("mapEntryExpressions", list(((MapExpression) node).getMapEntryExpressions()));
		} else if (node instanceof MapEntryExpression) {
			MapEntryExpression entry = (MapEntryExpression) node;
			result.field("keyExpression", adapt(entry.getKeyExpression()));
			result.field("valueExpression", adapt(entry.getValueExpression()));
		} else if (node instanceof ClosureExpression) {
			ClosureExpression closure = (ClosureExpression) node;
			result.field("parameters", parameters(closure.getParameters()));
			result.field("code", adapt(closure.getCode()));
		} else if (node instanceof GStringExpression) {
			GStringExpression gString = (GStringExpression) node;
			result.field("strings", list(gString.getStrings()));
			result.field("values", list(gString.getValues()));
		} else if (node instanceof TernaryExpression) {
			TernaryExpression ternary = (TernaryExpression) node;
			result.field("booleanExpression", adapt(ternary.getBooleanExpression()));
			result.field("trueExpression", adapt(ternary.getTrueExpression()));
			result.field("falseExpression", adapt(ternary.getFalseExpression()));
		} else if (node instanceof BooleanExpression) {
			result.field("expression", adapt(((BooleanExpression) node).getExpression()));
		} else if (node instanceof UnaryMinusExpression) {
			result.field("expression", adapt(((UnaryMinusExpression) node).getExpression()));
		} else if (node instanceof UnaryPlusExpression) {
			result.field("expression", adapt(((UnaryPlusExpression) node).getExpression()));
		} else if (node instanceof BitwiseNegationExpression) {
			result.field("expression", adapt(((BitwiseNegationExpression) node).getExpression()));
		} else if (node instanceof PrefixExpression) {
			PrefixExpression prefix = (PrefixExpression) node;
			result.field("operation", ScalarNode.of(prefix.getOperation().getText()));
			result.field("expression", adapt(prefix.getExpression()));
		} else if (node instanceof PostfixExpression) {
			PostfixExpression postfix = (PostfixExpression) node;
			result.field("expression", adapt(postfix.getExpression()));
			result.field("operation", ScalarNode.of(postfix.getOperation().getText()));
		} else if (node instanceof CastExpression) {
			CastExpression cast = (CastExpression) node;
			result.field("type", typeName(cast.getType()));
			result.field("expression", adapt(cast.getExpression()));
		} else if (node instanceof ClassExpression) {
			result.field("type", typeName(((ClassExpression) node).getType()));
		} else if (node instanceof RangeExpression) {
			RangeExpression range = (RangeExpression) node;
			result.field("from", adapt(range.getFrom()));
			result.field("to", adapt(range.getTo()));
			result.field("inclusive", ScalarNode.of(range.isInclusive()));
		} else if (node instanceof SpreadExpression) {
			result.field("expression", adapt(((SpreadExpression) node).getExpression()));
		} else if (node instanceof SpreadMapExpression) {
			result.field("expression", adapt(((SpreadMapExpression) node).getExpression()));
		} else if (node instanceof MethodPointerExpression) {
			MethodPointerExpression pointer = (MethodPointerExpression) node;
			result.field("expression", adapt(pointer.getExpression()));
			result.field("methodName", adapt(pointer.getMethodName()));
		} else if (node instanceof FieldExpression) {
			result.field("fieldName", ScalarNode.of(((FieldExpression) node).getFieldName()));
		} else if (node instanceof ArrayExpression) {
			ArrayExpression array = (ArrayExpression) node;
			result.field("elementType", typeName(array.getElementType()));
			result.field("expressions", list(array.getExpressions()));
			List<? extends ASTNode> sizes = array.getSizeExpression();
			result.field("sizeExpression", sizes != null ? list(sizes) : ScalarNode.of(null));
		} else {
			result.field("text", ScalarNode.of(node.getText()));
		}
	}

	private List<ImportNode> allImports(ModuleNode module) {
		List<ImportNode> imports = new ArrayList<>(module.getImports());
		imports.addAll(module.getStarImports());
		imports.addAll(module.getStaticImports().values());
		imports.addAll(module.getStaticStarImports().values());
		imports.sort(SOURCE_ORDER);
		return imports;
	}

	private static <T extends AnnotatedNode> List<T> withoutSynthetic(List<T> nodes) {
		List<T> result = new ArrayList<>(nodes.size());
		for (T node : nodes) {
			if (!node.isSynthetic()) {
				result.add(node);
			}
		}
		return result;
	}

	private SequenceNode list(List<? extends ASTNode> nodes) {
		List<ParseNode> elements = new ArrayList<>(nodes.size());
		for (ASTNode node : nodes) {
			elements.add(adapt(node));
		}
		return SequenceNode.list(elements);
	}

	private ParseNode parameters(Parameter[] parameters) {
		if (parameters == null) {
			return ScalarNode.of(null);
		}
		List<ParseNode> elements = new ArrayList<>(parameters.length);
		for (Parameter parameter : parameters) {
			elements.add(adapt(parameter));
		}
		return new SequenceNode(SequenceNode.ARRAY, elements);
	}

	private static ParseNode typeName(ClassNode type) {
		return ScalarNode.of(type != null ? type.getName() : null);
	}

	/**
	 * The node's start as a {@link SourcePosition}, or {@code null} when
	 * Groovy recorded no line for it.
	 */
	static SourcePosition positionOf(ASTNode node) {
		if (node == null || node.getLineNumber() < 1) {
			return null;
		}
		return SourcePosition.of(node.getLineNumber(), Math.max(0, node.getColumnNumber() - 1));
	}
}
