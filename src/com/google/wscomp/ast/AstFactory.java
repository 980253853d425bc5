/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.wscomp.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Convenience methods for building arena content without a parser. Every statement and
 * expression created through a factory gets a synthetic span; spans are strictly increasing in
 * creation order, so children sort before the statement that contains them.
 */
public final class AstFactory {
  private final AstArena arena;
  private int nextOffset = 0;

  private AstFactory(AstArena arena) {
    this.arena = arena;
  }

  public static AstFactory create(AstArena arena) {
    return new AstFactory(arena);
  }

  public AstArena getArena() {
    return arena;
  }

  private Span nextSpan() {
    Span span = new Span(nextOffset, nextOffset + 1);
    nextOffset++;
    return span;
  }

  // Expressions

  public ExpressionId number(double value) {
    return arena.addExpression(new Expression.NumberLiteral(value), nextSpan());
  }

  public ExpressionId bool(boolean value) {
    return arena.addExpression(new Expression.BooleanLiteral(value), nextSpan());
  }

  public ExpressionId string(String value) {
    return arena.addExpression(new Expression.StringLiteral(value), nextSpan());
  }

  /** A reference to a name that name resolution left unbound, such as a global. */
  public ExpressionId name(String name) {
    return reference(Binding.global(name));
  }

  public ExpressionId param(String name) {
    return reference(Binding.parameter(name));
  }

  /** A reference to the local declared by a {@code let} or {@code state} statement. */
  public ExpressionId ref(StatementId declaration) {
    return reference(bindingOf(declaration));
  }

  public ExpressionId constant(String name, ExpressionId value) {
    return reference(Binding.constant(name, value));
  }

  public ExpressionId reference(Binding binding) {
    return arena.addExpression(new Expression.Reference(binding), nextSpan());
  }

  public ExpressionId binary(BinaryOperator op, ExpressionId left, ExpressionId right) {
    return arena.addExpression(new Expression.Binary(op, left, right), nextSpan());
  }

  public ExpressionId call(ExpressionId callee, ExpressionId... arguments) {
    return arena.addExpression(
        new Expression.Call(callee, ImmutableList.copyOf(arguments)), nextSpan());
  }

  // Statements

  public StatementId let(String name, ExpressionId value) {
    return arena.addStatement(new Statement.Let(name, value), nextSpan());
  }

  public StatementId state(String name, ExpressionId value) {
    return arena.addStatement(new Statement.State(name, value), nextSpan());
  }

  public StatementId exprResult(ExpressionId expression) {
    return arena.addStatement(new Statement.ExpressionStatement(expression), nextSpan());
  }

  public StatementId assign(Binding target, ExpressionId value) {
    return arena.addStatement(new Statement.Assignment(target, value), nextSpan());
  }

  /** Assigns to the local declared by a {@code let} or {@code state} statement. */
  public StatementId assign(StatementId declaration, ExpressionId value) {
    return assign(bindingOf(declaration), value);
  }

  public StatementId returnStatement(ExpressionId value) {
    return arena.addStatement(new Statement.Return(value), nextSpan());
  }

  public StatementId ifStatement(ExpressionId condition, BlockId body) {
    return arena.addStatement(new Statement.If(condition, body, null, null), nextSpan());
  }

  public StatementId ifElse(ExpressionId condition, BlockId body, BlockId elseBlock) {
    return arena.addStatement(new Statement.If(condition, body, elseBlock, null), nextSpan());
  }

  /**
   * Creates {@code if condition { body } else if ...}. {@code elseIf} must be an if statement
   * created by this factory; it becomes the alternate of the new statement.
   */
  public StatementId ifElseIf(ExpressionId condition, BlockId body, StatementId elseIf) {
    Statement alternate = arena.getStatement(elseIf);
    checkArgument(alternate instanceof Statement.If, "not an if statement: %s", alternate);
    return arena.addStatement(
        new Statement.If(condition, body, null, (Statement.If) alternate), nextSpan());
  }

  public StatementId whileLoop(ExpressionId condition, BlockId body) {
    return arena.addStatement(new Statement.While(condition, body), nextSpan());
  }

  public StatementId forIn(String binding, ExpressionId iterable, BlockId body) {
    return arena.addStatement(new Statement.For(binding, iterable, body), nextSpan());
  }

  public BlockId block(StatementId... statements) {
    return arena.addBlock(new Block(ImmutableList.copyOf(statements)));
  }

  public BlockId block(List<StatementId> statements) {
    return arena.addBlock(new Block(ImmutableList.copyOf(statements)));
  }

  // Declarations

  public FunctionId function(String name, List<String> parameters, BlockId body) {
    return function(name, parameters, body, false);
  }

  public FunctionId function(
      String name, List<String> parameters, BlockId body, boolean isPublic) {
    return arena.addFunction(
        new FunctionDecl(name, ImmutableList.copyOf(parameters), body, isPublic));
  }

  public ComponentId component(
      String name, List<String> parameters, BlockId body, boolean isPublic) {
    return arena.addComponent(
        new ComponentDecl(name, ImmutableList.copyOf(parameters), body, isPublic));
  }

  private Binding bindingOf(StatementId declaration) {
    Statement statement = arena.getStatement(declaration);
    switch (statement.getKind()) {
      case LET:
        return Binding.let(((Statement.Let) statement).name(), declaration);
      case STATE:
        return Binding.state(((Statement.State) statement).name(), declaration);
      default:
        throw new IllegalArgumentException("not a declaration: " + statement);
    }
  }
}
