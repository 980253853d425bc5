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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns every statement, expression, block and declaration of a module. All cross references are
 * integer handles into this arena. Source spans live in side tables keyed by the same handles.
 *
 * <p>Passes that run after parsing treat the arena as read-only; only {@link AstFactory} and the
 * parser append to it.
 */
public final class AstArena {
  private final List<Statement> statements = new ArrayList<>();
  private final List<Span> statementSpans = new ArrayList<>();
  private final List<Expression> expressions = new ArrayList<>();
  private final List<Span> expressionSpans = new ArrayList<>();
  private final List<Block> blocks = new ArrayList<>();
  private final List<FunctionDecl> functions = new ArrayList<>();
  private final List<ComponentDecl> components = new ArrayList<>();
  private final List<Declaration> declarations = new ArrayList<>();

  public StatementId addStatement(Statement statement, Span span) {
    statements.add(statement);
    statementSpans.add(span);
    return new StatementId(statements.size() - 1);
  }

  public ExpressionId addExpression(Expression expression, Span span) {
    expressions.add(expression);
    expressionSpans.add(span);
    return new ExpressionId(expressions.size() - 1);
  }

  public BlockId addBlock(Block block) {
    blocks.add(block);
    return new BlockId(blocks.size() - 1);
  }

  public FunctionId addFunction(FunctionDecl function) {
    functions.add(function);
    declarations.add(function);
    return new FunctionId(functions.size() - 1);
  }

  public ComponentId addComponent(ComponentDecl component) {
    components.add(component);
    declarations.add(component);
    return new ComponentId(components.size() - 1);
  }

  public Statement getStatement(StatementId id) {
    checkElementIndex(id.index(), statements.size(), "statement");
    return statements.get(id.index());
  }

  public Span getSpan(StatementId id) {
    checkElementIndex(id.index(), statementSpans.size(), "statement");
    return statementSpans.get(id.index());
  }

  public Expression getExpression(ExpressionId id) {
    checkElementIndex(id.index(), expressions.size(), "expression");
    return expressions.get(id.index());
  }

  public Span getSpan(ExpressionId id) {
    checkElementIndex(id.index(), expressionSpans.size(), "expression");
    return expressionSpans.get(id.index());
  }

  public Block getBlock(BlockId id) {
    checkElementIndex(id.index(), blocks.size(), "block");
    return blocks.get(id.index());
  }

  public FunctionDecl getFunction(FunctionId id) {
    checkElementIndex(id.index(), functions.size(), "function");
    return functions.get(id.index());
  }

  public ComponentDecl getComponent(ComponentId id) {
    checkElementIndex(id.index(), components.size(), "component");
    return components.get(id.index());
  }

  public ImmutableList<FunctionId> getFunctionIds() {
    ImmutableList.Builder<FunctionId> ids = ImmutableList.builder();
    for (int i = 0; i < functions.size(); i++) {
      ids.add(new FunctionId(i));
    }
    return ids.build();
  }

  public ImmutableList<ComponentId> getComponentIds() {
    ImmutableList.Builder<ComponentId> ids = ImmutableList.builder();
    for (int i = 0; i < components.size(); i++) {
      ids.add(new ComponentId(i));
    }
    return ids.build();
  }

  /** Returns functions and components in the order they were declared. */
  public ImmutableList<Declaration> getDeclarations() {
    return ImmutableList.copyOf(declarations);
  }

  public int getStatementCount() {
    return statements.size();
  }
}
