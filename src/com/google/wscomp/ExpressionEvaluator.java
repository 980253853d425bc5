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

package com.google.wscomp;

import com.google.common.collect.ImmutableSet;
import com.google.wscomp.Value.BooleanValue;
import com.google.wscomp.Value.NumberValue;
import com.google.wscomp.ast.AstArena;
import com.google.wscomp.ast.BinaryOperator;
import com.google.wscomp.ast.Binding;
import com.google.wscomp.ast.Expression;
import com.google.wscomp.ast.ExpressionId;
import com.google.wscomp.ast.Statement;
import com.google.wscomp.ast.StatementId;
import org.jspecify.annotations.Nullable;

/**
 * Folds number and boolean expressions over an {@link AstArena}.
 *
 * <p>Literals, arithmetic, comparisons and the logical operators fold when their operands do. A
 * reference folds through a {@code const} binding, or through a {@code let} binding that is never
 * assigned after its declaration. State, parameters and calls never fold.
 */
public final class ExpressionEvaluator implements ConstantFolder {
  private final AstArena arena;
  private @Nullable ImmutableSet<StatementId> reassigned;

  public ExpressionEvaluator(AstArena arena) {
    this.arena = arena;
  }

  @Override
  public @Nullable Value evaluate(ExpressionId id) {
    Expression expression = arena.getExpression(id);
    switch (expression.getKind()) {
      case NUMBER:
        return Value.of(((Expression.NumberLiteral) expression).value());
      case BOOLEAN:
        return Value.of(((Expression.BooleanLiteral) expression).value());
      case REFERENCE:
        return evaluateReference(((Expression.Reference) expression).binding());
      case BINARY:
        return evaluateBinary((Expression.Binary) expression);
      case STRING:
      case CALL:
        return null;
    }
    throw new AssertionError(expression.getKind());
  }

  private @Nullable Value evaluateReference(Binding binding) {
    switch (binding.kind()) {
      case CONST:
        return binding.value() == null ? null : evaluate(binding.value());
      case LET:
        StatementId declaration = binding.declaration();
        if (declaration == null || getReassigned().contains(declaration)) {
          return null;
        }
        return evaluate(((Statement.Let) arena.getStatement(declaration)).value());
      default:
        return null;
    }
  }

  private @Nullable Value evaluateBinary(Expression.Binary binary) {
    Value left = evaluate(binary.left());
    Value right = evaluate(binary.right());
    if (left == null || right == null) {
      return null;
    }
    switch (binary.op()) {
      case DOUBLE_EQUALS:
        if (left instanceof NumberValue && right instanceof NumberValue) {
          return Value.of(((NumberValue) left).value() == ((NumberValue) right).value());
        }
        return left.getClass() == right.getClass() ? Value.of(left.equals(right)) : null;
      case AND:
      case OR:
        if (!(left instanceof BooleanValue) || !(right instanceof BooleanValue)) {
          return null;
        }
        boolean l = ((BooleanValue) left).value();
        boolean r = ((BooleanValue) right).value();
        return Value.of(binary.op() == BinaryOperator.AND ? l && r : l || r);
      default:
        break;
    }
    if (!(left instanceof NumberValue) || !(right instanceof NumberValue)) {
      return null;
    }
    double l = ((NumberValue) left).value();
    double r = ((NumberValue) right).value();
    switch (binary.op()) {
      case ADD:
        return Value.of(l + r);
      case SUB:
        return Value.of(l - r);
      case MUL:
        return Value.of(l * r);
      case DIV:
        return Value.of(l / r);
      case MOD:
        return Value.of(l % r);
      case GREATER_THAN:
        return Value.of(l > r);
      case LESS_THAN:
        return Value.of(l < r);
      default:
        throw new AssertionError(binary.op());
    }
  }

  private ImmutableSet<StatementId> getReassigned() {
    if (reassigned == null) {
      ImmutableSet.Builder<StatementId> builder = ImmutableSet.builder();
      for (int i = 0; i < arena.getStatementCount(); i++) {
        Statement statement = arena.getStatement(new StatementId(i));
        if (statement instanceof Statement.Assignment) {
          StatementId target = ((Statement.Assignment) statement).target().declaration();
          if (target != null) {
            builder.add(target);
          }
        }
      }
      reassigned = builder.build();
    }
    return reassigned;
  }
}
