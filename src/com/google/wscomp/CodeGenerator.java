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

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import com.google.wscomp.ast.AstArena;
import com.google.wscomp.ast.BinaryOperator;
import com.google.wscomp.ast.Binding;
import com.google.wscomp.ast.Expression;
import com.google.wscomp.ast.ExpressionId;
import com.google.wscomp.ast.Statement;
import com.google.wscomp.ast.StatementId;

/**
 * CodeGenerator generates JavaScript for the statements and expressions held by basic blocks.
 * State bindings become signals: a state declaration wraps its initial value in {@code
 * signal(...)}, and reads and writes go through {@code .value}.
 *
 * @see CodePrinter
 */
public class CodeGenerator {
  private static final int PRIMARY_PRECEDENCE = 100;

  private static final Escaper STRING_ESCAPER =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  private final AstArena arena;

  public CodeGenerator(AstArena arena) {
    this.arena = arena;
  }

  /** Returns one line of code for a straight-line statement, including the semicolon. */
  public String statement(StatementId id) {
    Statement statement = arena.getStatement(id);
    switch (statement.getKind()) {
      case LET:
        Statement.Let let = (Statement.Let) statement;
        return "let " + let.name() + " = " + expression(let.value()) + ";";
      case STATE:
        Statement.State state = (Statement.State) statement;
        return "let " + state.name() + " = signal(" + expression(state.value()) + ");";
      case EXPRESSION:
        return expression(((Statement.ExpressionStatement) statement).expression()) + ";";
      case ASSIGNMENT:
        Statement.Assignment assignment = (Statement.Assignment) statement;
        return name(assignment.target()) + " = " + expression(assignment.value()) + ";";
      case RETURN:
        return "return " + expression(((Statement.Return) statement).value()) + ";";
      case IF:
      case WHILE:
      case FOR:
        throw new IllegalStateException("control statement in a basic block: " + statement);
    }
    throw new AssertionError(statement.getKind());
  }

  public String expression(ExpressionId id) {
    StringBuilder sb = new StringBuilder();
    addExpr(sb, id, 0);
    return sb.toString();
  }

  private void addExpr(StringBuilder sb, ExpressionId id, int minPrecedence) {
    Expression expression = arena.getExpression(id);
    if (precedence(expression) < minPrecedence) {
      sb.append('(');
      add(sb, expression);
      sb.append(')');
    } else {
      add(sb, expression);
    }
  }

  private void add(StringBuilder sb, Expression expression) {
    switch (expression.getKind()) {
      case NUMBER:
        sb.append(formatNumber(((Expression.NumberLiteral) expression).value()));
        break;
      case BOOLEAN:
        sb.append(((Expression.BooleanLiteral) expression).value());
        break;
      case STRING:
        sb.append('"')
            .append(STRING_ESCAPER.escape(((Expression.StringLiteral) expression).value()))
            .append('"');
        break;
      case REFERENCE:
        sb.append(name(((Expression.Reference) expression).binding()));
        break;
      case BINARY:
        Expression.Binary binary = (Expression.Binary) expression;
        int p = precedence(binary.op());
        // All binary operators here are left associative.
        addExpr(sb, binary.left(), p);
        sb.append(' ').append(binary.op().getSymbol()).append(' ');
        addExpr(sb, binary.right(), p + 1);
        break;
      case CALL:
        Expression.Call call = (Expression.Call) expression;
        addExpr(sb, call.callee(), PRIMARY_PRECEDENCE);
        sb.append('(');
        boolean first = true;
        for (ExpressionId argument : call.arguments()) {
          if (!first) {
            sb.append(", ");
          }
          first = false;
          addExpr(sb, argument, 0);
        }
        sb.append(')');
        break;
    }
  }

  private static String name(Binding binding) {
    return binding.isState() ? binding.name() + ".value" : binding.name();
  }

  private static int precedence(Expression expression) {
    return expression instanceof Expression.Binary
        ? precedence(((Expression.Binary) expression).op())
        : PRIMARY_PRECEDENCE;
  }

  private static int precedence(BinaryOperator op) {
    switch (op) {
      case OR:
        return 4;
      case AND:
        return 5;
      case DOUBLE_EQUALS:
        return 9;
      case GREATER_THAN:
      case LESS_THAN:
        return 10;
      case ADD:
      case SUB:
        return 12;
      case MUL:
      case DIV:
      case MOD:
        return 13;
    }
    throw new AssertionError(op);
  }

  /** Formats a number the way JavaScript prints it for integral and simple fractional values. */
  static String formatNumber(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    } else if (Double.isInfinite(value)) {
      return value > 0 ? "Infinity" : "-Infinity";
    } else if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }
}
