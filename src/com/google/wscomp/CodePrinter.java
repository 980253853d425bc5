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

import com.google.common.base.Joiner;
import com.google.wscomp.ast.ComponentDecl;
import com.google.wscomp.ast.Declaration;
import com.google.wscomp.ast.ExpressionId;
import com.google.wscomp.ast.FunctionDecl;
import com.google.wscomp.ast.StatementId;
import java.util.List;

/**
 * CodePrinter prints structured statements and whole definitions in pretty format, one
 * statement per line with two-space indentation.
 *
 * @see CodeGenerator
 */
public final class CodePrinter {
  private static final String INDENT = "  ";
  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final CodeGenerator generator;
  private final StringBuilder code = new StringBuilder(1024);
  private int indent = 0;

  private CodePrinter(CodeGenerator generator) {
    this.generator = generator;
  }

  /** Prints a statement list at the top level. */
  public static String print(
      List<StructuredStatement<StatementId, ExpressionId>> statements, CodeGenerator generator) {
    CodePrinter printer = new CodePrinter(generator);
    printer.addStatements(statements);
    return printer.code.toString();
  }

  /**
   * Prints a function as {@code function name(params) { ... }} and a component as a class whose
   * constructor runs the body. Public declarations are exported.
   */
  public static String printDeclaration(
      Declaration declaration,
      List<StructuredStatement<StatementId, ExpressionId>> body,
      CodeGenerator generator) {
    CodePrinter printer = new CodePrinter(generator);
    String params = COMMA_JOINER.join(declaration.parameters());
    String export = declaration.isPublic() ? "export " : "";
    if (declaration instanceof FunctionDecl) {
      printer.line(export + "function " + declaration.name() + "(" + params + ") {");
      printer.addBlock(body);
      printer.line("}");
    } else if (declaration instanceof ComponentDecl) {
      printer.line(export + "class " + declaration.name() + " {");
      printer.indent++;
      printer.line("constructor(" + params + ") {");
      printer.addBlock(body);
      printer.line("}");
      printer.indent--;
      printer.line("}");
    } else {
      throw new IllegalArgumentException("unknown declaration " + declaration);
    }
    return printer.code.toString();
  }

  private void addBlock(List<StructuredStatement<StatementId, ExpressionId>> statements) {
    indent++;
    addStatements(statements);
    indent--;
  }

  private void addStatements(List<StructuredStatement<StatementId, ExpressionId>> statements) {
    for (StructuredStatement<StatementId, ExpressionId> statement : statements) {
      add(statement);
    }
  }

  private void add(StructuredStatement<StatementId, ExpressionId> statement) {
    if (statement instanceof StructuredStatement.Simple) {
      line(
          generator.statement(
              ((StructuredStatement.Simple<StatementId, ExpressionId>) statement).statement()));
    } else if (statement instanceof StructuredStatement.If) {
      addIf((StructuredStatement.If<StatementId, ExpressionId>) statement, "");
      line("}");
    } else if (statement instanceof StructuredStatement.While) {
      StructuredStatement.While<StatementId, ExpressionId> loop =
          (StructuredStatement.While<StatementId, ExpressionId>) statement;
      line("while (" + generator.expression(loop.condition()) + ") {");
      addBlock(loop.body());
      line("}");
    } else {
      throw new IllegalStateException("unexpected statement " + statement);
    }
  }

  /** Adds an if chain without its closing brace; {@code prefix} is "} else " inside a chain. */
  private void addIf(StructuredStatement.If<StatementId, ExpressionId> ifStatement, String prefix) {
    line(prefix + "if (" + generator.expression(ifStatement.condition()) + ") {");
    addBlock(ifStatement.thenBranch());
    if (ifStatement.hasElseIf()) {
      addIf(
          (StructuredStatement.If<StatementId, ExpressionId>) ifStatement.elseBranch().get(0),
          "} else ");
    } else if (ifStatement.hasElse()) {
      line("} else {");
      addBlock(ifStatement.elseBranch());
    }
  }

  private void line(String text) {
    for (int i = 0; i < indent; i++) {
      code.append(INDENT);
    }
    code.append(text).append('\n');
  }
}
