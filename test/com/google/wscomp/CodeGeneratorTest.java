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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.wscomp.ast.AstArena;
import com.google.wscomp.ast.AstFactory;
import com.google.wscomp.ast.BinaryOperator;
import com.google.wscomp.ast.Binding;
import com.google.wscomp.ast.ExpressionId;
import com.google.wscomp.ast.StatementId;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodeGeneratorTest {

  private AstFactory f;
  private CodeGenerator generator;

  @Before
  public void setUp() {
    AstArena arena = new AstArena();
    f = AstFactory.create(arena);
    generator = new CodeGenerator(arena);
  }

  private void assertExpression(ExpressionId expression, String expected) {
    assertThat(generator.expression(expression)).isEqualTo(expected);
  }

  private void assertStatement(StatementId statement, String expected) {
    assertThat(generator.statement(statement)).isEqualTo(expected);
  }

  @Test
  public void testNumbers() {
    assertExpression(f.number(1), "1");
    assertExpression(f.number(0), "0");
    assertExpression(f.number(1.5), "1.5");
    assertExpression(f.number(-3), "-3");
    assertExpression(f.number(Double.NaN), "NaN");
    assertExpression(f.number(Double.POSITIVE_INFINITY), "Infinity");
  }

  @Test
  public void testBooleans() {
    assertExpression(f.bool(true), "true");
    assertExpression(f.bool(false), "false");
  }

  @Test
  public void testStrings() {
    assertExpression(f.string("hello"), "\"hello\"");
    assertExpression(f.string("say \"hi\"\n"), "\"say \\\"hi\\\"\\n\"");
    assertExpression(f.string("a\\b"), "\"a\\\\b\"");
  }

  @Test
  public void testReferences() {
    StatementId count = f.state("count", f.number(0));
    StatementId total = f.let("total", f.number(0));
    assertExpression(f.ref(count), "count.value");
    assertExpression(f.ref(total), "total");
    assertExpression(f.param("props"), "props");
    assertExpression(f.name("console"), "console");
    assertExpression(f.constant("LIMIT", f.number(10)), "LIMIT");
  }

  @Test
  public void testCalls() {
    assertExpression(f.call(f.name("render")), "render()");
    assertExpression(
        f.call(f.name("max"), f.param("a"), f.binary(BinaryOperator.ADD, f.number(1), f.number(2))),
        "max(a, 1 + 2)");
  }

  @Test
  public void testOperators() {
    assertExpression(f.binary(BinaryOperator.DOUBLE_EQUALS, f.param("a"), f.number(1)), "a == 1");
    assertExpression(f.binary(BinaryOperator.AND, f.param("a"), f.param("b")), "a && b");
    assertExpression(f.binary(BinaryOperator.OR, f.param("a"), f.param("b")), "a || b");
    assertExpression(f.binary(BinaryOperator.MOD, f.param("a"), f.number(2)), "a % 2");
    assertExpression(f.binary(BinaryOperator.GREATER_THAN, f.param("a"), f.number(2)), "a > 2");
  }

  @Test
  public void testPrecedence() {
    ExpressionId sum = f.binary(BinaryOperator.ADD, f.param("a"), f.param("b"));
    assertExpression(f.binary(BinaryOperator.MUL, sum, f.param("c")), "(a + b) * c");

    ExpressionId product = f.binary(BinaryOperator.MUL, f.param("a"), f.param("b"));
    assertExpression(f.binary(BinaryOperator.ADD, product, f.param("c")), "a * b + c");

    ExpressionId or = f.binary(BinaryOperator.OR, f.param("a"), f.param("b"));
    assertExpression(f.binary(BinaryOperator.AND, or, f.param("c")), "(a || b) && c");
  }

  @Test
  public void testAssociativity() {
    ExpressionId left = f.binary(BinaryOperator.SUB, f.param("a"), f.param("b"));
    assertExpression(f.binary(BinaryOperator.SUB, left, f.param("c")), "a - b - c");

    ExpressionId right = f.binary(BinaryOperator.SUB, f.param("b"), f.param("c"));
    assertExpression(f.binary(BinaryOperator.SUB, f.param("a"), right), "a - (b - c)");
  }

  @Test
  public void testStatements() {
    StatementId let = f.let("x", f.number(1));
    assertStatement(let, "let x = 1;");
    StatementId state = f.state("count", f.number(0));
    assertStatement(state, "let count = signal(0);");
    assertStatement(f.exprResult(f.call(f.name("log"), f.ref(let))), "log(x);");
    assertStatement(f.assign(let, f.number(2)), "x = 2;");
    assertStatement(
        f.assign(state, f.binary(BinaryOperator.ADD, f.ref(state), f.number(1))),
        "count.value = count.value + 1;");
    assertStatement(f.assign(Binding.global("title"), f.string("hi")), "title = \"hi\";");
    assertStatement(f.returnStatement(f.ref(let)), "return x;");
  }

  @Test
  public void testControlStatementsAreNotStraightLine() {
    StatementId ifStatement = f.ifStatement(f.bool(true), f.block());
    StatementId loop = f.whileLoop(f.bool(true), f.block());
    assertThrows(IllegalStateException.class, () -> generator.statement(ifStatement));
    assertThrows(IllegalStateException.class, () -> generator.statement(loop));
  }
}
