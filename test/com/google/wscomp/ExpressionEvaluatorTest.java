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

import com.google.wscomp.ast.AstArena;
import com.google.wscomp.ast.AstFactory;
import com.google.wscomp.ast.BinaryOperator;
import com.google.wscomp.ast.ExpressionId;
import com.google.wscomp.ast.StatementId;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ExpressionEvaluator}. */
@RunWith(JUnit4.class)
public final class ExpressionEvaluatorTest {

  private AstFactory f;
  private ExpressionEvaluator evaluator;

  @Before
  public void setUp() {
    AstArena arena = new AstArena();
    f = AstFactory.create(arena);
    evaluator = new ExpressionEvaluator(arena);
  }

  private ExpressionId binary(BinaryOperator op, ExpressionId left, ExpressionId right) {
    return f.binary(op, left, right);
  }

  @Test
  public void testLiterals() {
    assertThat(evaluator.evaluate(f.number(2.5))).isEqualTo(Value.of(2.5));
    assertThat(evaluator.evaluate(f.bool(true))).isEqualTo(Value.of(true));
    assertThat(evaluator.evaluate(f.string("s"))).isNull();
  }

  @Test
  public void testArithmetic() {
    assertThat(evaluator.evaluate(binary(BinaryOperator.ADD, f.number(1), f.number(2))))
        .isEqualTo(Value.of(3));
    assertThat(evaluator.evaluate(binary(BinaryOperator.SUB, f.number(1), f.number(2))))
        .isEqualTo(Value.of(-1));
    assertThat(evaluator.evaluate(binary(BinaryOperator.MUL, f.number(3), f.number(2))))
        .isEqualTo(Value.of(6));
    assertThat(evaluator.evaluate(binary(BinaryOperator.DIV, f.number(1), f.number(4))))
        .isEqualTo(Value.of(0.25));
    assertThat(evaluator.evaluate(binary(BinaryOperator.MOD, f.number(7), f.number(4))))
        .isEqualTo(Value.of(3));
  }

  @Test
  public void testComparisons() {
    assertThat(evaluator.evaluate(binary(BinaryOperator.GREATER_THAN, f.number(2), f.number(1))))
        .isEqualTo(Value.of(true));
    assertThat(evaluator.evaluate(binary(BinaryOperator.LESS_THAN, f.number(2), f.number(1))))
        .isEqualTo(Value.of(false));
    assertThat(evaluator.evaluate(binary(BinaryOperator.DOUBLE_EQUALS, f.number(2), f.number(2))))
        .isEqualTo(Value.of(true));
    ExpressionId booleans = binary(BinaryOperator.DOUBLE_EQUALS, f.bool(true), f.bool(false));
    assertThat(evaluator.evaluate(booleans)).isEqualTo(Value.of(false));
  }

  @Test
  public void testEqualityFollowsNumberSemantics() {
    ExpressionId nan = f.number(Double.NaN);
    assertThat(evaluator.evaluate(binary(BinaryOperator.DOUBLE_EQUALS, nan, nan)))
        .isEqualTo(Value.of(false));
    ExpressionId zeros = binary(BinaryOperator.DOUBLE_EQUALS, f.number(0), f.number(-0.0));
    assertThat(evaluator.evaluate(zeros)).isEqualTo(Value.of(true));
  }

  @Test
  public void testMixedEqualityIsNotFolded() {
    ExpressionId mixed = binary(BinaryOperator.DOUBLE_EQUALS, f.number(1), f.bool(true));
    assertThat(evaluator.evaluate(mixed)).isNull();
  }

  @Test
  public void testLogicalOperators() {
    assertThat(evaluator.evaluate(binary(BinaryOperator.AND, f.bool(true), f.bool(false))))
        .isEqualTo(Value.of(false));
    assertThat(evaluator.evaluate(binary(BinaryOperator.OR, f.bool(true), f.bool(false))))
        .isEqualTo(Value.of(true));
    assertThat(evaluator.evaluate(binary(BinaryOperator.AND, f.number(1), f.bool(true)))).isNull();
  }

  @Test
  public void testArithmeticOnBooleansIsNotFolded() {
    assertThat(evaluator.evaluate(binary(BinaryOperator.ADD, f.bool(true), f.number(1)))).isNull();
    assertThat(evaluator.evaluate(binary(BinaryOperator.LESS_THAN, f.bool(true), f.bool(false))))
        .isNull();
  }

  @Test
  public void testNestedExpression() {
    ExpressionId sum = binary(BinaryOperator.ADD, f.number(1), f.number(2));
    ExpressionId comparison = binary(BinaryOperator.GREATER_THAN, sum, f.number(2));
    ExpressionId both = binary(BinaryOperator.AND, comparison, f.bool(true));
    assertThat(evaluator.evaluate(both)).isEqualTo(Value.of(true));
  }

  @Test
  public void testUnknownOperandIsNotFolded() {
    assertThat(evaluator.evaluate(binary(BinaryOperator.ADD, f.param("p"), f.number(1)))).isNull();
    assertThat(evaluator.evaluate(f.call(f.name("now")))).isNull();
    assertThat(evaluator.evaluate(f.name("window"))).isNull();
  }

  @Test
  public void testConstReference() {
    ExpressionId limit = f.constant("LIMIT", binary(BinaryOperator.MUL, f.number(5), f.number(2)));
    assertThat(evaluator.evaluate(limit)).isEqualTo(Value.of(10));
  }

  @Test
  public void testLetReference() {
    StatementId debug = f.let("debug", f.bool(true));
    assertThat(evaluator.evaluate(f.ref(debug))).isEqualTo(Value.of(true));
  }

  @Test
  public void testReassignedLetReference() {
    StatementId debug = f.let("debug", f.bool(true));
    f.assign(debug, f.bool(false));
    assertThat(evaluator.evaluate(f.ref(debug))).isNull();
  }

  @Test
  public void testStateReference() {
    StatementId count = f.state("count", f.number(0));
    assertThat(evaluator.evaluate(f.ref(count))).isNull();
  }
}
