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

import com.google.common.collect.ImmutableList;
import com.google.wscomp.ControlFlowGraph.Branch;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ControlFlowValidator}. */
@RunWith(JUnit4.class)
public final class ControlFlowValidatorTest {

  private ControlFlowGraph<String, String, Void> cfg;
  private int condition;
  private int thenBlock;
  private int join;

  /** Builds {@code if (c) { then } join}, which is valid. */
  @Before
  public void setUp() {
    cfg = new ControlFlowGraph<>();
    condition = cfg.addBranchCondition("c");
    thenBlock = cfg.addBasicBlock(ImmutableList.of("then"));
    join = cfg.addBasicBlock(ImmutableList.of("join"));
    cfg.addEdge(condition, thenBlock, Branch.ON_TRUE);
    cfg.addEdge(condition, join, Branch.ON_FALSE);
    cfg.addEdge(thenBlock, join, Branch.UNCOND);
    cfg.addEdgeToExit(join, Branch.UNCOND);
  }

  private void assertInvalid(String message) {
    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> ControlFlowValidator.validate(cfg));
    assertThat(e).hasMessageThat().contains(message);
  }

  @Test
  public void testValidGraph() {
    ControlFlowValidator.validate(cfg);
  }

  @Test
  public void testEmptyGraph() {
    ControlFlowGraph<String, String, Void> empty = new ControlFlowGraph<>();
    empty.addEdgeFromEntry(empty.getExit(), Branch.UNCOND);
    ControlFlowValidator.validate(empty);
  }

  @Test
  public void testEdgeIntoEntry() {
    cfg.connect(join, Branch.UNCOND, cfg.getEntry());
    assertInvalid("entry node has incoming edges");
  }

  @Test
  public void testEdgeOutOfExit() {
    cfg.connect(cfg.getExit(), Branch.UNCOND, join);
    assertInvalid("exit node has outgoing edges");
  }

  @Test
  public void testSecondExit() {
    cfg.createNode(CfgNode.exit());
    assertInvalid("stray exit node");
  }

  @Test
  public void testSecondEntry() {
    cfg.createNode(CfgNode.entry());
    assertInvalid("stray entry node");
  }

  @Test
  public void testConditionWithoutFalseEdge() {
    cfg.disconnect(condition, Branch.ON_FALSE, join);
    assertInvalid("condition 2 has 1 ON_TRUE and 0 ON_FALSE edges");
  }

  @Test
  public void testConditionWithTwoTrueEdges() {
    cfg.addEdge(condition, join, Branch.ON_TRUE);
    assertInvalid("condition 2 has 2 ON_TRUE and 1 ON_FALSE edges");
  }

  @Test
  public void testConditionWithUncondEdge() {
    cfg.addEdge(condition, join, Branch.UNCOND);
    assertInvalid("condition 2 has a UNCOND edge");
  }

  @Test
  public void testLoopConditionIsChecked() {
    int loop = cfg.addLoopCondition("w");
    cfg.addEdge(join, loop, Branch.UNCOND);
    cfg.addEdge(loop, thenBlock, Branch.ON_TRUE);
    assertInvalid("condition " + loop + " has 1 ON_TRUE and 0 ON_FALSE edges");
  }

  @Test
  public void testBasicBlockWithConditionEdge() {
    cfg.addEdge(thenBlock, join, Branch.ON_TRUE);
    assertInvalid("basic block 3 has a condition edge");
  }

  @Test
  public void testPendingEdges() {
    cfg.enqueueEdge(join, Branch.UNCOND);
    assertInvalid("unresolved edges");
  }
}
