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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.wscomp.ControlFlowGraph.Branch;
import com.google.wscomp.ast.AstArena;
import com.google.wscomp.ast.Block;
import com.google.wscomp.ast.BlockId;
import com.google.wscomp.ast.Span;
import com.google.wscomp.ast.Statement;
import com.google.wscomp.ast.StatementId;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * This class computes an {@link AstControlFlowGraph} for a function or component body.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * AstControlFlowGraph cfg = ControlFlowAnalysis.builder()
 *                               .setCompiler(compiler)
 *                               .setCfgRoot(function.body())
 *                               .computeCfg();
 * }</pre>
 *
 * <p>Every block, if statement and loop body is lowered into a graph of its own, and the
 * resulting fragment is copied into the enclosing graph. Edges that fall out of a fragment are
 * not wired when the fragment is copied. They wait in the enclosing graph's edge queue until the
 * next node is appended or the enclosing block ends and they are resolved to its exit.
 *
 * <p>A {@code return} ends its basic block with a RETURN edge to the exit. Statements after it in
 * the same block still get nodes, but nothing flows into them, which is how unreachable code is
 * found later. An if statement whose condition folds to a boolean is replaced by the graph of the
 * taken branch.
 */
public final class ControlFlowAnalysis {

  private static final Logger logger = Logger.getLogger(ControlFlowAnalysis.class.getName());

  private final AstArena arena;
  private final ConstantFolder folder;
  private final int maxDepth;
  private final boolean foldConditions;

  // Current nesting of blocks and if statements being lowered.
  private int depth = 0;

  private ControlFlowAnalysis(AbstractCompiler compiler) {
    this.arena = compiler.getArena();
    this.folder = compiler.getConstantFolder();
    this.maxDepth = compiler.getOptions().getMaxControlFlowNestingDepth();
    this.foldConditions = compiler.getOptions().getFoldConstantConditions();
  }

  /**
   * Configures a {@link ControlFlowAnalysis} instance then computes the {@link
   * AstControlFlowGraph}
   */
  public static final class Builder {
    private AbstractCompiler compiler;
    private BlockId cfgRoot;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setCompiler(AbstractCompiler compiler) {
      this.compiler = compiler;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCfgRoot(BlockId cfgRoot) {
      this.cfgRoot = cfgRoot;
      return this;
    }

    /**
     * Lowers the root block.
     *
     * @throws LoweringException if the body uses an unsupported statement or nests too deeply
     */
    public AstControlFlowGraph computeCfg() {
      Preconditions.checkNotNull(compiler, "Need to call setCompiler()");
      Preconditions.checkNotNull(cfgRoot, "Need to call setCfgRoot()");
      ControlFlowAnalysis cfa = new ControlFlowAnalysis(compiler);
      AstControlFlowGraph cfg = cfa.lowerBlock(cfgRoot);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(
            "Lowered " + cfgRoot + " to " + (cfg.getNodeCount() - 2) + " node(s)"
                + (cfg.hasEarlyReturn() ? ", always returns" : ""));
      }
      return cfg;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Lowers a statement sequence into a graph of its own. */
  private AstControlFlowGraph lowerBlock(BlockId blockId) {
    Block block = arena.getBlock(blockId);
    enter(block.isEmpty() ? null : block.statements().get(0));
    try {
      AstControlFlowGraph cfg = new AstControlFlowGraph();
      List<StatementId> open = new ArrayList<>();
      for (StatementId id : block.statements()) {
        Statement statement = arena.getStatement(id);
        switch (statement.getKind()) {
          case LET:
          case STATE:
          case EXPRESSION:
          case ASSIGNMENT:
            open.add(id);
            break;
          case RETURN:
            open.add(id);
            int returnBlock = cfg.addBasicBlock(open);
            open.clear();
            cfg.addEdgeToExit(returnBlock, Branch.RETURN);
            if (!cfg.hasEarlyReturn()) {
              cfg.recordReturnValue(folder.evaluate(((Statement.Return) statement).value()));
            }
            cfg.setHasEarlyReturn(true);
            break;
          case IF:
            commit(cfg, open);
            AstControlFlowGraph ifGraph = lowerIf((Statement.If) statement, id);
            cfg.appendSubgraph(ifGraph);
            if (ifGraph.hasEarlyReturn()) {
              cfg.setHasEarlyReturn(true);
            }
            break;
          case WHILE:
            commit(cfg, open);
            lowerWhile(cfg, (Statement.While) statement);
            break;
          case FOR:
            throw new LoweringException(
                AbstractCompiler.UNSUPPORTED_STATEMENT, arena.getSpan(id), "for");
        }
      }
      commit(cfg, open);
      if (!cfg.hasFirst()) {
        cfg.addEdgeFromEntry(cfg.getExit(), Branch.UNCOND);
      }
      cfg.flushEdgeQueue(cfg.getExit());
      return cfg;
    } finally {
      depth--;
    }
  }

  /** Turns the open statements into a basic block that falls through to whatever comes next. */
  private static void commit(AstControlFlowGraph cfg, List<StatementId> open) {
    if (open.isEmpty()) {
      return;
    }
    int block = cfg.addBasicBlock(open);
    open.clear();
    cfg.enqueueEdge(block, Branch.UNCOND);
  }

  /**
   * Lowers an if statement, including its else-if chain, into a graph of its own. The graph
   * always returns only if both branches do.
   */
  private AstControlFlowGraph lowerIf(Statement.If ifStatement, StatementId id) {
    enter(id);
    try {
      if (foldConditions) {
        Value condition = folder.evaluate(ifStatement.condition());
        if (condition instanceof Value.BooleanValue) {
          return lowerTakenBranch(ifStatement, id, ((Value.BooleanValue) condition).value());
        }
      }
      AstControlFlowGraph cfg = new AstControlFlowGraph();
      int branch = cfg.addBranchCondition(ifStatement.condition());
      AstControlFlowGraph thenGraph = lowerBlock(ifStatement.body());
      cfg.consumeSubgraph(thenGraph, Branch.ON_TRUE, branch);

      AstControlFlowGraph elseGraph = null;
      if (ifStatement.elseBlock() != null) {
        elseGraph = lowerBlock(ifStatement.elseBlock());
      } else if (ifStatement.elseIf() != null) {
        elseGraph = lowerIf(ifStatement.elseIf(), id);
      }
      if (elseGraph != null) {
        cfg.consumeSubgraph(elseGraph, Branch.ON_FALSE, branch);
        cfg.setHasEarlyReturn(thenGraph.hasEarlyReturn() && elseGraph.hasEarlyReturn());
      } else {
        cfg.addEdgeToExit(branch, Branch.ON_FALSE);
      }
      cfg.flushEdgeQueue(cfg.getExit());
      return cfg;
    } finally {
      depth--;
    }
  }

  /** Lowers only the branch a constant condition selects. */
  private AstControlFlowGraph lowerTakenBranch(
      Statement.If ifStatement, StatementId id, boolean condition) {
    logger.finer("Folded condition of " + id + " to " + condition);
    if (condition) {
      return lowerBlock(ifStatement.body());
    } else if (ifStatement.elseBlock() != null) {
      return lowerBlock(ifStatement.elseBlock());
    } else if (ifStatement.elseIf() != null) {
      return lowerIf(ifStatement.elseIf(), id);
    }
    AstControlFlowGraph empty = new AstControlFlowGraph();
    empty.addEdgeFromEntry(empty.getExit(), Branch.UNCOND);
    return empty;
  }

  /**
   * Appends a loop condition, hangs the lowered body off its ON_TRUE edge and turns every edge
   * falling out of the body into a back edge. The ON_FALSE edge waits for the loop's successor.
   * A body that always returns does not make the loop always return, since the body may never
   * run.
   */
  private void lowerWhile(AstControlFlowGraph cfg, Statement.While loop) {
    int condition = cfg.addLoopCondition(loop.condition());
    AstControlFlowGraph body = lowerBlock(loop.body());
    cfg.consumeSubgraph(body, Branch.ON_TRUE, condition);
    cfg.flushEdgeQueue(condition);
    cfg.enqueueEdge(condition, Branch.ON_FALSE);
  }

  private void enter(@Nullable StatementId at) {
    depth++;
    if (depth > maxDepth) {
      throw new LoweringException(
          AbstractCompiler.CONTROL_FLOW_TOO_DEEPLY_NESTED,
          at == null ? Span.NONE : arena.getSpan(at),
          Integer.toString(maxDepth));
    }
  }
}
