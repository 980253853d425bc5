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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.wscomp.ast.AstArena;
import com.google.wscomp.ast.Declaration;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Compiler (and the other classes in this package) lower the function and component bodies of a
 * module to control flow graphs, check them for unreachable code and print them back as
 * JavaScript.
 *
 * <p>A body that cannot be lowered is reported as an error and left out of the output; the other
 * declarations still compile. A broken graph is a bug in the compiler and aborts compilation with
 * an internal compiler error.
 *
 * <p>A Compiler may compile several modules in turn. Each {@link #init} starts over with a fresh
 * {@link ExpressionEvaluator} and, unless a custom error manager was supplied, a fresh {@link
 * LoggerErrorManager}. A custom error manager collects the diagnostics of every module.
 */
public class Compiler extends AbstractCompiler {

  /**
   * Logger for the whole com.google.wscomp domain - setting configuration for this logger affects
   * all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("com.google.wscomp");

  private CompilerOptions options = null;

  private ErrorManager errorManager;

  private boolean hasCustomErrorManager;

  private AstArena arena = null;

  private ConstantFolder constantFolder = null;

  private @Nullable ConstantFolder customConstantFolder = null;

  /** Creates a Compiler that reports errors and warnings to its logger. */
  public Compiler() {
    this.errorManager = new LoggerErrorManager(logger);
    this.hasCustomErrorManager = false;
  }

  /** Creates a Compiler that uses a custom error manager. */
  public Compiler(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager);
    this.hasCustomErrorManager = true;
  }

  /** Initializes the compiler for one module. */
  public void init(AstArena arena, CompilerOptions options) {
    this.arena = checkNotNull(arena);
    this.options = checkNotNull(options);
    constantFolder =
        customConstantFolder != null ? customConstantFolder : new ExpressionEvaluator(arena);
    if (!hasCustomErrorManager) {
      errorManager = new LoggerErrorManager(logger);
    }
  }

  /**
   * Replaces the default {@link ExpressionEvaluator} for every module initialized after this call.
   */
  public void setConstantFolder(ConstantFolder constantFolder) {
    this.customConstantFolder = checkNotNull(constantFolder);
  }

  public void setErrorManager(ErrorManager errorManager) {
    this.errorManager = checkNotNull(errorManager);
    this.hasCustomErrorManager = true;
  }

  /** Initializes the compiler and compiles {@code arena}. */
  public Result compile(AstArena arena, CompilerOptions options) {
    init(arena, options);
    return compile();
  }

  /** Compiles every declaration of the module passed to {@link #init}, in declaration order. */
  public Result compile() {
    checkState(arena != null, "Need to call init()");
    ControlFlowMap.Builder graphs = ControlFlowMap.builder();
    ImmutableList.Builder<String> definitions = ImmutableList.builder();
    CodeGenerator generator = new CodeGenerator(arena);
    CheckUnreachableCode unreachableCode = new CheckUnreachableCode(this);
    for (Declaration declaration : arena.getDeclarations()) {
      logger.fine("Compiling " + declaration.name());
      AstControlFlowGraph cfg = computeCfg(declaration);
      if (cfg == null) {
        continue;
      }
      graphs.put(declaration, cfg);
      try {
        unreachableCode.process(cfg);
        definitions.add(
            CodePrinter.printDeclaration(
                declaration, StructureDetector.detect(cfg), generator));
      } catch (IllegalStateException | IllegalArgumentException | IndexOutOfBoundsException e) {
        throwInternalError("Failed to generate code for " + declaration.name(), e);
      }
    }
    errorManager.generateReport();
    return new Result(
        errorManager.getErrors(), errorManager.getWarnings(), graphs.build(), definitions.build());
  }

  /**
   * Lowers the body of {@code declaration}, or reports why it cannot be lowered and returns null.
   */
  @Nullable AstControlFlowGraph computeCfg(Declaration declaration) {
    logger.fine("Computing Control Flow Graph");
    try {
      AstControlFlowGraph cfg =
          ControlFlowAnalysis.builder()
              .setCompiler(this)
              .setCfgRoot(declaration.body())
              .computeCfg();
      if (options.getValidateControlFlowGraphs()) {
        ControlFlowValidator.validate(cfg);
      }
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(DotFormatter.toDot(cfg, new CodeGenerator(arena)));
      }
      return cfg;
    } catch (LoweringException e) {
      report(e.toError(options.getSourceName()));
      logger.fine("Skipping " + declaration.name() + ": " + e.getMessage());
    } catch (IllegalStateException | IllegalArgumentException | IndexOutOfBoundsException e) {
      throwInternalError("Failed to lower " + declaration.name(), e);
    }
    return null;
  }

  @Override
  public CompilerOptions getOptions() {
    return options;
  }

  @Override
  public AstArena getArena() {
    return arena;
  }

  @Override
  public ConstantFolder getConstantFolder() {
    return constantFolder;
  }

  @Override
  public ErrorManager getErrorManager() {
    return errorManager;
  }

  @Override
  public void report(WsError error) {
    CheckLevel level = getLevel(error);
    if (level.isOn()) {
      errorManager.report(level, error);
    }
  }

  /** Returns the level {@code error} is reported at once options are applied. */
  CheckLevel getLevel(WsError error) {
    if (error.type().equals(CheckUnreachableCode.UNREACHABLE_CODE)) {
      return options.getUnreachableCodeLevel();
    }
    return error.defaultLevel();
  }

  /** Report an internal error. */
  @Override
  void throwInternalError(String message, Throwable cause) {
    throw new RuntimeException(
        "INTERNAL COMPILER ERROR.\nPlease report this problem.\n\n" + message, cause);
  }

  /** Gets the number of errors. */
  public int getErrorCount() {
    return errorManager.getErrorCount();
  }

  /** Gets the number of warnings. */
  public int getWarningCount() {
    return errorManager.getWarningCount();
  }

  public ImmutableList<WsError> getErrors() {
    return errorManager.getErrors();
  }

  public ImmutableList<WsError> getWarnings() {
    return errorManager.getWarnings();
  }
}
