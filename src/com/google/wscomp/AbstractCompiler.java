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

import com.google.wscomp.ast.AstArena;

/**
 * An abstract compiler, to help remove the circular dependency of passes on the compiler.
 *
 * <p>This is an abstract class, so that we can make the methods package-private.
 */
public abstract class AbstractCompiler {
  static final DiagnosticType UNSUPPORTED_STATEMENT =
      DiagnosticType.error("WSC_UNSUPPORTED_STATEMENT", "{0} statements are not yet supported");

  static final DiagnosticType CONTROL_FLOW_TOO_DEEPLY_NESTED =
      DiagnosticType.error(
          "WSC_CONTROL_FLOW_TOO_DEEPLY_NESTED", "control flow nested deeper than {0} levels");

  public abstract CompilerOptions getOptions();

  /** The arena holding every statement and expression of the module being compiled. */
  public abstract AstArena getArena();

  public abstract ConstantFolder getConstantFolder();

  /** Report an error or warning. */
  public abstract void report(WsError error);

  /** Report an internal error. */
  abstract void throwInternalError(String message, Throwable cause);

  public abstract ErrorManager getErrorManager();
}
