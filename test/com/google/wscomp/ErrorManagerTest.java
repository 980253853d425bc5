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

import com.google.wscomp.ast.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BasicErrorManager} and {@link LoggerErrorManager}. */
@RunWith(JUnit4.class)
public final class ErrorManagerTest {
  private static final DiagnosticType FOO = DiagnosticType.error("FOO", "Foo {0}");
  private static final DiagnosticType BAR = DiagnosticType.warning("BAR", "Bar");

  private RecordingHandler handler;
  private LoggerErrorManager manager;

  @Before
  public void setUp() {
    Logger logger = Logger.getLogger("com.google.wscomp.ErrorManagerTest");
    logger.setUseParentHandlers(false);
    handler = new RecordingHandler();
    for (Handler h : logger.getHandlers()) {
      logger.removeHandler(h);
    }
    logger.addHandler(handler);
    manager = new LoggerErrorManager(logger);
  }

  @Test
  public void testCounts() {
    manager.report(CheckLevel.ERROR, WsError.make("a.ws", new Span(0, 1), FOO, "x"));
    manager.report(CheckLevel.WARNING, WsError.make("a.ws", new Span(2, 3), BAR));
    manager.report(CheckLevel.ERROR, WsError.make("a.ws", new Span(4, 5), BAR));

    assertThat(manager.getErrorCount()).isEqualTo(2);
    assertThat(manager.getWarningCount()).isEqualTo(1);
    assertThat(manager.hasHaltingErrors()).isTrue();
  }

  @Test
  public void testPromotedErrorIsNotHalting() {
    manager.report(CheckLevel.ERROR, WsError.make(BAR));
    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.hasHaltingErrors()).isFalse();
  }

  @Test
  public void testDuplicatesAreDropped() {
    WsError error = WsError.make("a.ws", new Span(0, 1), FOO, "x");
    manager.report(CheckLevel.ERROR, error);
    manager.report(CheckLevel.ERROR, WsError.make("a.ws", new Span(0, 1), FOO, "x"));
    assertThat(manager.getErrors()).containsExactly(error);
    assertThat(manager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testSorting() {
    WsError late = WsError.make("a.ws", new Span(9, 10), FOO, "late");
    WsError early = WsError.make("a.ws", new Span(1, 2), FOO, "early");
    WsError otherFile = WsError.make("b.ws", new Span(0, 1), FOO, "other");
    WsError noFile = WsError.make(FOO, "none");
    manager.report(CheckLevel.ERROR, otherFile);
    manager.report(CheckLevel.ERROR, late);
    manager.report(CheckLevel.ERROR, noFile);
    manager.report(CheckLevel.ERROR, early);

    assertThat(manager.getErrors()).containsExactly(noFile, early, late, otherFile).inOrder();
  }

  @Test
  public void testGenerateReport() {
    manager.report(CheckLevel.ERROR, WsError.make("a.ws", new Span(0, 1), FOO, "x"));
    manager.report(CheckLevel.WARNING, WsError.make("a.ws", new Span(2, 3), BAR));
    manager.generateReport();

    assertThat(handler.records).hasSize(3);
    assertThat(handler.records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(handler.records.get(0).getMessage()).isEqualTo("a.ws:0..1: ERROR - [FOO] Foo x");
    assertThat(handler.records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(handler.records.get(1).getMessage()).isEqualTo("a.ws:2..3: WARNING - [BAR] Bar");
    assertThat(handler.records.get(2).getMessage()).isEqualTo("{0} error(s), {1} warning(s)");
    assertThat(handler.records.get(2).getParameters()).asList().containsExactly(1, 1).inOrder();
  }

  @Test
  public void testFormatWithoutSource() {
    assertThat(WsError.make(FOO, "y").format(CheckLevel.WARNING))
        .isEqualTo("WARNING - [FOO] Foo y");
  }

  @Test
  public void testDiagnosticTypesAreIdentifiedByKey() {
    DiagnosticType again = DiagnosticType.warning("FOO", "Other {0}");
    assertThat(again).isEqualTo(FOO);
    assertThat(again.hashCode()).isEqualTo(FOO.hashCode());
    assertThat(BAR).isLessThan(FOO);
    assertThat(FOO.level).isEqualTo(CheckLevel.ERROR);
    assertThat(BAR.level).isEqualTo(CheckLevel.WARNING);
    assertThat(FOO.format("z")).isEqualTo("Foo z");
  }

  private static final class RecordingHandler extends Handler {
    final List<LogRecord> records = new ArrayList<>();

    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
  }
}
