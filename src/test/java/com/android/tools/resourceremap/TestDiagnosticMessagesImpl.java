// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.hamcrest.Matcher;

/** A {@link DiagnosticsHandler} collecting all diagnostics for inspection by tests. */
public class TestDiagnosticMessagesImpl implements DiagnosticsHandler {

  private final List<Diagnostic> infos = Collections.synchronizedList(new ArrayList<>());
  private final List<Diagnostic> warnings = Collections.synchronizedList(new ArrayList<>());
  private final List<Diagnostic> errors = Collections.synchronizedList(new ArrayList<>());

  @Override
  public void info(Diagnostic info) {
    infos.add(info);
  }

  @Override
  public void warning(Diagnostic warning) {
    warnings.add(warning);
  }

  @Override
  public void error(Diagnostic error) {
    errors.add(error);
  }

  public List<Diagnostic> getInfos() {
    return infos;
  }

  public List<Diagnostic> getWarnings() {
    return warnings;
  }

  public List<Diagnostic> getErrors() {
    return errors;
  }

  public TestDiagnosticMessagesImpl assertNoMessages() {
    assertEmpty("info", infos);
    assertEmpty("warning", warnings);
    assertEmpty("error", errors);
    return this;
  }

  public TestDiagnosticMessagesImpl assertNoInfos() {
    assertEmpty("info", infos);
    return this;
  }

  public TestDiagnosticMessagesImpl assertNoWarnings() {
    assertEmpty("warning", warnings);
    return this;
  }

  public TestDiagnosticMessagesImpl assertNoErrors() {
    assertEmpty("error", errors);
    return this;
  }

  public TestDiagnosticMessagesImpl assertOnlyInfos() {
    assertNoWarnings();
    return assertNoErrors();
  }

  public TestDiagnosticMessagesImpl assertOnlyWarnings() {
    assertNoInfos();
    return assertNoErrors();
  }

  public TestDiagnosticMessagesImpl assertOnlyErrors() {
    assertNoInfos();
    return assertNoWarnings();
  }

  @SafeVarargs
  public final TestDiagnosticMessagesImpl assertInfosMatch(Matcher<Diagnostic>... matchers) {
    assertDiagnosticsMatch("info", infos, matchers);
    return this;
  }

  @SafeVarargs
  public final TestDiagnosticMessagesImpl assertWarningsMatch(Matcher<Diagnostic>... matchers) {
    assertDiagnosticsMatch("warning", warnings, matchers);
    return this;
  }

  @SafeVarargs
  public final TestDiagnosticMessagesImpl assertErrorsMatch(Matcher<Diagnostic>... matchers) {
    assertDiagnosticsMatch("error", errors, matchers);
    return this;
  }

  public TestDiagnosticMessagesImpl assertAllInfosMatch(Matcher<Diagnostic> matcher) {
    infos.forEach(info -> assertThat(info, matcher));
    return this;
  }

  private static void assertEmpty(String type, List<Diagnostic> diagnostics) {
    if (!diagnostics.isEmpty()) {
      fail("Expected no " + type + " messages, got:\n" + format(diagnostics));
    }
  }

  // Diagnostics are matched in order.
  private static void assertDiagnosticsMatch(
      String type, List<Diagnostic> diagnostics, Matcher<Diagnostic>[] matchers) {
    assertEquals(
        "Unexpected number of " + type + " messages:\n" + format(diagnostics),
        matchers.length,
        diagnostics.size());
    for (int i = 0; i < matchers.length; i++) {
      assertThat(diagnostics.get(i), matchers[i]);
    }
  }

  private static String format(List<Diagnostic> diagnostics) {
    StringBuilder builder = new StringBuilder();
    for (Diagnostic diagnostic : diagnostics) {
      builder
          .append("  ")
          .append(diagnostic.getClass().getSimpleName())
          .append(": ")
          .append(diagnostic.getDiagnosticMessage())
          .append("\n");
    }
    return builder.toString();
  }
}
