// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils;

import com.android.tools.resourceremap.Diagnostic;
import com.android.tools.resourceremap.DiagnosticsHandler;
import com.android.tools.resourceremap.errors.Unreachable;

public class Reporter implements DiagnosticsHandler {

  private final DiagnosticsHandler clientHandler;
  private int errorCount = 0;
  private Diagnostic lastError;

  public Reporter() {
    this(new DiagnosticsHandler() {});
  }

  public Reporter(DiagnosticsHandler clientHandler) {
    this.clientHandler = clientHandler;
  }

  @Override
  public void info(Diagnostic info) {
    clientHandler.info(info);
  }

  public void info(String message) {
    info(new StringDiagnostic(message));
  }

  @Override
  public void warning(Diagnostic warning) {
    clientHandler.warning(warning);
  }

  public void warning(String message) {
    warning(new StringDiagnostic(message));
  }

  @Override
  public void error(Diagnostic error) {
    clientHandler.error(error);
    synchronized (this) {
      lastError = error;
      errorCount++;
    }
  }

  public void error(String message) {
    error(new StringDiagnostic(message));
  }

  /**
   * @throws AbortException always.
   */
  public RuntimeException fatalError(String message) {
    return fatalError(new StringDiagnostic(message));
  }

  /**
   * @throws AbortException always.
   */
  public RuntimeException fatalError(Diagnostic error) {
    error(error);
    failIfPendingErrors();
    throw new Unreachable();
  }

  public synchronized int getErrorCount() {
    return errorCount;
  }

  /**
   * @throws AbortException if any error was reported.
   */
  public synchronized void failIfPendingErrors() {
    if (lastError != null) {
      throw new AbortException(lastError);
    }
  }
}
