// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils;

import com.android.tools.resourceremap.Diagnostic;

/**
 * Exception thrown to interrupt processing after a fatal error. The exception doesn't carry
 * directly information about the fatal error: the problem was already reported to the {@link
 * com.android.tools.resourceremap.DiagnosticsHandler}.
 */
public class AbortException extends RuntimeException {

  private final Diagnostic diagnostic;

  public AbortException(Diagnostic diagnostic) {
    super(diagnostic.getDiagnosticMessage());
    this.diagnostic = diagnostic;
  }

  public Diagnostic getDiagnostic() {
    return diagnostic;
  }
}
