// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap;

import com.android.tools.resourceremap.origin.Origin;
import com.android.tools.resourceremap.position.Position;
import java.io.PrintStream;

/**
 * A DiagnosticsHandler can be provided to customize handling of diagnostics information.
 *
 * <p>During remapping, warnings and errors can be reported by the remapper. Each of these is
 * reported to the handler, whose default implementation prints them on the standard streams.
 */
public interface DiagnosticsHandler {

  /**
   * Handle error diagnostics.
   *
   * @param error Diagnostic containing error information.
   */
  default void error(Diagnostic error) {
    printDiagnosticToStream(error, "Error", System.err);
  }

  /**
   * Handle warning diagnostics.
   *
   * @param warning Diagnostic containing warning information.
   */
  default void warning(Diagnostic warning) {
    printDiagnosticToStream(warning, "Warning", System.err);
  }

  /**
   * Handle info diagnostics.
   *
   * @param info Diagnostic containing the information.
   */
  default void info(Diagnostic info) {
    printDiagnosticToStream(info, "Info", System.out);
  }

  static void printDiagnosticToStream(
      Diagnostic diagnostic, String prefix, PrintStream stream) {
    StringBuilder builder = new StringBuilder(prefix);
    if (diagnostic.getOrigin() != Origin.unknown()) {
      builder.append(" in ").append(diagnostic.getOrigin());
      if (diagnostic.getPosition() != Position.UNKNOWN) {
        builder.append(":").append(diagnostic.getPosition().getDescription());
      }
    }
    builder.append(": ").append(diagnostic.getDiagnosticMessage());
    stream.println(builder);
  }
}
