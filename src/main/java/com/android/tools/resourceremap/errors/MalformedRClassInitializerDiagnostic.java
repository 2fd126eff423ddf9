// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.errors;

import com.android.tools.resourceremap.Diagnostic;
import com.android.tools.resourceremap.graph.DexEncodedMethod;
import com.android.tools.resourceremap.origin.Origin;
import com.android.tools.resourceremap.position.MethodPosition;
import com.android.tools.resourceremap.position.Position;

/** Reported for each R class whose initializer could not be remapped and was left unchanged. */
public class MalformedRClassInitializerDiagnostic implements Diagnostic {

  private final Origin origin;
  private final MethodPosition position;
  private final CompilationError error;

  public MalformedRClassInitializerDiagnostic(
      Origin origin, DexEncodedMethod method, CompilationError error) {
    this.origin = origin;
    this.position =
        error instanceof MalformedRClassInitializerException
            ? new MethodPosition(
                method, ((MalformedRClassInitializerException) error).getInstructionIndex())
            : new MethodPosition(method);
    this.error = error;
  }

  public CompilationError getError() {
    return error;
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  @Override
  public Position getPosition() {
    return position;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Unable to remap resource arrays of "
        + position.getMethod().getHolderType().toSourceString()
        + ", leaving it unchanged: "
        + error.getMessage();
  }
}
