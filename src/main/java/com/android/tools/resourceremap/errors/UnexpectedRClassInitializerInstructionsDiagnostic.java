// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.errors;

import com.android.tools.resourceremap.Diagnostic;
import com.android.tools.resourceremap.graph.DexEncodedMethod;
import com.android.tools.resourceremap.origin.Origin;
import com.android.tools.resourceremap.position.MethodPosition;
import com.android.tools.resourceremap.position.Position;

/**
 * Reported when the initializer of an R class that is not flagged as customized contains
 * instructions that a resource compiler does not generate.
 */
public class UnexpectedRClassInitializerInstructionsDiagnostic implements Diagnostic {

  private final Origin origin;
  private final MethodPosition position;
  private final int count;

  public UnexpectedRClassInitializerInstructionsDiagnostic(
      Origin origin, DexEncodedMethod method, int firstIndex, int count) {
    this.origin = origin;
    this.position = new MethodPosition(method, firstIndex);
    this.count = count;
  }

  public int getCount() {
    return count;
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
    return "Found "
        + count
        + " unexpected instruction(s) in "
        + position.getMethod().toSourceString()
        + ". Flag the class as a customized R class if this is intended.";
  }
}
