// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.errors;

import com.android.tools.resourceremap.Diagnostic;
import com.android.tools.resourceremap.graph.DexType;
import com.android.tools.resourceremap.origin.Origin;
import com.android.tools.resourceremap.position.Position;

/**
 * Reported when an R class declares resource arrays but no role rule tells whether its arrays are
 * iterated or indexed. This is a configuration error and aborts the remapping.
 */
public class UnknownRClassRoleDiagnostic implements Diagnostic {

  private final Origin origin;
  private final DexType rClass;

  public UnknownRClassRoleDiagnostic(Origin origin, DexType rClass) {
    this.origin = origin;
    this.rClass = rClass;
  }

  public DexType getRClass() {
    return rClass;
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  @Override
  public Position getPosition() {
    return Position.UNKNOWN;
  }

  @Override
  public String getDiagnosticMessage() {
    return "No role configured for R class "
        + rClass.toSourceString()
        + " with resource arrays. Add a role rule matching "
        + rClass.toDescriptorString();
  }
}
