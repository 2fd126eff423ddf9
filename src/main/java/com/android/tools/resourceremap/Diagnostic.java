// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap;

import com.android.tools.resourceremap.origin.Origin;
import com.android.tools.resourceremap.position.Position;

/**
 * Interface for all diagnostic message produced by the remapper.
 *
 * <p>A diagnostic carries the origin of the class it concerns, an optional position within that
 * origin, and a human readable message.
 */
public interface Diagnostic {

  /**
   * Origin of the resource causing the problem.
   *
   * @return the origin or {@link Origin#unknown()}.
   */
  Origin getOrigin();

  /** Position within the origin, or {@link Position#UNKNOWN}. */
  Position getPosition();

  /** User friendly description of the problem. */
  String getDiagnosticMessage();
}
