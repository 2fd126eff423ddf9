// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.errors;

/**
 * Exception to signal that a point in the code was reached that should not be reachable.
 *
 * <p>This is always an internal error.
 */
public class Unreachable extends InternalError {

  public Unreachable() {}

  public Unreachable(String s) {
    super(s);
  }

  public Unreachable(Throwable cause) {
    super(cause);
  }
}
