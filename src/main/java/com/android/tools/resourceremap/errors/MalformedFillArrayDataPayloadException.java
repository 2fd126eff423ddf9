// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.errors;

/**
 * Signals that the binary payload of a fill-array-data instruction is structurally invalid, or is
 * not a payload of 32-bit elements.
 */
public class MalformedFillArrayDataPayloadException extends CompilationError {

  public MalformedFillArrayDataPayloadException(String message) {
    super(message);
  }
}
