// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

/** The way the int[] fields of an R class are consumed by the rest of the program. */
public enum RClassRole {
  /**
   * The umbrella R class. Its arrays are only iterated, so a deleted id is removed from the array
   * and the following ids move up.
   */
  SEQUENTIAL(SequentialResourceArrayRemapStrategy.getInstance()),
  /**
   * The attribute list class {@code R$styleable}. Its arrays are indexed by the generated
   * {@code R$styleable.Name_attr} int constants, so every id must stay at its offset and a deleted
   * id is replaced by 0.
   */
  POSITIONAL(PositionalResourceArrayRemapStrategy.getInstance());

  private final ResourceArrayRemapStrategy remapStrategy;

  RClassRole(ResourceArrayRemapStrategy remapStrategy) {
    this.remapStrategy = remapStrategy;
  }

  public ResourceArrayRemapStrategy getRemapStrategy() {
    return remapStrategy;
  }
}
