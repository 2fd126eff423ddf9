// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.origin;

/** Origin of a class read from a named dex store, such as {@code classes} or a module store. */
public class StoreOrigin extends Origin {

  private final String storeName;

  public StoreOrigin(String storeName) {
    super(Origin.root());
    this.storeName = storeName;
  }

  @Override
  public String part() {
    return storeName;
  }
}
