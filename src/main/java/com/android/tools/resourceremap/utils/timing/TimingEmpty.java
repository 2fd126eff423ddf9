// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils.timing;

import com.android.tools.resourceremap.utils.ThrowingSupplier;

class TimingEmpty extends Timing {

  private static final TimingEmpty INSTANCE = new TimingEmpty();

  static Timing getEmpty() {
    return INSTANCE;
  }

  private TimingEmpty() {}

  @Override
  public Timing begin(String title) {
    return this;
  }

  @Override
  public Timing end() {
    return this;
  }

  @Override
  public boolean isEmpty() {
    return true;
  }

  @Override
  public <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier) throws E {
    return supplier.get();
  }

  @Override
  public void report() {}
}
