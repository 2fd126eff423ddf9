// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils.timing;

import com.android.tools.resourceremap.utils.ThrowingSupplier;

public abstract class Timing implements AutoCloseable {

  public static Timing empty() {
    return TimingEmpty.getEmpty();
  }

  public static Timing create(String title, boolean printTimes) {
    return printTimes ? new TimingImpl(title) : empty();
  }

  public abstract Timing begin(String title);

  public abstract Timing end();

  public boolean isEmpty() {
    return false;
  }

  public <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier)
      throws E {
    begin(title);
    try {
      return supplier.get();
    } finally {
      end();
    }
  }

  public abstract void report();

  // Remove throws from close() in AutoClosable to allow try with resources without explicit catch.
  @Override
  public final void close() {
    end();
  }
}
