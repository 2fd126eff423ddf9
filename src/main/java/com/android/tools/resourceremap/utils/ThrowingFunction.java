// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils;

/**
 * Similar to a {@link java.util.function.Function} but throws a single {@link Throwable}.
 *
 * @param <S> the type of the input to the function
 * @param <T> the type of the result of the function
 * @param <E> the type of the {@link Throwable}
 */
@FunctionalInterface
public interface ThrowingFunction<S, T, E extends Throwable> {
  T apply(S s) throws E;
}
