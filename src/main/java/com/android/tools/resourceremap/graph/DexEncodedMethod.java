// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.graph;

import com.android.tools.resourceremap.dex.code.DexCode;

public class DexEncodedMethod {

  public static final String CLASS_INITIALIZER_NAME = "<clinit>";

  private final DexType holder;
  private final String name;
  private final DexCode code;

  public DexEncodedMethod(DexType holder, String name, DexCode code) {
    this.holder = holder;
    this.name = name;
    this.code = code;
  }

  public static DexEncodedMethod createClassInitializer(DexType holder, DexCode code) {
    return new DexEncodedMethod(holder, CLASS_INITIALIZER_NAME, code);
  }

  public DexType getHolderType() {
    return holder;
  }

  public String getName() {
    return name;
  }

  public boolean isClassInitializer() {
    return name.equals(CLASS_INITIALIZER_NAME);
  }

  public boolean hasCode() {
    return code != null;
  }

  public DexCode getCode() {
    return code;
  }

  public String toSourceString() {
    return holder.toSourceString() + "." + name;
  }

  @Override
  public String toString() {
    return toSourceString();
  }
}
