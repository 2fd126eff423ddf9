// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.graph;

import com.android.tools.resourceremap.origin.Origin;
import com.google.common.collect.ImmutableList;
import java.util.List;

public class DexProgramClass {

  private final DexType type;
  private final Origin origin;
  private final List<DexEncodedMethod> methods;

  public DexProgramClass(DexType type, Origin origin, List<DexEncodedMethod> methods) {
    assert methods.stream().allMatch(method -> method.getHolderType().equals(type));
    this.type = type;
    this.origin = origin;
    this.methods = ImmutableList.copyOf(methods);
  }

  public DexType getType() {
    return type;
  }

  public Origin getOrigin() {
    return origin;
  }

  public List<DexEncodedMethod> methods() {
    return methods;
  }

  public boolean hasClassInitializer() {
    return getClassInitializer() != null;
  }

  public DexEncodedMethod getClassInitializer() {
    for (DexEncodedMethod method : methods) {
      if (method.isClassInitializer()) {
        return method;
      }
    }
    return null;
  }

  public String getTypeName() {
    return type.toSourceString();
  }

  @Override
  public String toString() {
    return type.toSourceString();
  }
}
