// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.graph;

import java.util.Objects;

public class DexField {

  public final DexType holder;
  public final DexType type;
  public final String name;

  public DexField(DexType holder, DexType type, String name) {
    this.holder = holder;
    this.type = type;
    this.name = name;
  }

  public DexType getHolderType() {
    return holder;
  }

  public DexType getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public String toSourceString() {
    return type.toSourceString() + " " + holder.toSourceString() + "." + name;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof DexField)) {
      return false;
    }
    DexField field = (DexField) other;
    return holder.equals(field.holder) && type.equals(field.type) && name.equals(field.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(holder, type, name);
  }

  @Override
  public String toString() {
    return holder.toDescriptorString() + "->" + name + ":" + type.toDescriptorString();
  }
}
