// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.graph;

import com.android.tools.resourceremap.utils.DescriptorUtils;

public class DexType implements Comparable<DexType> {

  public static final DexType INT = new DexType("I");
  public static final DexType INT_ARRAY = new DexType("[I");
  public static final DexType STRING = new DexType("Ljava/lang/String;");

  private final String descriptor;

  private DexType(String descriptor) {
    this.descriptor = descriptor;
  }

  public static DexType createFromDescriptor(String descriptor) {
    assert DescriptorUtils.isDescriptor(descriptor) : "Invalid descriptor: " + descriptor;
    return new DexType(descriptor);
  }

  public static DexType createFromJavaType(String javaType) {
    return createFromDescriptor(DescriptorUtils.javaTypeToDescriptor(javaType));
  }

  public String toDescriptorString() {
    return descriptor;
  }

  public String toSourceString() {
    return DescriptorUtils.descriptorToJavaType(descriptor);
  }

  public boolean isArrayType() {
    return descriptor.charAt(0) == '[';
  }

  @Override
  public int compareTo(DexType other) {
    return descriptor.compareTo(other.descriptor);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof DexType && descriptor.equals(((DexType) other).descriptor);
  }

  @Override
  public int hashCode() {
    return descriptor.hashCode();
  }

  @Override
  public String toString() {
    return toSourceString();
  }
}
