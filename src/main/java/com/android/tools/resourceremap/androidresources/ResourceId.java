// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

/**
 * A resource identifier of the form {@code 0xPPTTEEEE}: package id, type id and entry index.
 *
 * <p>Identifiers are compared and hashed by their raw 32-bit value.
 */
public final class ResourceId implements Comparable<ResourceId> {

  public static final int APPLICATION_PACKAGE_ID = 0x7f;

  private final int value;

  private ResourceId(int value) {
    this.value = value;
  }

  public static ResourceId of(int value) {
    return new ResourceId(value);
  }

  public static ResourceId of(int packageId, int typeId, int entryId) {
    assert 0 <= packageId && packageId <= 0xff;
    assert 0 <= typeId && typeId <= 0xff;
    assert 0 <= entryId && entryId <= 0xffff;
    return new ResourceId((packageId << 24) | (typeId << 16) | entryId);
  }

  public static int getPackageId(int value) {
    return value >>> 24;
  }

  public static int getTypeId(int value) {
    return (value >>> 16) & 0xff;
  }

  public static int getEntryId(int value) {
    return value & 0xffff;
  }

  public static boolean isSameType(int value, int other) {
    return getTypeId(value) == getTypeId(other);
  }

  public static String toHexString(int value) {
    return String.format("0x%08x", value);
  }

  public int getValue() {
    return value;
  }

  public int getPackageId() {
    return getPackageId(value);
  }

  public int getTypeId() {
    return getTypeId(value);
  }

  public int getEntryId() {
    return getEntryId(value);
  }

  public boolean isSameType(ResourceId other) {
    return isSameType(value, other.value);
  }

  @Override
  public int compareTo(ResourceId other) {
    return Integer.compareUnsigned(value, other.value);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ResourceId && ((ResourceId) other).value == value;
  }

  @Override
  public int hashCode() {
    return value;
  }

  @Override
  public String toString() {
    return toHexString(value);
  }
}
