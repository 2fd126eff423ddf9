// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

public class SystemPropertyUtils {

  public static boolean parseSystemPropertyOrDefault(String propertyName, boolean defaultValue) {
    String value = System.getProperty(propertyName);
    if (value == null) {
      return defaultValue;
    }
    switch (value) {
      case "":
      case "1":
      case "true":
        return true;
      case "0":
      case "false":
        return false;
      default:
        throw new IllegalArgumentException(
            "Invalid value for system property " + propertyName + ": " + value);
    }
  }

  public static int parseSystemPropertyOrDefault(String propertyName, int defaultValue) {
    String value = System.getProperty(propertyName);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid value for system property " + propertyName + ": " + value, e);
    }
  }

  /** Returns the comma separated, trimmed and non-empty entries of a system property. */
  public static List<String> parseSystemPropertyList(String propertyName) {
    String value = System.getProperty(propertyName);
    if (value == null) {
      return ImmutableList.of();
    }
    return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value);
  }
}
