// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.utils;

import com.google.common.base.Splitter;
import java.util.List;

public class DescriptorUtils {

  public static final char DESCRIPTOR_PACKAGE_SEPARATOR = '/';
  public static final char JAVA_PACKAGE_SEPARATOR = '.';
  public static final char INNER_CLASS_SEPARATOR = '$';

  private static final String R_CLASS_SIMPLE_NAME = "R";

  public static boolean isDescriptor(String string) {
    if (string == null || string.isEmpty()) {
      return false;
    }
    char first = string.charAt(0);
    switch (first) {
      case '[':
        return isDescriptor(string.substring(1));
      case 'L':
        return string.length() > 2 && string.charAt(string.length() - 1) == ';';
      case 'Z':
      case 'B':
      case 'C':
      case 'S':
      case 'I':
      case 'J':
      case 'F':
      case 'D':
      case 'V':
        return string.length() == 1;
      default:
        return false;
    }
  }

  public static boolean isClassDescriptor(String descriptor) {
    return isDescriptor(descriptor) && descriptor.charAt(0) == 'L';
  }

  /**
   * Convert a Java type name to a descriptor string.
   *
   * @param typeName the java type name, e.g. {@code com.example.R$styleable} or {@code int[]}
   * @return a descriptor string, e.g. {@code Lcom/example/R$styleable;}
   */
  public static String javaTypeToDescriptor(String typeName) {
    if (typeName.endsWith("[]")) {
      return "[" + javaTypeToDescriptor(typeName.substring(0, typeName.length() - 2));
    }
    switch (typeName) {
      case "boolean":
        return "Z";
      case "byte":
        return "B";
      case "char":
        return "C";
      case "short":
        return "S";
      case "int":
        return "I";
      case "long":
        return "J";
      case "float":
        return "F";
      case "double":
        return "D";
      case "void":
        return "V";
      default:
        return "L"
            + typeName.replace(JAVA_PACKAGE_SEPARATOR, DESCRIPTOR_PACKAGE_SEPARATOR)
            + ";";
    }
  }

  /**
   * Convert a descriptor to a Java type name.
   *
   * @param descriptor type descriptor, e.g. {@code Lcom/example/R$styleable;}
   * @return Java type name, e.g. {@code com.example.R$styleable}
   */
  public static String descriptorToJavaType(String descriptor) {
    char first = descriptor.charAt(0);
    switch (first) {
      case '[':
        return descriptorToJavaType(descriptor.substring(1)) + "[]";
      case 'L':
        return descriptor
            .substring(1, descriptor.length() - 1)
            .replace(DESCRIPTOR_PACKAGE_SEPARATOR, JAVA_PACKAGE_SEPARATOR);
      case 'Z':
        return "boolean";
      case 'B':
        return "byte";
      case 'C':
        return "char";
      case 'S':
        return "short";
      case 'I':
        return "int";
      case 'J':
        return "long";
      case 'F':
        return "float";
      case 'D':
        return "double";
      case 'V':
        return "void";
      default:
        throw new IllegalArgumentException("Unknown type descriptor: " + descriptor);
    }
  }

  /**
   * Get the simple class name, including the names of enclosing classes, from a class descriptor.
   *
   * @param classDescriptor a class descriptor, e.g. {@code Lcom/example/R$styleable;}
   * @return the class name without package, e.g. {@code R$styleable}
   */
  public static String getSimpleClassNameFromDescriptor(String classDescriptor) {
    assert isClassDescriptor(classDescriptor);
    int start = classDescriptor.lastIndexOf(DESCRIPTOR_PACKAGE_SEPARATOR) + 1;
    if (start == 0) {
      start = 1;
    }
    return classDescriptor.substring(start, classDescriptor.length() - 1);
  }

  /**
   * Decides if a class descriptor denotes a generated resource id holder.
   *
   * <p>We match the outer class {@code R} itself, and classes named {@code R$type} where the type
   * starts with a lower case letter. The R class may itself be an inner class of another class.
   */
  public static boolean isRClassDescriptor(String classDescriptor) {
    if (!isClassDescriptor(classDescriptor)) {
      return false;
    }
    List<String> split =
        Splitter.on(INNER_CLASS_SEPARATOR)
            .splitToList(getSimpleClassNameFromDescriptor(classDescriptor));
    String last = split.get(split.size() - 1);
    if (last.equals(R_CLASS_SIMPLE_NAME)) {
      return true;
    }
    return split.size() >= 2
        && !last.isEmpty()
        && Character.isLowerCase(last.charAt(0))
        && split.get(split.size() - 2).equals(R_CLASS_SIMPLE_NAME);
  }

  /**
   * Returns the resource type of an inner R class, e.g. {@code styleable} for {@code
   * Lcom/example/R$styleable;}, or null for the outer R class.
   */
  public static String getRClassResourceType(String classDescriptor) {
    assert isRClassDescriptor(classDescriptor);
    String simpleName = getSimpleClassNameFromDescriptor(classDescriptor);
    int index = simpleName.lastIndexOf(INNER_CLASS_SEPARATOR);
    if (index < 0 || simpleName.substring(index + 1).equals(R_CLASS_SIMPLE_NAME)) {
      return null;
    }
    return simpleName.substring(index + 1);
  }
}
