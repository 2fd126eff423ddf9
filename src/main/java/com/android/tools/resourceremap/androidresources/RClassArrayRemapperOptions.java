// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import com.android.tools.resourceremap.graph.DexType;
import com.android.tools.resourceremap.utils.DescriptorUtils;
import com.android.tools.resourceremap.utils.SystemPropertyUtils;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Configuration of the R class array remapping.
 *
 * <p>R classes are recognized by name. Which remap strategy applies to an R class is decided by
 * the first role rule whose pattern matches the class descriptor. R classes can be flagged as
 * customized when the app injects its own code into their initializers; this only silences the
 * diagnostic about unexpected instructions.
 */
public class RClassArrayRemapperOptions {

  public static final String CUSTOMIZED_R_CLASSES_PROPERTY =
      "com.android.tools.resourceremap.customizedrclasses";
  public static final String PRINT_TIMES_PROPERTY = "com.android.tools.resourceremap.printtimes";
  public static final String VERBOSE_PROPERTY = "com.android.tools.resourceremap.verbose";

  private final Set<DexType> customizedRClasses;
  private final List<RoleRule> roleRules;
  private final boolean printTimes;
  private final boolean verbose;

  private RClassArrayRemapperOptions(
      Set<DexType> customizedRClasses,
      List<RoleRule> roleRules,
      boolean printTimes,
      boolean verbose) {
    this.customizedRClasses = customizedRClasses;
    this.roleRules = roleRules;
    this.printTimes = printTimes;
    this.verbose = verbose;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Options with the default role rules, extended from system properties. */
  public static RClassArrayRemapperOptions createDefault() {
    return builder().addDefaultRoleRules().addSystemPropertyDefaults().build();
  }

  public boolean isRClass(DexType type) {
    return DescriptorUtils.isRClassDescriptor(type.toDescriptorString());
  }

  public boolean isCustomized(DexType type) {
    return customizedRClasses.contains(type);
  }

  public Set<DexType> getCustomizedRClasses() {
    return customizedRClasses;
  }

  /** Returns the role of an R class, or null if no role rule matches. */
  public RClassRole getRole(DexType type) {
    String descriptor = type.toDescriptorString();
    for (RoleRule rule : roleRules) {
      if (rule.matches(descriptor)) {
        return rule.getRole();
      }
    }
    return null;
  }

  public List<RoleRule> getRoleRules() {
    return roleRules;
  }

  public boolean isPrintTimes() {
    return printTimes;
  }

  public boolean isVerbose() {
    return verbose;
  }

  public static class RoleRule {

    private final Pattern descriptorPattern;
    private final RClassRole role;

    public RoleRule(Pattern descriptorPattern, RClassRole role) {
      this.descriptorPattern = descriptorPattern;
      this.role = role;
    }

    public boolean matches(String descriptor) {
      return descriptorPattern.matcher(descriptor).matches();
    }

    public Pattern getDescriptorPattern() {
      return descriptorPattern;
    }

    public RClassRole getRole() {
      return role;
    }

    @Override
    public String toString() {
      return descriptorPattern.pattern() + " -> " + role;
    }
  }

  public static class Builder {

    public static final String STYLEABLE_DESCRIPTOR_PATTERN = "L(.*/)?R\\$styleable;";
    public static final String UMBRELLA_DESCRIPTOR_PATTERN = "L(.*/)?R;";

    private final ImmutableSet.Builder<DexType> customizedRClasses = ImmutableSet.builder();
    private final List<RoleRule> roleRules = new ArrayList<>();
    private boolean printTimes = false;
    private boolean verbose = false;

    private Builder() {}

    /**
     * Flags an R class as customized.
     *
     * @param name a class descriptor such as {@code Lcom/example/R;} or a Java type name such as
     *     {@code com.example.R}
     */
    public Builder addCustomizedRClass(String name) {
      customizedRClasses.add(
          DescriptorUtils.isClassDescriptor(name)
              ? DexType.createFromDescriptor(name)
              : DexType.createFromJavaType(name));
      return this;
    }

    public Builder addRoleRule(String descriptorRegex, RClassRole role) {
      roleRules.add(new RoleRule(Pattern.compile(descriptorRegex), role));
      return this;
    }

    /** Maps {@code R$styleable} to {@link RClassRole#POSITIONAL} and {@code R} to sequential. */
    public Builder addDefaultRoleRules() {
      addRoleRule(STYLEABLE_DESCRIPTOR_PATTERN, RClassRole.POSITIONAL);
      addRoleRule(UMBRELLA_DESCRIPTOR_PATTERN, RClassRole.SEQUENTIAL);
      return this;
    }

    public Builder addSystemPropertyDefaults() {
      SystemPropertyUtils.parseSystemPropertyList(CUSTOMIZED_R_CLASSES_PROPERTY)
          .forEach(this::addCustomizedRClass);
      printTimes |= SystemPropertyUtils.parseSystemPropertyOrDefault(PRINT_TIMES_PROPERTY, false);
      verbose |= SystemPropertyUtils.parseSystemPropertyOrDefault(VERBOSE_PROPERTY, false);
      return this;
    }

    public Builder setPrintTimes(boolean printTimes) {
      this.printTimes = printTimes;
      return this;
    }

    public Builder setVerbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public RClassArrayRemapperOptions build() {
      return new RClassArrayRemapperOptions(
          customizedRClasses.build(), ImmutableList.copyOf(roleRules), printTimes, verbose);
    }
  }
}
