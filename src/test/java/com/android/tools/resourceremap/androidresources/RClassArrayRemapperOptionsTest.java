// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.android.tools.resourceremap.TestBase;
import com.android.tools.resourceremap.androidresources.RClassArrayRemapperOptions.RoleRule;
import com.android.tools.resourceremap.graph.DexType;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import org.junit.After;
import org.junit.Test;

public class RClassArrayRemapperOptionsTest extends TestBase {

  private static DexType type(String descriptor) {
    return DexType.createFromDescriptor(descriptor);
  }

  @After
  public void clearProperties() {
    System.clearProperty(RClassArrayRemapperOptions.CUSTOMIZED_R_CLASSES_PROPERTY);
    System.clearProperty(RClassArrayRemapperOptions.PRINT_TIMES_PROPERTY);
    System.clearProperty(RClassArrayRemapperOptions.VERBOSE_PROPERTY);
  }

  @Test
  public void testDefaultRoles() {
    RClassArrayRemapperOptions options = defaultOptions();
    assertSame(RClassRole.SEQUENTIAL, options.getRole(type("Lcom/example/R;")));
    assertSame(RClassRole.SEQUENTIAL, options.getRole(type("LR;")));
    assertSame(RClassRole.POSITIONAL, options.getRole(type("Lcom/example/R$styleable;")));
    assertNull(options.getRole(type("Lcom/example/R$array;")));

    List<RoleRule> rules = options.getRoleRules();
    assertEquals(2, rules.size());
    assertEquals(
        RClassArrayRemapperOptions.Builder.STYLEABLE_DESCRIPTOR_PATTERN,
        rules.get(0).getDescriptorPattern().pattern());
    assertSame(RClassRole.POSITIONAL, rules.get(0).getRole());
    assertEquals(
        RClassArrayRemapperOptions.Builder.UMBRELLA_DESCRIPTOR_PATTERN,
        rules.get(1).getDescriptorPattern().pattern());
    assertSame(RClassRole.SEQUENTIAL, rules.get(1).getRole());
  }

  @Test
  public void testFirstMatchingRuleWins() {
    RClassArrayRemapperOptions options =
        RClassArrayRemapperOptions.builder()
            .addRoleRule("Lcom/example/R\\$.*;", RClassRole.POSITIONAL)
            .addRoleRule("L.*/R\\$array;", RClassRole.SEQUENTIAL)
            .build();
    assertSame(RClassRole.POSITIONAL, options.getRole(type("Lcom/example/R$array;")));
    assertSame(RClassRole.SEQUENTIAL, options.getRole(type("Lcom/other/R$array;")));
  }

  @Test
  public void testRClassRecognition() {
    RClassArrayRemapperOptions options = defaultOptions();
    assertTrue(options.isRClass(type("Lcom/example/R;")));
    assertTrue(options.isRClass(type("Lcom/example/R$styleable;")));
    assertFalse(options.isRClass(type("Lcom/example/Resources;")));
    assertFalse(options.isRClass(type("Lcom/example/R$Styleable;")));
  }

  @Test
  public void testSystemPropertyDefaults() {
    System.setProperty(
        RClassArrayRemapperOptions.CUSTOMIZED_R_CLASSES_PROPERTY, "Lcom/a/R;, com.b.R,");
    System.setProperty(RClassArrayRemapperOptions.PRINT_TIMES_PROPERTY, "true");
    System.setProperty(RClassArrayRemapperOptions.VERBOSE_PROPERTY, "0");
    RClassArrayRemapperOptions options = RClassArrayRemapperOptions.createDefault();
    assertTrue(options.isCustomized(type("Lcom/a/R;")));
    assertTrue(options.isCustomized(type("Lcom/b/R;")));
    assertFalse(options.isCustomized(type("Lcom/c/R;")));
    assertEquals(
        ImmutableSet.of(type("Lcom/a/R;"), type("Lcom/b/R;")), options.getCustomizedRClasses());
    assertTrue(options.isPrintTimes());
    assertFalse(options.isVerbose());
    assertSame(RClassRole.POSITIONAL, options.getRole(type("Lcom/a/R$styleable;")));
  }

  @Test
  public void testInvalidBooleanProperty() {
    System.setProperty(RClassArrayRemapperOptions.VERBOSE_PROPERTY, "yes");
    assertThrows(IllegalArgumentException.class, RClassArrayRemapperOptions::createDefault);
  }
}
