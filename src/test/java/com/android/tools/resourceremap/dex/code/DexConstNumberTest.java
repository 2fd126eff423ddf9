// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;

import com.android.tools.resourceremap.TestBase;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class DexConstNumberTest extends TestBase {

  @Parameter(0)
  public int register;

  @Parameter(1)
  public int literal;

  @Parameter(2)
  public Class<? extends DexConstNumber> expectedClass;

  @Parameters(name = "v{0}, {1}")
  public static List<Object[]> data() {
    return ImmutableList.of(
        new Object[] {0, 0, DexConst4.class},
        new Object[] {0, -8, DexConst4.class},
        new Object[] {15, 7, DexConst4.class},
        new Object[] {16, 1, DexConst16.class},
        new Object[] {0, 8, DexConst16.class},
        new Object[] {0, (int) Short.MIN_VALUE, DexConst16.class},
        new Object[] {0, (int) Short.MAX_VALUE, DexConst16.class},
        new Object[] {0, 0x7f010000, DexConstHigh16.class},
        new Object[] {0, 0x80000000, DexConstHigh16.class},
        new Object[] {0, 0x7f010001, DexConst.class},
        new Object[] {255, -32769, DexConst.class});
  }

  @Test
  public void testCreate() {
    DexConstNumber instruction = DexConstNumber.create(register, literal);
    assertThat(instruction, instanceOf(expectedClass));
    assertEquals(register, instruction.getRegister());
    assertEquals(literal, instruction.getLiteral());
    int expectedSize =
        expectedClass == DexConst4.class ? 1 : expectedClass == DexConst.class ? 3 : 2;
    assertEquals(expectedSize, instruction.getSize());
  }
}
