// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import com.android.tools.resourceremap.TestBase;
import com.android.tools.resourceremap.dex.code.DexCode;
import com.android.tools.resourceremap.dex.code.DexConst16;
import com.android.tools.resourceremap.dex.code.DexConst4;
import com.android.tools.resourceremap.dex.code.DexConstNumber;
import com.android.tools.resourceremap.dex.code.DexFillArrayData;
import com.android.tools.resourceremap.dex.code.DexInstruction;
import com.android.tools.resourceremap.dex.code.DexNewArray;
import com.android.tools.resourceremap.dex.code.DexSput;
import com.android.tools.resourceremap.dex.code.DexSputObject;
import com.android.tools.resourceremap.graph.DexType;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class RClassArrayRewriterTest extends TestBase {

  private static List<ResourceArrayRewritePlan> plan(
      DexCode code, RClassRole role, ResourceIdMapping mapping) {
    List<ResourceArrayRewritePlan> plans = new ArrayList<>();
    for (RClassArrayGroup group : RClassInitializerScanner.scan(code).getGroups()) {
      plans.add(role.getRemapStrategy().plan(group, mapping));
    }
    return plans;
  }

  private static int[] elementsAt(DexCode code, int fillArrayDataIndex) {
    return FillArrayDataPayloadCodec.decode(
            code.getInstruction(fillArrayDataIndex).asFillArrayData().getPayload())
        .toIntArray();
  }

  @Test
  public void testSizeAndPayloadAreReplaced() {
    DexCode code =
        RClassInitializerBuilder.builder("Lcom/example/R;")
            .addIntArray("ids", 0x7f020000, 0x7f020001, 0x7f020002, 0x7f020003)
            .buildCode();
    DexInstruction[] original = code.getInstructions();
    DexCode expectedUnchanged = code.copy();
    ResourceIdMapping mapping =
        ResourceIdMapping.builder().keep(0x7f020000).map(0x7f020002, 0x7f020001).build();

    int replaced =
        new RClassArrayRewriter(code).rewrite(plan(code, RClassRole.SEQUENTIAL, mapping));

    assertEquals(2, replaced);
    assertNotSame(original, code.getInstructions());
    assertEquals(2, code.getInstruction(0).asConstNumber().getLiteral());
    assertEquals(0, code.getInstruction(0).asConstNumber().getRegister());
    assertSame(original[1], code.getInstruction(1));
    assertEquals(
        IntArrayList.wrap(new int[] {0x7f020000, 0x7f020001}),
        IntArrayList.wrap(elementsAt(code, 2)));
    // The previous instruction array is not modified in place.
    assertTrue(new DexCode(code.registerSize, original).hasSameInstructions(expectedUnchanged));
  }

  @Test
  public void testSmallestConstEncodingIsChosen() {
    int[] ids = new int[10];
    for (int i = 0; i < ids.length; i++) {
      ids[i] = 0x7f010000 + i;
    }
    DexCode code =
        RClassInitializerBuilder.builder("Lcom/example/R;").addIntArray("ids", ids).buildCode();
    assertTrue(code.getInstruction(0) instanceof DexConst16);
    int sizeBefore = code.codeSizeInCodeUnits();
    ResourceIdMapping mapping =
        ResourceIdMapping.builder().keep(ids[0]).keep(ids[5]).keep(ids[9]).build();

    new RClassArrayRewriter(code).rewrite(plan(code, RClassRole.SEQUENTIAL, mapping));

    assertTrue(code.getInstruction(0) instanceof DexConst4);
    assertEquals(3, code.getInstruction(0).asConstNumber().getLiteral());
    assertEquals(sizeBefore - 1, code.codeSizeInCodeUnits());
  }

  @Test
  public void testNoChangesKeepsInstructions() {
    DexCode code =
        RClassInitializerBuilder.builder("Lcom/example/R$styleable;")
            .addIntArray("View", 0x7f040000, 0x7f040001)
            .buildCode();
    DexInstruction[] original = code.getInstructions();
    ResourceIdMapping mapping =
        ResourceIdMapping.builder().keep(0x7f040000).keep(0x7f040001).build();

    int replaced =
        new RClassArrayRewriter(code).rewrite(plan(code, RClassRole.POSITIONAL, mapping));

    assertEquals(0, replaced);
    assertSame(original, code.getInstructions());
  }

  @Test
  public void testPositionalOnlyReplacesPayload() {
    DexCode code =
        RClassInitializerBuilder.builder("Lcom/example/R$styleable;")
            .addIntArray("View", 0x7f040000, 0x7f040001)
            .buildCode();
    DexInstruction sizeDefiner = code.getInstruction(0);
    ResourceIdMapping mapping = ResourceIdMapping.builder().keep(0x7f040001).build();

    int replaced =
        new RClassArrayRewriter(code).rewrite(plan(code, RClassRole.POSITIONAL, mapping));

    assertEquals(1, replaced);
    assertSame(sizeDefiner, code.getInstruction(0));
    assertEquals(
        IntArrayList.wrap(new int[] {0, 0x7f040001}), IntArrayList.wrap(elementsAt(code, 2)));
  }

  private static DexCode createCodeWithSharedSize(RClassInitializerBuilder builder) {
    return builder
        .setRegisterSize(2)
        .add(
            new DexConst4(1, 2),
            new DexNewArray(0, 1, DexType.INT_ARRAY),
            new DexFillArrayData(
                0, FillArrayDataPayloadCodec.encode(IntArrayList.wrap(new int[] {0xa, 0xb}))),
            new DexSputObject(0, builder.field("first", DexType.INT_ARRAY)),
            new DexNewArray(0, 1, DexType.INT_ARRAY),
            new DexFillArrayData(
                0, FillArrayDataPayloadCodec.encode(IntArrayList.wrap(new int[] {0xc, 0xd}))),
            new DexSputObject(0, builder.field("second", DexType.INT_ARRAY)))
        .buildCode();
  }

  @Test
  public void testSharedSizeWithSameNewSize() {
    DexCode code = createCodeWithSharedSize(RClassInitializerBuilder.builder("Lcom/example/R;"));
    ResourceIdMapping mapping = ResourceIdMapping.builder().keep(0xa).keep(0xd).build();

    int replaced =
        new RClassArrayRewriter(code).rewrite(plan(code, RClassRole.SEQUENTIAL, mapping));

    // One size definer and two payloads.
    assertEquals(3, replaced);
    assertEquals(1, code.getInstruction(0).asConstNumber().getLiteral());
    assertEquals(IntArrayList.wrap(new int[] {0xa}), IntArrayList.wrap(elementsAt(code, 2)));
    assertEquals(IntArrayList.wrap(new int[] {0xd}), IntArrayList.wrap(elementsAt(code, 5)));
  }

  @Test
  public void testSharedSizeWithDifferentNewSizes() {
    DexCode code = createCodeWithSharedSize(RClassInitializerBuilder.builder("Lcom/example/R;"));
    DexInstruction sharedSizeDefiner = code.getInstruction(0);
    ResourceIdMapping mapping = ResourceIdMapping.builder().keep(0xa).keep(0xb).keep(0xc).build();

    int replaced =
        new RClassArrayRewriter(code).rewrite(plan(code, RClassRole.SEQUENTIAL, mapping));

    // An inserted const, the rewritten new-array and the second payload.
    assertEquals(3, replaced);
    assertEquals(9, code.getInstructions().length);
    assertSame(sharedSizeDefiner, code.getInstruction(0));
    assertEquals(2, code.getInstruction(0).asConstNumber().getLiteral());
    DexConstNumber insertedSize = code.getInstruction(4).asConstNumber();
    assertEquals(0, insertedSize.getRegister());
    assertEquals(1, insertedSize.getLiteral());
    DexNewArray newArray = code.getInstruction(5).asNewArray();
    assertEquals(0, newArray.getDestRegister());
    assertEquals(0, newArray.getSizeRegister());
    assertEquals(IntArrayList.wrap(new int[] {0xa, 0xb}), IntArrayList.wrap(elementsAt(code, 2)));
    assertEquals(IntArrayList.wrap(new int[] {0xc}), IntArrayList.wrap(elementsAt(code, 6)));

    List<RClassArrayGroup> groups = RClassInitializerScanner.scan(code).getGroups();
    assertEquals(2, groups.size());
    assertEquals(2, groups.get(0).getDeclaredSize());
    assertEquals(1, groups.get(1).getDeclaredSize());
  }

  @Test
  public void testSharedSizeOfFourWithOneArrayShrinking() {
    RClassInitializerBuilder builder = RClassInitializerBuilder.builder("Lcom/example/R;");
    DexCode code =
        builder
            .setRegisterSize(2)
            .add(
                new DexConst4(1, 4),
                new DexNewArray(0, 1, DexType.INT_ARRAY),
                new DexFillArrayData(
                    0,
                    FillArrayDataPayloadCodec.encode(
                        IntArrayList.wrap(
                            new int[] {0x7f010000, 0x7f010001, 0x7f010002, 0x7f010003}))),
                new DexSputObject(0, builder.field("first", DexType.INT_ARRAY)),
                new DexNewArray(0, 1, DexType.INT_ARRAY),
                new DexFillArrayData(
                    0,
                    FillArrayDataPayloadCodec.encode(
                        IntArrayList.wrap(
                            new int[] {0x7f020000, 0x7f020001, 0x7f020002, 0x7f020003}))),
                new DexSputObject(0, builder.field("second", DexType.INT_ARRAY)))
            .buildCode();
    ResourceIdMapping mapping =
        ResourceIdMapping.builder()
            .map(0x7f010000, 0x7f010010)
            .map(0x7f010001, 0x7f010011)
            .map(0x7f010002, 0x7f010012)
            .map(0x7f010003, 0x7f010013)
            .keep(0x7f020000)
            .keep(0x7f020001)
            .build();

    new RClassArrayRewriter(code).rewrite(plan(code, RClassRole.SEQUENTIAL, mapping));

    List<RClassArrayGroup> groups = RClassInitializerScanner.scan(code).getGroups();
    assertEquals(2, groups.size());
    assertEquals(4, groups.get(0).getDeclaredSize());
    assertEquals(
        IntArrayList.wrap(new int[] {0x7f010010, 0x7f010011, 0x7f010012, 0x7f010013}),
        groups.get(0).getElements());
    assertEquals(2, groups.get(1).getDeclaredSize());
    assertEquals(
        IntArrayList.wrap(new int[] {0x7f020000, 0x7f020001}), groups.get(1).getElements());
    assertEquals("second", groups.get(1).getField().getName());
  }

  @Test
  public void testSizeConstantUsedByIntField() {
    RClassInitializerBuilder builder = RClassInitializerBuilder.builder("Lcom/example/R;");
    DexCode code =
        builder
            .add(
                new DexConst4(0, 2),
                new DexSput(0, builder.field("two", DexType.INT)),
                new DexNewArray(0, 0, DexType.INT_ARRAY),
                new DexFillArrayData(
                    0, FillArrayDataPayloadCodec.encode(IntArrayList.wrap(new int[] {0xa, 0xb}))))
            .buildCode();
    DexInstruction intFieldValue = code.getInstruction(0);
    List<ResourceArrayRewritePlan> plans =
        plan(code, RClassRole.SEQUENTIAL, ResourceIdMapping.builder().keep(0xa).build());

    new RClassArrayRewriter(code).rewrite(plans);

    assertEquals(6, code.getInstructions().length);
    assertSame(intFieldValue, code.getInstruction(0));
    assertEquals(1, code.getInstruction(2).asConstNumber().getLiteral());
    assertTrue(code.getInstruction(3).isNewArray());
    assertEquals(IntArrayList.wrap(new int[] {0xa}), IntArrayList.wrap(elementsAt(code, 4)));
  }
}
