// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import com.android.tools.resourceremap.dex.code.DexCode;
import com.android.tools.resourceremap.dex.code.DexConstNumber;
import com.android.tools.resourceremap.dex.code.DexInstruction;
import com.android.tools.resourceremap.dex.code.DexNewArray;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Writes the rewrite plans of an R class initializer back into its code.
 *
 * <p>For each plan the literal of the size definer and the payload of the fill-array-data
 * instruction are replaced. When the size definer is also read by an instruction that needs its
 * old literal, the definer is left alone and the allocation instead receives its own {@code const}
 * into its destination register, inserted right before it. The new instructions are installed with
 * a single {@link DexCode#setInstructions} call, so the code is either fully rewritten or left as
 * it was.
 */
public class RClassArrayRewriter {

  private final DexCode code;
  private final DexInstruction[] instructions;

  public RClassArrayRewriter(DexCode code) {
    this.code = code;
    this.instructions = code.getInstructions();
  }

  /**
   * Applies the plans to the code.
   *
   * @return the number of replaced or inserted instructions.
   */
  public int rewrite(List<ResourceArrayRewritePlan> plans) {
    Int2IntMap newSizeByNewArrayIndex = new Int2IntOpenHashMap();
    for (ResourceArrayRewritePlan plan : plans) {
      newSizeByNewArrayIndex.put(plan.getGroup().getNewArrayIndex(), plan.getNewSize());
    }
    DexInstruction[] newInstructions = Arrays.copyOf(instructions, instructions.length);
    Int2ObjectMap<DexConstNumber> insertedSizeByNewArrayIndex = new Int2ObjectOpenHashMap<>();
    int replaced = 0;
    for (ResourceArrayRewritePlan plan : plans) {
      RClassArrayGroup group = plan.getGroup();
      if (plan.isSizeChanged()) {
        DexConstNumber sizeDefiner = group.getSizeDefiner();
        int index = group.getSizeDefinerIndex();
        if (isSizeDefinerExclusive(plan, newSizeByNewArrayIndex)) {
          // A definer shared by several arrays of the same new size is replaced only once.
          if (newInstructions[index] == sizeDefiner) {
            newInstructions[index] =
                DexConstNumber.create(sizeDefiner.getRegister(), plan.getNewSize());
            replaced++;
          }
        } else {
          DexNewArray newArray = group.getNewArray();
          int destRegister = newArray.getDestRegister();
          insertedSizeByNewArrayIndex.put(
              group.getNewArrayIndex(), DexConstNumber.create(destRegister, plan.getNewSize()));
          newInstructions[group.getNewArrayIndex()] =
              new DexNewArray(destRegister, destRegister, newArray.getType());
          replaced += 2;
        }
      }
      if (plan.isContentChanged()) {
        newInstructions[group.getFillArrayDataIndex()] =
            group
                .getFillArrayData()
                .withPayload(FillArrayDataPayloadCodec.encode(plan.getNewElements()));
        replaced++;
      }
    }
    if (replaced > 0) {
      code.setInstructions(insertSizeDefiners(newInstructions, insertedSizeByNewArrayIndex));
    }
    return replaced;
  }

  private static DexInstruction[] insertSizeDefiners(
      DexInstruction[] newInstructions, Int2ObjectMap<DexConstNumber> insertedSizeByNewArrayIndex) {
    if (insertedSizeByNewArrayIndex.isEmpty()) {
      return newInstructions;
    }
    List<DexInstruction> result =
        new ArrayList<>(newInstructions.length + insertedSizeByNewArrayIndex.size());
    for (int index = 0; index < newInstructions.length; index++) {
      DexConstNumber sizeDefiner = insertedSizeByNewArrayIndex.get(index);
      if (sizeDefiner != null) {
        result.add(sizeDefiner);
      }
      result.add(newInstructions[index]);
    }
    return result.toArray(new DexInstruction[0]);
  }

  /**
   * The literal of a size definer can only be changed if every instruction reading it is the
   * allocation of an array that receives the same new size.
   */
  private boolean isSizeDefinerExclusive(
      ResourceArrayRewritePlan plan, Int2IntMap newSizeByNewArrayIndex) {
    RClassArrayGroup group = plan.getGroup();
    int register = group.getSizeDefiner().getRegister();
    for (int index = group.getSizeDefinerIndex() + 1; index < instructions.length; index++) {
      DexInstruction instruction = instructions[index];
      if (instruction.readsRegister(register)) {
        boolean isArrayWithSameNewSize =
            instruction.isNewArray()
                && newSizeByNewArrayIndex.containsKey(index)
                && newSizeByNewArrayIndex.get(index) == plan.getNewSize();
        if (!isArrayWithSameNewSize) {
          return false;
        }
      }
      if (instruction.writesRegister(register)) {
        // A new-array may redefine its own size register as the array register.
        break;
      }
    }
    return true;
  }
}
