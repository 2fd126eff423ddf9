// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import com.android.tools.resourceremap.dex.code.DexCode;
import com.android.tools.resourceremap.dex.code.DexConstNumber;
import com.android.tools.resourceremap.dex.code.DexFillArrayData;
import com.android.tools.resourceremap.dex.code.DexInstruction;
import com.android.tools.resourceremap.dex.code.DexNewArray;
import com.android.tools.resourceremap.dex.code.DexSputObject;
import com.android.tools.resourceremap.errors.MalformedFillArrayDataPayloadException;
import com.android.tools.resourceremap.errors.MalformedRClassInitializerException;
import com.android.tools.resourceremap.graph.DexType;
import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reconstructs the int[] declarations of an R class initializer from its instructions.
 *
 * <p>The initializer must be straight-line code. Every {@code new-array} of type int[] starts an
 * {@link ArrayMatcher} that follows the array register through the subsequent instructions:
 *
 * <pre>
 *   SEARCHING_FILL --fill-array-data vArray--> SEARCHING_STORE --sput-object vArray--> DONE
 *         |                                           |
 *         +--vArray redefined or read by a non-store--+--> DISCARDED / DONE without store
 * </pre>
 *
 * <p>Arrays that are never filled from a payload are left alone. A payload that cannot be decoded
 * fails the scan with a {@link MalformedFillArrayDataPayloadException}. The size of a matched
 * array must be defined by a const instruction whose literal equals the number of payload
 * elements, otherwise the initializer is rejected with a {@link
 * MalformedRClassInitializerException}.
 *
 * <p>Instructions other than those a resource compiler generates for R classes are counted as
 * unrelated, so that the caller can tell apart generated and customized initializers.
 */
public class RClassInitializerScanner {

  private final DexInstruction[] instructions;

  private RClassInitializerScanner(DexCode code) {
    this.instructions = code.getInstructions();
  }

  public static Result scan(DexCode code) {
    return new RClassInitializerScanner(code).run();
  }

  private Result run() {
    verifyStraightLine();
    List<RClassArrayGroup> groups = new ArrayList<>();
    List<ArrayMatcher> activeMatchers = new ArrayList<>();
    IntList unrelatedInstructionIndices = new IntArrayList();
    int discardedAllocations = 0;
    for (int index = 0; index < instructions.length; index++) {
      DexInstruction instruction = instructions[index];
      for (ArrayMatcher matcher : activeMatchers) {
        matcher.accept(index, instruction);
      }
      for (ArrayMatcher matcher : activeMatchers) {
        if (matcher.isDiscarded()) {
          discardedAllocations++;
        } else if (matcher.isDone()) {
          groups.add(matcher.toGroup());
        }
      }
      activeMatchers.removeIf(ArrayMatcher::isFinished);
      if (isIntArrayAllocation(instruction)) {
        activeMatchers.add(new ArrayMatcher(index, instruction.asNewArray()));
      } else if (!isGeneratedInstruction(instruction)) {
        unrelatedInstructionIndices.add(index);
      }
    }
    for (ArrayMatcher matcher : activeMatchers) {
      matcher.finish();
      if (matcher.isDiscarded()) {
        discardedAllocations++;
      } else {
        groups.add(matcher.toGroup());
      }
    }
    groups.sort(Comparator.comparingInt(RClassArrayGroup::getNewArrayIndex));
    return new Result(groups, unrelatedInstructionIndices, discardedAllocations);
  }

  private void verifyStraightLine() {
    for (int index = 0; index < instructions.length; index++) {
      DexInstruction instruction = instructions[index];
      if (instruction.isBranch()) {
        throw new MalformedRClassInitializerException(
            "Unsupported control flow instruction " + instruction, index);
      }
      if (instruction.isReturn() && index != instructions.length - 1) {
        throw new MalformedRClassInitializerException(
            "Unexpected return before the end of the initializer", index);
      }
    }
  }

  private static boolean isIntArrayAllocation(DexInstruction instruction) {
    return instruction.isNewArray() && instruction.asNewArray().getType().equals(DexType.INT_ARRAY);
  }

  private static boolean isGeneratedInstruction(DexInstruction instruction) {
    return instruction.isConstNumber()
        || instruction.isFillArrayData()
        || instruction.isSput()
        || instruction.isSputObject()
        || instruction.isReturn();
  }

  private int findSizeDefinerIndex(int newArrayIndex, int sizeRegister) {
    for (int index = newArrayIndex - 1; index >= 0; index--) {
      DexInstruction instruction = instructions[index];
      if (instruction.writesRegister(sizeRegister)) {
        if (instruction.isConstNumber()) {
          return index;
        }
        throw new MalformedRClassInitializerException(
            "Array size register v"
                + sizeRegister
                + " is defined by non-constant instruction "
                + instruction,
            newArrayIndex);
      }
    }
    throw new MalformedRClassInitializerException(
        "No definition of array size register v" + sizeRegister, newArrayIndex);
  }

  private enum State {
    SEARCHING_FILL,
    SEARCHING_STORE,
    DONE,
    DISCARDED
  }

  private class ArrayMatcher {

    private final int newArrayIndex;
    private final DexNewArray newArray;
    private final int arrayRegister;

    private State state = State.SEARCHING_FILL;
    private int fillArrayDataIndex = -1;
    private DexFillArrayData fillArrayData;
    private IntList elements;
    private int storeIndex = RClassArrayGroup.NO_STORE;
    private DexSputObject store;

    ArrayMatcher(int newArrayIndex, DexNewArray newArray) {
      this.newArrayIndex = newArrayIndex;
      this.newArray = newArray;
      this.arrayRegister = newArray.getDestRegister();
    }

    void accept(int index, DexInstruction instruction) {
      switch (state) {
        case SEARCHING_FILL:
          if (instruction.isFillArrayData()
              && instruction.asFillArrayData().getArrayRegister() == arrayRegister) {
            fillArrayDataIndex = index;
            fillArrayData = instruction.asFillArrayData();
            elements = FillArrayDataPayloadCodec.decode(fillArrayData.getPayload());
            state = State.SEARCHING_STORE;
          } else if (instruction.writesRegister(arrayRegister)
              || (instruction.readsRegister(arrayRegister)
                  && !instruction.isStaticOrArrayStoreOf(arrayRegister))) {
            state = State.DISCARDED;
          }
          break;
        case SEARCHING_STORE:
          if (instruction.isSputObject()
              && instruction.asSputObject().getRegister() == arrayRegister) {
            storeIndex = index;
            store = instruction.asSputObject();
            state = State.DONE;
          } else if (instruction.writesRegister(arrayRegister)) {
            state = State.DONE;
          }
          break;
        default:
          break;
      }
    }

    void finish() {
      if (state == State.SEARCHING_FILL) {
        state = State.DISCARDED;
      } else if (state == State.SEARCHING_STORE) {
        state = State.DONE;
      }
    }

    boolean isDone() {
      return state == State.DONE;
    }

    boolean isDiscarded() {
      return state == State.DISCARDED;
    }

    boolean isFinished() {
      return isDone() || isDiscarded();
    }

    RClassArrayGroup toGroup() {
      assert isDone();
      int sizeDefinerIndex = findSizeDefinerIndex(newArrayIndex, newArray.getSizeRegister());
      DexConstNumber sizeDefiner = instructions[sizeDefinerIndex].asConstNumber();
      if (sizeDefiner.getLiteral() != elements.size()) {
        throw new MalformedRClassInitializerException(
            "Array size "
                + sizeDefiner.getLiteral()
                + " does not match the "
                + elements.size()
                + " elements of its payload",
            fillArrayDataIndex);
      }
      return new RClassArrayGroup(
          sizeDefinerIndex,
          sizeDefiner,
          newArrayIndex,
          newArray,
          fillArrayDataIndex,
          fillArrayData,
          storeIndex,
          store,
          elements);
    }
  }

  public static class Result {

    private final List<RClassArrayGroup> groups;
    private final IntList unrelatedInstructionIndices;
    private final int discardedAllocations;

    Result(
        List<RClassArrayGroup> groups,
        IntList unrelatedInstructionIndices,
        int discardedAllocations) {
      this.groups = ImmutableList.copyOf(groups);
      this.unrelatedInstructionIndices = unrelatedInstructionIndices;
      this.discardedAllocations = discardedAllocations;
    }

    public List<RClassArrayGroup> getGroups() {
      return groups;
    }

    public boolean hasUnrelatedInstructions() {
      return !unrelatedInstructionIndices.isEmpty();
    }

    public IntList getUnrelatedInstructionIndices() {
      return unrelatedInstructionIndices;
    }

    /** Number of int[] allocations that were not filled from a payload and thus left untouched. */
    public int getDiscardedAllocations() {
      return discardedAllocations;
    }
  }
}
