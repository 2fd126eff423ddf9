// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import com.android.tools.resourceremap.errors.CompilationError;
import com.android.tools.resourceremap.graph.DexEncodedMethod;
import com.android.tools.resourceremap.graph.DexProgramClass;
import com.android.tools.resourceremap.graph.DexType;
import com.android.tools.resourceremap.metadata.RClassArrayRemappingMetadata;
import com.android.tools.resourceremap.metadata.impl.RClassArrayRemappingMetadataImpl;
import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.Comparator;
import java.util.List;

/** Outcome of one run of the {@link RClassArrayRemapper}. */
public class RClassArrayRemappingResult {

  private final List<ClassResult> classResults;
  private final Statistics statistics;

  private RClassArrayRemappingResult(List<ClassResult> classResults, Statistics statistics) {
    this.classResults = classResults;
    this.statistics = statistics;
  }

  static RClassArrayRemappingResult create(List<ClassResult> classResults) {
    Statistics statistics = new Statistics();
    classResults.forEach(statistics::add);
    return new RClassArrayRemappingResult(ImmutableList.copyOf(classResults), statistics);
  }

  /** Results of all processed R classes in the order the classes appear in the stores. */
  public List<ClassResult> getClassResults() {
    return classResults;
  }

  /** Results of the R classes that were left unchanged because of an error, sorted by type. */
  public List<ClassResult> getFailedClassResults() {
    return classResults.stream()
        .filter(ClassResult::isFailed)
        .sorted(Comparator.comparing(ClassResult::getType))
        .collect(ImmutableList.toImmutableList());
  }

  public ClassResult getClassResult(DexType type) {
    for (ClassResult classResult : classResults) {
      if (classResult.getType().equals(type)) {
        return classResult;
      }
    }
    return null;
  }

  public Statistics getStatistics() {
    return statistics;
  }

  public RClassArrayRemappingMetadata getMetadata() {
    return RClassArrayRemappingMetadataImpl.create(this);
  }

  public static class ClassResult {

    private final DexProgramClass clazz;
    private final RClassRole role;
    private final List<ResourceArrayRewritePlan> plans;
    private final IntList unrelatedInstructionIndices;
    private final int discardedAllocations;
    private final int replacedInstructions;
    private final CompilationError error;

    private ClassResult(
        DexProgramClass clazz,
        RClassRole role,
        List<ResourceArrayRewritePlan> plans,
        IntList unrelatedInstructionIndices,
        int discardedAllocations,
        int replacedInstructions,
        CompilationError error) {
      this.clazz = clazz;
      this.role = role;
      this.plans = plans;
      this.unrelatedInstructionIndices = unrelatedInstructionIndices;
      this.discardedAllocations = discardedAllocations;
      this.replacedInstructions = replacedInstructions;
      this.error = error;
    }

    static ClassResult success(
        DexProgramClass clazz,
        RClassRole role,
        RClassInitializerScanner.Result scanResult,
        List<ResourceArrayRewritePlan> plans,
        int replacedInstructions) {
      return new ClassResult(
          clazz,
          role,
          ImmutableList.copyOf(plans),
          scanResult.getUnrelatedInstructionIndices(),
          scanResult.getDiscardedAllocations(),
          replacedInstructions,
          null);
    }

    static ClassResult failure(DexProgramClass clazz, RClassRole role, CompilationError error) {
      return new ClassResult(clazz, role, ImmutableList.of(), IntLists.EMPTY_LIST, 0, 0, error);
    }

    public DexProgramClass getHolder() {
      return clazz;
    }

    public DexType getType() {
      return clazz.getType();
    }

    public DexEncodedMethod getClassInitializer() {
      return clazz.getClassInitializer();
    }

    public RClassRole getRole() {
      return role;
    }

    public boolean isFailed() {
      return error != null;
    }

    /** The error that made the class be left unchanged, or null if the class was processed. */
    public CompilationError getError() {
      return error;
    }

    public List<ResourceArrayRewritePlan> getPlans() {
      return plans;
    }

    public IntList getUnrelatedInstructionIndices() {
      return unrelatedInstructionIndices;
    }

    public int getDiscardedAllocations() {
      return discardedAllocations;
    }

    public int getReplacedInstructions() {
      return replacedInstructions;
    }

    public boolean isRewritten() {
      return replacedInstructions > 0;
    }

    public int getKeptCount() {
      return plans.stream().mapToInt(ResourceArrayRewritePlan::getKeptCount).sum();
    }

    public int getRemappedCount() {
      return plans.stream().mapToInt(ResourceArrayRewritePlan::getRemappedCount).sum();
    }

    public int getDeletedCount() {
      return plans.stream().mapToInt(ResourceArrayRewritePlan::getDeletedCount).sum();
    }

    @Override
    public String toString() {
      if (isFailed()) {
        return getType().toSourceString() + ": failed (" + error.getMessage() + ")";
      }
      return getType().toSourceString()
          + ": "
          + plans.size()
          + " arrays, "
          + getKeptCount()
          + " kept, "
          + getRemappedCount()
          + " remapped, "
          + getDeletedCount()
          + " deleted";
    }
  }

  /** Counters summed over all class results. */
  public static class Statistics {

    private int processedClasses = 0;
    private int rewrittenClasses = 0;
    private int failedClasses = 0;
    private int arrays = 0;
    private int discardedAllocations = 0;
    private int keptElements = 0;
    private int remappedElements = 0;
    private int deletedElements = 0;
    private int replacedInstructions = 0;

    private Statistics() {}

    private void add(ClassResult classResult) {
      processedClasses++;
      if (classResult.isFailed()) {
        failedClasses++;
        return;
      }
      if (classResult.isRewritten()) {
        rewrittenClasses++;
      }
      arrays += classResult.getPlans().size();
      discardedAllocations += classResult.getDiscardedAllocations();
      keptElements += classResult.getKeptCount();
      remappedElements += classResult.getRemappedCount();
      deletedElements += classResult.getDeletedCount();
      replacedInstructions += classResult.getReplacedInstructions();
    }

    public int getProcessedClasses() {
      return processedClasses;
    }

    public int getRewrittenClasses() {
      return rewrittenClasses;
    }

    public int getFailedClasses() {
      return failedClasses;
    }

    public int getArrays() {
      return arrays;
    }

    public int getDiscardedAllocations() {
      return discardedAllocations;
    }

    public int getKeptElements() {
      return keptElements;
    }

    public int getRemappedElements() {
      return remappedElements;
    }

    public int getDeletedElements() {
      return deletedElements;
    }

    public int getReplacedInstructions() {
      return replacedInstructions;
    }

    @Override
    public String toString() {
      return "Processed "
          + processedClasses
          + " R classes ("
          + rewrittenClasses
          + " rewritten, "
          + failedClasses
          + " failed), "
          + arrays
          + " arrays: "
          + keptElements
          + " ids kept, "
          + remappedElements
          + " remapped, "
          + deletedElements
          + " deleted";
    }
  }
}
