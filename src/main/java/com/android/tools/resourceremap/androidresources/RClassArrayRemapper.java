// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import com.android.tools.resourceremap.androidresources.RClassArrayRemappingResult.ClassResult;
import com.android.tools.resourceremap.dex.code.DexCode;
import com.android.tools.resourceremap.dex.code.DexInstruction;
import com.android.tools.resourceremap.errors.CompilationError;
import com.android.tools.resourceremap.errors.DuplicateRemappedResourceIdDiagnostic;
import com.android.tools.resourceremap.errors.MalformedRClassInitializerDiagnostic;
import com.android.tools.resourceremap.errors.UnexpectedRClassInitializerInstructionsDiagnostic;
import com.android.tools.resourceremap.errors.UnknownRClassRoleDiagnostic;
import com.android.tools.resourceremap.graph.DexEncodedMethod;
import com.android.tools.resourceremap.graph.DexProgramClass;
import com.android.tools.resourceremap.graph.DexStore;
import com.android.tools.resourceremap.utils.Reporter;
import com.android.tools.resourceremap.utils.StringDiagnostic;
import com.android.tools.resourceremap.utils.ThreadUtils;
import com.android.tools.resourceremap.utils.ThreadUtils.WorkLoad;
import com.android.tools.resourceremap.utils.timing.Timing;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Rewrites the resource id arrays built by the class initializers of R classes after resource ids
 * have been renumbered or removed.
 *
 * <p>For every R class with arrays the initializer is scanned, each array is planned with the
 * strategy of the class role and the new sizes and payloads are written back. Classes are
 * processed independently and in parallel. A class whose initializer cannot be handled is left
 * unchanged and reported as a warning once all classes are done.
 */
public class RClassArrayRemapper {

  private final RClassArrayRemapperOptions options;
  private final Reporter reporter;

  public RClassArrayRemapper(RClassArrayRemapperOptions options, Reporter reporter) {
    this.options = options;
    this.reporter = reporter;
  }

  /**
   * Remaps the arrays of all R classes in {@code stores}.
   *
   * @throws com.android.tools.resourceremap.utils.AbortException if an R class with arrays has no
   *     role. No class is modified in that case.
   */
  public RClassArrayRemappingResult run(
      List<DexStore> stores, ResourceIdMapping mapping, ExecutorService executorService)
      throws ExecutionException {
    Timing timing = Timing.create("R class array remapping", options.isPrintTimes());
    try {
      List<RClassWorkItem> workItems =
          timing.time("Collect R classes", () -> collectRClasses(stores));
      List<ClassResult> classResults =
          timing.time(
              "Remap arrays",
              () ->
                  ThreadUtils.processItemsWithResults(
                      workItems,
                      workItem -> processClass(workItem, mapping),
                      executorService,
                      WorkLoad.LIGHT));
      RClassArrayRemappingResult result = RClassArrayRemappingResult.create(classResults);
      report(result);
      return result;
    } finally {
      timing.end();
      timing.report();
    }
  }

  private List<RClassWorkItem> collectRClasses(List<DexStore> stores) {
    List<RClassWorkItem> workItems = new ArrayList<>();
    for (DexStore store : stores) {
      store.forEachProgramClass(
          clazz -> {
            RClassWorkItem workItem = createWorkItem(clazz);
            if (workItem != null) {
              workItems.add(workItem);
            }
          });
    }
    return workItems;
  }

  private RClassWorkItem createWorkItem(DexProgramClass clazz) {
    if (!options.isRClass(clazz.getType()) || !clazz.hasClassInitializer()) {
      return null;
    }
    DexEncodedMethod classInitializer = clazz.getClassInitializer();
    if (!classInitializer.hasCode() || !allocatesArrays(classInitializer.getCode())) {
      return null;
    }
    RClassRole role = options.getRole(clazz.getType());
    if (role == null) {
      throw reporter.fatalError(
          new UnknownRClassRoleDiagnostic(clazz.getOrigin(), clazz.getType()));
    }
    return new RClassWorkItem(clazz, role);
  }

  private static boolean allocatesArrays(DexCode code) {
    for (DexInstruction instruction : code.getInstructions()) {
      if (instruction.isNewArray()) {
        return true;
      }
    }
    return false;
  }

  private ClassResult processClass(RClassWorkItem workItem, ResourceIdMapping mapping) {
    DexProgramClass clazz = workItem.clazz;
    DexCode code = clazz.getClassInitializer().getCode();
    try {
      RClassInitializerScanner.Result scanResult = RClassInitializerScanner.scan(code);
      ResourceArrayRemapStrategy strategy = workItem.role.getRemapStrategy();
      List<ResourceArrayRewritePlan> plans = new ArrayList<>(scanResult.getGroups().size());
      for (RClassArrayGroup group : scanResult.getGroups()) {
        plans.add(strategy.plan(group, mapping));
      }
      int replacedInstructions = new RClassArrayRewriter(code).rewrite(plans);
      return ClassResult.success(clazz, workItem.role, scanResult, plans, replacedInstructions);
    } catch (CompilationError e) {
      return ClassResult.failure(clazz, workItem.role, e);
    }
  }

  // Diagnostics are reported from the calling thread, in a deterministic order.
  private void report(RClassArrayRemappingResult result) {
    for (ClassResult classResult : result.getClassResults()) {
      if (classResult.isFailed()) {
        continue;
      }
      DexProgramClass clazz = classResult.getHolder();
      IntList unrelatedInstructionIndices = classResult.getUnrelatedInstructionIndices();
      if (!unrelatedInstructionIndices.isEmpty() && !options.isCustomized(clazz.getType())) {
        reporter.info(
            new UnexpectedRClassInitializerInstructionsDiagnostic(
                clazz.getOrigin(),
                classResult.getClassInitializer(),
                unrelatedInstructionIndices.getInt(0),
                unrelatedInstructionIndices.size()));
      }
      for (ResourceArrayRewritePlan plan : classResult.getPlans()) {
        if (plan.hasDuplicateElements()) {
          RClassArrayGroup group = plan.getGroup();
          reporter.info(
              new DuplicateRemappedResourceIdDiagnostic(
                  clazz.getOrigin(),
                  DuplicateRemappedResourceIdDiagnostic.getArrayName(
                      group.getField(), clazz.getTypeName(), group.getNewArrayIndex()),
                  plan.getDuplicateElements()));
        }
      }
      if (options.isVerbose()) {
        reporter.info(new StringDiagnostic(classResult.toString(), clazz.getOrigin()));
      }
    }
    for (ClassResult classResult : result.getFailedClassResults()) {
      reporter.warning(
          new MalformedRClassInitializerDiagnostic(
              classResult.getHolder().getOrigin(),
              classResult.getClassInitializer(),
              classResult.getError()));
    }
    if (options.isVerbose()) {
      reporter.info(result.getStatistics().toString());
    }
  }

  private static class RClassWorkItem {

    private final DexProgramClass clazz;
    private final RClassRole role;

    private RClassWorkItem(DexProgramClass clazz, RClassRole role) {
      this.clazz = clazz;
      this.role = role;
    }
  }
}
