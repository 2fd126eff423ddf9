// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap;

import com.android.tools.resourceremap.androidresources.RClassArrayRemapper;
import com.android.tools.resourceremap.androidresources.RClassArrayRemapperOptions;
import com.android.tools.resourceremap.androidresources.RClassArrayRemappingResult;
import com.android.tools.resourceremap.androidresources.ResourceIdMapping;
import com.android.tools.resourceremap.graph.DexProgramClass;
import com.android.tools.resourceremap.graph.DexStore;
import com.android.tools.resourceremap.utils.Reporter;
import com.android.tools.resourceremap.utils.ThreadUtils;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

public class TestBase {

  public static final String ROOT_STORE_NAME = "classes";

  /** Thread counts that exercise both the serial and the parallel processing. */
  public static List<Object[]> getThreadCountParameters() {
    return ImmutableList.of(new Object[] {1}, new Object[] {4});
  }

  public static DexStore createStore(DexProgramClass... classes) {
    return DexStore.builder(ROOT_STORE_NAME).addDex(Arrays.asList(classes)).build();
  }

  public static RClassArrayRemappingResult runRemapper(
      List<DexStore> stores,
      ResourceIdMapping mapping,
      RClassArrayRemapperOptions options,
      TestDiagnosticMessagesImpl diagnostics,
      int threads)
      throws ExecutionException {
    ExecutorService executorService = ThreadUtils.getExecutorService(threads);
    try {
      return new RClassArrayRemapper(options, new Reporter(diagnostics))
          .run(stores, mapping, executorService);
    } finally {
      executorService.shutdown();
    }
  }

  public static RClassArrayRemapperOptions defaultOptions() {
    return RClassArrayRemapperOptions.builder().addDefaultRoleRules().build();
  }
}
