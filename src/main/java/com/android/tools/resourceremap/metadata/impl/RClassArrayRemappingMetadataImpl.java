// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.metadata.impl;

import com.android.tools.resourceremap.androidresources.RClassArrayRemappingResult;
import com.android.tools.resourceremap.androidresources.RClassArrayRemappingResult.Statistics;
import com.android.tools.resourceremap.metadata.RClassArrayRemappingMetadata;
import com.google.common.collect.ImmutableList;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;
import java.util.List;

public class RClassArrayRemappingMetadataImpl implements RClassArrayRemappingMetadata {

  @Expose
  @SerializedName("processedClassCount")
  private final int processedClassCount;

  @Expose
  @SerializedName("rewrittenClassCount")
  private final int rewrittenClassCount;

  @Expose
  @SerializedName("arrayCount")
  private final int arrayCount;

  @Expose
  @SerializedName("keptIdCount")
  private final int keptIdCount;

  @Expose
  @SerializedName("remappedIdCount")
  private final int remappedIdCount;

  @Expose
  @SerializedName("deletedIdCount")
  private final int deletedIdCount;

  @Expose
  @SerializedName("failedClasses")
  private final List<String> failedClasses;

  private RClassArrayRemappingMetadataImpl(
      int processedClassCount,
      int rewrittenClassCount,
      int arrayCount,
      int keptIdCount,
      int remappedIdCount,
      int deletedIdCount,
      List<String> failedClasses) {
    this.processedClassCount = processedClassCount;
    this.rewrittenClassCount = rewrittenClassCount;
    this.arrayCount = arrayCount;
    this.keptIdCount = keptIdCount;
    this.remappedIdCount = remappedIdCount;
    this.deletedIdCount = deletedIdCount;
    this.failedClasses = failedClasses;
  }

  public static RClassArrayRemappingMetadataImpl create(RClassArrayRemappingResult result) {
    Statistics statistics = result.getStatistics();
    List<String> failedClasses =
        result.getFailedClassResults().stream()
            .map(classResult -> classResult.getType().toDescriptorString())
            .collect(ImmutableList.toImmutableList());
    return new RClassArrayRemappingMetadataImpl(
        statistics.getProcessedClasses(),
        statistics.getRewrittenClasses(),
        statistics.getArrays(),
        statistics.getKeptElements(),
        statistics.getRemappedElements(),
        statistics.getDeletedElements(),
        failedClasses);
  }

  @Override
  public int getProcessedClassCount() {
    return processedClassCount;
  }

  @Override
  public int getRewrittenClassCount() {
    return rewrittenClassCount;
  }

  @Override
  public int getArrayCount() {
    return arrayCount;
  }

  @Override
  public int getKeptIdCount() {
    return keptIdCount;
  }

  @Override
  public int getRemappedIdCount() {
    return remappedIdCount;
  }

  @Override
  public int getDeletedIdCount() {
    return deletedIdCount;
  }

  @Override
  public List<String> getFailedClasses() {
    return failedClasses;
  }

  @Override
  public String toJson() {
    return new GsonBuilder().excludeFieldsWithoutExposeAnnotation().create().toJson(this);
  }
}
