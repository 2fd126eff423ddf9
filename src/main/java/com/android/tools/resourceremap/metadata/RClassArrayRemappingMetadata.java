// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.metadata;

import com.android.tools.resourceremap.metadata.impl.RClassArrayRemappingMetadataImpl;
import com.google.gson.GsonBuilder;
import java.util.List;

/** Summary of an R class array remapping run that can be written as JSON. */
public interface RClassArrayRemappingMetadata {

  static RClassArrayRemappingMetadata fromJson(String json) {
    return new GsonBuilder()
        .excludeFieldsWithoutExposeAnnotation()
        .create()
        .fromJson(json, RClassArrayRemappingMetadataImpl.class);
  }

  int getProcessedClassCount();

  int getRewrittenClassCount();

  int getArrayCount();

  int getKeptIdCount();

  int getRemappedIdCount();

  int getDeletedIdCount();

  /**
   * @return the descriptors of the R classes that were left unchanged, in sorted order.
   */
  List<String> getFailedClasses();

  String toJson();
}
