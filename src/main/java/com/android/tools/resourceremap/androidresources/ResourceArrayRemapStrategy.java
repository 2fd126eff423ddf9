// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

/**
 * Computes the new content of one R class array under a resource id mapping.
 *
 * <p>Implementations are stateless, so one instance is shared by all threads.
 */
public interface ResourceArrayRemapStrategy {

  ResourceArrayRewritePlan plan(RClassArrayGroup group, ResourceIdMapping mapping);
}
