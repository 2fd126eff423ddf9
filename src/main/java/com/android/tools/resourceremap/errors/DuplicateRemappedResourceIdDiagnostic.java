// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.errors;

import com.android.tools.resourceremap.Diagnostic;
import com.android.tools.resourceremap.androidresources.ResourceId;
import com.android.tools.resourceremap.graph.DexField;
import com.android.tools.resourceremap.origin.Origin;
import com.android.tools.resourceremap.position.Position;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import java.util.stream.Collectors;

/**
 * Reported when several ids of one array of the umbrella R class are mapped to the same new id.
 * All occurrences are kept.
 */
public class DuplicateRemappedResourceIdDiagnostic implements Diagnostic {

  private final Origin origin;
  private final String arrayName;
  private final IntSortedSet duplicateIds;

  public DuplicateRemappedResourceIdDiagnostic(
      Origin origin, String arrayName, IntSortedSet duplicateIds) {
    this.origin = origin;
    this.arrayName = arrayName;
    this.duplicateIds = duplicateIds;
  }

  public static String getArrayName(DexField field, String holderName, int newArrayIndex) {
    return field != null ? field.toSourceString() : holderName + "@" + newArrayIndex;
  }

  public IntSortedSet getDuplicateIds() {
    return duplicateIds;
  }

  @Override
  public Origin getOrigin() {
    return origin;
  }

  @Override
  public Position getPosition() {
    return Position.UNKNOWN;
  }

  @Override
  public String getDiagnosticMessage() {
    return "Resource array "
        + arrayName
        + " contains duplicated ids after remapping: "
        + duplicateIds
            .intStream()
            .mapToObj(ResourceId::toHexString)
            .collect(Collectors.joining(", "));
  }
}
