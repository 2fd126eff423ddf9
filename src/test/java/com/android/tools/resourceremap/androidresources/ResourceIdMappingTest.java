// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.androidresources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.android.tools.resourceremap.TestBase;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.Test;

public class ResourceIdMappingTest extends TestBase {

  @Test
  public void testLookup() {
    ResourceIdMapping mapping =
        ResourceIdMapping.builder().map(0x7f010000, 0x7f010010).keep(0x7f020000).build();
    assertEquals(2, mapping.size());
    assertTrue(mapping.contains(0x7f010000));
    assertEquals(0x7f010010, mapping.lookup(0x7f010000));
    assertFalse(mapping.isIdentity(0x7f010000));
    assertTrue(mapping.isIdentity(0x7f020000));
    assertFalse(mapping.contains(0x7f030000));
    assertFalse(mapping.isIdentity(0x7f030000));
  }

  @Test
  public void testEmpty() {
    ResourceIdMapping mapping = ResourceIdMapping.empty();
    assertTrue(mapping.isEmpty());
    assertFalse(mapping.contains(0x7f010000));
  }

  @Test
  public void testOldIdsInUnsignedOrder() {
    Int2IntOpenHashMap oldToNew = new Int2IntOpenHashMap();
    oldToNew.put(0x80010000, 0x80010000);
    oldToNew.put(0x7f020000, 0x7f010000);
    oldToNew.put(0x01010000, 0x01010000);
    ResourceIdMapping mapping = ResourceIdMapping.create(oldToNew);
    IntList oldIds = new IntArrayList();
    mapping.forEachOldId(oldIds::add);
    assertEquals(IntArrayList.wrap(new int[] {0x01010000, 0x7f020000, 0x80010000}), oldIds);
  }

  @Test
  public void testBuilderIsDetached() {
    ResourceIdMapping.Builder builder = ResourceIdMapping.builder().keep(0x7f010000);
    ResourceIdMapping mapping = builder.build();
    builder.keep(0x7f010001);
    assertEquals(1, mapping.size());
    assertFalse(mapping.contains(0x7f010001));
  }
}
