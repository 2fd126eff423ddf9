// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.graph;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * A named collection of dex files, each being an ordered list of program classes.
 *
 * <p>The root store of an application is conventionally named {@code classes}; further stores hold
 * the dex files of separately loaded modules.
 */
public class DexStore {

  private final String name;
  private final List<List<DexProgramClass>> dexes;

  private DexStore(String name, List<List<DexProgramClass>> dexes) {
    this.name = name;
    this.dexes = dexes;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public List<List<DexProgramClass>> getDexes() {
    return dexes;
  }

  public void forEachProgramClass(Consumer<DexProgramClass> consumer) {
    for (List<DexProgramClass> dex : dexes) {
      dex.forEach(consumer);
    }
  }

  @Override
  public String toString() {
    return "DexStore(" + name + ", " + dexes.size() + " dex files)";
  }

  public static class Builder {

    private final String name;
    private final List<List<DexProgramClass>> dexes = new ArrayList<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder addDex(List<DexProgramClass> classes) {
      dexes.add(ImmutableList.copyOf(classes));
      return this;
    }

    public DexStore build() {
      return new DexStore(name, ImmutableList.copyOf(dexes));
    }
  }
}
