// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

import com.android.tools.resourceremap.graph.DexField;

public class DexSput extends DexSgetOrSput {

  public DexSput(int AA, DexField field) {
    super(AA, field);
  }

  @Override
  public String getName() {
    return "sput";
  }

  @Override
  public boolean readsRegister(int register) {
    return register == AA;
  }

  @Override
  public boolean isSput() {
    return true;
  }

  @Override
  public boolean isStaticOrArrayStoreOf(int register) {
    return register == AA;
  }
}
