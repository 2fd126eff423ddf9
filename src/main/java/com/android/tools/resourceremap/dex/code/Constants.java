// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

public class Constants {

  public static final int S4BIT_MIN = -8;
  public static final int S4BIT_MAX = 7;
  public static final int U4BIT_MAX = 15;
  public static final int U8BIT_MAX = 255;
  public static final int U16BIT_MAX = 65535;

  public static final int FILL_ARRAY_DATA_PAYLOAD_IDENT = 0x0300;
}
