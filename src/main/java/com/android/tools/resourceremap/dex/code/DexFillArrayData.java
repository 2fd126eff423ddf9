// Copyright (c) 2026, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.resourceremap.dex.code;

import java.util.Arrays;

/**
 * {@code fill-array-data vAA, payload}: fills the array in vAA from an embedded data block.
 *
 * <p>The payload is kept as the raw bytes of the {@code fill-array-data-payload} pseudo
 * instruction, starting with its identifying tag. See {@code FillArrayDataPayloadCodec} for the
 * layout.
 */
public class DexFillArrayData extends DexInstruction {

  public final int AA;
  private final byte[] payload;

  public DexFillArrayData(int register, byte[] payload) {
    this.AA = register;
    this.payload = payload.clone();
  }

  public int getArrayRegister() {
    return AA;
  }

  /** Returns a copy of the raw payload bytes. */
  public byte[] getPayload() {
    return payload.clone();
  }

  public DexFillArrayData withPayload(byte[] newPayload) {
    return new DexFillArrayData(AA, newPayload);
  }

  @Override
  public String getName() {
    return "fill-array-data";
  }

  @Override
  public int getSize() {
    return 3;
  }

  @Override
  public boolean readsRegister(int register) {
    return register == AA;
  }

  @Override
  public boolean isFillArrayData() {
    return true;
  }

  @Override
  public DexFillArrayData asFillArrayData() {
    return this;
  }

  @Override
  protected String operandsToString() {
    return formatRegister(AA) + ", <payload of " + payload.length + " bytes>";
  }

  boolean hasSamePayload(DexFillArrayData other) {
    return Arrays.equals(payload, other.payload);
  }
}
