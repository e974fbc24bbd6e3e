// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

@Immutable
public final class BitvectorConstant extends BitvectorFormula {

  private final long value;
  private final int bits;

  BitvectorConstant(long pValue, int pBits) {
    checkArgument(pBits > 0 && pBits <= 64, "unsupported width %s", pBits);
    value = truncate(pValue, pBits);
    bits = pBits;
  }

  /** The value, truncated to the width of this constant. */
  public long getValue() {
    return value;
  }

  @Override
  public int getBits() {
    return bits;
  }

  static long truncate(long pValue, int pBits) {
    return pBits >= 64 ? pValue : pValue & ((1L << pBits) - 1);
  }

  static long signExtend(long pValue, int pBits) {
    if (pBits >= 64) {
      return pValue;
    }
    int shift = 64 - pBits;
    return (pValue << shift) >> shift;
  }

  @Override
  public <R, X extends Exception> R accept(BitvectorFormulaVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BitvectorConstant)) {
      return false;
    }
    BitvectorConstant other = (BitvectorConstant) pObj;
    return value == other.value && bits == other.bits;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, bits);
  }

  @Override
  public String toString() {
    return Long.toUnsignedString(value);
  }
}
