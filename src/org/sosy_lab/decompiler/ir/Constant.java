// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ir;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

@Immutable
public final class Constant implements Expression {

  public static final Constant TRUE = new Constant(1, 1);
  public static final Constant FALSE = new Constant(0, 1);

  private final long value;
  private final int bits;

  public Constant(long pValue, int pBits) {
    checkArgument(pBits > 0 && pBits <= 64, "unsupported width %s", pBits);
    value = pValue;
    bits = pBits;
  }

  public long getValue() {
    return value;
  }

  @Override
  public int getBits() {
    return bits;
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Constant)) {
      return false;
    }
    Constant other = (Constant) pObj;
    return value == other.value && bits == other.bits;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, bits);
  }

  @Override
  public String toString() {
    if (bits == 1) {
      return value == 0 ? "false" : "true";
    }
    return value >= 0 && value < 10 ? Long.toString(value) : "0x" + Long.toHexString(value);
  }
}
