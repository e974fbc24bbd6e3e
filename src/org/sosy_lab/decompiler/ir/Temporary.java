// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ir;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Temporary value of the lifter. Temporaries are normally eliminated before structuring, so one
 * showing up in a condition is worth a warning.
 */
@Immutable
public final class Temporary implements Expression {

  private final int index;
  private final int bits;

  public Temporary(int pIndex, int pBits) {
    index = pIndex;
    bits = pBits;
  }

  public int getIndex() {
    return index;
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
    if (!(pObj instanceof Temporary)) {
      return false;
    }
    Temporary other = (Temporary) pObj;
    return index == other.index && bits == other.bits;
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, bits);
  }

  @Override
  public String toString() {
    return "t" + index;
  }
}
