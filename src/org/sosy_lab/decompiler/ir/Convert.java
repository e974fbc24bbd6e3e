// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Width conversion of an operand. A conversion to one bit yields a boolean. */
@Immutable
public final class Convert implements Expression {

  private final int fromBits;
  private final int toBits;
  private final Expression operand;

  public Convert(int pFromBits, int pToBits, Expression pOperand) {
    fromBits = pFromBits;
    toBits = pToBits;
    operand = checkNotNull(pOperand);
  }

  public int getFromBits() {
    return fromBits;
  }

  public int getToBits() {
    return toBits;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public int getBits() {
    return toBits;
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
    if (!(pObj instanceof Convert)) {
      return false;
    }
    Convert other = (Convert) pObj;
    return fromBits == other.fromBits && toBits == other.toBits && operand.equals(other.operand);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromBits, toBits, operand);
  }

  @Override
  public String toString() {
    return "Conv(" + fromBits + "->" + toBits + ", " + operand + ")";
  }
}
