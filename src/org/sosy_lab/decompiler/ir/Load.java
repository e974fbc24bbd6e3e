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

/** Memory read of {@link #getBits()} bits at an address. */
@Immutable
public final class Load implements Expression {

  private final Expression address;
  private final int bits;

  public Load(Expression pAddress, int pBits) {
    address = checkNotNull(pAddress);
    bits = pBits;
  }

  public Expression getAddress() {
    return address;
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
    if (!(pObj instanceof Load)) {
      return false;
    }
    Load other = (Load) pObj;
    return address.equals(other.address) && bits == other.bits;
  }

  @Override
  public int hashCode() {
    return Objects.hash(address, bits);
  }

  @Override
  public String toString() {
    return "*(" + address + ")";
  }
}
