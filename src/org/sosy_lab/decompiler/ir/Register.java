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

/** A machine register, identified by its name and the width it is accessed with. */
@Immutable
public final class Register implements Expression {

  private final String name;
  private final int bits;

  public Register(String pName, int pBits) {
    name = checkNotNull(pName);
    bits = pBits;
  }

  public String getName() {
    return name;
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
    if (!(pObj instanceof Register)) {
      return false;
    }
    Register other = (Register) pObj;
    return name.equals(other.name) && bits == other.bits;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, bits);
  }

  @Override
  public String toString() {
    return name;
  }
}
