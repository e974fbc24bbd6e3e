// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

@Immutable
public final class BitvectorVariable extends BitvectorFormula {

  private final String name;
  private final int bits;

  BitvectorVariable(String pName, int pBits) {
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
  public <R, X extends Exception> R accept(BitvectorFormulaVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BitvectorVariable)) {
      return false;
    }
    BitvectorVariable other = (BitvectorVariable) pObj;
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
