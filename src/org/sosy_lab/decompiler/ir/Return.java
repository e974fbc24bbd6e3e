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

/** Function return. It has no successor inside a region. */
@Immutable
public final class Return implements Statement {

  private final long instructionAddress;
  private final @Nullable Expression value;

  public Return(long pInstructionAddress, @Nullable Expression pValue) {
    instructionAddress = pInstructionAddress;
    value = pValue;
  }

  @Override
  public long getInstructionAddress() {
    return instructionAddress;
  }

  public @Nullable Expression getValue() {
    return value;
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Return)) {
      return false;
    }
    Return other = (Return) pObj;
    return instructionAddress == other.instructionAddress && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instructionAddress, value);
  }

  @Override
  public String toString() {
    return value == null ? "return" : "return " + value;
  }
}
