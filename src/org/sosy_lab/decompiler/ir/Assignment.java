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

@Immutable
public final class Assignment implements Statement {

  private final long instructionAddress;
  private final Expression target;
  private final Expression value;

  public Assignment(long pInstructionAddress, Expression pTarget, Expression pValue) {
    instructionAddress = pInstructionAddress;
    target = checkNotNull(pTarget);
    value = checkNotNull(pValue);
  }

  @Override
  public long getInstructionAddress() {
    return instructionAddress;
  }

  public Expression getTarget() {
    return target;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Assignment)) {
      return false;
    }
    Assignment other = (Assignment) pObj;
    return instructionAddress == other.instructionAddress
        && target.equals(other.target)
        && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instructionAddress, target, value);
  }

  @Override
  public String toString() {
    return target + " = " + value;
  }
}
