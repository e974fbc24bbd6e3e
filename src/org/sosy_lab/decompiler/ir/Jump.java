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

/** Unconditional transfer to a known address. */
@Immutable
public final class Jump implements Statement {

  private final long instructionAddress;
  private final long target;

  public Jump(long pInstructionAddress, long pTarget) {
    instructionAddress = pInstructionAddress;
    target = pTarget;
  }

  @Override
  public long getInstructionAddress() {
    return instructionAddress;
  }

  public long getTarget() {
    return target;
  }

  public Jump withTarget(long pTarget) {
    return new Jump(instructionAddress, pTarget);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Jump)) {
      return false;
    }
    Jump other = (Jump) pObj;
    return instructionAddress == other.instructionAddress && target == other.target;
  }

  @Override
  public int hashCode() {
    return Objects.hash(instructionAddress, target);
  }

  @Override
  public String toString() {
    return "goto 0x" + Long.toHexString(target);
  }
}
