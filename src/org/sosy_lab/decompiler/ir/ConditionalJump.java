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

/** Two-way transfer: to the true target if the condition holds, to the false target otherwise. */
@Immutable
public final class ConditionalJump implements Statement {

  private final long instructionAddress;
  private final Expression condition;
  private final long trueTarget;
  private final long falseTarget;

  public ConditionalJump(
      long pInstructionAddress, Expression pCondition, long pTrueTarget, long pFalseTarget) {
    instructionAddress = pInstructionAddress;
    condition = checkNotNull(pCondition);
    trueTarget = pTrueTarget;
    falseTarget = pFalseTarget;
  }

  @Override
  public long getInstructionAddress() {
    return instructionAddress;
  }

  public Expression getCondition() {
    return condition;
  }

  public long getTrueTarget() {
    return trueTarget;
  }

  public long getFalseTarget() {
    return falseTarget;
  }

  public ConditionalJump withTrueTarget(long pTarget) {
    return new ConditionalJump(instructionAddress, condition, pTarget, falseTarget);
  }

  public ConditionalJump withFalseTarget(long pTarget) {
    return new ConditionalJump(instructionAddress, condition, trueTarget, pTarget);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof ConditionalJump)) {
      return false;
    }
    ConditionalJump other = (ConditionalJump) pObj;
    return instructionAddress == other.instructionAddress
        && condition.equals(other.condition)
        && trueTarget == other.trueTarget
        && falseTarget == other.falseTarget;
  }

  @Override
  public int hashCode() {
    return Objects.hash(instructionAddress, condition, trueTarget, falseTarget);
  }

  @Override
  public String toString() {
    return "if "
        + condition
        + " goto 0x"
        + Long.toHexString(trueTarget)
        + " else goto 0x"
        + Long.toHexString(falseTarget);
  }
}
