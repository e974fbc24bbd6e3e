// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.ir.BinaryOperation;
import org.sosy_lab.decompiler.ir.BinaryOperation.BinaryOperator;
import org.sosy_lab.decompiler.ir.Constant;
import org.sosy_lab.decompiler.ir.Expression;
import org.sosy_lab.decompiler.ir.Register;
import org.sosy_lab.decompiler.ir.Temporary;

public class ConditionVariableMappingTest {

  private final ConditionVariableMapping mapping = new ConditionVariableMapping();
  private final ConditionTranslator translator =
      new ConditionTranslator(mapping, LogManager.createTestLogManager());

  private static Expression isZero(Expression pExpression) {
    return new BinaryOperation(
        BinaryOperator.EQUALS, pExpression, new Constant(0, pExpression.getBits()));
  }

  @Test
  public void sameExpressionGetsSameVariable() {
    Register eax = new Register("eax", 32);

    assertThat(mapping.bitvectorVariableFor(eax))
        .isEqualTo(mapping.bitvectorVariableFor(new Register("eax", 32)));
    assertThat(mapping.size()).isEqualTo(1);
  }

  @Test
  public void registerAndTemporaryWithSameRenderingAreDistinct() throws StructuringException {
    Expression register = isZero(new Register("t1", 32));
    Expression temporary = isZero(new Temporary(1, 32));

    assertThat(translator.toFormula(register).toString()).isEqualTo("(t1:32 == 0)");
    assertThat(translator.toFormula(temporary).toString()).isEqualTo("(t1:32#1 == 0)");

    assertThat(translator.toExpression(translator.toFormula(temporary))).isEqualTo(temporary);
    assertThat(translator.toExpression(translator.toFormula(register))).isEqualTo(register);
    assertThat(mapping.getExpression("t1:32")).isEqualTo(new Register("t1", 32));
    assertThat(mapping.getExpression("t1:32#1")).isEqualTo(new Temporary(1, 32));
  }

  @Test
  public void truthValueAndBitvectorOfSameExpressionAreDistinct() {
    Register flag = new Register("zf", 1);

    assertThat(mapping.booleanVariableFor(flag).getName()).isEqualTo("cond:zf:1");
    assertThat(mapping.bitvectorVariableFor(flag).getName()).isEqualTo("zf:1");
    assertThat(mapping.getExpression("cond:zf:1")).isEqualTo(flag);
    assertThat(mapping.getExpression("zf:1")).isEqualTo(flag);
  }

  @Test
  public void unknownVariable() {
    assertThat(mapping.getExpression("eax:32")).isNull();
  }
}
