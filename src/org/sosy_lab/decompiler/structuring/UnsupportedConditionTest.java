// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.sosy_lab.decompiler.ir.BinaryOperation;
import org.sosy_lab.decompiler.ir.BinaryOperation.BinaryOperator;
import org.sosy_lab.decompiler.ir.Constant;
import org.sosy_lab.decompiler.ir.Expression;
import org.sosy_lab.decompiler.ir.Temporary;
import org.sosy_lab.decompiler.ir.UnaryOperation;
import org.sosy_lab.decompiler.ir.UnaryOperation.UnaryOperator;
import org.sosy_lab.decompiler.logic.Formulas;
import org.sosy_lab.decompiler.region.Block;
import org.sosy_lab.decompiler.region.GraphRegion;

public class UnsupportedConditionTest extends AbstractStructurerTest {

  private ConditionTranslator newTranslator() {
    return new ConditionTranslator(new ConditionVariableMapping(), logger);
  }

  @Test
  public void multiplicationIsRejected() {
    Expression product = new BinaryOperation(BinaryOperator.MULTIPLY, EAX, new Constant(3, 32));
    Expression condition = isZero(product);

    UnsupportedExpressionException e =
        assertThrows(
            UnsupportedExpressionException.class, () -> newTranslator().toFormula(condition));
    assertThat(e.getExpression()).isEqualTo(product);
  }

  @Test
  public void arithmeticNegationIsRejected() {
    Expression negated = new UnaryOperation(UnaryOperator.NEGATE, EAX);

    assertThrows(
        UnsupportedExpressionException.class, () -> newTranslator().toFormula(isZero(negated)));
  }

  @Test
  public void truthValueAsOperandIsRejected() {
    Expression condition =
        new BinaryOperation(BinaryOperator.PLUS, isZero(EAX), new Constant(1, 1));

    assertThrows(
        UnsupportedExpressionException.class, () -> newTranslator().toFormula(isZero(condition)));
  }

  @Test
  public void unknownVariableCannotBeTranslatedBack() {
    assertThrows(
        StructuringException.class,
        () -> newTranslator().toExpression(Formulas.makeVariable("cond:unknown:1")));
  }

  @Test
  public void temporariesAreKept() throws StructuringException {
    ConditionTranslator translator = newTranslator();
    Expression condition = isZero(new Temporary(3, 32));

    assertThat(translator.toExpression(translator.toFormula(condition))).isEqualTo(condition);
    assertThat(translator.getMapping().getExpression("t3:32")).isEqualTo(new Temporary(3, 32));
  }

  @Test
  public void unsupportedBranchConditionAbortsStructuring() throws Exception {
    Expression product = new BinaryOperation(BinaryOperator.MULTIPLY, EAX, new Constant(3, 32));
    Block a = block(0x10, branch(0x10, isZero(product), 0x20, 0x30));
    Block b = block(0x20, assign(0x20, 1), jump(0x24, 0x30));
    Block c = block(0x30, ret(0x30));
    GraphRegion region =
        GraphRegion.builder().addEdge(a, b).addEdge(a, c).addEdge(b, c).build(a);

    assertThrows(UnsupportedExpressionException.class, () -> newStructurer().structure(region));
  }
}
