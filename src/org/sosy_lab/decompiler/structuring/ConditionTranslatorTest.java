// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.truth.Truth.assertThat;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.ir.BinaryOperation;
import org.sosy_lab.decompiler.ir.BinaryOperation.BinaryOperator;
import org.sosy_lab.decompiler.ir.Constant;
import org.sosy_lab.decompiler.ir.Convert;
import org.sosy_lab.decompiler.ir.Expression;
import org.sosy_lab.decompiler.ir.Load;
import org.sosy_lab.decompiler.ir.Register;
import org.sosy_lab.decompiler.ir.Temporary;
import org.sosy_lab.decompiler.ir.UnaryOperation;
import org.sosy_lab.decompiler.logic.BooleanFormula;

@RunWith(Parameterized.class)
@SuppressFBWarnings(
    value = "NP_NONNULL_FIELD_NOT_INITIALIZED_IN_CONSTRUCTOR",
    justification = "Fields are filled by parameterization of JUnit")
public class ConditionTranslatorTest {

  private static final Register EAX = new Register("eax", 32);
  private static final Register ZF = new Register("zf", 1);
  private static final Register CF = new Register("cf", 1);

  private static Expression binary(BinaryOperator pOperator, Expression pLeft, Expression pRight) {
    return new BinaryOperation(pOperator, pLeft, pRight);
  }

  private static Constant constant(long pValue) {
    return new Constant(pValue, 32);
  }

  @Parameters(name = "{0}")
  public static Object[][] conditions() {
    return new Object[][] {
      {"flag", ZF, "cond:zf:1"},
      {"equality", binary(BinaryOperator.EQUALS, EAX, constant(0)), "(eax:32 == 0)"},
      {
        "negated equality",
        UnaryOperation.not(binary(BinaryOperator.EQUALS, EAX, constant(0))),
        "!(eax:32 == 0)"
      },
      {"conjunction", binary(BinaryOperator.LOGICAL_AND, ZF, CF), "(cond:zf:1 && cond:cf:1)"},
      {
        "disjunction with comparison",
        binary(BinaryOperator.LOGICAL_OR, ZF, binary(BinaryOperator.LESS_THAN, EAX, constant(5))),
        "(cond:zf:1 || (eax:32 <s 5))"
      },
      {
        "unsigned comparison with arithmetic and memory",
        binary(
            BinaryOperator.UNSIGNED_LESS_THAN,
            binary(BinaryOperator.PLUS, EAX, constant(4)),
            new Load(EAX, 32)),
        "((eax:32 + 4) <u *(eax):32)"
      },
      {
        "shift in comparison",
        binary(
            BinaryOperator.NOT_EQUALS,
            binary(BinaryOperator.SHIFT_RIGHT, EAX, constant(8)),
            constant(0)),
        "((eax:32 >> 8) != 0)"
      },
      {
        "subtraction",
        binary(BinaryOperator.EQUALS, binary(BinaryOperator.MINUS, EAX, constant(1)), constant(0)),
        "((eax:32 - 1) == 0)"
      },
      {
        "exclusive or",
        binary(
            BinaryOperator.NOT_EQUALS,
            binary(BinaryOperator.BINARY_XOR, EAX, constant(255)),
            constant(0)),
        "((eax:32 ^ 255) != 0)"
      },
      {
        "signed less or equal",
        binary(BinaryOperator.LESS_EQUAL, EAX, constant(7)),
        "(eax:32 <=s 7)"
      },
      {"signed greater", binary(BinaryOperator.GREATER_THAN, EAX, constant(7)), "(eax:32 >s 7)"},
      {
        "signed greater or equal",
        binary(BinaryOperator.GREATER_EQUAL, EAX, constant(7)),
        "(eax:32 >=s 7)"
      },
      {
        "unsigned less or equal",
        binary(BinaryOperator.UNSIGNED_LESS_EQUAL, EAX, constant(7)),
        "(eax:32 <=u 7)"
      },
      {
        "unsigned greater",
        binary(BinaryOperator.UNSIGNED_GREATER_THAN, EAX, constant(7)),
        "(eax:32 >u 7)"
      },
      {
        "unsigned greater or equal",
        binary(BinaryOperator.UNSIGNED_GREATER_EQUAL, EAX, constant(7)),
        "(eax:32 >=u 7)"
      },
      {"conversion to truth value", new Convert(32, 1, EAX), "cond:Conv(32->1, eax):1"},
      {
        "narrowing conversion in comparison",
        binary(BinaryOperator.EQUALS, new Convert(32, 8, EAX), new Constant(0, 8)),
        "(Conv(32->8, eax):8 == 0)"
      },
      {
        "temporary in comparison",
        binary(BinaryOperator.UNSIGNED_LESS_THAN, new Temporary(2, 32), EAX),
        "(t2:32 <u eax:32)"
      },
      {
        "masked value as truth value",
        binary(BinaryOperator.BINARY_AND, EAX, constant(1)),
        "cond:(eax & 1):32"
      },
    };
  }

  @Parameter(0)
  public String name;

  @Parameter(1)
  public Expression expression;

  @Parameter(2)
  public String formula;

  @Test
  public void translatesIntoFormula() throws StructuringException {
    ConditionTranslator translator =
        new ConditionTranslator(new ConditionVariableMapping(), LogManager.createTestLogManager());

    assertThat(translator.toFormula(expression).toString()).isEqualTo(formula);
  }

  @Test
  public void translatesBackIntoSameExpression() throws StructuringException {
    ConditionTranslator translator =
        new ConditionTranslator(new ConditionVariableMapping(), LogManager.createTestLogManager());

    BooleanFormula translated = translator.toFormula(expression);
    assertThat(translator.toExpression(translated)).isEqualTo(expression);
  }
}
