// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.truth.Truth.assertThat;
import static org.sosy_lab.decompiler.logic.Formulas.and;
import static org.sosy_lab.decompiler.logic.Formulas.compare;
import static org.sosy_lab.decompiler.logic.Formulas.not;
import static org.sosy_lab.decompiler.logic.Formulas.or;

import org.junit.Test;
import org.sosy_lab.decompiler.logic.BooleanFormula;
import org.sosy_lab.decompiler.logic.ComparisonOperator;
import org.sosy_lab.decompiler.logic.Formulas;

public class ConditionSimplifierTest {

  private static final BooleanFormula ZF = Formulas.makeVariable("cond:zf:1");
  private static final BooleanFormula CF = Formulas.makeVariable("cond:cf:1");

  private static BooleanFormula isZero(String pRegister) {
    return compare(
        ComparisonOperator.EQUAL,
        Formulas.makeBitvectorVariable(pRegister + ":32", 32),
        Formulas.makeBitvector(0, 32));
  }

  private static BooleanFormula isNotZero(String pRegister) {
    return compare(
        ComparisonOperator.NOT_EQUAL,
        Formulas.makeBitvectorVariable(pRegister + ":32", 32),
        Formulas.makeBitvector(0, 32));
  }

  private final ConditionSimplifier simplifier = new ConditionSimplifier(true);

  @Test
  public void shortCircuitDisjunctionOfFlags() {
    assertThat(simplifier.simplify(or(not(ZF), and(ZF, not(CF))))).isEqualTo(not(and(ZF, CF)));
  }

  @Test
  public void shortCircuitDisjunctionOfComparisons() {
    BooleanFormula condition = or(isNotZero("eax"), and(isZero("eax"), not(CF)));

    assertThat(simplifier.simplify(condition)).isEqualTo(not(and(isZero("eax"), CF)));
  }

  @Test
  public void rewriteCanBeDisabled() {
    BooleanFormula condition = or(isNotZero("eax"), and(isZero("eax"), not(CF)));

    assertThat(new ConditionSimplifier(false).simplify(condition)).isEqualTo(condition);
  }

  @Test
  public void furtherDisjunctsAreKept() {
    BooleanFormula condition = or(isNotZero("eax"), and(isZero("eax"), not(CF)), ZF);

    assertThat(simplifier.simplify(condition))
        .isEqualTo(or(not(and(isZero("eax"), CF)), ZF));
  }

  @Test
  public void unrelatedOperandsAreNotRewritten() {
    BooleanFormula condition = or(isNotZero("eax"), and(isZero("ebx"), not(CF)));

    assertThat(simplifier.simplify(condition)).isEqualTo(condition);
  }

  @Test
  public void constantsStayConstants() {
    assertThat(simplifier.simplify(or(ZF, not(ZF)))).isEqualTo(Formulas.makeTrue());
    assertThat(simplifier.simplify(and(ZF, not(ZF)))).isEqualTo(Formulas.makeFalse());
  }
}
