// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;

public class SatisfiabilityCheckerTest {

  private static final BooleanFormula A = Formulas.makeVariable("a");
  private static final BooleanFormula B = Formulas.makeVariable("b");
  private static final BitvectorFormula X = Formulas.makeBitvectorVariable("x", 32);
  private static final BitvectorFormula Y = Formulas.makeBitvectorVariable("y", 32);

  private static BooleanFormula compare(
      ComparisonOperator pOperator, BitvectorFormula pLeft, BitvectorFormula pRight) {
    return Formulas.compare(pOperator, pLeft, pRight);
  }

  @Test
  public void propositionalFormulas() {
    assertThat(SatisfiabilityChecker.isSatisfiable(Formulas.and(A, Formulas.not(B)))).isTrue();
    assertThat(
            SatisfiabilityChecker.isUnsatisfiable(
                Formulas.and(Formulas.or(A, B), Formulas.not(A), Formulas.not(B))))
        .isTrue();
  }

  @Test
  public void equivalenceUpToReordering() {
    assertThat(SatisfiabilityChecker.isEquivalent(Formulas.and(A, B), Formulas.and(B, A)))
        .isTrue();
    assertThat(
            SatisfiabilityChecker.isEquivalent(
                Formulas.not(Formulas.and(A, B)), Formulas.or(Formulas.not(A), Formulas.not(B))))
        .isTrue();
    assertThat(SatisfiabilityChecker.isEquivalent(A, B)).isFalse();
  }

  @Test
  public void complementaryComparisons() {
    BooleanFormula less = compare(ComparisonOperator.SIGNED_LESS_THAN, X, Y);
    BooleanFormula greaterEqual = compare(ComparisonOperator.SIGNED_GREATER_EQUAL, X, Y);
    BooleanFormula lessEqualSwapped = compare(ComparisonOperator.SIGNED_LESS_EQUAL, Y, X);
    assertThat(SatisfiabilityChecker.isComplement(less, greaterEqual)).isTrue();
    assertThat(SatisfiabilityChecker.isComplement(less, lessEqualSwapped)).isTrue();
    assertThat(
            SatisfiabilityChecker.isComplement(
                less, compare(ComparisonOperator.UNSIGNED_GREATER_EQUAL, X, Y)))
        .isFalse();
  }

  @Test
  public void equalityIsSymmetric() {
    assertThat(
            SatisfiabilityChecker.isEquivalent(
                compare(ComparisonOperator.EQUAL, X, Y), compare(ComparisonOperator.EQUAL, Y, X)))
        .isTrue();
    assertThat(
            SatisfiabilityChecker.isComplement(
                compare(ComparisonOperator.EQUAL, X, Y),
                compare(ComparisonOperator.NOT_EQUAL, Y, X)))
        .isTrue();
  }

  @Test
  public void constantsAreNotComplements() {
    assertThat(SatisfiabilityChecker.isComplement(Formulas.makeTrue(), Formulas.makeTrue()))
        .isFalse();
    assertThat(SatisfiabilityChecker.isComplement(Formulas.makeTrue(), Formulas.makeFalse()))
        .isTrue();
  }
}
