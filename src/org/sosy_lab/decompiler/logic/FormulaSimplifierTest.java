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

public class FormulaSimplifierTest {

  private static final BooleanFormula A = Formulas.makeVariable("a");
  private static final BooleanFormula B = Formulas.makeVariable("b");
  private static final BooleanFormula C = Formulas.makeVariable("c");
  private static final BitvectorFormula X = Formulas.makeBitvectorVariable("x", 32);

  private static BitvectorFormula bv(long pValue) {
    return Formulas.makeBitvector(pValue, 32);
  }

  @Test
  public void doubleNegation() {
    assertThat(FormulaSimplifier.simplify(Formulas.not(Formulas.not(A)))).isEqualTo(A);
  }

  @Test
  public void negatedComparisonFlipsOperator() {
    BooleanFormula equal = Formulas.compare(ComparisonOperator.EQUAL, X, bv(0));
    assertThat(FormulaSimplifier.simplify(Formulas.not(equal)))
        .isEqualTo(Formulas.compare(ComparisonOperator.NOT_EQUAL, X, bv(0)));
  }

  @Test
  public void constantsMoveToTheRight() {
    BooleanFormula less = Formulas.compare(ComparisonOperator.SIGNED_LESS_THAN, bv(5), X);
    assertThat(FormulaSimplifier.simplify(less))
        .isEqualTo(Formulas.compare(ComparisonOperator.SIGNED_GREATER_THAN, X, bv(5)));
  }

  @Test
  public void constantComparisonsAreEvaluated() {
    assertThat(
            FormulaSimplifier.simplify(
                Formulas.compare(ComparisonOperator.SIGNED_LESS_THAN, bv(-1), bv(0))))
        .isEqualTo(Formulas.makeTrue());
    assertThat(
            FormulaSimplifier.simplify(
                Formulas.compare(ComparisonOperator.UNSIGNED_LESS_THAN, bv(-1), bv(0))))
        .isEqualTo(Formulas.makeFalse());
    assertThat(FormulaSimplifier.simplify(Formulas.compare(ComparisonOperator.EQUAL, X, X)))
        .isEqualTo(Formulas.makeTrue());
  }

  @Test
  public void complementaryOperands() {
    assertThat(FormulaSimplifier.simplify(Formulas.or(A, Formulas.not(A))))
        .isEqualTo(Formulas.makeTrue());
    assertThat(FormulaSimplifier.simplify(Formulas.and(A, B, Formulas.not(A))))
        .isEqualTo(Formulas.makeFalse());
  }

  @Test
  public void nestedConnectivesAreFlattened() {
    BooleanFormula nested = Formulas.and(A, Formulas.and(B, Formulas.and(C, A)));
    assertThat(FormulaSimplifier.simplify(nested)).isEqualTo(Formulas.and(A, B, C));
  }

  @Test
  public void trueConjunctsVanish() {
    assertThat(FormulaSimplifier.simplify(Formulas.and(Formulas.makeTrue(), A))).isEqualTo(A);
    assertThat(FormulaSimplifier.simplify(Formulas.or(Formulas.makeFalse(), A))).isEqualTo(A);
  }

  @Test
  public void absorption() {
    assertThat(FormulaSimplifier.simplify(Formulas.or(A, Formulas.and(A, B)))).isEqualTo(A);
    assertThat(FormulaSimplifier.simplify(Formulas.and(A, Formulas.or(A, B)))).isEqualTo(A);
  }

  @Test
  public void commonConjunctsAreFactoredOut() {
    BooleanFormula formula = Formulas.or(Formulas.and(A, B), Formulas.and(A, C));
    assertThat(FormulaSimplifier.simplify(formula)).isEqualTo(Formulas.and(A, Formulas.or(B, C)));
  }

  @Test
  public void factoringCanResolveToTheCommonPart() {
    BooleanFormula formula = Formulas.or(Formulas.and(A, B), Formulas.and(A, Formulas.not(B)));
    assertThat(FormulaSimplifier.simplify(formula)).isEqualTo(A);
  }

  private static BitvectorFormula simplify(
      BitvectorOperator pOperator, BitvectorFormula pLeft, BitvectorFormula pRight) {
    return FormulaSimplifier.simplify(Formulas.makeOperation(pOperator, pLeft, pRight));
  }

  @Test
  public void bitvectorArithmetic() {
    assertThat(simplify(BitvectorOperator.ADD, bv(2), bv(3))).isEqualTo(bv(5));
    assertThat(simplify(BitvectorOperator.ADD, X, bv(0))).isEqualTo(X);
    assertThat(simplify(BitvectorOperator.AND, X, bv(0))).isEqualTo(bv(0));
    assertThat(simplify(BitvectorOperator.SUBTRACT, bv(0), bv(1))).isEqualTo(bv(0xFFFFFFFFL));
  }
}
