// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;

/**
 * Factory and basic queries for formulas of the condition algebra. The factory methods do not
 * simplify, use {@link FormulaSimplifier} for that.
 */
public final class Formulas {

  private Formulas() {}

  public static BooleanFormula makeTrue() {
    return BooleanConstant.TRUE;
  }

  public static BooleanFormula makeFalse() {
    return BooleanConstant.FALSE;
  }

  public static BooleanFormula makeBoolean(boolean pValue) {
    return BooleanConstant.of(pValue);
  }

  public static boolean isTrue(BooleanFormula pFormula) {
    return pFormula == BooleanConstant.TRUE;
  }

  public static boolean isFalse(BooleanFormula pFormula) {
    return pFormula == BooleanConstant.FALSE;
  }

  public static BooleanVariable makeVariable(String pName) {
    return new BooleanVariable(pName);
  }

  public static BooleanFormula not(BooleanFormula pOperand) {
    return new NotFormula(pOperand);
  }

  public static BooleanFormula and(BooleanFormula... pOperands) {
    return and(Arrays.asList(pOperands));
  }

  /** Conjunction of the operands; TRUE if there are none, the operand itself if there is one. */
  public static BooleanFormula and(Iterable<? extends BooleanFormula> pOperands) {
    ImmutableList<BooleanFormula> operands = ImmutableList.copyOf(pOperands);
    switch (operands.size()) {
      case 0:
        return makeTrue();
      case 1:
        return operands.get(0);
      default:
        return new AndFormula(operands);
    }
  }

  public static BooleanFormula or(BooleanFormula... pOperands) {
    return or(Arrays.asList(pOperands));
  }

  /** Disjunction of the operands; FALSE if there are none, the operand itself if there is one. */
  public static BooleanFormula or(Iterable<? extends BooleanFormula> pOperands) {
    ImmutableList<BooleanFormula> operands = ImmutableList.copyOf(pOperands);
    switch (operands.size()) {
      case 0:
        return makeFalse();
      case 1:
        return operands.get(0);
      default:
        return new OrFormula(operands);
    }
  }

  public static BooleanFormula compare(
      ComparisonOperator pOperator, BitvectorFormula pLeft, BitvectorFormula pRight) {
    return new ComparisonFormula(pOperator, pLeft, pRight);
  }

  public static BitvectorFormula makeBitvector(long pValue, int pBits) {
    return new BitvectorConstant(pValue, pBits);
  }

  public static BitvectorVariable makeBitvectorVariable(String pName, int pBits) {
    return new BitvectorVariable(pName, pBits);
  }

  public static BitvectorFormula makeOperation(
      BitvectorOperator pOperator, BitvectorFormula pLeft, BitvectorFormula pRight) {
    return new BitvectorOperation(pOperator, pLeft, pRight);
  }

  /** Names of all boolean and bit-vector variables occurring in the formula. */
  public static ImmutableSet<String> extractVariableNames(BooleanFormula pFormula) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    pFormula.accept(new VariableCollector(names));
    return names.build();
  }

  private static final class VariableCollector
      implements FormulaVisitor<Void, RuntimeException>,
          BitvectorFormulaVisitor<Void, RuntimeException> {

    private final ImmutableSet.Builder<String> names;

    private VariableCollector(ImmutableSet.Builder<String> pNames) {
      names = pNames;
    }

    @Override
    public Void visit(BooleanConstant pConstant) {
      return null;
    }

    @Override
    public Void visit(BooleanVariable pVariable) {
      names.add(pVariable.getName());
      return null;
    }

    @Override
    public Void visit(NotFormula pNot) {
      return pNot.getOperand().accept(this);
    }

    @Override
    public Void visit(AndFormula pAnd) {
      pAnd.getOperands().forEach(op -> op.accept(this));
      return null;
    }

    @Override
    public Void visit(OrFormula pOr) {
      pOr.getOperands().forEach(op -> op.accept(this));
      return null;
    }

    @Override
    public Void visit(ComparisonFormula pComparison) {
      pComparison.getLeft().accept(this);
      pComparison.getRight().accept(this);
      return null;
    }

    @Override
    public Void visit(BitvectorConstant pConstant) {
      return null;
    }

    @Override
    public Void visit(BitvectorVariable pVariable) {
      names.add(pVariable.getName());
      return null;
    }

    @Override
    public Void visit(BitvectorOperation pOperation) {
      pOperation.getLeft().accept(this);
      pOperation.getRight().accept(this);
      return null;
    }
  }
}
