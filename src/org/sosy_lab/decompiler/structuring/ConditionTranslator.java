// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.ir.BinaryOperation;
import org.sosy_lab.decompiler.ir.BinaryOperation.BinaryOperator;
import org.sosy_lab.decompiler.ir.Constant;
import org.sosy_lab.decompiler.ir.Convert;
import org.sosy_lab.decompiler.ir.Expression;
import org.sosy_lab.decompiler.ir.ExpressionVisitor;
import org.sosy_lab.decompiler.ir.Guard;
import org.sosy_lab.decompiler.ir.Load;
import org.sosy_lab.decompiler.ir.Register;
import org.sosy_lab.decompiler.ir.Temporary;
import org.sosy_lab.decompiler.ir.UnaryOperation;
import org.sosy_lab.decompiler.ir.UnaryOperation.UnaryOperator;
import org.sosy_lab.decompiler.logic.AndFormula;
import org.sosy_lab.decompiler.logic.BitvectorConstant;
import org.sosy_lab.decompiler.logic.BitvectorFormula;
import org.sosy_lab.decompiler.logic.BitvectorFormulaVisitor;
import org.sosy_lab.decompiler.logic.BitvectorOperation;
import org.sosy_lab.decompiler.logic.BitvectorOperator;
import org.sosy_lab.decompiler.logic.BitvectorVariable;
import org.sosy_lab.decompiler.logic.BooleanConstant;
import org.sosy_lab.decompiler.logic.BooleanFormula;
import org.sosy_lab.decompiler.logic.BooleanVariable;
import org.sosy_lab.decompiler.logic.ComparisonFormula;
import org.sosy_lab.decompiler.logic.ComparisonOperator;
import org.sosy_lab.decompiler.logic.FormulaVisitor;
import org.sosy_lab.decompiler.logic.Formulas;
import org.sosy_lab.decompiler.logic.NotFormula;
import org.sosy_lab.decompiler.logic.OrFormula;

/**
 * Translates branch conditions between native expressions and the condition algebra.
 *
 * <p>Leaves (registers, memory loads, temporaries and conversions) and arithmetic in boolean
 * position become opaque variables, which are recorded in a {@link ConditionVariableMapping} so
 * that the reverse translation can restore them.
 */
final class ConditionTranslator {

  private final ConditionVariableMapping mapping;
  private final LogManager logger;

  private final BooleanTranslation booleanTranslation = new BooleanTranslation();
  private final TermTranslation termTranslation = new TermTranslation();
  private final ExpressionTranslation expressionTranslation = new ExpressionTranslation();

  ConditionTranslator(ConditionVariableMapping pMapping, LogManager pLogger) {
    mapping = checkNotNull(pMapping);
    logger = checkNotNull(pLogger);
  }

  ConditionVariableMapping getMapping() {
    return mapping;
  }

  BooleanFormula toFormula(Expression pExpression) throws StructuringException {
    return pExpression.accept(booleanTranslation);
  }

  BooleanFormula toFormula(Guard pGuard) throws StructuringException {
    if (pGuard instanceof BooleanFormula) {
      return (BooleanFormula) pGuard;
    }
    return toFormula((Expression) pGuard);
  }

  BitvectorFormula toTerm(Expression pExpression) throws StructuringException {
    return pExpression.accept(termTranslation);
  }

  Expression toExpression(BooleanFormula pFormula) throws StructuringException {
    return pFormula.accept(expressionTranslation);
  }

  Expression toExpression(Guard pGuard) throws StructuringException {
    if (pGuard instanceof Expression) {
      return (Expression) pGuard;
    }
    return toExpression((BooleanFormula) pGuard);
  }

  /** Translates an operand where it is used, as a truth value if it is one bit wide. */
  private void checkTranslatable(Expression pExpression) throws StructuringException {
    if (pExpression.getBits() == 1) {
      toFormula(pExpression);
    } else {
      toTerm(pExpression);
    }
  }

  private void warnAboutTemporary(Temporary pTemporary) {
    logger.log(
        Level.WARNING,
        "Left-over temporary",
        pTemporary,
        "in a branch condition, it is kept as an opaque value");
  }

  private static ComparisonOperator toComparisonOperator(BinaryOperation pOperation)
      throws UnsupportedExpressionException {
    switch (pOperation.getOperator()) {
      case EQUALS:
        return ComparisonOperator.EQUAL;
      case NOT_EQUALS:
        return ComparisonOperator.NOT_EQUAL;
      case LESS_THAN:
        return ComparisonOperator.SIGNED_LESS_THAN;
      case LESS_EQUAL:
        return ComparisonOperator.SIGNED_LESS_EQUAL;
      case GREATER_THAN:
        return ComparisonOperator.SIGNED_GREATER_THAN;
      case GREATER_EQUAL:
        return ComparisonOperator.SIGNED_GREATER_EQUAL;
      case UNSIGNED_LESS_THAN:
        return ComparisonOperator.UNSIGNED_LESS_THAN;
      case UNSIGNED_LESS_EQUAL:
        return ComparisonOperator.UNSIGNED_LESS_EQUAL;
      case UNSIGNED_GREATER_THAN:
        return ComparisonOperator.UNSIGNED_GREATER_THAN;
      case UNSIGNED_GREATER_EQUAL:
        return ComparisonOperator.UNSIGNED_GREATER_EQUAL;
      default:
        throw new UnsupportedExpressionException("Not a comparison", pOperation);
    }
  }

  private static BinaryOperator toBinaryOperator(ComparisonOperator pOperator) {
    switch (pOperator) {
      case EQUAL:
        return BinaryOperator.EQUALS;
      case NOT_EQUAL:
        return BinaryOperator.NOT_EQUALS;
      case SIGNED_LESS_THAN:
        return BinaryOperator.LESS_THAN;
      case SIGNED_LESS_EQUAL:
        return BinaryOperator.LESS_EQUAL;
      case SIGNED_GREATER_THAN:
        return BinaryOperator.GREATER_THAN;
      case SIGNED_GREATER_EQUAL:
        return BinaryOperator.GREATER_EQUAL;
      case UNSIGNED_LESS_THAN:
        return BinaryOperator.UNSIGNED_LESS_THAN;
      case UNSIGNED_LESS_EQUAL:
        return BinaryOperator.UNSIGNED_LESS_EQUAL;
      case UNSIGNED_GREATER_THAN:
        return BinaryOperator.UNSIGNED_GREATER_THAN;
      case UNSIGNED_GREATER_EQUAL:
        return BinaryOperator.UNSIGNED_GREATER_EQUAL;
      default:
        throw new AssertionError("unhandled comparison " + pOperator);
    }
  }

  private static BitvectorOperator toBitvectorOperator(BinaryOperation pOperation)
      throws UnsupportedExpressionException {
    switch (pOperation.getOperator()) {
      case PLUS:
        return BitvectorOperator.ADD;
      case MINUS:
        return BitvectorOperator.SUBTRACT;
      case BINARY_XOR:
        return BitvectorOperator.XOR;
      case BINARY_AND:
        return BitvectorOperator.AND;
      case SHIFT_RIGHT:
        return BitvectorOperator.LOGICAL_SHIFT_RIGHT;
      default:
        throw new UnsupportedExpressionException(
            "Unsupported operator " + pOperation.getOperator() + " in branch condition",
            pOperation);
    }
  }

  private static BinaryOperator toBinaryOperator(BitvectorOperator pOperator) {
    switch (pOperator) {
      case ADD:
        return BinaryOperator.PLUS;
      case SUBTRACT:
        return BinaryOperator.MINUS;
      case XOR:
        return BinaryOperator.BINARY_XOR;
      case AND:
        return BinaryOperator.BINARY_AND;
      case LOGICAL_SHIFT_RIGHT:
        return BinaryOperator.SHIFT_RIGHT;
      default:
        throw new AssertionError("unhandled bit-vector operator " + pOperator);
    }
  }

  /** Native expression in boolean position to formula. */
  private final class BooleanTranslation
      implements ExpressionVisitor<BooleanFormula, StructuringException> {

    @Override
    public BooleanFormula visit(Constant pConstant) {
      return Formulas.makeBoolean(pConstant.getValue() != 0);
    }

    @Override
    public BooleanFormula visit(Register pRegister) {
      return mapping.booleanVariableFor(pRegister);
    }

    @Override
    public BooleanFormula visit(Load pLoad) {
      return mapping.booleanVariableFor(pLoad);
    }

    @Override
    public BooleanFormula visit(Temporary pTemporary) {
      warnAboutTemporary(pTemporary);
      return mapping.booleanVariableFor(pTemporary);
    }

    @Override
    public BooleanFormula visit(Convert pConvert) throws StructuringException {
      checkTranslatable(pConvert.getOperand());
      return mapping.booleanVariableFor(pConvert);
    }

    @Override
    public BooleanFormula visit(UnaryOperation pOperation) throws StructuringException {
      if (pOperation.getOperator() == UnaryOperator.LOGICAL_NOT) {
        return Formulas.not(pOperation.getOperand().accept(this));
      }
      throw new UnsupportedExpressionException(
          "Unsupported operator " + pOperation.getOperator() + " in branch condition", pOperation);
    }

    @Override
    public BooleanFormula visit(BinaryOperation pOperation) throws StructuringException {
      switch (pOperation.getOperator()) {
        case LOGICAL_AND:
          return Formulas.and(
              pOperation.getOperand1().accept(this), pOperation.getOperand2().accept(this));
        case LOGICAL_OR:
          return Formulas.or(
              pOperation.getOperand1().accept(this), pOperation.getOperand2().accept(this));
        default:
          if (pOperation.getOperator().hasBooleanResult()) {
            return Formulas.compare(
                toComparisonOperator(pOperation),
                toTerm(pOperation.getOperand1()),
                toTerm(pOperation.getOperand2()));
          }
          // arithmetic used as truth value
          toTerm(pOperation);
          return mapping.booleanVariableFor(pOperation);
      }
    }
  }

  /** Native expression in bit-vector position to term. */
  private final class TermTranslation
      implements ExpressionVisitor<BitvectorFormula, StructuringException> {

    @Override
    public BitvectorFormula visit(Constant pConstant) {
      return Formulas.makeBitvector(pConstant.getValue(), pConstant.getBits());
    }

    @Override
    public BitvectorFormula visit(Register pRegister) {
      return mapping.bitvectorVariableFor(pRegister);
    }

    @Override
    public BitvectorFormula visit(Load pLoad) {
      return mapping.bitvectorVariableFor(pLoad);
    }

    @Override
    public BitvectorFormula visit(Temporary pTemporary) {
      warnAboutTemporary(pTemporary);
      return mapping.bitvectorVariableFor(pTemporary);
    }

    @Override
    public BitvectorFormula visit(Convert pConvert) throws StructuringException {
      checkTranslatable(pConvert.getOperand());
      return mapping.bitvectorVariableFor(pConvert);
    }

    @Override
    public BitvectorFormula visit(UnaryOperation pOperation) throws StructuringException {
      throw new UnsupportedExpressionException(
          "Unsupported operator " + pOperation.getOperator() + " in branch condition", pOperation);
    }

    @Override
    public BitvectorFormula visit(BinaryOperation pOperation) throws StructuringException {
      if (pOperation.getOperator().hasBooleanResult()) {
        throw new UnsupportedExpressionException(
            "Truth value used as bit-vector in branch condition", pOperation);
      }
      return Formulas.makeOperation(
          toBitvectorOperator(pOperation),
          pOperation.getOperand1().accept(this),
          pOperation.getOperand2().accept(this));
    }
  }

  /** Formula back to native expression. */
  private final class ExpressionTranslation
      implements FormulaVisitor<Expression, StructuringException>,
          BitvectorFormulaVisitor<Expression, StructuringException> {

    private Expression lookup(String pName) throws StructuringException {
      Expression expression = mapping.getExpression(pName);
      if (expression == null) {
        throw new StructuringException("Condition variable " + pName + " has no native expression");
      }
      return expression;
    }

    private Expression fold(BinaryOperator pOperator, List<BooleanFormula> pOperands)
        throws StructuringException {
      Expression result = pOperands.get(0).accept(this);
      for (BooleanFormula operand : pOperands.subList(1, pOperands.size())) {
        result = new BinaryOperation(pOperator, result, operand.accept(this));
      }
      return result;
    }

    @Override
    public Expression visit(BooleanConstant pConstant) {
      return pConstant.getValue() ? Constant.TRUE : Constant.FALSE;
    }

    @Override
    public Expression visit(BooleanVariable pVariable) throws StructuringException {
      return lookup(pVariable.getName());
    }

    @Override
    public Expression visit(NotFormula pNot) throws StructuringException {
      return UnaryOperation.not(pNot.getOperand().accept(this));
    }

    @Override
    public Expression visit(AndFormula pAnd) throws StructuringException {
      return fold(BinaryOperator.LOGICAL_AND, pAnd.getOperands());
    }

    @Override
    public Expression visit(OrFormula pOr) throws StructuringException {
      return fold(BinaryOperator.LOGICAL_OR, pOr.getOperands());
    }

    @Override
    public Expression visit(ComparisonFormula pComparison) throws StructuringException {
      return new BinaryOperation(
          toBinaryOperator(pComparison.getOperator()),
          pComparison.getLeft().accept(this),
          pComparison.getRight().accept(this));
    }

    @Override
    public Expression visit(BitvectorConstant pConstant) {
      return new Constant(pConstant.getValue(), pConstant.getBits());
    }

    @Override
    public Expression visit(BitvectorVariable pVariable) throws StructuringException {
      return lookup(pVariable.getName());
    }

    @Override
    public Expression visit(BitvectorOperation pOperation) throws StructuringException {
      return new BinaryOperation(
          toBinaryOperator(pOperation.getOperator()),
          pOperation.getLeft().accept(this),
          pOperation.getRight().accept(this));
    }
  }
}
