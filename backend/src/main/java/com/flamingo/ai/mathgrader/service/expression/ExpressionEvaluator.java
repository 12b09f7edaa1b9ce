package com.flamingo.ai.mathgrader.service.expression;

import com.flamingo.ai.mathgrader.exception.EvaluationException;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Evaluates an expression tree numerically for given symbol values. */
@Component
public class ExpressionEvaluator {

  /**
   * Evaluates {@code expr}.
   *
   * @param values value of every symbol that may occur
   * @return the value; real when the imaginary part is exactly zero
   * @throws EvaluationException on unbound symbols, declared functions, division by zero or a
   *     non-finite result
   */
  public Complex evaluate(Expr expr, Map<String, Complex> values) {
    Complex result = eval(expr, values);
    if (!result.isFinite()) {
      throw new EvaluationException("Expression '" + expr + "' does not evaluate to a finite number");
    }
    return result;
  }

  private Complex eval(Expr expr, Map<String, Complex> values) {
    if (expr instanceof Num num) {
      return Complex.real(num.value().doubleValue());
    }
    if (expr instanceof Constant constant) {
      return constant.value();
    }
    if (expr instanceof Sym sym) {
      Complex value = values.get(sym.name());
      if (value == null) {
        throw new EvaluationException("No value for symbol '" + sym.name() + "'");
      }
      return value;
    }
    if (expr instanceof Add add) {
      Complex sum = Complex.ZERO;
      for (Expr term : add.terms()) {
        sum = sum.plus(eval(term, values));
      }
      return sum;
    }
    if (expr instanceof Mul mul) {
      Complex product = Complex.ONE;
      for (Expr factor : mul.factors()) {
        product = product.times(eval(factor, values));
      }
      return product;
    }
    if (expr instanceof Pow pow) {
      return eval(pow.base(), values).pow(eval(pow.exponent(), values));
    }
    if (expr instanceof Call call) {
      if (call.builtin() == null) {
        throw new EvaluationException(
            "Cannot evaluate undefined function '" + call.function() + "' numerically");
      }
      return call.builtin().apply(eval(call.args().get(0), values));
    }
    if (expr instanceof Dagger dagger) {
      return eval(dagger.operand(), values).conjugate();
    }
    throw new EvaluationException("Unsupported expression node " + expr.getClass().getSimpleName());
  }
}
