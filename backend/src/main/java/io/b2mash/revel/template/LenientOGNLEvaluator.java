package io.b2mash.revel.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.context.IExpressionContext;
import org.thymeleaf.standard.expression.IStandardVariableExpression;
import org.thymeleaf.standard.expression.IStandardVariableExpressionEvaluator;
import org.thymeleaf.standard.expression.OGNLVariableExpressionEvaluator;
import org.thymeleaf.standard.expression.StandardExpressionExecutionContext;

/** Evaluates OGNL expressions, yielding {@code null} for any expression that cannot resolve. */
public class LenientOGNLEvaluator implements IStandardVariableExpressionEvaluator {

  private static final Logger log = LoggerFactory.getLogger(LenientOGNLEvaluator.class);

  static final LenientOGNLEvaluator INSTANCE = new LenientOGNLEvaluator();

  private final OGNLVariableExpressionEvaluator delegate =
      new OGNLVariableExpressionEvaluator(true);

  @Override
  public Object evaluate(
      IExpressionContext context,
      IStandardVariableExpression expression,
      StandardExpressionExecutionContext expContext) {
    try {
      return delegate.evaluate(context, expression, expContext);
    } catch (Exception e) {
      log.debug(
          "Notification template expression '{}' unresolved: {}",
          expression.getExpression(),
          e.getMessage());
      return null;
    }
  }
}
