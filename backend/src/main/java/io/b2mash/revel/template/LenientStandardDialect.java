package io.b2mash.revel.template;

import org.thymeleaf.standard.StandardDialect;
import org.thymeleaf.standard.expression.IStandardVariableExpressionEvaluator;

/**
 * Standard (OGNL) dialect with lenient variable evaluation, so a template referencing an optional
 * context key renders instead of failing. OGNL resolves {@code map.key} on the plain maps that
 * notification contexts are stored as.
 */
public class LenientStandardDialect extends StandardDialect {

  @Override
  public IStandardVariableExpressionEvaluator getVariableExpressionEvaluator() {
    return LenientOGNLEvaluator.INSTANCE;
  }
}
