package io.b2mash.revel.notification.template;

import io.b2mash.revel.notification.NotificationType;
import java.util.Locale;
import java.util.Set;

/** Picks the title by evaluation outcome; unknown outcomes use the generic title. */
public class QuestionnaireEvaluationTemplate extends StandardNotificationTemplate {

  private static final Set<String> OUTCOMES = Set.of("accepted", "rejected", "pending_payment");

  public QuestionnaireEvaluationTemplate(TemplateToolkit toolkit) {
    super(NotificationType.QUESTIONNAIRE_EVALUATION_RESULT, toolkit, "questionnaire_name");
  }

  @Override
  protected String titleKey(RenderContext context) {
    String outcome = context.string("evaluation_status").toLowerCase(Locale.ROOT);
    return OUTCOMES.contains(outcome) ? messageKey("title." + outcome) : messageKey("title");
  }
}
