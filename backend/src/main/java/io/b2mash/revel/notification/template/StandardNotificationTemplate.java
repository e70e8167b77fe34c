package io.b2mash.revel.notification.template;

import io.b2mash.revel.notification.NotificationType;
import java.util.List;

/** Template whose title arguments are plain context values, looked up by key. */
public class StandardNotificationTemplate extends AbstractNotificationTemplate {

  private final List<String> titleArgumentKeys;

  public StandardNotificationTemplate(
      NotificationType type, TemplateToolkit toolkit, String... titleArgumentKeys) {
    super(type, toolkit);
    this.titleArgumentKeys = List.of(titleArgumentKeys);
  }

  @Override
  protected Object[] titleArguments(RenderContext context) {
    return titleArgumentKeys.stream().map(context::string).toArray();
  }
}
