package io.b2mash.b2b.backing.notification.channel;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/** Fallback used when no SMTP configuration is present. Logs messages instead of sending them. */
@Component
@ConditionalOnMissingBean(EmailNotifier.class)
public class LoggingNotifier implements Notifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

  @Override
  public String channelId() {
    return "log";
  }

  @Override
  public void deliver(Recipient recipient, String subject, Map<String, Object> payload) {
    log.info(
        "Notification for user {} <{}>: '{}' ({} payload keys)",
        recipient.userId(),
        recipient.email(),
        subject,
        payload.size());
  }
}
