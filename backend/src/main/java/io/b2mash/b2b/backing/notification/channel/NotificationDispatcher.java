package io.b2mash.b2b.backing.notification.channel;

import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hands a message to every registered {@link Notifier}. A failing channel is logged and does not
 * prevent delivery on the others.
 */
@Component
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<Notifier> notifiers;

  public NotificationDispatcher(List<Notifier> notifiers) {
    this.notifiers = List.copyOf(notifiers);
  }

  /**
   * @return true if at least one channel accepted the message
   */
  public boolean dispatch(Recipient recipient, String subject, Map<String, Object> payload) {
    boolean delivered = false;
    for (var notifier : notifiers) {
      try {
        notifier.deliver(recipient, subject, payload);
        delivered = true;
      } catch (Exception e) {
        log.warn(
            "Failed to deliver '{}' via channel={} to user={}",
            subject,
            notifier.channelId(),
            recipient.userId(),
            e);
      }
    }
    return delivered;
  }
}
