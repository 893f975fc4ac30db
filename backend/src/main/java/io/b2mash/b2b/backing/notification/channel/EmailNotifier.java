package io.b2mash.b2b.backing.notification.channel;

import io.b2mash.b2b.backing.notification.NotificationProperties;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Sends notifications as plain-text mail via {@link JavaMailSender}. Only active when {@code
 * spring.mail.host} is configured. The body lists the payload; templating is left to the mail
 * relay.
 */
@Component
@ConditionalOnProperty(name = "spring.mail.host")
public class EmailNotifier implements Notifier {

  private static final Logger log = LoggerFactory.getLogger(EmailNotifier.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public EmailNotifier(JavaMailSender mailSender, NotificationProperties properties) {
    this.mailSender = mailSender;
    this.senderAddress = properties.senderAddress();
  }

  @Override
  public String channelId() {
    return "email";
  }

  @Override
  public void deliver(Recipient recipient, String subject, Map<String, Object> payload) {
    if (recipient.email() == null) {
      log.debug("User {} has no email address, skipping", recipient.userId());
      return;
    }
    var message = new SimpleMailMessage();
    message.setFrom(senderAddress);
    message.setTo(recipient.email());
    message.setSubject(subject);
    message.setText(renderBody(payload));
    mailSender.send(message);
    log.debug("Sent '{}' to {}", subject, recipient.email());
  }

  static String renderBody(Map<String, Object> payload) {
    var body = new StringBuilder();
    appendEntries(body, payload, "");
    return body.toString();
  }

  private static void appendEntries(StringBuilder body, Map<?, ?> values, String indent) {
    for (var entry : values.entrySet()) {
      if (entry.getValue() instanceof Map<?, ?> nested) {
        body.append(indent).append(entry.getKey()).append(":\n");
        appendEntries(body, nested, indent + "  ");
      } else {
        body.append(indent)
            .append(entry.getKey())
            .append(": ")
            .append(entry.getValue())
            .append('\n');
      }
    }
  }
}
