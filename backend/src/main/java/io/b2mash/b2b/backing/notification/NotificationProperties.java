package io.b2mash.b2b.backing.notification;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "backing.notifications")
public record NotificationProperties(String senderAddress) {

  public NotificationProperties {
    if (senderAddress == null || senderAddress.isBlank()) {
      senderAddress = "no-reply@backing.local";
    }
  }
}
