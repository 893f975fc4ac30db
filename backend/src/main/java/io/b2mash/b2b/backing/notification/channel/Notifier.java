package io.b2mash.b2b.backing.notification.channel;

import java.util.Map;

/** Outbound delivery channel. Implementations receive a subject and a structured payload only. */
public interface Notifier {

  String channelId();

  void deliver(Recipient recipient, String subject, Map<String, Object> payload);
}
