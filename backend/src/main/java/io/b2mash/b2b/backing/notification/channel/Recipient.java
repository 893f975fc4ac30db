package io.b2mash.b2b.backing.notification.channel;

import java.util.UUID;

public record Recipient(UUID userId, String email, String name) {}
