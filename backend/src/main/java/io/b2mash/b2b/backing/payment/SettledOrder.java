package io.b2mash.b2b.backing.payment;

import io.b2mash.b2b.backing.order.Order;
import io.b2mash.b2b.backing.subscription.Subscription;

/** A processed order and, for recurring tiers, its subscription snapshot. */
public record SettledOrder(Order order, Subscription subscription) {}
