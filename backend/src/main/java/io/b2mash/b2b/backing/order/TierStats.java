package io.b2mash.b2b.backing.order;

/** Read-side capacity figures for a tier; {@code availableQuantity} is null when unlimited. */
public record TierStats(long totalOrders, Integer availableQuantity) {}
