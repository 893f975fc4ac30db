package io.b2mash.b2b.backing.order;

import io.b2mash.b2b.backing.collective.Tier;

/**
 * Outcome of a successful capacity check. {@code remaining} is the capacity left once this
 * reservation's order is inserted, or {@code null} for unlimited tiers.
 */
public record Reservation(Tier tier, int quantity, Integer remaining) {}
