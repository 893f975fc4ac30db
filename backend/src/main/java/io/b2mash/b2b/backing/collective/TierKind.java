package io.b2mash.b2b.backing.collective;

public enum TierKind {
  TICKET,
  TIER
}
