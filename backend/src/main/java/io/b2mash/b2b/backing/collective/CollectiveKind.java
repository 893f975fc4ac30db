package io.b2mash.b2b.backing.collective;

public enum CollectiveKind {
  PERSON,
  ORGANIZATION,
  COLLECTIVE,
  EVENT
}
