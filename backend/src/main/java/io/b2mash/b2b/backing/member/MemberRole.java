package io.b2mash.b2b.backing.member;

public enum MemberRole {
  HOST,
  ADMIN,
  BACKER,
  ATTENDEE,
  FOLLOWER
}
