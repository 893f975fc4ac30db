package io.b2mash.b2b.backing.activity;

public enum ActivityType {
  /** A membership was created; announced on the collective's {@code admins} channel. */
  COLLECTIVE_MEMBER_CREATED("collective.member.created"),
  /** Tickets were confirmed; sent to the buyer only. */
  TICKET_CONFIRMED("ticket.confirmed");

  private final String value;

  ActivityType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
