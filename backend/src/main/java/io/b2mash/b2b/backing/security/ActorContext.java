package io.b2mash.b2b.backing.security;

public final class ActorContext {

  private static final ThreadLocal<Actor> CURRENT_ACTOR = new ThreadLocal<>();

  private ActorContext() {}

  public static void setCurrentActor(Actor actor) {
    CURRENT_ACTOR.set(actor);
  }

  /** Returns the current actor, or {@code null} for anonymous requests. */
  public static Actor getCurrentActor() {
    return CURRENT_ACTOR.get();
  }

  public static Actor requireCurrentActor() {
    Actor actor = CURRENT_ACTOR.get();
    if (actor == null) {
      throw new IllegalStateException("No authenticated actor bound to the current request");
    }
    return actor;
  }

  public static void clear() {
    CURRENT_ACTOR.remove();
  }
}
