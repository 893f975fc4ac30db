package io.b2mash.b2b.backing.user;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Locale;
import java.util.UUID;

public final class SlugGenerator {

  private static final UUID NAMESPACE = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

  private SlugGenerator() {}

  /** Lower-case, dash-separated ascii slug; falls back to {@code fallback} when nothing is left. */
  public static String slugify(String input, String fallback) {
    if (input == null || input.isBlank()) {
      return fallback;
    }
    String ascii =
        Normalizer.normalize(input, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    String slug =
        ascii
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("(^-+)|(-+$)", "");
    return slug.isEmpty() ? fallback : slug;
  }

  /** Base slug for a person: their name if given, otherwise the local part of their email. */
  public static String forPerson(String name, String email) {
    if (name != null && !name.isBlank()) {
      return slugify(name, "user");
    }
    String localPart = email.contains("@") ? email.substring(0, email.indexOf('@')) : email;
    return slugify(localPart, "user");
  }

  /** Stable six character suffix used to disambiguate colliding slugs. */
  public static String suffix(String seed) {
    byte[] input = (NAMESPACE + seed).getBytes(StandardCharsets.UTF_8);
    return UUID.nameUUIDFromBytes(input).toString().replace("-", "").substring(0, 6);
  }
}
