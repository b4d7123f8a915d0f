package io.ledgerbridge.auth;

import io.ledgerbridge.UnauthorizedException;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * The set of principals allowed to change bridge configuration.
 *
 * <p>Wards can add ({@link #rely}) and remove ({@link #deny}) other wards. The set is seeded
 * at construction; a bridge with no wards can never be reconfigured.
 *
 * <h2>Thread Safety</h2>
 * <p>Safe for concurrent use.
 */
public final class Wards {
  private static final Logger logger = Logger.getLogger(Wards.class.getName());

  private final Set<String> wards = ConcurrentHashMap.newKeySet();

  public Wards(Collection<String> initial) {
    Objects.requireNonNull(initial, "initial");
    for (String ward : initial) {
      wards.add(requireName(ward));
    }
  }

  public static Wards of(String... initial) {
    return new Wards(Set.of(initial));
  }

  public boolean isWard(String principal) {
    return principal != null && wards.contains(principal);
  }

  /**
   * @throws UnauthorizedException if {@code principal} is not a ward
   */
  public void requireWard(String principal) {
    if (!isWard(principal)) {
      throw new UnauthorizedException("Not a ward: " + principal);
    }
  }

  public void rely(String caller, String principal) {
    requireWard(caller);
    wards.add(requireName(principal));
    logger.info("Ward " + principal + " added by " + caller);
  }

  public void deny(String caller, String principal) {
    requireWard(caller);
    if (wards.remove(principal)) {
      logger.info("Ward " + principal + " removed by " + caller);
    }
  }

  private static String requireName(String principal) {
    Objects.requireNonNull(principal, "principal");
    if (principal.isBlank()) {
      throw new IllegalArgumentException("ward name cannot be blank");
    }
    return principal;
  }
}
