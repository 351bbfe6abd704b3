package io.b2mash.b2b.isolation.provisioning;

/** Outcome of a subdomain check. {@code reason} is null when the subdomain is available. */
public record SubdomainAvailability(boolean available, String reason) {

  public static SubdomainAvailability ok() {
    return new SubdomainAvailability(true, null);
  }

  public static SubdomainAvailability rejected(String reason) {
    return new SubdomainAvailability(false, reason);
  }
}
