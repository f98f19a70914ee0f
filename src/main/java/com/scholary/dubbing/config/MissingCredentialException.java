package com.scholary.dubbing.config;

/**
 * Thrown when a collaborator needs an API token that was neither configured nor exported.
 *
 * <p>Raised lazily, at the first call that needs the token, so a service can start without
 * credentials for collaborators it never uses.
 */
public class MissingCredentialException extends RuntimeException {

  private final String environmentVariable;

  public MissingCredentialException(String propertyName, String environmentVariable) {
    super(
        String.format(
            "You must either set the '%s' property or the '%s' environment variable",
            propertyName, environmentVariable));
    this.environmentVariable = environmentVariable;
  }

  public String getEnvironmentVariable() {
    return environmentVariable;
  }
}
