package com.scholary.dubbing.config;

import java.util.function.UnaryOperator;

/** Resolves API tokens: the configured value wins, the environment variable is the fallback. */
public final class Credentials {

  private Credentials() {}

  public static String require(String configured, String propertyName, String environmentVariable) {
    return require(configured, propertyName, environmentVariable, System::getenv);
  }

  static String require(
      String configured,
      String propertyName,
      String environmentVariable,
      UnaryOperator<String> environment) {
    if (configured != null && !configured.isBlank()) {
      return configured;
    }
    String fromEnvironment = environment.apply(environmentVariable);
    if (fromEnvironment != null && !fromEnvironment.isBlank()) {
      return fromEnvironment;
    }
    throw new MissingCredentialException(propertyName, environmentVariable);
  }
}
