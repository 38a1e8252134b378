// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.stackless.compiler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Properties;

/** Build metadata from the filtered {@code build.properties} resource. */
public record VersionInfo(String version, String buildTimestamp, String buildJdk) {
  private static final String UNKNOWN = "unknown";

  static VersionInfo load() {
    var properties = new Properties();
    try (var input = VersionInfo.class.getResourceAsStream("/build.properties")) {
      if (input != null) {
        properties.load(input);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read build.properties", e);
    }
    return new VersionInfo(
        properties.getProperty("stackless.version", UNKNOWN),
        properties.getProperty("build.timestamp", UNKNOWN),
        "%s %s"
            .formatted(
                properties.getProperty("java.vendor", UNKNOWN),
                properties.getProperty("java.version", UNKNOWN)));
  }

  @Override
  public String toString() {
    return "Stackless %s, built %s with %s, running on Java %s"
        .formatted(version, buildTimestamp, buildJdk, System.getProperty("java.version"));
  }
}
