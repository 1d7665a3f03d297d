/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.vehicletrends.vehicles;

import org.vehicletrends.etl.EtlException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads YAML or JSON configuration files into plain maps.
 *
 * <p>YAML is parsed with SnakeYAML so anchors and aliases resolve, then
 * converted through Jackson; JSON goes straight through Jackson. The format
 * is chosen by file extension.
 */
public final class ConfigFiles {

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
  private static final Pattern ENV_VAR_PATTERN =
      Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?\\}");
  private static final TypeReference<Map<String, Object>> MAP_TYPE =
      new TypeReference<Map<String, Object>>() { };

  private ConfigFiles() {
  }

  /**
   * Loads a classpath resource.
   *
   * @throws EtlException if the resource is missing or malformed
   */
  public static Map<String, Object> loadResource(String resourceName) {
    try (InputStream is = ConfigFiles.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new EtlException("Could not find configuration resource " + resourceName);
      }
      return parse(is, resourceName);
    } catch (IOException e) {
      throw new EtlException("Error loading " + resourceName, e);
    }
  }

  /**
   * Loads a file from disk.
   */
  public static Map<String, Object> loadFile(Path path) throws IOException {
    try (InputStream is = Files.newInputStream(path)) {
      return parse(is, path.getFileName().toString());
    }
  }

  /**
   * Parses YAML or JSON, chosen by the extension of {@code name}.
   */
  public static Map<String, Object> parse(InputStream stream, String name) throws IOException {
    Object parsed;
    if (name.endsWith(".yaml") || name.endsWith(".yml")) {
      LoaderOptions loaderOptions = new LoaderOptions();
      loaderOptions.setMaxAliasesForCollections(200);
      parsed = new Yaml(loaderOptions).load(stream);
    } else {
      parsed = JSON_MAPPER.readValue(stream, Object.class);
    }
    if (parsed == null) {
      return Collections.emptyMap();
    }
    if (!(parsed instanceof Map)) {
      throw new IOException("Configuration " + name + " must be a mapping at top level");
    }
    return JSON_MAPPER.convertValue(parsed, MAP_TYPE);
  }

  /**
   * Resolves {@code ${VAR}} and {@code ${VAR:default}} placeholders from the
   * environment, then system properties, then the default.
   *
   * <p>A value that is exactly one placeholder resolves to null when the
   * variable is unset and has no default. Placeholders embedded in longer
   * text are substituted in place; an unresolvable one is left as written.
   */
  public static @Nullable String resolveEnvVar(@Nullable String value) {
    if (value == null || !value.contains("${")) {
      return value;
    }
    Matcher matcher = ENV_VAR_PATTERN.matcher(value);
    if (matcher.matches()) {
      return lookup(matcher.group(1), matcher.group(2));
    }
    matcher.reset();
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String resolved = lookup(matcher.group(1), matcher.group(2));
      matcher.appendReplacement(sb,
          Matcher.quoteReplacement(resolved != null ? resolved : matcher.group()));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  private static @Nullable String lookup(String name, @Nullable String defaultValue) {
    String resolved = System.getenv(name);
    if (resolved == null) {
      resolved = System.getProperty(name);
    }
    return resolved != null ? resolved : defaultValue;
  }
}
