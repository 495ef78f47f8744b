package io.wfpath.mcp;

import io.wfpath.query.FieldType;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Server configuration. Loads from {@code ~/.wfpath/config.properties} by default; command-line
 * flags override the file.
 *
 * @param env Temporal CLI environment, null for the CLI's default
 * @param cliPath the {@code temporal} binary
 * @param timeoutSeconds per-command timeout
 * @param defaultListLimit list size when a caller gives none
 * @param maxListLimit largest list size a caller may request
 * @param maxPayloadLength decoded payload length limit, in characters
 * @param failureContextSize events kept before the last failure by {@code last_failure_context}
 * @param searchAttributes custom search attributes of the namespace
 * @param port HTTP port of the SSE transport
 * @param stdio whether to serve over stdio instead of HTTP
 */
public record WfPathConfig(
    String env,
    String cliPath,
    int timeoutSeconds,
    int defaultListLimit,
    int maxListLimit,
    int maxPayloadLength,
    int failureContextSize,
    Map<String, FieldType> searchAttributes,
    int port,
    boolean stdio) {

  private static final String SEARCH_ATTRIBUTE_PREFIX = "searchAttribute.";

  public WfPathConfig {
    searchAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(searchAttributes));
    if (timeoutSeconds <= 0) {
      throw new IllegalArgumentException(
          "cli.timeoutSeconds must be positive: " + timeoutSeconds);
    }
    if (defaultListLimit <= 0 || maxListLimit <= 0) {
      throw new IllegalArgumentException("List limits must be positive");
    }
    if (maxPayloadLength <= 0) {
      throw new IllegalArgumentException(
          "history.maxPayloadLength must be positive: " + maxPayloadLength);
    }
    if (failureContextSize < 0) {
      throw new IllegalArgumentException(
          "history.failureContextSize must not be negative: " + failureContextSize);
    }
  }

  /**
   * Default configuration: {@code temporal} on the PATH, its default environment, 60 s timeout.
   *
   * @return default configuration
   */
  public static WfPathConfig defaults() {
    return new WfPathConfig(null, "temporal", 60, 10, 100, 4000, 10, Map.of(), 3000, false);
  }

  /**
   * Loads the configuration file named by {@code --config}, or the default one, then applies the
   * remaining flags.
   *
   * @param args command-line arguments
   * @return the effective configuration
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException for unknown flags or bad values
   */
  public static WfPathConfig fromArgs(String[] args) throws IOException {
    Path file = getConfigPath();
    for (int i = 0; i < args.length - 1; i++) {
      if ("--config".equals(args[i])) {
        file = Path.of(args[i + 1]);
      }
    }
    return load(file).withArgs(args);
  }

  /**
   * Loads configuration from a properties file.
   *
   * @param configPath file to read
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static WfPathConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      return defaults();
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  private static Path getConfigPath() {
    String home = System.getProperty("user.home");
    return Path.of(home, ".wfpath", "config.properties");
  }

  static WfPathConfig fromProperties(Properties props) {
    String env = props.getProperty("env");
    String cliPath = props.getProperty("cli.path", "temporal");
    int timeoutSeconds = intProperty(props, "cli.timeoutSeconds", 60);
    int defaultListLimit = intProperty(props, "list.defaultLimit", 10);
    int maxListLimit = intProperty(props, "list.maxLimit", 100);
    int maxPayloadLength = intProperty(props, "history.maxPayloadLength", 4000);
    int failureContextSize = intProperty(props, "history.failureContextSize", 10);
    int port = intProperty(props, "mcp.port", 3000);

    Map<String, FieldType> searchAttributes = new LinkedHashMap<>();
    for (String key : new TreeSet<>(props.stringPropertyNames())) {
      if (key.startsWith(SEARCH_ATTRIBUTE_PREFIX)) {
        String name = key.substring(SEARCH_ATTRIBUTE_PREFIX.length());
        searchAttributes.put(name, FieldType.fromText(props.getProperty(key)));
      }
    }

    return new WfPathConfig(
        env == null || env.isBlank() ? null : env.trim(),
        cliPath.trim(),
        timeoutSeconds,
        defaultListLimit,
        maxListLimit,
        maxPayloadLength,
        failureContextSize,
        searchAttributes,
        port,
        false);
  }

  /**
   * Applies command-line flags: {@code --env E}, {@code --cli PATH}, {@code --timeout SECONDS},
   * {@code --port N}, {@code --stdio}. {@code --config} is consumed by {@link #fromArgs}.
   */
  public WfPathConfig withArgs(String[] args) {
    String env = this.env;
    String cliPath = this.cliPath;
    int timeoutSeconds = this.timeoutSeconds;
    int port = this.port;
    boolean stdio = this.stdio;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
        case "--stdio" -> stdio = true;
        case "--env" -> env = value(args, ++i, arg);
        case "--cli" -> cliPath = value(args, ++i, arg);
        case "--timeout" -> timeoutSeconds = parseInt(arg, value(args, ++i, arg));
        case "--port" -> port = parseInt(arg, value(args, ++i, arg));
        case "--config" -> value(args, ++i, arg);
        default -> throw new IllegalArgumentException("Unknown option: " + arg);
      }
    }
    return new WfPathConfig(
        env,
        cliPath,
        timeoutSeconds,
        defaultListLimit,
        maxListLimit,
        maxPayloadLength,
        failureContextSize,
        searchAttributes,
        port,
        stdio);
  }

  private static String value(String[] args, int i, String flag) {
    if (i >= args.length) {
      throw new IllegalArgumentException(flag + " requires a value");
    }
    return args[i];
  }

  private static int intProperty(Properties props, String key, int defaultValue) {
    String value = props.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return parseInt(key, value);
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " is not a number: " + value);
    }
  }
}
