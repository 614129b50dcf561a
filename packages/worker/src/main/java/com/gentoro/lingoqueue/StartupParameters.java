package com.gentoro.lingoqueue;

import com.gentoro.lingoqueue.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line parameters in the {@code --name=value} (or bare {@code --flag}) form.
 *
 * <p>Recognized parameters: {@code --mode=worker|queue-stats|cleanup-active}, {@code
 * --config=<file>} and {@code --requeue} (used by {@code cleanup-active}).
 */
public class StartupParameters {
  public static final String MODE_WORKER = "worker";
  public static final String MODE_QUEUE_STATS = "queue-stats";
  public static final String MODE_CLEANUP_ACTIVE = "cleanup-active";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unsupported argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  /** Returns the parameter converted to the requested type, or {@code null} when absent. */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(raw);
    } else if (type == Boolean.class) {
      return type.cast(Boolean.parseBoolean(raw));
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public String mode() {
    String mode = getParameter("mode", String.class);
    return mode == null || mode.isBlank() ? MODE_WORKER : mode.trim().toLowerCase();
  }

  public boolean isEnabled(String flag) {
    return Boolean.TRUE.equals(getParameter(flag, Boolean.class));
  }

  /** External YAML file layered over the bundled defaults, if one was given. */
  public Path configFile() {
    String value = getParameter("config", String.class);
    if (value == null || value.isBlank()) {
      return null;
    }
    Path path = Path.of(value.trim());
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return path;
  }
}
