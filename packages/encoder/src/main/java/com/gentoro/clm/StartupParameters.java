package com.gentoro.clm;

import com.gentoro.clm.exception.ClmErrorCode;
import com.gentoro.clm.exception.ClmException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Command line arguments as {@code --name value} pairs. A name followed by another option, or by
 * nothing, is a boolean flag set to {@code true}.
 */
public class StartupParameters {
  public static final String CONFIG = "config";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ClmException(ClmErrorCode.CONFIGURATION_ERROR, "Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      String value = "true";
      int eq = name.indexOf('=');
      if (eq > 0) {
        value = name.substring(eq + 1);
        name = name.substring(0, eq);
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        value = args[++i];
      }
      parameters.put(name, value);
    }
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  /** Converted value, or null when the parameter was not given. */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) {
      return null;
    }
    Object value;
    if (type == String.class) {
      value = raw;
    } else if (type == Integer.class) {
      if (!NumberUtils.isCreatable(raw)) {
        throw invalid(name, raw, type);
      }
      value = NumberUtils.createInteger(raw);
    } else if (type == Boolean.class) {
      value = BooleanUtils.toBooleanObject(raw);
      if (value == null) throw invalid(name, raw, type);
    } else if (type == Path.class) {
      value = Path.of(raw);
    } else {
      throw new ClmException(
          ClmErrorCode.CONFIGURATION_ERROR, "Unsupported parameter type " + type.getSimpleName());
    }
    return type.cast(value);
  }

  /** The {@code --config} file, or null to use the bundled configuration. */
  public String configFile() {
    return StringUtils.trimToNull(parameters.get(CONFIG));
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }

  private static ClmException invalid(String name, String raw, Class<?> type) {
    return new ClmException(
            ClmErrorCode.CONFIGURATION_ERROR,
            "Parameter --" + name + " expects " + type.getSimpleName() + ", got '" + raw + "'")
        .withContext("parameter", name);
  }
}
