package com.gentoro.claimgraph;

import com.gentoro.claimgraph.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command-line arguments of {@link ClaimGraphApp}, given as {@code --name value} pairs. */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("stream", "graph", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "stream");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new ValidationException("Invalid mode: " + mode);
    }
    String configFile = parameters.get("config-file");
    if (configFile == null || configFile.isBlank()) {
      throw new ValidationException("Missing config file location");
    }
    if (!"help".equals(mode)) {
      String worldview = parameters.get("worldview");
      if (worldview == null || worldview.isBlank()) {
        throw new ValidationException("Missing --worldview");
      }
    }
  }

  public String mode() {
    return parameters.get("mode");
  }

  public String configFile() {
    return parameters.get("config-file");
  }

  public String worldview() {
    return parameters.get("worldview");
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }
}
