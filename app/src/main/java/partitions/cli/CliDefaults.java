package partitions.cli;

/**
 * Size guards for what the command line is willing to print. Each resolves from a system
 * property, then an environment variable, then a built-in default.
 */
final class CliDefaults {
  static final String MAX_SET_SIZE_PROPERTY = "partitions.maxSetSize";
  static final String MAX_SET_SIZE_ENV = "PARTITIONS_MAX_SET_SIZE";
  static final String MAX_TREE_SIZE_PROPERTY = "partitions.maxTreeSize";
  static final String MAX_TREE_SIZE_ENV = "PARTITIONS_MAX_TREE_SIZE";
  private static final int DEFAULT_MAX_SET_SIZE = 12;
  private static final int DEFAULT_MAX_TREE_SIZE = 12;

  private CliDefaults() {}

  /** Largest n accepted by {@code enumerate}. */
  static int maxSetSize() {
    return resolve(MAX_SET_SIZE_PROPERTY, MAX_SET_SIZE_ENV, DEFAULT_MAX_SET_SIZE);
  }

  /** Largest n accepted by {@code tree}. */
  static int maxTreeSize() {
    return resolve(MAX_TREE_SIZE_PROPERTY, MAX_TREE_SIZE_ENV, DEFAULT_MAX_TREE_SIZE);
  }

  private static int resolve(String property, String env, int defaultValue) {
    String propertyValue = System.getProperty(property);
    if (propertyValue != null && !propertyValue.isBlank()) {
      return CliParsers.parseInt(propertyValue, defaultValue, property);
    }
    String envValue = System.getenv(env);
    if (envValue != null && !envValue.isBlank()) {
      return CliParsers.parseInt(envValue, defaultValue, env);
    }
    return defaultValue;
  }
}
