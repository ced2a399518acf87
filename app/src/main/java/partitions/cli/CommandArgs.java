package partitions.cli;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Option table for one command: {@code --name value}, {@code --name=value} and bare flags. */
final class CommandArgs<B> {
  private final Map<String, OptionSpec<B>> specs = new LinkedHashMap<>();

  CommandArgs<B> withValue(String option, BiConsumer<B, String> consumer) {
    specs.put(option, new OptionSpec<>(true, consumer));
    return this;
  }

  CommandArgs<B> flag(String option, Consumer<B> consumer) {
    specs.put(option, new OptionSpec<>(false, (builder, ignored) -> consumer.accept(builder)));
    return this;
  }

  /** Applies {@code args} (command name already removed) to {@code builder}. */
  B parse(String[] args, B builder) {
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec<B> spec = specs.get(parsed.option());
      if (spec == null) {
        throw new UsageException("Unknown option: " + args[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new UsageException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply().accept(builder, value);
    }
    return builder;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new UsageException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec<T>(boolean requiresValue, BiConsumer<T, String> apply) {}
}
