package ai.docindexer.env;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

@FunctionalInterface
public interface EnvironmentLookupProvider {

  @Nullable
  String getValue(@Nonnull String key);

  /** First non-blank value among the given keys, in order. */
  @Nullable
  default String getFirstValue(@Nonnull String... keys) {
    for (String key : keys) {
      String value = getValue(key);
      if (value != null && !value.trim().isEmpty()) {
        return value;
      }
    }
    return null;
  }

  class System implements EnvironmentLookupProvider {
    @Nullable @Override
    public String getValue(@Nonnull String key) {
      return java.lang.System.getenv(key);
    }
  }
}
