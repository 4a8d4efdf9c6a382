package ai.floedb.metr.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.util.Map;
import java.util.Objects;

/**
 * Loads metr config mappings outside of a container.
 *
 * <p>Values come from system properties, environment variables and {@code
 * META-INF/microprofile-config.properties}; explicit overrides win over all of them. Keys under
 * {@code metr.} that belong to other modules' mappings are ignored.
 */
public final class MetrConfigs {
  static final int OVERRIDE_ORDINAL = 500;

  private MetrConfigs() {}

  public static <T> T load(Class<T> mapping) {
    return load(mapping, Map.of());
  }

  public static <T> T load(Class<T> mapping, Map<String, String> overrides) {
    Objects.requireNonNull(mapping, "mapping");
    Objects.requireNonNull(overrides, "overrides");
    SmallRyeConfig config =
        new SmallRyeConfigBuilder()
            .addDefaultSources()
            .withSources(new PropertiesConfigSource(overrides, "metr-overrides", OVERRIDE_ORDINAL))
            .withMapping(mapping)
            .withValidateUnknown(false)
            .build();
    return config.getConfigMapping(mapping);
  }
}
