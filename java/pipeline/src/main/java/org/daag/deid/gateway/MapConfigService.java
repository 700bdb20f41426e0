package org.daag.deid.gateway;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * config from explicit values, eg command-line arguments
 */
@Builder
@Value
public class MapConfigService implements ConfigService {

    @Singular
    Map<String, String> values;

    @Override
    public Optional<String> getConfigPropertyAsOptional(ConfigProperty property) {
        return Optional.ofNullable(values.get(property.name()));
    }
}
