package org.daag.deid.gateway;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * config from several sources; first source that has a value for a property wins
 */
@Builder
@Value
public class CompositeConfigService implements ConfigService {

    @NonNull
    @Singular
    List<ConfigService> sources;

    @Override
    public Optional<String> getConfigPropertyAsOptional(ConfigProperty property) {
        return sources.stream()
            .map(source -> source.getConfigPropertyAsOptional(property))
            .filter(Optional::isPresent)
            .map(Optional::get)
            .findFirst();
    }
}
