package org.daag.deid;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dagger.Module;
import dagger.Provides;
import org.daag.deid.core.pseudonyms.HashidsPseudonymCodec;
import org.daag.deid.core.pseudonyms.PseudonymCodec;
import org.daag.deid.gateway.ConfigService;
import org.daag.deid.gateway.ProcessingConfigProperty;

import javax.inject.Singleton;

@Module
public class DeidModule {

    @Provides
    @Singleton
    public CsvMapper csvMapper() {
        return CsvMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            // exports carry columns we don't use
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            // blank amount/quantity/id is malformed, not zero
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .build();
    }

    @Provides
    @Singleton
    public PseudonymCodec pseudonymCodec(ConfigService config) {
        return HashidsPseudonymCodec.of(config.getConfigPropertyOrError(ProcessingConfigProperty.PSEUDONYMIZATION_SALT));
    }
}
