package org.daag.deid;

import dagger.BindsInstance;
import dagger.Component;
import org.daag.deid.gateway.ConfigService;
import org.daag.deid.pipeline.CleanerPipeline;
import org.daag.deid.pipeline.JoinPipeline;

import javax.inject.Singleton;

@Singleton
@Component(modules = {
    DeidModule.class,
})
public interface DeidComponent {

    JoinPipeline joinPipeline();

    CleanerPipeline cleanerPipeline();

    @Component.Builder
    interface Builder {

        @BindsInstance
        Builder configService(ConfigService configService);

        DeidComponent build();
    }
}
