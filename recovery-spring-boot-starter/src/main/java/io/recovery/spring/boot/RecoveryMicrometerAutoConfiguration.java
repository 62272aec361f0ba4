package io.recovery.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.recovery.micrometer.MicrometerMetricsExporter;
import io.recovery.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exports recovery metrics to the application's {@link MeterRegistry}.
 *
 * <p>Active when Micrometer is on the classpath and {@code recovery.metrics.enabled}
 * is true (default). Runs before {@link RecoveryAutoConfiguration} so the exporter
 * is injected into every component.
 */
@AutoConfiguration(
        before = RecoveryAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "recovery.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RecoveryProperties.class)
public class RecoveryMicrometerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(MetricsExporter.class)
    public MicrometerMetricsExporter micrometerMetricsExporter(MeterRegistry meterRegistry,
                                                               RecoveryProperties props) {
        return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
