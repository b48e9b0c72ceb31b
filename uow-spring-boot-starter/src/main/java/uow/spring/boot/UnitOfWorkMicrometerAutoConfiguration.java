package uow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import uow.micrometer.MicrometerMetricsExporter;
import uow.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code uow.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link UnitOfWorkAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the unit-of-work factory.
 */
@AutoConfiguration(before = UnitOfWorkAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "uow.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(UnitOfWorkProperties.class)
public class UnitOfWorkMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, UnitOfWorkProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
