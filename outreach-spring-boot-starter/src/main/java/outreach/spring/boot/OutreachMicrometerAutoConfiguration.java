package outreach.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import outreach.micrometer.MicrometerMetricsExporter;
import outreach.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code outreach.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link OutreachAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the Outreach composite.
 */
@AutoConfiguration(before = OutreachAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "outreach.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(OutreachProperties.class)
public class OutreachMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, OutreachProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
