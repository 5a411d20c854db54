package eu.virtualparadox.spansampler;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Entry point for Spring applications embedding the span sampler.
 * Registers all sampling components and binds the {@code sampler.*} defaults.
 */
@Configuration
@ComponentScan(basePackageClasses = SpanSamplerConfiguration.class)
@EnableConfigurationProperties
public class SpanSamplerConfiguration {
}
