package eu.virtualparadox.spansampler.application.config;

import eu.virtualparadox.spansampler.sampling.SamplingParameters;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Default sampling parameters, bound from {@code sampler.*} properties.
 */
@Configuration
@ConfigurationProperties(prefix = "sampler")
@Getter @Setter
public class SamplerConfig {

    private int minBytesLength = 8;
    private int maxBytesLength = 1024;
    private int numSamples = 1;
    private boolean sampleWithReplacement = false;
    private double temperature = 0.8;

    public SamplingParameters toParameters() {
        return new SamplingParameters(minBytesLength, maxBytesLength, numSamples, sampleWithReplacement, temperature);
    }
}
