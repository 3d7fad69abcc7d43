package uk.gegc.codejudge.features.sandbox.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "codejudge.sandbox")
public class SandboxProperties {

    private String baseUrl = "https://ce.judge0.com";

    /**
     * Sent as X-Auth-Token when set.
     */
    private String apiKey;

    private Duration pollInterval = Duration.ofSeconds(1);

    private int maxPolls = 10;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(30);
}
