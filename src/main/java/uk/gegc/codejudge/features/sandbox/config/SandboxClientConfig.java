package uk.gegc.codejudge.features.sandbox.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
@Slf4j
public class SandboxClientConfig {

    public static final String AUTH_HEADER = "X-Auth-Token";

    @Bean
    public RestClient sandboxRestClient(RestClient.Builder builder, SandboxProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.getReadTimeout().toMillis());

        RestClient.Builder configured = builder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(properties.getApiKey())) {
            configured = configured.defaultHeader(AUTH_HEADER, properties.getApiKey());
        }

        log.info("Sandbox client configured - Base URL: {}, Poll interval: {}, Max polls: {}",
                properties.getBaseUrl(), properties.getPollInterval(), properties.getMaxPolls());
        return configured.build();
    }
}
