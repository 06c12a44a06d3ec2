package com.positionalert.engine.application.config;

import com.positionalert.engine.domain.exceptions.ConfigurationException;
import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
public class PolygonClientConfig {

    @Bean
    public RestClient polygonRestClient(AlertProperties properties) {
        var provider = properties.provider();
        if (!StringUtils.hasText(provider.apiKey())) {
            throw ConfigurationException.missing("alert.provider.api-key (POLYGON_API_KEY)");
        }
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(provider.connectTimeout())
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(provider.readTimeout());
        return RestClient.builder()
                .baseUrl(provider.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
