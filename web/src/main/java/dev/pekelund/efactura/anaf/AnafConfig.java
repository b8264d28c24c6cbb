package dev.pekelund.efactura.anaf;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(AnafProperties.class)
public class AnafConfig {

    @Bean
    @ConditionalOnMissingBean
    public AnafClientFactory anafClientFactory(RestClient.Builder restClientBuilder, AnafProperties properties,
        AccessTokenProvider accessTokenProvider, ObjectMapper objectMapper, Clock clock) {

        RestClient listClient = restClientBuilder.clone()
            .requestFactory(requestFactory(properties.getConnectTimeout(), properties.getListReadTimeout()))
            .build();
        RestClient downloadClient = restClientBuilder.clone()
            .requestFactory(requestFactory(properties.getConnectTimeout(), properties.getDownloadReadTimeout()))
            .build();

        return userId -> new RestAnafClient(listClient, downloadClient, properties, accessTokenProvider, userId,
            objectMapper, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnafTokenClient anafTokenClient(RestClient.Builder restClientBuilder, AnafProperties properties,
        ObjectMapper objectMapper, Clock clock) {
        Duration timeout = properties.getOauth().getTimeout();
        RestClient tokenClient = restClientBuilder.clone()
            .requestFactory(requestFactory(timeout, timeout))
            .build();
        return new AnafTokenClient(tokenClient, properties.getOauth(), objectMapper, clock);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return requestFactory;
    }
}
