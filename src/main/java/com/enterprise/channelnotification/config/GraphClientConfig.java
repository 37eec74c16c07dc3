package com.enterprise.channelnotification.config;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.enterprise.channelnotification.client.GraphAuthInterceptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Wiring for the Graph REST client and the service clock.
 * 
 * The JDK request factory is used because Graph renewals are PATCH requests.
 */
@Configuration
@Slf4j
public class GraphClientConfig {
    
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    @Bean
    @ConditionalOnMissingBean(TokenCredential.class)
    public TokenCredential graphTokenCredential(GraphSubscriptionProperties properties) {
        GraphSubscriptionProperties.Graph graph = properties.getGraph();
        log.info("Configuring Graph client credential: tenantId={}, clientId={}",
            graph.getTenantId(), graph.getClientId());
        
        return new ClientSecretCredentialBuilder()
            .tenantId(graph.getTenantId())
            .clientId(graph.getClientId())
            .clientSecret(graph.getClientSecret())
            .build();
    }
    
    @Bean
    public RestTemplate graphRestTemplate(
        RestTemplateBuilder builder,
        GraphSubscriptionProperties properties,
        TokenCredential graphTokenCredential
    ) {
        GraphSubscriptionProperties.Graph graph = properties.getGraph();
        
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(graph.getConnectTimeout())
            .build();
        
        return builder
            .rootUri(graph.getEndpoint())
            .requestFactory(() -> {
                JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
                factory.setReadTimeout(graph.getReadTimeout());
                return factory;
            })
            .additionalInterceptors(new GraphAuthInterceptor(graphTokenCredential))
            .build();
    }
}
