package com.lumis.invoiceingest.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.HttpURLConnection;

/**
 * HTTP client used to retrieve invoice confirmation pages from the DGI portal.
 * <p>
 * Redirects are not followed by the connection: the fetcher walks them itself so it can
 * report the final URL, which is where the portal puts the CUFE in some flows.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate invoicePortalRestTemplate(RestTemplateBuilder builder, AppProperties properties) {
        AppProperties.Fetch fetch = properties.getFetch();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        requestFactory.setConnectTimeout((int) fetch.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) fetch.getReadTimeout().toMillis());

        return builder
                .requestFactory(() -> requestFactory)
                .build();
    }
}
