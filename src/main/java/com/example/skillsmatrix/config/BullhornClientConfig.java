package com.example.skillsmatrix.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.HttpURLConnection;

/**
 * RestTemplate for the Bullhorn OAuth and REST endpoints. Redirects are not followed so the
 * authorization code can be read from the Location header of the authorize response.
 */
@Configuration
public class BullhornClientConfig {

    @Bean
    public RestTemplate bullhornRestTemplate(SkillsMatrixProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        requestFactory.setConnectTimeout(properties.getBullhorn().getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getBullhorn().getReadTimeoutMs());
        return new RestTemplate(requestFactory);
    }
}
