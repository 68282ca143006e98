package com.example.skillsmatrix.bullhorn;

import com.example.skillsmatrix.config.SkillsMatrixProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * Three-step Bullhorn login: authorization code, OAuth access token, REST session.
 */
@Slf4j
@Component
public class BullhornAuthenticator {

    private final RestTemplate restTemplate;
    private final SkillsMatrixProperties.Bullhorn settings;
    private final Clock clock;

    private String refreshToken;
    private Instant refreshTokenExpiry;

    @Autowired
    public BullhornAuthenticator(@Qualifier("bullhornRestTemplate") RestTemplate restTemplate,
                                 SkillsMatrixProperties properties) {
        this(restTemplate, properties.getBullhorn(), Clock.systemUTC());
    }

    BullhornAuthenticator(RestTemplate restTemplate, SkillsMatrixProperties.Bullhorn settings, Clock clock) {
        this.restTemplate = restTemplate;
        this.settings = settings;
        this.clock = clock;
    }

    public synchronized BullhornSession authenticate() {
        String authCode = attainAuthCode();
        String accessToken = requestAccessToken(authCode);
        return login(accessToken);
    }

    String attainAuthCode() {
        URI uri = endpoint("auth-url", settings.getAuthUrl(), "/authorize")
                .queryParam("client_id", settings.getClientId())
                .queryParam("response_type", "code")
                .queryParam("username", settings.getUsername())
                .queryParam("password", settings.getPassword())
                .queryParam("action", "Login")
                .encode()
                .build()
                .toUri();
        try {
            ResponseEntity<String> response = restTemplate.exchange(RequestEntity.get(uri).build(), String.class);
            URI location = response.getHeaders().getLocation();
            String code = location == null ? null
                    : UriComponentsBuilder.fromUri(location).build().getQueryParams().getFirst("code");
            if (code == null || code.isBlank()) {
                log.error("Authorization response carried no code (status {})", response.getStatusCode());
                throw new BullhornException("Authorization code not found in authorize response");
            }
            log.info("Successfully retrieved authorization code.");
            return URLDecoder.decode(code, StandardCharsets.UTF_8);
        } catch (RestClientException e) {
            log.error("Error while requesting the authorization code: {}", e.getMessage());
            throw new BullhornException("Authorization code request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Exchanges an authorization code, or the refresh token held from a previous exchange
     * when {@code authCode} is null, for an access token.
     */
    String requestAccessToken(String authCode) {
        UriComponentsBuilder builder = endpoint("auth-url", settings.getAuthUrl(), "/token")
                .queryParam("client_id", settings.getClientId())
                .queryParam("client_secret", settings.getClientSecret());
        if (authCode != null && !authCode.isBlank()) {
            builder.queryParam("code", authCode).queryParam("grant_type", "authorization_code");
        } else if (refreshToken != null) {
            builder.queryParam("refresh_token", refreshToken).queryParam("grant_type", "refresh_token");
        } else {
            throw new BullhornException("Either an authorization code or a refresh token is required");
        }

        try {
            JsonNode body = restTemplate.postForObject(builder.encode().build().toUri(), null, JsonNode.class);
            if (body == null || body.path("access_token").asText("").isEmpty()) {
                throw new BullhornException("Token response carried no access_token");
            }
            refreshToken = body.path("refresh_token").asText(null);
            if (body.hasNonNull("expires_in")) {
                refreshTokenExpiry = clock.instant().plusSeconds(body.get("expires_in").asLong());
            }
            log.info("Successfully retrieved the access token.");
            return body.get("access_token").asText();
        } catch (RestClientException e) {
            log.error("Error getting access token: {}", e.getMessage());
            throw new BullhornException("Access token request failed: " + e.getMessage(), e);
        }
    }

    public synchronized BullhornSession refresh() {
        if (refreshToken == null || isRefreshTokenExpired()) {
            return authenticate();
        }
        return login(requestAccessToken(null));
    }

    BullhornSession login(String accessToken) {
        URI uri = endpoint("rest-url", settings.getRestUrl(), "/login")
                .queryParam("version", "*")
                .queryParam("access_token", accessToken)
                .encode()
                .build()
                .toUri();
        try {
            JsonNode body = restTemplate.postForObject(uri, null, JsonNode.class);
            String token = body == null ? "" : body.path("BhRestToken").asText("");
            String restUrl = body == null ? "" : body.path("restUrl").asText("");
            if (token.isEmpty() || restUrl.isEmpty()) {
                throw new BullhornException("REST login response is missing BhRestToken or restUrl");
            }
            log.info("Successfully logged into REST API.");
            return new BullhornSession(token, restUrl);
        } catch (RestClientException e) {
            log.error("REST login failed: {}", e.getMessage());
            throw new BullhornException("REST login failed: " + e.getMessage(), e);
        }
    }

    private static UriComponentsBuilder endpoint(String property, String baseUrl, String path) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new BullhornException("skills-matrix.bullhorn." + property + " is not configured");
        }
        try {
            return UriComponentsBuilder.fromHttpUrl(baseUrl + path);
        } catch (IllegalArgumentException e) {
            throw new BullhornException("skills-matrix.bullhorn." + property + " is not a valid URL: " + baseUrl, e);
        }
    }

    boolean isRefreshTokenExpired() {
        return refreshTokenExpiry != null && !clock.instant().isBefore(refreshTokenExpiry);
    }

    String currentRefreshToken() {
        return refreshToken;
    }
}
