package com.example.skillsmatrix.bullhorn;

import com.example.skillsmatrix.config.SkillsMatrixProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class BullhornAuthenticatorTest {

    private static final String AUTH_URL = "https://auth.example.com/oauth";
    private static final String REST_URL = "https://rest.example.com/rest-services";
    private static final String TOKEN_JSON =
            "{\"access_token\":\"access-1\",\"refresh_token\":\"refresh-1\",\"expires_in\":600}";
    private static final String LOGIN_JSON =
            "{\"BhRestToken\":\"bh-token\",\"restUrl\":\"https://rest9.example.com/rest-services/abc/\"}";

    private MockRestServiceServer server;
    private BullhornAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        SkillsMatrixProperties.Bullhorn settings = new SkillsMatrixProperties.Bullhorn();
        settings.setAuthUrl(AUTH_URL);
        settings.setRestUrl(REST_URL);
        settings.setClientId("client");
        settings.setClientSecret("secret");
        settings.setUsername("api.user");
        settings.setPassword("pw");
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
        authenticator = new BullhornAuthenticator(restTemplate, settings, clock);
    }

    @Test
    void authenticatesThroughCodeTokenAndLogin() {
        expectAuthorize("https://app.example.com/callback?code=22%3Aabc-def&client_id=client");
        server.expect(requestTo(startsWith(AUTH_URL + "/token")))
                .andExpect(method(HttpMethod.POST))
                .andExpect(queryParam("grant_type", "authorization_code"))
                .andExpect(queryParam("code", "22:abc-def"))
                .andExpect(queryParam("client_secret", "secret"))
                .andRespond(withSuccess(TOKEN_JSON, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(REST_URL + "/login")))
                .andExpect(method(HttpMethod.POST))
                .andExpect(queryParam("version", "*"))
                .andExpect(queryParam("access_token", "access-1"))
                .andRespond(withSuccess(LOGIN_JSON, MediaType.APPLICATION_JSON));

        BullhornSession session = authenticator.authenticate();

        assertThat(session.bhRestToken()).isEqualTo("bh-token");
        assertThat(session.restUrl()).isEqualTo("https://rest9.example.com/rest-services/abc/");
        assertThat(authenticator.currentRefreshToken()).isEqualTo("refresh-1");
        assertThat(authenticator.isRefreshTokenExpired()).isFalse();
        server.verify();
    }

    @Test
    void refreshUsesHeldRefreshToken() {
        expectAuthorize("https://app.example.com/callback?code=abc");
        server.expect(requestTo(startsWith(AUTH_URL + "/token")))
                .andRespond(withSuccess(TOKEN_JSON, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(REST_URL + "/login")))
                .andRespond(withSuccess(LOGIN_JSON, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(AUTH_URL + "/token")))
                .andExpect(queryParam("grant_type", "refresh_token"))
                .andExpect(queryParam("refresh_token", "refresh-1"))
                .andRespond(withSuccess(
                        "{\"access_token\":\"access-2\",\"refresh_token\":\"refresh-2\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(REST_URL + "/login")))
                .andExpect(queryParam("access_token", "access-2"))
                .andRespond(withSuccess(LOGIN_JSON, MediaType.APPLICATION_JSON));

        authenticator.authenticate();
        BullhornSession refreshed = authenticator.refresh();

        assertThat(refreshed.bhRestToken()).isEqualTo("bh-token");
        assertThat(authenticator.currentRefreshToken()).isEqualTo("refresh-2");
        server.verify();
    }

    @Test
    void missingAuthorizationCodeFails() {
        expectAuthorize("https://app.example.com/callback?error=invalid_grant");

        assertThatThrownBy(() -> authenticator.authenticate())
                .isInstanceOf(BullhornException.class)
                .hasMessageContaining("Authorization code not found");
    }

    @Test
    void tokenWithoutCodeOrRefreshTokenIsRejected() {
        assertThatThrownBy(() -> authenticator.requestAccessToken(null))
                .isInstanceOf(BullhornException.class)
                .hasMessageContaining("refresh token");
    }

    @Test
    void loginFailureIsWrapped() {
        server.expect(requestTo(startsWith(REST_URL + "/login")))
                .andRespond(withServerError());

        assertThatThrownBy(() -> authenticator.login("access-1"))
                .isInstanceOf(BullhornException.class)
                .hasMessageStartingWith("REST login failed");
    }

    @Test
    void loginWithoutRestTokenFails() {
        server.expect(requestTo(startsWith(REST_URL + "/login")))
                .andRespond(withSuccess("{\"restUrl\":\"https://rest9.example.com/\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> authenticator.login("access-1"))
                .isInstanceOf(BullhornException.class)
                .hasMessageContaining("BhRestToken");
    }

    @Test
    void unconfiguredAuthUrlIsABullhornFailure() {
        SkillsMatrixProperties.Bullhorn settings = new SkillsMatrixProperties.Bullhorn();
        settings.setAuthUrl(" ");
        settings.setRestUrl(REST_URL);
        BullhornAuthenticator unconfigured = new BullhornAuthenticator(new RestTemplate(), settings, Clock.systemUTC());

        assertThatThrownBy(unconfigured::authenticate)
                .isInstanceOf(BullhornException.class)
                .hasMessageContaining("auth-url is not configured");
    }

    @Test
    void malformedAuthUrlIsABullhornFailure() {
        SkillsMatrixProperties.Bullhorn settings = new SkillsMatrixProperties.Bullhorn();
        settings.setAuthUrl("auth.example.com/oauth");
        settings.setRestUrl(REST_URL);
        BullhornAuthenticator misconfigured = new BullhornAuthenticator(new RestTemplate(), settings, Clock.systemUTC());

        assertThatThrownBy(misconfigured::authenticate)
                .isInstanceOf(BullhornException.class)
                .hasMessageContaining("auth-url is not a valid URL")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    private void expectAuthorize(String redirect) {
        server.expect(requestTo(startsWith(AUTH_URL + "/authorize")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("client_id", "client"))
                .andExpect(queryParam("response_type", "code"))
                .andExpect(queryParam("action", "Login"))
                .andRespond(withStatus(HttpStatus.FOUND).location(URI.create(redirect)));
    }
}
