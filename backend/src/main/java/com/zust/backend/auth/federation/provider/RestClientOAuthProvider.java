package com.zust.backend.auth.federation.provider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.zust.backend.auth.federation.OAuthProvider;
import com.zust.backend.auth.federation.OAuthProviderException;
import com.zust.backend.auth.federation.OAuthProviderException.Stage;

/**
 * HTTP plumbing shared by the providers: form POST for the code exchange, bearer GET for
 * profile calls. Any non-2xx answer or transport failure becomes an
 * {@link OAuthProviderException} of the calling stage.
 */
public abstract class RestClientOAuthProvider implements OAuthProvider {

    private static final int MAX_LOGGED_BODY = 2000;

    protected final RestClient restClient;

    protected RestClientOAuthProvider(RestClient restClient) {
        this.restClient = restClient;
    }

    protected <T> T postForm(String uri, MultiValueMap<String, String> form, Class<T> responseType) {
        try {
            return restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        throw upstreamError(Stage.EXCHANGE, res);
                    })
                    .body(responseType);
        } catch (RestClientException e) {
            throw new OAuthProviderException(name(), Stage.EXCHANGE, "token exchange call failed", e);
        }
    }

    protected <T> T getWithBearer(String uri, String accessToken, MediaType accept, Class<T> responseType) {
        try {
            return bearerGet(uri, accessToken, accept).body(responseType);
        } catch (RestClientException e) {
            throw new OAuthProviderException(name(), Stage.FETCH, "profile call failed", e);
        }
    }

    protected <T> T getWithBearer(String uri, String accessToken, MediaType accept, ParameterizedTypeReference<T> responseType) {
        try {
            return bearerGet(uri, accessToken, accept).body(responseType);
        } catch (RestClientException e) {
            throw new OAuthProviderException(name(), Stage.FETCH, "profile call failed", e);
        }
    }

    protected OAuthProviderException invalidAnswer(Stage stage, String message) {
        return new OAuthProviderException(name(), stage, null, null, message);
    }

    protected static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private RestClient.ResponseSpec bearerGet(String uri, String accessToken, MediaType accept) {
        return restClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .accept(accept)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw upstreamError(Stage.FETCH, res);
                });
    }

    private OAuthProviderException upstreamError(Stage stage, ClientHttpResponse res) throws IOException {
        byte[] raw = res.getBody().readAllBytes();
        String body = new String(raw, StandardCharsets.UTF_8);
        if (body.length() > MAX_LOGGED_BODY) {
            body = body.substring(0, MAX_LOGGED_BODY);
        }
        int status = res.getStatusCode().value();
        return new OAuthProviderException(name(), stage, status, body, name() + " answered " + status);
    }
}
