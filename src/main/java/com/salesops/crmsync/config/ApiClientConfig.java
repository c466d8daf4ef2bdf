package com.salesops.crmsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpRequest;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.List;

@Configuration
public class ApiClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApiClientConfig.class);
    // refresh a minute before the CRM says the token expires
    private static final long EXPIRY_SKEW_MILLIS = 60_000L;

    @Bean
    @Qualifier("crmRestTemplate")
    public RestTemplate crmRestTemplate(RestTemplateBuilder builder, CrmSyncProperties properties) {
        CrmSyncProperties.Remote remote = properties.getRemote();
        logger.info("Initializing crmRestTemplate for {}", remote.getBaseUrl());
        return builder
                .rootUri(remote.getBaseUrl())
                .setConnectTimeout(remote.getConnectTimeout())
                .setReadTimeout(remote.getReadTimeout())
                .additionalInterceptors(new OAuthRefreshInterceptor(remote, builder.build()))
                .build();
    }

    /**
     * Adds the access token to every CRM request, exchanging the refresh token for a new one
     * when none is cached or the cached one is about to expire.
     */
    static class OAuthRefreshInterceptor implements ClientHttpRequestInterceptor {

        private final CrmSyncProperties.Remote remote;
        private final RestTemplate tokenTemplate;
        private String cachedToken;
        private long expiresAtMillis;

        OAuthRefreshInterceptor(CrmSyncProperties.Remote remote, RestTemplate tokenTemplate) {
            this.remote = remote;
            this.tokenTemplate = tokenTemplate;
        }

        private synchronized String currentToken() {
            long now = System.currentTimeMillis();
            if (cachedToken != null && now < expiresAtMillis - EXPIRY_SKEW_MILLIS) {
                return cachedToken;
            }
            logger.info("Refreshing CRM access token from {}", remote.getTokenUrl());
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            form.add("grant_type", "refresh_token");
            form.add("refresh_token", remote.getRefreshToken());
            form.add("client_id", remote.getClientId());
            form.add("client_secret", remote.getClientSecret());

            record TokenResponse(String access_token, Long expires_in) {}
            var response = tokenTemplate.exchange(remote.getTokenUrl(), HttpMethod.POST,
                    new HttpEntity<>(form, headers), TokenResponse.class);
            TokenResponse body = response.getBody();
            if (body == null || body.access_token() == null) {
                logger.error("Failed to refresh CRM access token. Status: {}", response.getStatusCode());
                throw new IllegalStateException("Failed to refresh CRM access token");
            }
            cachedToken = body.access_token();
            long lifetimeSeconds = body.expires_in() == null ? 3600L : body.expires_in();
            expiresAtMillis = now + lifetimeSeconds * 1000;
            logger.info("Cached new CRM access token valid for {} seconds", lifetimeSeconds);
            return cachedToken;
        }

        @Override
        @NonNull
        public ClientHttpResponse intercept(@NonNull HttpRequest request,
                                            @NonNull byte[] body,
                                            @NonNull ClientHttpRequestExecution execution) throws IOException {
            request.getHeaders().set(HttpHeaders.AUTHORIZATION, "Zoho-oauthtoken " + currentToken());
            logger.debug("CRM API request: {} {}", request.getMethod(), request.getURI());
            ClientHttpResponse response = execution.execute(request, body);
            logger.debug("CRM API response status: {}", response.getStatusCode());
            return response;
        }
    }
}
