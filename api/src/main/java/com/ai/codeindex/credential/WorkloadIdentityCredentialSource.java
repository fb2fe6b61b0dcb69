package com.ai.codeindex.credential;

import com.ai.codeindex.config.CredentialProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.security.oauth2.client.AuthorizedClientServiceOAuth2AuthorizedClientManager;
import org.springframework.security.oauth2.client.OAuth2AuthorizeRequest;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClient;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientProviderBuilder;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientService;
import org.springframework.security.oauth2.client.registration.ClientRegistrationRepository;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.security.oauth2.core.OAuth2AuthorizationException;
import org.springframework.stereotype.Component;

/**
 * Obtains a token through the OAuth2 client-credentials grant of the configured
 * client registration. Absent when no registration is configured.
 */
@Component
public class WorkloadIdentityCredentialSource implements CredentialSource {

    private static final Logger log = LoggerFactory.getLogger(WorkloadIdentityCredentialSource.class);
    private static final String PRINCIPAL = "code-index";

    private final ObjectProvider<ClientRegistrationRepository> registrations;
    private final ObjectProvider<OAuth2AuthorizedClientService> authorizedClients;
    private final CredentialProperties properties;

    public WorkloadIdentityCredentialSource(
            ObjectProvider<ClientRegistrationRepository> registrations,
            ObjectProvider<OAuth2AuthorizedClientService> authorizedClients,
            CredentialProperties properties) {
        this.registrations = registrations;
        this.authorizedClients = authorizedClients;
        this.properties = properties;
    }

    @Override
    public CredentialSourceType type() {
        return CredentialSourceType.WORKLOAD_IDENTITY;
    }

    @Override
    public CredentialResult fetch() {
        ClientRegistrationRepository repository = registrations.getIfAvailable();
        OAuth2AuthorizedClientService clientService = authorizedClients.getIfAvailable();
        String registrationId = properties.getWorkloadRegistrationId();
        if (repository == null || clientService == null || repository.findByRegistrationId(registrationId) == null) {
            return CredentialResult.failure(type(), "no OAuth2 client registration '" + registrationId + "'");
        }

        // drop the cached client so the grant runs again instead of returning the near-expiry token
        clientService.removeAuthorizedClient(registrationId, PRINCIPAL);

        AuthorizedClientServiceOAuth2AuthorizedClientManager manager =
                new AuthorizedClientServiceOAuth2AuthorizedClientManager(repository, clientService);
        manager.setAuthorizedClientProvider(OAuth2AuthorizedClientProviderBuilder.builder()
                .clientCredentials()
                .build());

        try {
            OAuth2AuthorizedClient client = manager.authorize(OAuth2AuthorizeRequest
                    .withClientRegistrationId(registrationId)
                    .principal(PRINCIPAL)
                    .build());
            if (client == null) {
                return CredentialResult.failure(type(), "authorization returned no client");
            }
            OAuth2AccessToken token = client.getAccessToken();
            return CredentialResult.success(new Credential(
                    token.getTokenValue(), token.getIssuedAt(), token.getExpiresAt(), type()));
        } catch (OAuth2AuthorizationException e) {
            log.warn("[WorkloadIdentity] Token request failed: {}", e.getError().getErrorCode());
            return CredentialResult.failure(type(), "token request failed: " + e.getError().getErrorCode());
        }
    }
}
