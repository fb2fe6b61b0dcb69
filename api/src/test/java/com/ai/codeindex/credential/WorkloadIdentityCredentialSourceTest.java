package com.ai.codeindex.credential;

import com.ai.codeindex.config.CredentialProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientService;
import org.springframework.security.oauth2.client.registration.ClientRegistrationRepository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkloadIdentityCredentialSourceTest {

    @Mock
    private ObjectProvider<ClientRegistrationRepository> registrations;

    @Mock
    private ObjectProvider<OAuth2AuthorizedClientService> authorizedClients;

    @Mock
    private ClientRegistrationRepository repository;

    @Mock
    private OAuth2AuthorizedClientService clientService;

    @Test
    void fetch_withoutOAuth2ClientSupportIsFailure() {
        when(registrations.getIfAvailable()).thenReturn(null);
        when(authorizedClients.getIfAvailable()).thenReturn(null);

        CredentialResult result = new WorkloadIdentityCredentialSource(registrations, authorizedClients,
                new CredentialProperties()).fetch();

        assertThat(result).isInstanceOf(CredentialResult.Failure.class);
        assertThat(((CredentialResult.Failure) result).source()).isEqualTo(CredentialSourceType.WORKLOAD_IDENTITY);
    }

    @Test
    void fetch_unknownRegistrationIsFailure() {
        when(registrations.getIfAvailable()).thenReturn(repository);
        when(authorizedClients.getIfAvailable()).thenReturn(clientService);
        when(repository.findByRegistrationId("code-index-upstream")).thenReturn(null);

        CredentialResult result = new WorkloadIdentityCredentialSource(registrations, authorizedClients,
                new CredentialProperties()).fetch();

        assertThat(((CredentialResult.Failure) result).reason()).contains("code-index-upstream");
    }
}
