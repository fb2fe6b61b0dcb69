package com.ai.codeindex.config;

import com.ai.codeindex.credential.CredentialSupervisor;
import com.ai.codeindex.credential.EnvironmentCredentialSource;
import com.ai.codeindex.credential.ProfileCredentialSource;
import com.ai.codeindex.credential.WorkloadIdentityCredentialSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class CredentialConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Sources are consulted in a fixed order: profile, environment, workload identity.
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    CredentialSupervisor credentialSupervisor(
            ProfileCredentialSource profile,
            EnvironmentCredentialSource environment,
            WorkloadIdentityCredentialSource workloadIdentity,
            CredentialProperties properties,
            Clock clock) {
        return new CredentialSupervisor(
                List.of(profile, environment, workloadIdentity),
                clock,
                properties.getRefreshThreshold(),
                properties.getAcquireTimeout(),
                properties.getFailureThreshold(),
                properties.getCooldown());
    }
}
