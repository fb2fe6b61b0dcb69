package com.ai.codeindex.controller;

import com.ai.codeindex.config.SecurityConfig;
import com.ai.codeindex.credential.CredentialSourceType;
import com.ai.codeindex.credential.CredentialStatus;
import com.ai.codeindex.credential.CredentialSupervisor;
import com.ai.codeindex.credential.SupervisorState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CredentialController.class)
@Import(SecurityConfig.class)
class CredentialControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CredentialSupervisor supervisor;

    @Test
    void status_reportsBreakerWithoutToken() throws Exception {
        when(supervisor.status()).thenReturn(new CredentialStatus(SupervisorState.DEGRADED,
                CredentialSourceType.WORKLOAD_IDENTITY, null, 3, Instant.parse("2026-03-01T10:01:00Z"), 4,
                "WORKLOAD_IDENTITY: token endpoint returned 503"));

        mockMvc.perform(get("/credentials/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("DEGRADED"))
                .andExpect(jsonPath("$.consecutive_failures").value(3))
                .andExpect(jsonPath("$.breaker_open_until").value("2026-03-01T10:01:00Z"))
                .andExpect(jsonPath("$.token").doesNotExist());
    }
}
