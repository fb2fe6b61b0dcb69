package com.ai.codeindex.controller;

import com.ai.codeindex.credential.CredentialSupervisor;
import com.ai.codeindex.dto.CredentialStatusResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CredentialController {

    private final CredentialSupervisor supervisor;

    public CredentialController(CredentialSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @GetMapping("/credentials/status")
    public CredentialStatusResponse status() {
        return CredentialStatusResponse.from(supervisor.status());
    }
}
