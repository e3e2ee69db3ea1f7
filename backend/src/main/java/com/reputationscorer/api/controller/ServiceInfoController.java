package com.reputationscorer.api.controller;

import com.reputationscorer.api.dto.ServiceInfoResponse;
import com.reputationscorer.config.ServiceInfoProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /: service name, description and version.
 */
@RestController
@RequiredArgsConstructor
public class ServiceInfoController {

    private final ServiceInfoProperties serviceInfoProperties;

    @GetMapping("/")
    public ServiceInfoResponse root() {
        return new ServiceInfoResponse(
                serviceInfoProperties.getTitle(),
                serviceInfoProperties.getDescription(),
                serviceInfoProperties.getVersion(),
                "running");
    }
}
