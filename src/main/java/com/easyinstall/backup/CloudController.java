package com.easyinstall.backup;

import com.easyinstall.backup.service.CloudCredentialService;
import com.easyinstall.backup.utils.AppConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class CloudController {

    private final CloudCredentialService cloudCredentialService;

    @PostMapping("/api/cloud/configure/{provider}")
    public Mono<Map<String, Object>> configure(@RequestHeader(AppConstants.OPERATOR_HEADER) Long operatorId,
                                               @PathVariable("provider") String provider,
                                               @RequestBody Map<String, Object> request) {
        log.info("configuring {} credentials for operator {}", provider, operatorId);
        return Mono.fromCallable(() -> {
            cloudCredentialService.configure(operatorId, provider, request);
            return Map.<String, Object>of(AppConstants.SUCCESS, true);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/api/cloud/status")
    public Mono<Map<String, Map<String, Boolean>>> status(@RequestHeader(AppConstants.OPERATOR_HEADER) Long operatorId) {
        return Mono.fromCallable(() -> cloudCredentialService.status(operatorId)).subscribeOn(Schedulers.boundedElastic());
    }
}
