package com.fabric.runtime.contract;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background TTL sweep. Reads already treat a contract past its TTL as expired; the sweep
 * makes that durable so listings by status stay accurate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContractExpirySweep {

    private final BoundaryContractStore contracts;

    @Scheduled(fixedDelayString = "${runtime.contracts.sweep-interval-ms:60000}")
    public void sweep() {
        int expired = contracts.sweepExpired();
        if (expired > 0) {
            log.info("Contract sweep: expired={}", expired);
        }
    }
}
