package com.fabric.runtime.api;

import com.fabric.runtime.identity.CallerIdentity;
import com.fabric.runtime.intake.Admission;
import com.fabric.runtime.intake.IntentIntake;
import com.fabric.runtime.intake.IntentSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Intent REST Controller
 *
 * POST /intent/submit → 202 with the execution id; progress is read from
 * {@code GET /execution/{id}/status}.
 */
@Slf4j
@RestController
@RequestMapping("/intent")
@RequiredArgsConstructor
public class IntentController {

    private final IntentIntake intake;

    @PostMapping("/submit")
    public ResponseEntity<Admission> submit(
            @RequestBody IntentSubmission submission,
            @RequestHeader(value = Headers.TENANT, required = false) String tenantId,
            @RequestHeader(value = Headers.USER, required = false) String userId,
            @RequestHeader(value = Headers.SESSION, required = false) String sessionId) {

        Admission admission = intake.submit(submission, CallerIdentity.of(tenantId, userId, sessionId));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(admission);
    }
}
