package com.autonomous.quota.controller;

import com.autonomous.quota.model.ChatResponse;
import com.autonomous.quota.model.PriceEntry;
import com.autonomous.quota.model.QuotaStatus;
import com.autonomous.quota.service.AdmissionService;
import com.autonomous.quota.service.PriceCatalogService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
public class ProxyController {

    @Autowired
    private AdmissionService admissionService;

    @Autowired
    private PriceCatalogService catalogService;

    @PostMapping({"/v1/chat/completions", "/api/v1/chat/completions"})
    public ResponseEntity<ChatResponse> chatCompletions(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) String body) {
        return ResponseEntity.ok(admissionService.handle(authorization, body));
    }

    @GetMapping({"/v1/chat/completions", "/api/v1/chat/completions"})
    public ResponseEntity<QuotaStatus> info() {
        return ResponseEntity.ok(admissionService.status());
    }

    @GetMapping({"/pricing", "/api/pricing"})
    public ResponseEntity<Map<String, Map<String, PriceEntry>>> pricing() {
        return ResponseEntity.ok(Map.of("pricing", catalogService.getCatalog().getEntries()));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
