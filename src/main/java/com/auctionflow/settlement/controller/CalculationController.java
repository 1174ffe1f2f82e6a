package com.auctionflow.settlement.controller;

import com.auctionflow.settlement.config.CalculationDefaults;
import com.auctionflow.settlement.config.MonetaryContext;
import com.auctionflow.settlement.model.CalculationInputs;
import com.auctionflow.settlement.model.CalculationResponse;
import com.auctionflow.settlement.model.CalculationResult;
import com.auctionflow.settlement.model.CalculationTotals;
import com.auctionflow.settlement.model.ValidationReport;
import com.auctionflow.settlement.model.VerificationOutcome;
import com.auctionflow.settlement.service.CalculationOrchestrator;
import com.auctionflow.settlement.service.checksum.ChecksumGenerator;
import com.auctionflow.settlement.service.validation.CalculationInputValidator;
import com.auctionflow.settlement.service.verification.AccuracyVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST surface of the calculation engine.
 *
 * POST /api/calculations/preview → validate, compute, return the serialized result
 * POST /api/calculations/verify  → re-check a serialized result
 * GET  /api/calculations/rates   → default rates and currency
 */
@RestController
@RequestMapping("/api/calculations")
@RequiredArgsConstructor
@Slf4j
public class CalculationController {

    private final CalculationOrchestrator orchestrator;
    private final CalculationInputValidator validator;
    private final AccuracyVerifier verifier;
    private final ChecksumGenerator checksumGenerator;
    private final MonetaryContext money;
    private final CalculationDefaults defaults;

    @PostMapping("/preview")
    public ResponseEntity<?> preview(@RequestBody CalculationInputs inputs) {
        ValidationReport report = validator.validate(inputs);
        if (!report.valid()) {
            log.info("Rejected calculation preview with {} validation errors", report.errors().size());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Invalid inputs");
            body.put("details", report.errors());
            return ResponseEntity.badRequest().body(body);
        }

        CalculationResult result = orchestrator.compute(inputs);
        return ResponseEntity.ok(CalculationResponse.from(result, money));
    }

    @PostMapping("/verify")
    public Map<String, Object> verify(@RequestBody CalculationResponse submitted) {
        CalculationTotals totals = submitted.toTotals();
        VerificationOutcome outcome = verifier.verify(totals);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accurate", outcome.accurate());
        body.put("error", outcome.error());
        body.put("discrepancy", outcome.discrepancy() != null ? outcome.discrepancy().toPlainString() : null);
        body.put("checksum_valid", outcome.accurate()
                && submitted.currency() != null
                && checksumGenerator.matches(totals, submitted.currency(), submitted.checksum()));
        return body;
    }

    @GetMapping("/rates")
    public Map<String, Object> rates() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("buyers_premium_rate", defaults.premiumRate().toPlainString());
        body.put("tax_rate", defaults.taxRate().toPlainString());
        body.put("currency", defaults.currency());
        return body;
    }
}
