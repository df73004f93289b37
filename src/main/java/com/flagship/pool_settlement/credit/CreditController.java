package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.config.PoolProperties;
import com.flagship.pool_settlement.credit.dto.ApproveBorrowerRequest;
import com.flagship.pool_settlement.credit.dto.CreditAmountRequest;
import com.flagship.pool_settlement.credit.dto.CreditResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for credit administration and plain credit lines.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class CreditController {

    private final CreditManager creditManager;
    private final CreditLine creditLine;
    private final PoolProperties properties;

    @PostMapping("/credits")
    public ResponseEntity<CreditResponse> approveBorrower(@Valid @RequestBody ApproveBorrowerRequest request) {
        log.info("Received credit approval: borrower={}, type={}, limit={}", request.getBorrowerId(),
            request.getCreditType(), request.getCreditLimit());
        CreditRecord record = creditManager.approveBorrower(request.getBorrowerId(), request.getCreditType(),
            request.toCreditConfig(properties.getPayPeriodDuration()));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(record));
    }

    @GetMapping("/credits")
    public ResponseEntity<List<CreditResponse>> getCreditsForBorrower(@RequestParam("borrower_id") String borrowerId) {
        return ResponseEntity.ok(creditManager.getCreditsForBorrower(borrowerId).stream()
            .map(this::toResponse)
            .toList());
    }

    @GetMapping("/credits/{creditId}")
    public ResponseEntity<CreditResponse> getCredit(@PathVariable("creditId") String creditId) {
        return ResponseEntity.ok(toResponse(creditManager.getCreditRecord(creditId)));
    }

    @PostMapping("/credits/{creditId}/refresh")
    public ResponseEntity<CreditResponse> refreshCredit(@PathVariable("creditId") String creditId) {
        return ResponseEntity.ok(toResponse(creditManager.refreshCredit(creditId)));
    }

    @PostMapping("/credits/{creditId}/default")
    public ResponseEntity<CreditResponse> triggerDefault(@PathVariable("creditId") String creditId) {
        return ResponseEntity.ok(toResponse(creditManager.triggerDefault(creditId)));
    }

    @PostMapping("/credits/{creditId}/force-default")
    public ResponseEntity<CreditResponse> forceDefault(@PathVariable("creditId") String creditId,
                                                       @RequestParam(value = "reason", required = false)
                                                       String reason) {
        return ResponseEntity.ok(toResponse(creditManager.forceDefault(creditId, reason)));
    }

    @PostMapping("/credits/{creditId}/close")
    public ResponseEntity<CreditResponse> closeCredit(@PathVariable("creditId") String creditId) {
        return ResponseEntity.ok(toResponse(creditManager.closeCredit(creditId)));
    }

    @PostMapping("/credit-lines/{borrowerId}/drawdowns")
    public ResponseEntity<DrawdownResult> drawdown(@PathVariable("borrowerId") String borrowerId,
                                                   @Valid @RequestBody CreditAmountRequest request) {
        return ResponseEntity.ok(creditLine.drawdown(borrowerId, request.getAmount()));
    }

    @PostMapping("/credit-lines/{borrowerId}/payments")
    public ResponseEntity<PaymentResult> makePayment(@PathVariable("borrowerId") String borrowerId,
                                                     @Valid @RequestBody CreditAmountRequest request) {
        return ResponseEntity.ok(creditLine.makePayment(borrowerId, request.getAmount()));
    }

    @GetMapping("/credit-lines/{borrowerId}/payoff")
    public ResponseEntity<Map<String, Object>> payoffAmount(@PathVariable("borrowerId") String borrowerId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("borrower_id", borrowerId);
        body.put("payoff_amount", creditLine.payoffAmount(borrowerId));
        return ResponseEntity.ok(body);
    }

    private CreditResponse toResponse(CreditRecord record) {
        BigDecimal available = creditManager.availableCredit(record.getCreditId());
        return CreditResponse.from(record, available);
    }
}
