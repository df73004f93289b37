package com.flagship.pool_settlement.credit;

import com.flagship.pool_settlement.credit.dto.CreditAmountRequest;
import com.flagship.pool_settlement.credit.dto.CreditResponse;
import com.flagship.pool_settlement.credit.dto.FactoringApprovalRequest;
import com.flagship.pool_settlement.credit.dto.FactoringPaymentRequest;
import com.flagship.pool_settlement.credit.dto.PrincipalPaymentAndDrawdownRequest;
import com.flagship.pool_settlement.receivable.Receivable;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST endpoints for receivable backed credit lines and receivable factoring.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ReceivableCreditController {

    private final ReceivableBackedCreditLineManager backedManager;
    private final ReceivableBackedCreditLine backedCreditLine;
    private final ReceivableFactoringCreditManager factoringManager;
    private final ReceivableFactoringCredit factoringCredit;
    private final CreditManager creditManager;

    // ==================== Receivable backed credit line ====================

    @PostMapping("/receivable-backed-lines/{borrowerId}/receivables/{receivableId}/approval")
    public ResponseEntity<Map<String, Object>> approveBackingReceivable(
            @PathVariable("borrowerId") String borrowerId,
            @PathVariable("receivableId") String receivableId) {
        BigDecimal available = backedManager.approveReceivable(borrowerId, receivableId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("receivable_id", receivableId);
        body.put("available_credit", available);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/receivable-backed-lines/{borrowerId}/receivables/{receivableId}/rejection")
    public ResponseEntity<Receivable> rejectBackingReceivable(@PathVariable("borrowerId") String borrowerId,
                                                              @PathVariable("receivableId") String receivableId) {
        return ResponseEntity.ok(backedManager.rejectReceivable(borrowerId, receivableId));
    }

    @PostMapping("/receivable-backed-lines/{borrowerId}/drawdowns")
    public ResponseEntity<DrawdownResult> drawdownWithReceivable(@PathVariable("borrowerId") String borrowerId,
                                                                 @Valid @RequestBody CreditAmountRequest request) {
        requireReceivableId(request);
        return ResponseEntity.ok(backedCreditLine.drawdownWithReceivable(borrowerId, request.getReceivableId(),
            request.getAmount()));
    }

    /**
     * Pays the line; with a receivable id the payment is also booked against that receivable.
     */
    @PostMapping("/receivable-backed-lines/{borrowerId}/payments")
    public ResponseEntity<PaymentResult> makeBackedPayment(@PathVariable("borrowerId") String borrowerId,
                                                           @Valid @RequestBody CreditAmountRequest request) {
        if (request.getReceivableId() == null) {
            return ResponseEntity.ok(backedCreditLine.makePayment(borrowerId, request.getAmount()));
        }
        return ResponseEntity.ok(backedCreditLine.makePaymentWithReceivable(borrowerId, request.getReceivableId(),
            request.getAmount()));
    }

    @PostMapping("/receivable-backed-lines/{borrowerId}/principal-payments")
    public ResponseEntity<PaymentResult> makeBackedPrincipalPayment(@PathVariable("borrowerId") String borrowerId,
                                                                    @Valid @RequestBody CreditAmountRequest request) {
        requireReceivableId(request);
        return ResponseEntity.ok(backedCreditLine.makePrincipalPaymentWithReceivable(borrowerId,
            request.getReceivableId(), request.getAmount()));
    }

    @PostMapping("/receivable-backed-lines/{borrowerId}/principal-payment-drawdowns")
    public ResponseEntity<PrincipalPaymentAndDrawdownResult> makePrincipalPaymentAndDrawdown(
            @PathVariable("borrowerId") String borrowerId,
            @Valid @RequestBody PrincipalPaymentAndDrawdownRequest request) {
        return ResponseEntity.ok(backedCreditLine.makePrincipalPaymentAndDrawdownWithReceivable(borrowerId,
            request.getPaymentReceivableId(), request.getPaymentAmount(), request.getDrawdownReceivableId(),
            request.getDrawdownAmount()));
    }

    // ==================== Factoring ====================

    @PostMapping("/factoring/{borrowerId}/receivables/{receivableId}/approval")
    public ResponseEntity<CreditResponse> approveFactoringReceivable(
            @PathVariable("borrowerId") String borrowerId,
            @PathVariable("receivableId") String receivableId,
            @Valid @RequestBody FactoringApprovalRequest request) {
        CreditRecord record = factoringManager.approveReceivable(borrowerId, receivableId, request.getYieldBps());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(CreditResponse.from(record, creditManager.availableCredit(record.getCreditId())));
    }

    @PostMapping("/factoring/{borrowerId}/receivables/{receivableId}/rejection")
    public ResponseEntity<Receivable> rejectFactoringReceivable(@PathVariable("borrowerId") String borrowerId,
                                                                @PathVariable("receivableId") String receivableId) {
        return ResponseEntity.ok(factoringManager.rejectReceivable(borrowerId, receivableId));
    }

    @PostMapping("/factoring/{borrowerId}/receivables/{receivableId}/drawdowns")
    public ResponseEntity<DrawdownResult> drawdownFactoring(@PathVariable("borrowerId") String borrowerId,
                                                            @PathVariable("receivableId") String receivableId,
                                                            @Valid @RequestBody CreditAmountRequest request) {
        return ResponseEntity.ok(factoringCredit.drawdownWithReceivable(borrowerId, receivableId,
            request.getAmount()));
    }

    @PostMapping("/factoring/receivables/{receivableId}/payments")
    public ResponseEntity<PaymentResult> makeFactoringPayment(@PathVariable("receivableId") String receivableId,
                                                              @Valid @RequestBody FactoringPaymentRequest request) {
        return ResponseEntity.ok(factoringCredit.makePaymentWithReceivable(request.getPayerId(), receivableId,
            request.getAmount()));
    }

    private static void requireReceivableId(CreditAmountRequest request) {
        if (request.getReceivableId() == null || request.getReceivableId().isBlank()) {
            throw new IllegalArgumentException("receivable_id is required");
        }
    }
}
