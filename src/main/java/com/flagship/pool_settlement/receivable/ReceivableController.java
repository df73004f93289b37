package com.flagship.pool_settlement.receivable;

import com.flagship.pool_settlement.receivable.dto.CreateReceivableRequest;
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

import java.util.List;

/**
 * REST endpoints for registering and looking up receivables.
 */
@RestController
@RequestMapping("/api/receivables")
@RequiredArgsConstructor
@Slf4j
public class ReceivableController {

    private final ReceivableRegistry receivableRegistry;

    @PostMapping
    public ResponseEntity<Receivable> createReceivable(@Valid @RequestBody CreateReceivableRequest request) {
        log.info("Received receivable: owner={}, amount={}, maturity={}", request.getOwnerId(),
            request.getAmount(), request.getMaturityDate());
        Receivable receivable = receivableRegistry.createReceivable(request.getOwnerId(), request.getAmount(),
            request.getMaturityDate(), request.getReferenceId());
        return ResponseEntity.status(HttpStatus.CREATED).body(receivable);
    }

    @GetMapping("/{receivableId}")
    public ResponseEntity<Receivable> getReceivable(@PathVariable("receivableId") String receivableId) {
        return ResponseEntity.ok(receivableRegistry.getReceivable(receivableId));
    }

    @GetMapping
    public ResponseEntity<List<Receivable>> getReceivables(@RequestParam("owner_id") String ownerId) {
        return ResponseEntity.ok(receivableRegistry.findByOwner(ownerId));
    }
}
