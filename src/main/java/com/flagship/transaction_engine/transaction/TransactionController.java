package com.flagship.transaction_engine.transaction;

import com.flagship.transaction_engine.instruction.Instruction;
import com.flagship.transaction_engine.instruction.InstructionKind;
import com.flagship.transaction_engine.ledger.LedgerQueryService;
import com.flagship.transaction_engine.ledger.dto.LedgerEntryResponse;
import com.flagship.transaction_engine.money.Money;
import com.flagship.transaction_engine.transaction.dto.TransactionAcceptedResponse;
import com.flagship.transaction_engine.transaction.dto.TransactionRequest;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for submitting transactions and reading account history.
 *
 * Submission is asynchronous: a 202 means the instruction was durably queued,
 * not that balances changed.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionSubmissionService submissionService;
    private final LedgerQueryService ledgerQueryService;

    @PostMapping
    public ResponseEntity<TransactionAcceptedResponse> submit(@Valid @RequestBody TransactionRequest request) {
        log.info("Received transaction request: type={}, amount={}", request.getType(), request.getAmount());

        Instruction instruction = Instruction.of(
            InstructionKind.fromWireName(request.getType()),
            request.getAccountId(),
            request.getFromAccountId(),
            request.getToAccountId(),
            Money.of(request.getAmount()),
            null
        );

        Instruction queued = submissionService.submit(instruction);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(TransactionAcceptedResponse.from(queued));
    }

    /**
     * Ledger history for an account, oldest first. Responds 404 when there is none.
     */
    @GetMapping("/{accountId}")
    public ResponseEntity<List<LedgerEntryResponse>> history(@PathVariable("accountId") String accountId) {
        List<LedgerEntryResponse> entries = ledgerQueryService.history(accountId).stream()
            .map(LedgerEntryResponse::from)
            .toList();
        if (entries.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(entries);
    }
}
