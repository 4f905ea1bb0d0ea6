package com.flagship.transaction_engine.account;

import com.flagship.transaction_engine.account.dto.AccountResponse;
import com.flagship.transaction_engine.account.dto.CreateAccountRequest;
import com.flagship.transaction_engine.account.dto.ReconciliationResponse;
import com.flagship.transaction_engine.ledger.LedgerQueryService;
import com.flagship.transaction_engine.ledger.Reconciliation;
import com.flagship.transaction_engine.money.Money;
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
 * REST controller for the account directory.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final LedgerQueryService ledgerQueryService;

    @PostMapping
    public ResponseEntity<AccountResponse> openAccount(@Valid @RequestBody CreateAccountRequest request) {
        log.info("Received account creation request: username={}", request.getUsername());

        Money opening = request.getOpeningBalance() != null
            ? Money.of(request.getOpeningBalance())
            : Money.ZERO;
        Account account = accountService.openAccount(request.getUsername(), request.getPhone(), opening);

        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    /**
     * Lists all accounts. Responds 404 when the directory is empty.
     */
    @GetMapping
    public ResponseEntity<List<AccountResponse>> listAccounts() {
        List<AccountResponse> accounts = accountService.listAccounts().stream()
            .map(AccountResponse::from)
            .toList();
        if (accounts.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(accounts);
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("accountId") String accountId) {
        return ResponseEntity.ok(AccountResponse.from(accountService.getAccount(accountId)));
    }

    @GetMapping("/{accountId}/reconciliation")
    public ResponseEntity<ReconciliationResponse> reconcile(@PathVariable("accountId") String accountId) {
        Reconciliation reconciliation = ledgerQueryService.reconcile(accountId);
        if (!reconciliation.consistent()) {
            log.error("Ledger mismatch: accountId={}, expected={}, actual={}",
                accountId, reconciliation.expectedBalance(), reconciliation.actualBalance());
        }
        return ResponseEntity.ok(ReconciliationResponse.from(reconciliation));
    }
}
