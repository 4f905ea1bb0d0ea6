package com.flagship.transaction_engine.transaction;

import com.flagship.transaction_engine.account.AccountService;
import com.flagship.transaction_engine.instruction.Instruction;
import com.flagship.transaction_engine.money.Money;
import com.flagship.transaction_engine.queue.InstructionQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Accepts instructions from the HTTP layer and hands them to the queue.
 *
 * The account and balance checks here read committed state without locks. They
 * reject obviously bad requests early; the balance mutator re-checks everything
 * under lock when the instruction is applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionSubmissionService {

    private final AccountService accountService;
    private final InstructionQueue instructionQueue;

    /**
     * @return the instruction as queued
     * @throws AccountNotFoundException if an affected account does not exist
     * @throws InsufficientBalanceException if the debited account's current balance is too low
     * @throws com.flagship.transaction_engine.queue.PublishException if the queue did not accept it
     */
    public Instruction submit(Instruction instruction) {
        for (String accountId : instruction.affectedAccountIds()) {
            if (!accountService.exists(accountId)) {
                throw new AccountNotFoundException(accountId);
            }
        }

        String debited = instruction.debitedAccountId();
        if (debited != null) {
            Money balance = accountService.getBalance(debited);
            if (balance.isLessThan(instruction.getAmount())) {
                throw new InsufficientBalanceException(debited, balance, instruction.getAmount());
            }
        }

        Instruction queued = instructionQueue.publish(instruction);
        log.info("Transaction queued: type={}, key={}, amount={}",
                queued.getKind().wireName(), queued.partitionKey(), queued.getAmount());
        return queued;
    }
}
