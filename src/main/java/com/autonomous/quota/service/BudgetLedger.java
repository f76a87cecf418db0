package com.autonomous.quota.service;

import com.autonomous.quota.exception.RejectionReason;
import com.autonomous.quota.model.LedgerSnapshot;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Process-wide spend against the configured ceiling. Every read and write goes through this
 * object's monitor.
 *
 * <p>Admission checks do not reserve anything: requests admitted concurrently are each checked
 * against the spend committed so far, so total spend may pass the ceiling by roughly the cost of
 * the requests in flight at that moment.
 */
@Slf4j
@Component
public class BudgetLedger {

    @Value("${quota.limit-usd:2.0}")
    private double ceiling = 2.0;

    private double totalSpent;

    @PostConstruct
    public void init() {
        log.info("Budget ledger ready with quota limit: ${}", String.format("%.2f", getCeiling()));
    }

    public synchronized void setCeiling(double ceiling) {
        this.ceiling = ceiling;
    }

    public synchronized double getCeiling() {
        return ceiling;
    }

    public synchronized double getTotalSpent() {
        return totalSpent;
    }

    public synchronized double remaining() {
        return ceiling - totalSpent;
    }

    public synchronized boolean isExhausted() {
        return totalSpent >= ceiling;
    }

    /**
     * Reaching the ceiling exactly counts as exceeding it.
     */
    public synchronized boolean wouldExceed(double additionalCost) {
        return totalSpent + additionalCost >= ceiling;
    }

    /**
     * Exhaustion and estimate checks taken against one consistent view of the spend.
     *
     * @return the refusal reason, or empty when the request may be dispatched
     */
    public synchronized Optional<RejectionReason> checkAdmission(double estimatedCost) {
        if (isExhausted()) {
            return Optional.of(RejectionReason.BUDGET_EXHAUSTED);
        }
        if (wouldExceed(estimatedCost)) {
            return Optional.of(RejectionReason.BUDGET_WOULD_BE_EXCEEDED);
        }
        return Optional.empty();
    }

    /**
     * @return the total spend after the commit
     */
    public synchronized double commit(double delta) {
        totalSpent += delta;
        return totalSpent;
    }

    public synchronized LedgerSnapshot snapshot() {
        return new LedgerSnapshot(ceiling, totalSpent, ceiling - totalSpent);
    }

    /**
     * Puts the ledger into a known state. Only meant for test harnesses.
     */
    public synchronized void restore(double totalSpent) {
        this.totalSpent = totalSpent;
    }
}
