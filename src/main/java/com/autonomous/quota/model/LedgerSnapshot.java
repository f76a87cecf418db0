package com.autonomous.quota.model;

import lombok.Value;

@Value
public class LedgerSnapshot {
    double ceiling;
    double totalSpent;
    double remaining;
}
