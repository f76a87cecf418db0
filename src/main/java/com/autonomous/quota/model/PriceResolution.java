package com.autonomous.quota.model;

import lombok.Value;

@Value
public class PriceResolution {
    PriceEntry entry;
    boolean matched;
}
