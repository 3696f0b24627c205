package com.kotsin.optionsengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class OptionContract {
    String symbol;
    IndexName index;
    OptionLeg leg;
    int strike;
    LocalDate expiry;
    String exchange;
}
