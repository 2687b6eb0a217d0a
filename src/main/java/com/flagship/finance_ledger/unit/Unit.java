package com.flagship.finance_ledger.unit;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A unit of measure. {@code ratio} converts one of this unit into the
 * base unit of its group and is always positive.
 */
@Value
@Builder
public class Unit {
    Long id;
    String name;
    Long groupId;
    BigDecimal ratio;
    @JsonProperty("is_base")
    boolean base;
}
