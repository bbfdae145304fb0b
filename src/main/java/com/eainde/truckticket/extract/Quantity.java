package com.eainde.truckticket.extract;

import com.eainde.truckticket.model.QuantityUnit;

import java.math.BigDecimal;

public record Quantity(BigDecimal value, QuantityUnit unit) {
}
