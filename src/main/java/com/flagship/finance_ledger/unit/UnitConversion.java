package com.flagship.finance_ledger.unit;

import com.flagship.finance_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Converts quantities expressed in any unit to the base unit of its group.
 * Batch stock is always compared in base units.
 */
@Component
@RequiredArgsConstructor
public class UnitConversion {

    private final UnitRepository unitRepository;

    /**
     * Ratio of the unit, or 1 when the row carries no usable ratio.
     *
     * @throws NotFoundException if the unit does not exist
     */
    public BigDecimal unitRatio(long unitId) {
        Unit unit = unitRepository.findById(unitId)
            .orElseThrow(() -> NotFoundException.of("Unit", unitId));
        BigDecimal ratio = unit.getRatio();
        return ratio != null && ratio.signum() > 0 ? ratio : BigDecimal.ONE;
    }

    public BigDecimal toBase(BigDecimal amount, long unitId) {
        return amount.multiply(unitRatio(unitId));
    }
}
