package com.flagship.finance_ledger.unit;

import com.flagship.finance_ledger.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class UnitConversionTest {

    private UnitRepository unitRepository;
    private UnitConversion unitConversion;

    @BeforeEach
    void setUp() {
        unitRepository = mock(UnitRepository.class);
        unitConversion = new UnitConversion(unitRepository);
    }

    private static Unit unit(long id, String ratio) {
        return Unit.builder().id(id).name("u" + id).groupId(1L)
            .ratio(ratio == null ? null : new BigDecimal(ratio)).build();
    }

    @Test
    @DisplayName("Amounts convert to base units by the unit ratio")
    void toBase() {
        when(unitRepository.findById(2L)).thenReturn(Optional.of(unit(2, "12")));

        assertEquals(0, new BigDecimal("36").compareTo(unitConversion.toBase(new BigDecimal("3"), 2L)));
    }

    @Test
    @DisplayName("A unit without a usable ratio counts as 1")
    void missingRatioIsOne() {
        when(unitRepository.findById(3L)).thenReturn(Optional.of(unit(3, null)));
        when(unitRepository.findById(4L)).thenReturn(Optional.of(unit(4, "0")));

        assertEquals(BigDecimal.ONE, unitConversion.unitRatio(3L));
        assertEquals(BigDecimal.ONE, unitConversion.unitRatio(4L));
    }

    @Test
    @DisplayName("Unknown unit is reported as not found")
    void unknownUnit() {
        when(unitRepository.findById(99L)).thenReturn(Optional.empty());

        NotFoundException e = assertThrows(NotFoundException.class, () -> unitConversion.unitRatio(99L));
        assertEquals("Unit not found: 99", e.getMessage());
    }
}
