package com.flagship.finance_ledger.currency;

import com.flagship.finance_ledger.currency.dto.CurrencyRequest;
import com.flagship.finance_ledger.exception.CurrencyNotFoundException;
import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.ledger.BalanceLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CurrencyServiceTest {

    private CurrencyRepository currencyRepository;
    private BalanceLedger balanceLedger;
    private CurrencyService currencyService;

    @BeforeEach
    void setUp() {
        currencyRepository = mock(CurrencyRepository.class);
        balanceLedger = mock(BalanceLedger.class);
        currencyService = new CurrencyService(currencyRepository, balanceLedger);
    }

    private static Currency currency(long id, String name, boolean base, String rate) {
        return Currency.builder().id(id).name(name).base(base).rate(new BigDecimal(rate)).build();
    }

    @Test
    @DisplayName("Creating a base currency clears the flag on every other currency")
    void createBase() {
        when(currencyRepository.insert("AFN", false, BigDecimal.ONE)).thenReturn(3L);
        when(currencyRepository.findById(3L)).thenReturn(Optional.of(currency(3, "AFN", true, "1")));

        Currency created = currencyService.create(
            CurrencyRequest.builder().name("  AFN ").base(true).rate(BigDecimal.ONE).build());

        assertTrue(created.isBase());
        verify(currencyRepository).clearBaseExcept(3L);
        verify(currencyRepository).markBase(3L);
    }

    @Test
    @DisplayName("Duplicate name is reported as a duplicate entry")
    void createDuplicate() {
        when(currencyRepository.insert(anyString(), anyBoolean(), any())).thenThrow(new DuplicateKeyException("uq"));

        DuplicateEntryException ex = assertThrows(DuplicateEntryException.class, () -> currencyService.create(
            CurrencyRequest.builder().name("USD").rate(BigDecimal.ONE).build()));

        assertEquals("Currency already exists: USD", ex.getMessage());
        verify(currencyRepository, never()).markBase(anyLong());
    }

    @Test
    @DisplayName("A rate change reprices the accounts holding the currency")
    void rateChangeRecomputesAccounts() {
        when(currencyRepository.findById(2L)).thenReturn(Optional.of(currency(2, "USD", false, "70")));

        currencyService.update(2L, CurrencyRequest.builder().name("USD").rate(new BigDecimal("71")).build());
        verify(balanceLedger).recomputeAccountsHolding(2L);

        clearInvocations(balanceLedger);
        currencyService.update(2L, CurrencyRequest.builder().name("USD").rate(new BigDecimal("70.000")).build());
        verify(balanceLedger, never()).recomputeAccountsHolding(anyLong());
    }

    @Test
    @DisplayName("Identity pair is 1; a pair without history is not found")
    void exchangeRateLookup() {
        LocalDate date = LocalDate.of(2024, 6, 1);
        when(currencyRepository.findLatestRate(1L, 2L, date)).thenReturn(Optional.empty());

        assertEquals(BigDecimal.ONE, currencyService.getExchangeRate(5L, 5L, date));
        assertThrows(NotFoundException.class, () -> currencyService.getExchangeRate(1L, 2L, date));
        verify(currencyRepository, never()).findLatestRate(eq(5L), eq(5L), any());
    }

    @Test
    @DisplayName("Unknown currency name raises CurrencyNotFound")
    void requireByName() {
        when(currencyRepository.findByName("XYZ")).thenReturn(Optional.empty());

        CurrencyNotFoundException ex = assertThrows(CurrencyNotFoundException.class,
            () -> currencyService.requireByName("XYZ"));

        assertEquals("Currency not found: XYZ", ex.getMessage());
    }

    @Test
    @DisplayName("Referenced currency cannot be deleted")
    void deleteInUse() {
        when(currencyRepository.findById(4L)).thenReturn(Optional.of(currency(4, "EUR", false, "80")));
        when(currencyRepository.countReferences(4L)).thenReturn(2L);

        assertThrows(ReferentialConflictException.class, () -> currencyService.delete(4L));
        verify(currencyRepository, never()).delete(anyLong());
    }

    @Test
    @DisplayName("A currency recorded by name on payments keeps its name")
    void renameReferencedByName() {
        when(currencyRepository.findById(2L)).thenReturn(Optional.of(currency(2, "USD", false, "70")));
        when(currencyRepository.countNameReferences("USD")).thenReturn(1L);

        ReferentialConflictException ex = assertThrows(ReferentialConflictException.class, () ->
            currencyService.update(2L, CurrencyRequest.builder().name("US Dollar").rate(new BigDecimal("70")).build()));

        assertTrue(ex.getMessage().contains("cannot be renamed"), ex.getMessage());
        verify(currencyRepository, never()).update(anyLong(), anyString(), anyBoolean(), any());

        currencyService.update(2L, CurrencyRequest.builder().name("USD").rate(new BigDecimal("72")).build());
        verify(currencyRepository).update(2L, "USD", false, new BigDecimal("72"));
    }

    @Test
    @DisplayName("A currency recorded only by name still blocks deletion")
    void deleteReferencedByName() {
        when(currencyRepository.findById(4L)).thenReturn(Optional.of(currency(4, "EUR", false, "80")));
        when(currencyRepository.countReferences(4L)).thenReturn(0L);
        when(currencyRepository.countNameReferences("EUR")).thenReturn(3L);

        assertThrows(ReferentialConflictException.class, () -> currencyService.delete(4L));
        verify(currencyRepository, never()).delete(anyLong());
    }
}
