package com.flagship.finance_ledger.ledger;

import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.ErrorCode;
import com.flagship.finance_ledger.ledger.dto.AccountRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class AccountServiceTest {

    private AccountRepository accountRepository;
    private BalanceLedger balanceLedger;
    private AccountService accountService;

    @BeforeEach
    void setUp() {
        accountRepository = mock(AccountRepository.class);
        balanceLedger = mock(BalanceLedger.class);
        accountService = new AccountService(accountRepository, balanceLedger);

        when(accountRepository.findById(6L)).thenReturn(Optional.of(Account.builder().id(6L).name("Cash").build()));
    }

    private void givenBalances(String stored, String debits, String credits) {
        when(balanceLedger.getBalance(6L, 2L)).thenReturn(new BigDecimal(stored));
        when(accountRepository.sumJournalDebits(6L, 2L)).thenReturn(new BigDecimal(debits));
        when(accountRepository.sumJournalCredits(6L, 2L)).thenReturn(new BigDecimal(credits));
    }

    @Test
    @DisplayName("Duplicate account code is reported as a duplicate key")
    void duplicateAccountCode() {
        when(accountRepository.insert(any())).thenThrow(new DuplicateKeyException("uq_accounts_code"));

        DuplicateEntryException ex = assertThrows(DuplicateEntryException.class, () -> accountService.create(
            AccountRequest.builder().name("Till").accountCode(" 1010 ").build()));

        assertEquals(ErrorCode.DUPLICATE_KEY, ex.getCode());
        assertEquals("Account code already exists: 1010", ex.getMessage());
        verify(balanceLedger, never()).recomputeCurrentBalance(anyLong());
    }

    @Test
    @DisplayName("A difference below one cent still counts as balanced")
    void reconcileWithinTolerance() {
        givenBalances("100.009", "250", "150");

        BalanceReconciliation result = accountService.reconcile(6L, 2L);

        assertEquals(0, new BigDecimal("100").compareTo(result.getJournalBalance()));
        assertEquals(0, new BigDecimal("0.009").compareTo(result.getDifference()));
        assertTrue(result.isBalanced());
    }

    @Test
    @DisplayName("A difference of one cent or more is reported as unbalanced")
    void reconcileOutsideTolerance() {
        givenBalances("99.99", "250", "150");

        BalanceReconciliation result = accountService.reconcile(6L, 2L);

        assertEquals(0, new BigDecimal("-0.01").compareTo(result.getDifference()));
        assertFalse(result.isBalanced());
    }

    @Test
    @DisplayName("An account without journal lines reconciles against zero")
    void reconcileWithoutJournal() {
        when(balanceLedger.getBalance(6L, 2L)).thenReturn(BigDecimal.ZERO);

        BalanceReconciliation result = accountService.reconcile(6L, 2L);

        assertEquals(0, result.getJournalDebits().signum());
        assertEquals(0, result.getJournalCredits().signum());
        assertTrue(result.isBalanced());
    }
}
