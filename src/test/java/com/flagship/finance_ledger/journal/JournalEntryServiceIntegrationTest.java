package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.LedgerFixtures;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.journal.dto.JournalEntryRequest;
import com.flagship.finance_ledger.journal.dto.JournalLineInput;
import com.flagship.finance_ledger.ledger.Account;
import com.flagship.finance_ledger.ledger.AccountService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;

import static com.flagship.finance_ledger.LedgerFixtures.DATE;
import static com.flagship.finance_ledger.LedgerFixtures.dec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Journal entries move (account, currency) balances and undo themselves
 * on update and delete.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JournalEntryServiceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("finance_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private JournalEntryService journalEntryService;

    @Autowired
    private AccountService accountService;

    private Currency usd;
    private Account cash;
    private Account revenue;

    @BeforeEach
    void setUp() {
        LedgerFixtures fixtures = new LedgerFixtures(context);
        usd = fixtures.currency("1", false);
        cash = fixtures.account("0");
        revenue = fixtures.account("0");
    }

    private JournalLineInput debit(Account account, String amount) {
        return JournalLineInput.builder().accountId(account.getId()).currencyId(usd.getId())
            .debitAmount(dec(amount)).build();
    }

    private JournalLineInput credit(Account account, String amount) {
        return JournalLineInput.builder().accountId(account.getId()).currencyId(usd.getId())
            .creditAmount(dec(amount)).build();
    }

    private JournalEntryRequest entry(JournalLineInput... lines) {
        return JournalEntryRequest.builder()
            .entryDate(DATE)
            .description("Cash sale")
            .lines(List.of(lines))
            .build();
    }

    private BigDecimal balance(Account account) {
        return accountService.getBalanceByCurrency(account.getId(), usd.getId());
    }

    @Test
    @DisplayName("Lines move each account's balance by debit minus credit")
    void createAppliesLines() {
        // Given / When
        JournalEntryDetail detail = journalEntryService.create(entry(debit(cash, "100"), credit(revenue, "100")));

        // Then
        assertTrue(detail.getEntry().getEntryNumber().matches("J\\d{6}"), detail.getEntry().getEntryNumber());
        assertEquals(2, detail.getLines().size());
        assertEquals(0, dec("100").compareTo(balance(cash)));
        assertEquals(0, dec("-100").compareTo(balance(revenue)));
        assertEquals(0, dec("100").compareTo(accountService.get(cash.getId()).getCurrentBalance()));
    }

    @Test
    @DisplayName("Update replaces the old effect instead of stacking on it")
    void updateReversesOldLines() {
        long entryId = journalEntryService.create(entry(debit(cash, "100"), credit(revenue, "100")))
            .getEntry().getId();

        journalEntryService.update(entryId, entry(debit(cash, "30")));

        assertEquals(0, dec("30").compareTo(balance(cash)));
        assertEquals(0, balance(revenue).signum());
        assertEquals(1, journalEntryService.get(entryId).getLines().size());
    }

    @Test
    @DisplayName("Deleting an entry returns balances to where they were")
    void deleteReversesLines() {
        long entryId = journalEntryService.create(entry(debit(cash, "45.5"), credit(revenue, "45.5")))
            .getEntry().getId();

        journalEntryService.delete(entryId);

        assertEquals(0, balance(cash).signum());
        assertEquals(0, balance(revenue).signum());
        assertEquals(0, accountService.get(revenue.getId()).getCurrentBalance().signum());
    }

    @Test
    @DisplayName("A line with both sides or with neither is rejected")
    void lineValidation() {
        JournalLineInput both = JournalLineInput.builder().accountId(cash.getId()).currencyId(usd.getId())
            .debitAmount(dec("5")).creditAmount(dec("5")).build();
        JournalLineInput neither = JournalLineInput.builder().accountId(cash.getId()).currencyId(usd.getId())
            .build();

        ValidationFailedException bothEx = assertThrows(ValidationFailedException.class,
            () -> journalEntryService.create(entry(both)));
        ValidationFailedException neitherEx = assertThrows(ValidationFailedException.class,
            () -> journalEntryService.create(entry(neither)));
        ValidationFailedException emptyEx = assertThrows(ValidationFailedException.class,
            () -> journalEntryService.create(entry()));

        assertEquals("A journal line cannot have both a debit and a credit", bothEx.getMessage());
        assertEquals("A journal line needs a debit or a credit amount", neitherEx.getMessage());
        assertEquals("Journal entry must have at least one line", emptyEx.getMessage());
        assertEquals(0, balance(cash).signum());
    }

    @Test
    @DisplayName("Entry numbers are sequential")
    void entryNumbersIncrement() {
        String first = journalEntryService.create(entry(debit(cash, "5"), credit(revenue, "5"))).getEntry().getEntryNumber();
        String second = journalEntryService.create(entry(debit(cash, "5"), credit(revenue, "5"))).getEntry().getEntryNumber();

        assertEquals(Integer.parseInt(first.substring(1)) + 1, Integer.parseInt(second.substring(1)));
    }
}
