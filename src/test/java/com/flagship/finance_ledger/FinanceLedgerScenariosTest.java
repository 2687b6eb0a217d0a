package com.flagship.finance_ledger;

import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.discount.DiscountType;
import com.flagship.finance_ledger.exception.InsufficientFundsException;
import com.flagship.finance_ledger.exception.InsufficientStockException;
import com.flagship.finance_ledger.inventory.BatchInventoryLedger;
import com.flagship.finance_ledger.inventory.ProductBatch;
import com.flagship.finance_ledger.ledger.Account;
import com.flagship.finance_ledger.ledger.AccountService;
import com.flagship.finance_ledger.ledger.AccountTransactionService;
import com.flagship.finance_ledger.ledger.dto.AccountTransactionRequest;
import com.flagship.finance_ledger.purchase.PurchaseDetail;
import com.flagship.finance_ledger.sale.Sale;
import com.flagship.finance_ledger.sale.SaleDetail;
import com.flagship.finance_ledger.sale.SaleItemService;
import com.flagship.finance_ledger.sale.SaleService;
import com.flagship.finance_ledger.sale.dto.SaleItemInput;
import com.flagship.finance_ledger.sale.dto.SaleItemRequest;
import com.flagship.finance_ledger.sale.dto.SaleRequest;
import com.flagship.finance_ledger.unit.Unit;
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
 * End-to-end flows over a real database: purchase creates a batch, sales
 * consume it, deposits and withdrawals move account balances.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class FinanceLedgerScenariosTest {

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
    private SaleService saleService;

    @Autowired
    private SaleItemService saleItemService;

    @Autowired
    private BatchInventoryLedger batchInventoryLedger;

    @Autowired
    private AccountService accountService;

    @Autowired
    private AccountTransactionService accountTransactionService;

    @Autowired
    private CurrencyService currencyService;

    private LedgerFixtures fixtures;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(context);
    }

    private BigDecimal remaining(long productId, long purchaseItemId) {
        return batchInventoryLedger.getProductBatches(productId).stream()
            .filter(batch -> batch.getPurchaseItemId().equals(purchaseItemId))
            .map(ProductBatch::getRemainingQuantity)
            .findFirst()
            .orElse(BigDecimal.ZERO);
    }

    private static SaleItemInput saleItem(long productId, long unitId, String price, String amount, Long batch) {
        return SaleItemInput.builder()
            .productId(productId)
            .unitId(unitId)
            .perPrice(dec(price))
            .amount(dec(amount))
            .purchaseItemId(batch)
            .build();
    }

    @Test
    @DisplayName("Purchase of 100 pieces at 10 totals 1000 and opens a batch of 100")
    void purchaseCreatesBatch() {
        printTestHeader("Purchase creates batch");

        // Given
        Unit pcs = fixtures.unit("1");
        long productId = fixtures.product();

        // When
        PurchaseDetail purchase = fixtures.purchase(productId, pcs.getId(), "10", "100");
        long batchId = purchase.getItems().get(0).getId();
        printOutput("Purchase", purchase.getPurchase());

        // Then
        assertEquals(0, dec("1000").compareTo(purchase.getPurchase().getTotalAmount()));
        assertTrue(purchase.getPurchase().getBatchNumber().matches("BATCH-\\d{6}"),
            purchase.getPurchase().getBatchNumber());
        assertEquals(0, dec("100").compareTo(remaining(productId, batchId)));

        printSuccess("Batch opened with 100 remaining");
    }

    @Test
    @DisplayName("Selling 30 leaves 70; a further line of 80 is rejected and stock is unchanged")
    void saleConsumesBatch() {
        printTestHeader("Sale consumes batch");

        // Given
        Unit pcs = fixtures.unit("1");
        long productId = fixtures.product();
        long batchId = fixtures.purchase(productId, pcs.getId(), "10", "100").getItems().get(0).getId();

        // When
        SaleDetail sale = saleService.create(SaleRequest.builder()
            .customerId(fixtures.customer())
            .date(DATE)
            .items(List.of(saleItem(productId, pcs.getId(), "15", "30", batchId)))
            .build());
        printOutput("Remaining after first sale", remaining(productId, batchId));

        // Then
        assertEquals(0, dec("70").compareTo(remaining(productId, batchId)));

        SaleItemRequest oversell = SaleItemRequest.builder()
            .saleId(sale.getSale().getId())
            .item(saleItem(productId, pcs.getId(), "15", "80", batchId))
            .build();
        printInput("Extra line amount", 80);
        assertThrows(InsufficientStockException.class, () -> saleItemService.createItem(oversell));

        assertEquals(0, dec("70").compareTo(remaining(productId, batchId)));
        assertEquals(1, saleItemService.getItems(sale.getSale().getId()).size());

        printSuccess("Oversell rejected, batch unchanged");
    }

    @Test
    @DisplayName("Two lines of one sale cannot jointly oversell a batch")
    void crossLineOversell() {
        Unit pcs = fixtures.unit("1");
        long productId = fixtures.product();
        long batchId = fixtures.purchase(productId, pcs.getId(), "10", "100").getItems().get(0).getId();

        SaleRequest request = SaleRequest.builder()
            .customerId(fixtures.customer())
            .date(DATE)
            .items(List.of(
                saleItem(productId, pcs.getId(), "15", "60", batchId),
                saleItem(productId, pcs.getId(), "15", "50", batchId)))
            .build();

        assertThrows(InsufficientStockException.class, () -> saleService.create(request));
        assertEquals(0, dec("100").compareTo(remaining(productId, batchId)));
    }

    @Test
    @DisplayName("Deposit 50, withdraw 20, then an overdraft of 100 is rejected")
    void depositAndWithdraw() {
        printTestHeader("Deposit and withdraw");

        // Given
        Currency usd = fixtures.currency("1", false);
        Account account = fixtures.account("0");

        // When
        fixtures.deposit(account.getId(), usd, "50");

        // Then
        assertEquals(0, dec("50").compareTo(accountService.getBalanceByCurrency(account.getId(), usd.getId())));
        assertEquals(0, dec("50").compareTo(accountService.get(account.getId()).getCurrentBalance()));

        accountTransactionService.withdraw(withdrawal(account.getId(), usd, "20"));
        assertEquals(0, dec("30").compareTo(accountService.getBalanceByCurrency(account.getId(), usd.getId())));
        assertEquals(0, dec("30").compareTo(accountService.get(account.getId()).getCurrentBalance()));

        printInput("Overdraft", 100);
        assertThrows(InsufficientFundsException.class,
            () -> accountTransactionService.withdraw(withdrawal(account.getId(), usd, "100")));
        assertEquals(0, dec("30").compareTo(accountService.getBalanceByCurrency(account.getId(), usd.getId())));
        assertEquals(2, accountTransactionService.getTransactions(account.getId()).size());

        printSuccess("Balances 50 -> 30, overdraft rejected");
    }

    private static AccountTransactionRequest withdrawal(long accountId, Currency currency, String amount) {
        return AccountTransactionRequest.builder()
            .accountId(accountId)
            .currency(currency.getName())
            .amount(dec(amount))
            .transactionDate(DATE)
            .build();
    }

    @Test
    @DisplayName("Current balance adds the initial balance and converts every currency at its rate")
    void currentBalanceAcrossCurrencies() {
        Currency usd = fixtures.currency("1", false);
        Currency eur = fixtures.currency("1.5", false);
        Account account = fixtures.account("10");

        fixtures.deposit(account.getId(), usd, "20");
        fixtures.deposit(account.getId(), eur, "10");

        assertEquals(0, dec("45").compareTo(accountService.get(account.getId()).getCurrentBalance()));
        assertEquals(2, accountService.getCurrencyBalances(account.getId()).size());
    }

    @Test
    @DisplayName("One item of 100 with a 10% order discount totals 90")
    void orderDiscount() {
        printTestHeader("Order discount");

        long productId = fixtures.product();
        Unit pcs = fixtures.unit("1");

        SaleDetail sale = saleService.create(SaleRequest.builder()
            .customerId(fixtures.customer())
            .date(DATE)
            .items(List.of(saleItem(productId, pcs.getId(), "100", "1", null)))
            .orderDiscountType(DiscountType.PERCENT)
            .orderDiscountValue(dec("10"))
            .build());

        printOutput("Sale", sale.getSale());
        assertEquals(0, dec("90").compareTo(sale.getSale().getTotalAmount()));
        assertEquals(0, dec("10").compareTo(sale.getSale().getOrderDiscountAmount()));

        printSuccess("Total is 90");
    }

    @Test
    @DisplayName("Recomputing a sale twice without line changes gives the same totals")
    void recomputeIsIdempotent() {
        long productId = fixtures.product();
        Unit pcs = fixtures.unit("1");
        SaleDetail sale = saleService.create(SaleRequest.builder()
            .customerId(fixtures.customer())
            .date(DATE)
            .items(List.of(
                saleItem(productId, pcs.getId(), "19.99", "3", null),
                saleItem(productId, pcs.getId(), "4.50", "2", null)))
            .orderDiscountType(DiscountType.FIXED)
            .orderDiscountValue(dec("5"))
            .build());
        long saleId = sale.getSale().getId();

        Sale first = saleItemService.recompute(saleId);
        Sale second = saleItemService.recompute(saleId);

        assertEquals(0, first.getTotalAmount().compareTo(second.getTotalAmount()));
        assertEquals(0, first.getBaseAmount().compareTo(second.getBaseAmount()));
        assertEquals(0, sale.getSale().getTotalAmount().compareTo(first.getTotalAmount()));
        assertEquals(0, dec("63.97").compareTo(first.getTotalAmount()));
    }

    @Test
    @DisplayName("Setting a base currency leaves exactly one base currency")
    void singleBaseCurrency() {
        Currency first = fixtures.currency("1", true);
        Currency second = fixtures.currency("2", false);

        currencyService.setBase(second.getId());

        List<Currency> bases = currencyService.list().stream().filter(Currency::isBase).toList();
        assertEquals(1, bases.size());
        assertEquals(second.getId(), bases.get(0).getId());
        assertFalse(currencyService.get(first.getId()).isBase());
    }
}
