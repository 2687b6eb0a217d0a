package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.LedgerFixtures;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.discount.DiscountCode;
import com.flagship.finance_ledger.discount.DiscountCodeService;
import com.flagship.finance_ledger.discount.DiscountType;
import com.flagship.finance_ledger.discount.dto.DiscountCodeRequest;
import com.flagship.finance_ledger.exception.InsufficientStockException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.ledger.Account;
import com.flagship.finance_ledger.inventory.BatchInventoryLedger;
import com.flagship.finance_ledger.ledger.AccountService;
import com.flagship.finance_ledger.sale.dto.SaleItemInput;
import com.flagship.finance_ledger.sale.dto.SaleItemRequest;
import com.flagship.finance_ledger.sale.dto.SalePaymentRequest;
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

import java.util.List;

import static com.flagship.finance_ledger.LedgerFixtures.DATE;
import static com.flagship.finance_ledger.LedgerFixtures.dec;
import static com.flagship.finance_ledger.LedgerFixtures.unique;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Sale edits against batch stock, payments against accounts, line removal and
 * discount code redemption.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class SaleServiceIntegrationTest {

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
    private SalePaymentService salePaymentService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private DiscountCodeService discountCodeService;

    @Autowired
    private BatchInventoryLedger batchInventoryLedger;

    private LedgerFixtures fixtures;
    private Currency usd;
    private Unit pcs;
    private long productId;
    private long batchId;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(context);
        usd = fixtures.currency("1", false);
        pcs = fixtures.unit("1");
        productId = fixtures.product();
        batchId = fixtures.purchase(productId, pcs.getId(), "8", "100").getItems().get(0).getId();
    }

    private SaleRequest.SaleRequestBuilder saleOf(String amount) {
        return SaleRequest.builder()
            .customerId(fixtures.customer())
            .date(DATE)
            .currencyId(usd.getId())
            .items(List.of(line(batchId, amount)));
    }

    private SaleItemInput line(long batch, String amount) {
        return SaleItemInput.builder()
            .productId(productId)
            .unitId(pcs.getId())
            .perPrice(dec("12"))
            .amount(dec(amount))
            .purchaseItemId(batch)
            .build();
    }

    private String remaining(long batch) {
        return batchInventoryLedger.remainingBase(batch).stripTrailingZeros().toPlainString();
    }

    private SalePayment pay(long saleId, Long accountId, String amount) {
        return salePaymentService.create(SalePaymentRequest.builder()
            .saleId(saleId)
            .accountId(accountId)
            .amount(dec(amount))
            .date(DATE)
            .build());
    }

    private String balance(Account account) {
        return accountService.getBalanceByCurrency(account.getId(), usd.getId()).stripTrailingZeros().toPlainString();
    }

    @Test
    @DisplayName("Payment into an account deposits there and deleting it withdraws again")
    void paymentCreditsAccount() {
        Account account = fixtures.account("0");
        long saleId = saleService.create(saleOf("5").build()).getSale().getId();

        SalePayment payment = pay(saleId, account.getId(), "40");

        assertEquals(usd.getId(), payment.getCurrencyId());
        assertEquals("40", balance(account));
        assertEquals(0, dec("40").compareTo(saleService.get(saleId).getSale().getPaidAmount()));

        salePaymentService.delete(payment.getId());

        assertEquals("0", balance(account));
        assertEquals(0, saleService.get(saleId).getSale().getPaidAmount().signum());
        assertTrue(salePaymentService.getPayments(saleId).isEmpty());
    }

    @Test
    @DisplayName("Paid amount given at creation is recorded as a payment without an account")
    void initialPayment() {
        SaleDetail sale = saleService.create(saleOf("5").paidAmount(dec("25")).build());
        long saleId = sale.getSale().getId();

        List<SalePayment> payments = salePaymentService.getPayments(saleId);

        assertEquals(1, payments.size());
        assertNull(payments.get(0).getAccountId());
        assertEquals(0, dec("25").compareTo(payments.get(0).getAmount()));
        assertEquals(0, dec("25").compareTo(sale.getSale().getPaidAmount()));
        assertEquals(0, dec("60").compareTo(sale.getSale().getTotalAmount()));
    }

    @Test
    @DisplayName("The only line of a sale cannot be deleted")
    void lastLineIsKept() {
        SaleDetail sale = saleService.create(saleOf("2").build());
        long itemId = sale.getItems().get(0).getId();

        ValidationFailedException ex = assertThrows(ValidationFailedException.class,
            () -> saleItemService.deleteItem(itemId));

        assertEquals("Sale must have at least one item or service", ex.getMessage());
        assertEquals(1, saleItemService.getItems(sale.getSale().getId()).size());
    }

    @Test
    @DisplayName("Deleting a sale withdraws its account payments")
    void deleteReversesPayments() {
        Account account = fixtures.account("0");
        long saleId = saleService.create(saleOf("5").build()).getSale().getId();
        pay(saleId, account.getId(), "60");
        assertEquals("60", balance(account));

        saleService.delete(saleId);

        assertEquals("0", balance(account));
        assertThrows(NotFoundException.class, () -> saleService.get(saleId));
    }

    @Test
    @DisplayName("A discount code is consumed by the sale that uses it")
    void discountCodeRedeemed() {
        DiscountCode code = discountCodeService.create(DiscountCodeRequest.builder()
            .code(unique("ONCE"))
            .type(DiscountType.FIXED)
            .value(dec("5"))
            .maxUses(1)
            .build());

        saleService.create(saleOf("1").discountCodeId(code.getId()).build());
        assertEquals(1, discountCodeService.get(code.getId()).getUseCount());

        assertThrows(ValidationFailedException.class,
            () -> saleService.create(saleOf("1").discountCodeId(code.getId()).build()));
        assertEquals(1, discountCodeService.get(code.getId()).getUseCount());
    }

    @Test
    @DisplayName("Updating a sale counts its own lines as available again")
    void updateReleasesOldLines() {
        SaleDetail sale = saleService.create(saleOf("30").build());
        long saleId = sale.getSale().getId();
        SaleRequest.SaleRequestBuilder request = SaleRequest.builder()
            .customerId(sale.getSale().getCustomerId())
            .date(DATE)
            .currencyId(usd.getId());

        assertThrows(InsufficientStockException.class,
            () -> saleService.update(saleId, request.items(List.of(line(batchId, "101"))).build()));

        List<SaleItem> kept = saleService.get(saleId).getItems();
        assertEquals(1, kept.size());
        assertEquals(0, dec("30").compareTo(kept.get(0).getAmount()));
        assertEquals("70", remaining(batchId));

        SaleDetail updated = saleService.update(saleId, request.items(List.of(line(batchId, "100"))).build());

        assertEquals(0, dec("1200").compareTo(updated.getSale().getTotalAmount()));
        assertEquals("0", remaining(batchId));
    }

    @Test
    @DisplayName("Editing a line gives back its stock only when it stays on the same batch")
    void updateItemGiveBack() {
        SaleDetail sale = saleService.create(saleOf("30").build());
        long itemId = sale.getItems().get(0).getId();
        long saleId = sale.getSale().getId();

        SaleItem grown = saleItemService.updateItem(itemId,
            SaleItemRequest.builder().item(line(batchId, "100")).build());
        assertEquals(0, dec("100").compareTo(grown.getAmount()));
        assertEquals("0", remaining(batchId));

        long otherBatch = fixtures.purchase(productId, pcs.getId(), "8", "100").getItems().get(0).getId();
        saleService.create(saleOf("1").items(List.of(line(otherBatch, "80"))).build());

        assertThrows(InsufficientStockException.class, () -> saleItemService.updateItem(itemId,
            SaleItemRequest.builder().item(line(otherBatch, "30")).build()));
        assertEquals(batchId, saleItemService.getItems(saleId).get(0).getPurchaseItemId());

        saleItemService.updateItem(itemId, SaleItemRequest.builder().item(line(otherBatch, "20")).build());
        assertEquals("100", remaining(batchId));
        assertEquals("0", remaining(otherBatch));
        assertEquals(0, dec("240").compareTo(saleService.get(saleId).getSale().getTotalAmount()));
    }
}
