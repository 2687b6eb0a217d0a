package com.flagship.finance_ledger.purchase;

import com.flagship.finance_ledger.LedgerFixtures;
import com.flagship.finance_ledger.catalog.CatalogService;
import com.flagship.finance_ledger.common.AdditionalCostInput;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.currency.dto.CurrencyRequest;
import com.flagship.finance_ledger.exception.InsufficientFundsException;
import com.flagship.finance_ledger.exception.InsufficientStockException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.inventory.BatchInventoryLedger;
import com.flagship.finance_ledger.ledger.Account;
import com.flagship.finance_ledger.ledger.AccountService;
import com.flagship.finance_ledger.purchase.dto.PurchaseAdditionalCostRequest;
import com.flagship.finance_ledger.purchase.dto.PurchaseItemInput;
import com.flagship.finance_ledger.purchase.dto.PurchasePaymentRequest;
import com.flagship.finance_ledger.purchase.dto.PurchaseRequest;
import com.flagship.finance_ledger.sale.SaleService;
import com.flagship.finance_ledger.sale.dto.SaleItemInput;
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
import static com.flagship.finance_ledger.LedgerFixtures.purchaseItem;
import static com.flagship.finance_ledger.LedgerFixtures.unique;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Purchase edits against sold batches, additional costs and payments.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class PurchaseServiceIntegrationTest {

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
    private PurchaseService purchaseService;

    @Autowired
    private PurchasePaymentService purchasePaymentService;

    @Autowired
    private SaleService saleService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private CurrencyService currencyService;

    @Autowired
    private BatchInventoryLedger batchInventoryLedger;

    private LedgerFixtures fixtures;
    private Unit pcs;
    private long productId;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(context);
        pcs = fixtures.unit("1");
        productId = fixtures.product();
    }

    private void sell(long batchId, String amount) {
        saleService.create(SaleRequest.builder()
            .customerId(fixtures.customer())
            .date(DATE)
            .items(List.of(SaleItemInput.builder()
                .productId(productId)
                .unitId(pcs.getId())
                .perPrice(dec("12"))
                .amount(dec(amount))
                .purchaseItemId(batchId)
                .build()))
            .build());
    }

    private PurchaseRequest replaceItems(PurchaseDetail purchase, List<PurchaseItemInput> items) {
        return PurchaseRequest.builder()
            .supplierId(purchase.getPurchase().getSupplierId())
            .date(DATE)
            .items(items)
            .build();
    }

    @Test
    @DisplayName("Purchase total includes additional costs and follows item-level cost edits")
    void totalWithAdditionalCosts() {
        PurchaseDetail purchase = purchaseService.create(PurchaseRequest.builder()
            .supplierId(fixtures.supplier())
            .date(DATE)
            .items(List.of(purchaseItem(productId, pcs.getId(), "2.5", "40")))
            .additionalCosts(List.of(AdditionalCostInput.builder().name("Shipping").amount(dec("15")).build()))
            .build());
        long purchaseId = purchase.getPurchase().getId();

        assertEquals(0, dec("115").compareTo(purchase.getPurchase().getTotalAmount()));
        assertEquals(0, dec("15").compareTo(purchase.getPurchase().getAdditionalCost()));

        purchaseService.createAdditionalCost(PurchaseAdditionalCostRequest.builder()
            .purchaseId(purchaseId).name("Customs").amount(dec("5")).build());
        Purchase afterAdd = purchaseService.get(purchaseId).getPurchase();
        assertEquals(0, dec("120").compareTo(afterAdd.getTotalAmount()));
        assertEquals(0, dec("20").compareTo(afterAdd.getAdditionalCost()));

        long shippingId = purchase.getAdditionalCosts().get(0).getId();
        purchaseService.deleteAdditionalCost(shippingId);
        assertEquals(0, dec("105").compareTo(purchaseService.get(purchaseId).getPurchase().getTotalAmount()));
    }

    @Test
    @DisplayName("A sold batch cannot be removed from its purchase or shrunk below what was sold")
    void soldBatchIsProtected() {
        PurchaseDetail purchase = fixtures.purchase(productId, pcs.getId(), "10", "100");
        long purchaseId = purchase.getPurchase().getId();
        long batchId = purchase.getItems().get(0).getId();
        sell(batchId, "30");

        PurchaseItemInput replacement = purchaseItem(productId, pcs.getId(), "10", "50");
        assertThrows(ReferentialConflictException.class,
            () -> purchaseService.update(purchaseId, replaceItems(purchase, List.of(replacement))));

        PurchaseItemInput shrunk = PurchaseItemInput.builder()
            .id(batchId).productId(productId).unitId(pcs.getId())
            .perPrice(dec("10")).amount(dec("20")).build();
        assertThrows(InsufficientStockException.class,
            () -> purchaseService.update(purchaseId, replaceItems(purchase, List.of(shrunk))));

        PurchaseItemInput resized = PurchaseItemInput.builder()
            .id(batchId).productId(productId).unitId(pcs.getId())
            .perPrice(dec("10")).amount(dec("30")).build();
        PurchaseDetail updated = purchaseService.update(purchaseId, replaceItems(purchase, List.of(resized)));
        assertEquals(0, dec("300").compareTo(updated.getPurchase().getTotalAmount()));

        assertThrows(ReferentialConflictException.class, () -> purchaseService.delete(purchaseId));
        assertThrows(ReferentialConflictException.class, () -> purchaseService.deleteItem(batchId));
    }

    @Test
    @DisplayName("An unsold purchase can be deleted")
    void deleteUnsoldPurchase() {
        long purchaseId = fixtures.purchase(productId, pcs.getId(), "10", "5").getPurchase().getId();

        purchaseService.delete(purchaseId);

        assertThrows(NotFoundException.class,
            () -> purchaseService.get(purchaseId));
    }

    @Test
    @DisplayName("Purchase payment withdraws from the account and deleting it restores the balance")
    void paymentWithdrawsAndDeleteRestores() {
        Currency usd = fixtures.currency("1", false);
        Account account = fixtures.account("0");
        fixtures.deposit(account.getId(), usd, "500");
        long purchaseId = fixtures.purchase(productId, pcs.getId(), "10", "20").getPurchase().getId();

        PurchasePayment payment = purchasePaymentService.create(PurchasePaymentRequest.builder()
            .purchaseId(purchaseId)
            .accountId(account.getId())
            .amount(dec("200"))
            .currency(usd.getName())
            .date(DATE)
            .build());

        assertEquals(0, dec("300").compareTo(accountService.getBalanceByCurrency(account.getId(), usd.getId())));
        assertEquals(0, dec("200").compareTo(payment.getTotal()));

        purchasePaymentService.delete(payment.getId());

        assertEquals(0, dec("500").compareTo(accountService.getBalanceByCurrency(account.getId(), usd.getId())));
        assertEquals(0, dec("500").compareTo(accountService.get(account.getId()).getCurrentBalance()));
        assertTrue(purchasePaymentService.getPayments(purchaseId).isEmpty());
    }

    @Test
    @DisplayName("Editing a payment swaps the old withdrawal for the new one")
    void paymentUpdate() {
        Currency usd = fixtures.currency("1", false);
        Account account = fixtures.account("0");
        fixtures.deposit(account.getId(), usd, "100");
        long purchaseId = fixtures.purchase(productId, pcs.getId(), "10", "20").getPurchase().getId();
        PurchasePaymentRequest.PurchasePaymentRequestBuilder request = PurchasePaymentRequest.builder()
            .purchaseId(purchaseId)
            .accountId(account.getId())
            .currency(usd.getName())
            .date(DATE);

        PurchasePayment payment = purchasePaymentService.create(request.amount(dec("80")).build());
        // the old 80 is given back before the new 90 is checked
        purchasePaymentService.update(payment.getId(), request.amount(dec("90")).build());
        assertEquals(0, dec("10").compareTo(accountService.getBalanceByCurrency(account.getId(), usd.getId())));

        assertThrows(InsufficientFundsException.class,
            () -> purchasePaymentService.update(payment.getId(), request.amount(dec("150")).build()));
        assertEquals(0, dec("10").compareTo(accountService.getBalanceByCurrency(account.getId(), usd.getId())));
    }

    @Test
    @DisplayName("Purchase payment beyond the account balance is rejected")
    void paymentRequiresFunds() {
        Currency usd = fixtures.currency("1", false);
        Account account = fixtures.account("0");
        fixtures.deposit(account.getId(), usd, "50");
        long purchaseId = fixtures.purchase(productId, pcs.getId(), "10", "20").getPurchase().getId();

        assertThrows(InsufficientFundsException.class, () -> purchasePaymentService.create(
            PurchasePaymentRequest.builder()
                .purchaseId(purchaseId)
                .accountId(account.getId())
                .amount(dec("60"))
                .currency(usd.getName())
                .date(DATE)
                .build()));
        assertTrue(purchasePaymentService.getPayments(purchaseId).isEmpty());
    }

    @Test
    @DisplayName("A batch bought in twelfths can be sold down to exactly one base unit")
    void nonTerminatingRatioKeepsFullStock() {
        Unit twelfth = fixtures.unit("0.083333333333333333333333333333");
        long batchId = fixtures.purchase(productId, twelfth.getId(), "1", "12").getItems().get(0).getId();

        assertDoesNotThrow(() -> sell(batchId, "1"));

        assertTrue(batchInventoryLedger.remainingBase(batchId).abs().compareTo(dec("1e-9")) < 0);
        assertThrows(InsufficientStockException.class, () -> sell(batchId, "0.001"));
    }

    @Test
    @DisplayName("A currency used by a purchase payment cannot be renamed, so the payment stays reversible")
    void renameBlockedWhilePaymentRecordsCurrency() {
        Currency usd = fixtures.currency("1", false);
        Account account = fixtures.account("0");
        fixtures.deposit(account.getId(), usd, "500");
        long purchaseId = fixtures.purchase(productId, pcs.getId(), "10", "20").getPurchase().getId();
        PurchasePayment payment = purchasePaymentService.create(PurchasePaymentRequest.builder()
            .purchaseId(purchaseId)
            .accountId(account.getId())
            .amount(dec("120"))
            .currency(usd.getName())
            .date(DATE)
            .build());

        assertThrows(ReferentialConflictException.class, () -> currencyService.update(usd.getId(),
            CurrencyRequest.builder().name(unique("renamed")).rate(dec("1")).build()));
        assertEquals(usd.getName(), currencyService.get(usd.getId()).getName());

        purchasePaymentService.delete(payment.getId());
        assertEquals(0, dec("500").compareTo(accountService.getBalanceByCurrency(account.getId(), usd.getId())));
    }

    @Test
    @DisplayName("Payments of an unknown purchase are not found")
    void paymentsOfUnknownPurchase() {
        assertThrows(NotFoundException.class, () -> purchasePaymentService.getPayments(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("A product bought on a purchase cannot be deleted from the catalog")
    void purchasedProductIsProtected() {
        fixtures.purchase(productId, pcs.getId(), "10", "5");
        CatalogService catalogService = context.getBean(CatalogService.class);

        assertThrows(ReferentialConflictException.class, () -> catalogService.deleteProduct(productId));
        assertEquals(productId, catalogService.requireProduct(productId).getId());
    }
}
