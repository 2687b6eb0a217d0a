package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.catalog.CatalogService;
import com.flagship.finance_ledger.catalog.PartyKind;
import com.flagship.finance_ledger.common.AdditionalCostInput;
import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.common.PageQuery;
import com.flagship.finance_ledger.common.PagedResult;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.discount.DiscountCodeService;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.inventory.BatchDemand;
import com.flagship.finance_ledger.inventory.BatchInventoryLedger;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.sale.dto.SaleItemInput;
import com.flagship.finance_ledger.sale.dto.SaleRequest;
import com.flagship.finance_ledger.sale.dto.SaleServiceItemInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sale aggregate: create, full-replace update, delete and reads.
 *
 * Create and update check every product line against its batch together,
 * before any line is written, while holding row locks on the referenced
 * batches. Each operation is one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SaleService {

    private final SaleRepository saleRepository;
    private final SaleItemService saleItemService;
    private final SalePaymentService salePaymentService;
    private final BatchInventoryLedger batchInventoryLedger;
    private final DiscountCodeService discountCodeService;
    private final CatalogService catalogService;
    private final CurrencyService currencyService;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public SaleDetail create(SaleRequest request) {
        validate(request);
        checkStock(request);

        List<SaleItem> items = new ArrayList<>();
        for (SaleItemInput input : request.getItems()) {
            items.add(saleItemService.toItem(null, 0L, input));
        }
        List<SaleServiceItem> serviceItems = new ArrayList<>();
        for (SaleServiceItemInput input : request.getServiceItems()) {
            serviceItems.add(saleItemService.toServiceItem(null, 0L, input));
        }
        SalePricing.Totals totals = price(request, items, serviceItems);

        long saleId = saleRepository.insert(header(null, request, totals));
        MDC.put(CorrelationContext.SALE_ID_MDC_KEY, String.valueOf(saleId));
        try {
            insertLines(saleId, items, serviceItems, request.getAdditionalCosts());

            if (Money.isPositive(request.getPaidAmount())) {
                salePaymentService.recordInitialPayment(saleId, request.getCurrencyId(), request.getExchangeRate(),
                    request.getPaidAmount(), request.getDate());
            }
            if (request.getDiscountCodeId() != null) {
                discountCodeService.redeem(request.getDiscountCodeId());
            }

            ledgerMetrics.incrementSalesCreated();
            log.info("Sale created: id={}, customer={}, items={}, services={}, total={}",
                saleId, request.getCustomerId(), items.size(), serviceItems.size(), totals.getTotalAmount());
            return get(saleId);
        } finally {
            MDC.remove(CorrelationContext.SALE_ID_MDC_KEY);
        }
    }

    /**
     * Replaces header, lines and additional costs. Payments and paid_amount
     * are kept. The old lines are removed before the new set is checked, so
     * stock they held counts as available again.
     */
    @Transactional
    public SaleDetail update(long saleId, SaleRequest request) {
        if (!saleRepository.lock(saleId)) {
            throw NotFoundException.of("Sale", saleId);
        }
        Sale existing = requireSale(saleId);
        validate(request);

        List<Long> batches = new ArrayList<>();
        saleRepository.findItems(saleId).forEach(item -> batches.add(item.getPurchaseItemId()));
        request.getItems().forEach(item -> batches.add(item.getPurchaseItemId()));
        batchInventoryLedger.lockBatches(batches);

        saleRepository.deleteItems(saleId);
        saleRepository.deleteServiceItems(saleId);
        saleRepository.deleteAdditionalCosts(saleId);
        batchInventoryLedger.checkLines(demands(request));

        List<SaleItem> items = new ArrayList<>();
        for (SaleItemInput input : request.getItems()) {
            items.add(saleItemService.toItem(null, saleId, input));
        }
        List<SaleServiceItem> serviceItems = new ArrayList<>();
        for (SaleServiceItemInput input : request.getServiceItems()) {
            serviceItems.add(saleItemService.toServiceItem(null, saleId, input));
        }
        SalePricing.Totals totals = price(request, items, serviceItems);

        saleRepository.updateHeader(header(saleId, request, totals));
        insertLines(saleId, items, serviceItems, request.getAdditionalCosts());

        if (request.getDiscountCodeId() != null
            && !Objects.equals(request.getDiscountCodeId(), existing.getDiscountCodeId())) {
            discountCodeService.redeem(request.getDiscountCodeId());
        }

        log.info("Sale updated: id={}, items={}, services={}, total={}",
            saleId, items.size(), serviceItems.size(), totals.getTotalAmount());
        return get(saleId);
    }

    /**
     * Deletes a sale with its lines and payments. Account-linked payments are
     * reversed first; the batches it consumed become available again.
     */
    @Transactional
    public void delete(long saleId) {
        if (!saleRepository.lock(saleId)) {
            throw NotFoundException.of("Sale", saleId);
        }
        salePaymentService.reverseAll(saleId);
        saleRepository.delete(saleId);
        log.info("Sale deleted: id={}", saleId);
    }

    @Transactional(readOnly = true)
    public SaleDetail get(long saleId) {
        Sale sale = requireSale(saleId);
        return new SaleDetail(sale,
            saleRepository.findItems(saleId),
            saleRepository.findServiceItems(saleId),
            saleRepository.findAdditionalCosts(saleId));
    }

    @Transactional(readOnly = true)
    public PagedResult<Sale> list(PageQuery query) {
        return PagedResult.of(saleRepository.findPage(query), saleRepository.count(query), query);
    }

    private void validate(SaleRequest request) {
        if (request.getItems().isEmpty() && request.getServiceItems().isEmpty()) {
            throw new ValidationFailedException("Sale must have at least one item or service");
        }
        if (request.getCustomerId() == null) {
            throw new ValidationFailedException("Customer is required");
        }
        if (request.getDate() == null) {
            throw new ValidationFailedException("Date is required");
        }
        if (request.getExchangeRate().signum() <= 0) {
            throw new ValidationFailedException("Exchange rate must be greater than 0");
        }
        catalogService.requireParty(PartyKind.CUSTOMER, request.getCustomerId());
        if (request.getCurrencyId() != null) {
            currencyService.get(request.getCurrencyId());
        }
        request.getItems().forEach(saleItemService::validateItem);
    }

    private void checkStock(SaleRequest request) {
        List<Long> batches = new ArrayList<>();
        request.getItems().forEach(item -> batches.add(item.getPurchaseItemId()));
        batchInventoryLedger.lockBatches(batches);
        batchInventoryLedger.checkLines(demands(request));
    }

    private static List<BatchDemand> demands(SaleRequest request) {
        return request.getItems().stream().map(SaleItemService::demand).toList();
    }

    private static SalePricing.Totals price(SaleRequest request, List<SaleItem> items,
                                            List<SaleServiceItem> serviceItems) {
        List<BigDecimal> lineTotals = new ArrayList<>();
        items.forEach(item -> lineTotals.add(item.getTotal()));
        serviceItems.forEach(item -> lineTotals.add(item.getTotal()));
        BigDecimal additionalCost = request.getAdditionalCosts().stream()
            .map(cost -> Money.orZero(cost.getAmount()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return SalePricing.totals(lineTotals, request.getOrderDiscountType(), request.getOrderDiscountValue(),
            additionalCost, request.getExchangeRate());
    }

    private static Sale header(Long saleId, SaleRequest request, SalePricing.Totals totals) {
        return Sale.builder()
            .id(saleId)
            .customerId(request.getCustomerId())
            .date(request.getDate())
            .notes(request.getNotes())
            .currencyId(request.getCurrencyId())
            .exchangeRate(request.getExchangeRate())
            .totalAmount(totals.getTotalAmount())
            .baseAmount(totals.getBaseAmount())
            .paidAmount(BigDecimal.ZERO)
            .additionalCost(totals.getAdditionalCost())
            .orderDiscountType(request.getOrderDiscountType())
            .orderDiscountValue(Money.orZero(request.getOrderDiscountValue()))
            .orderDiscountAmount(totals.getOrderDiscountAmount())
            .discountCodeId(request.getDiscountCodeId())
            .build();
    }

    private void insertLines(long saleId, List<SaleItem> items, List<SaleServiceItem> serviceItems,
                             List<AdditionalCostInput> costs) {
        for (SaleItem item : items) {
            saleRepository.insertItem(item.toBuilder().saleId(saleId).build());
        }
        for (SaleServiceItem item : serviceItems) {
            saleRepository.insertServiceItem(item.toBuilder().saleId(saleId).build());
        }
        for (AdditionalCostInput cost : costs) {
            saleRepository.insertAdditionalCost(saleId, cost.getName(), Money.orZero(cost.getAmount()));
        }
    }

    private Sale requireSale(long saleId) {
        return saleRepository.findById(saleId).orElseThrow(() -> NotFoundException.of("Sale", saleId));
    }
}
