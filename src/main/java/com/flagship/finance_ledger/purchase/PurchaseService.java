package com.flagship.finance_ledger.purchase;

import com.flagship.finance_ledger.catalog.CatalogService;
import com.flagship.finance_ledger.catalog.PartyKind;
import com.flagship.finance_ledger.common.AdditionalCost;
import com.flagship.finance_ledger.common.AdditionalCostInput;
import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.common.PageQuery;
import com.flagship.finance_ledger.common.PagedResult;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ReferentialConflictException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.inventory.BatchInventoryLedger;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.purchase.dto.PurchaseAdditionalCostRequest;
import com.flagship.finance_ledger.purchase.dto.PurchaseItemInput;
import com.flagship.finance_ledger.purchase.dto.PurchaseItemRequest;
import com.flagship.finance_ledger.purchase.dto.PurchaseRequest;
import com.flagship.finance_ledger.sequence.DocumentNumberGenerator;
import com.flagship.finance_ledger.unit.UnitConversion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Purchase aggregate: header, items (each one an inventory batch), additional
 * costs. Each operation runs in one transaction.
 *
 * Items carry their identity across updates because sale lines point at them:
 * an update edits kept items in place, inserts new ones and removes the rest,
 * and refuses to shrink or remove stock that has already been sold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseService {

    private final PurchaseRepository purchaseRepository;
    private final PurchasePaymentService purchasePaymentService;
    private final DocumentNumberGenerator documentNumberGenerator;
    private final BatchInventoryLedger batchInventoryLedger;
    private final CatalogService catalogService;
    private final CurrencyService currencyService;
    private final UnitConversion unitConversion;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public PurchaseDetail create(PurchaseRequest request) {
        validateHeader(request);
        request.getItems().forEach(this::validateItem);

        BigDecimal additionalCost = sumCosts(request.getAdditionalCosts());
        BigDecimal itemsTotal = request.getItems().stream()
            .map(PurchaseService::lineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        String batchNumber = documentNumberGenerator.nextBatchNumber();
        long purchaseId = purchaseRepository.insert(Purchase.builder()
            .supplierId(request.getSupplierId())
            .date(request.getDate())
            .notes(request.getNotes())
            .currencyId(request.getCurrencyId())
            .totalAmount(itemsTotal.add(additionalCost))
            .additionalCost(additionalCost)
            .batchNumber(batchNumber)
            .build());

        for (PurchaseItemInput item : request.getItems()) {
            purchaseRepository.insertItem(toItem(null, purchaseId, item));
        }
        insertCosts(purchaseId, request.getAdditionalCosts());

        ledgerMetrics.incrementPurchasesCreated();
        log.info("Purchase created: id={}, batchNumber={}, items={}, total={}",
            purchaseId, batchNumber, request.getItems().size(), itemsTotal.add(additionalCost));
        return get(purchaseId);
    }

    /**
     * Replaces header, items and additional costs. Items with an id are kept
     * and edited; other stored items are removed.
     */
    @Transactional
    public PurchaseDetail update(long purchaseId, PurchaseRequest request) {
        Purchase existing = lockPurchase(purchaseId);
        validateHeader(request);
        request.getItems().forEach(this::validateItem);

        List<PurchaseItem> storedItems = purchaseRepository.findItems(purchaseId);
        batchInventoryLedger.lockBatches(storedItems.stream().map(PurchaseItem::getId).toList());
        Map<Long, PurchaseItem> storedById = storedItems.stream()
            .collect(Collectors.toMap(PurchaseItem::getId, Function.identity()));
        Set<Long> keptIds = request.getItems().stream()
            .map(PurchaseItemInput::getId)
            .filter(id -> id != null)
            .collect(Collectors.toSet());

        for (Long keptId : keptIds) {
            if (!storedById.containsKey(keptId)) {
                throw new NotFoundException("Purchase item " + keptId + " does not belong to purchase " + purchaseId);
            }
        }
        for (PurchaseItem stored : storedItems) {
            if (!keptIds.contains(stored.getId())) {
                removeItem(stored);
            }
        }
        for (PurchaseItemInput item : request.getItems()) {
            if (item.getId() != null) {
                batchInventoryLedger.checkResize(item.getId(), item.getAmount(), item.getUnitId());
                purchaseRepository.updateItem(toItem(item.getId(), purchaseId, item));
            } else {
                purchaseRepository.insertItem(toItem(null, purchaseId, item));
            }
        }

        purchaseRepository.deleteAdditionalCosts(purchaseId);
        insertCosts(purchaseId, request.getAdditionalCosts());

        purchaseRepository.updateHeader(Purchase.builder()
            .id(purchaseId)
            .supplierId(request.getSupplierId())
            .date(request.getDate())
            .notes(request.getNotes())
            .currencyId(request.getCurrencyId())
            .totalAmount(existing.getTotalAmount())
            .additionalCost(sumCosts(request.getAdditionalCosts()))
            .build());
        BigDecimal total = purchaseRepository.recomputeTotal(purchaseId);

        log.info("Purchase updated: id={}, items={}, total={}", purchaseId, request.getItems().size(), total);
        return get(purchaseId);
    }

    /**
     * Deletes a purchase whose batches were never sold, reversing the account
     * effect of its payments first.
     */
    @Transactional
    public void delete(long purchaseId) {
        lockPurchase(purchaseId);
        if (purchaseRepository.countSoldItems(purchaseId) > 0) {
            throw new ReferentialConflictException(
                "Purchase " + purchaseId + " has batches referenced by sales and cannot be deleted");
        }
        purchasePaymentService.reverseAll(purchaseId);
        purchaseRepository.delete(purchaseId);
        log.info("Purchase deleted: id={}", purchaseId);
    }

    @Transactional(readOnly = true)
    public PurchaseDetail get(long purchaseId) {
        Purchase purchase = purchaseRepository.findById(purchaseId)
            .orElseThrow(() -> NotFoundException.of("Purchase", purchaseId));
        return new PurchaseDetail(purchase,
            purchaseRepository.findItems(purchaseId),
            purchaseRepository.findAdditionalCosts(purchaseId));
    }

    @Transactional(readOnly = true)
    public PagedResult<Purchase> list(PageQuery query) {
        return PagedResult.of(purchaseRepository.findPage(query), purchaseRepository.count(query), query);
    }

    // ==================== Item-level operations ====================

    @Transactional
    public PurchaseItem createItem(PurchaseItemRequest request) {
        if (request.getPurchaseId() == null) {
            throw new ValidationFailedException("Purchase is required");
        }
        long purchaseId = request.getPurchaseId();
        lockPurchase(purchaseId);
        validateItem(request.getItem());
        long itemId = purchaseRepository.insertItem(toItem(null, purchaseId, request.getItem()));
        purchaseRepository.recomputeTotal(purchaseId);
        return requireItem(itemId);
    }

    @Transactional
    public PurchaseItem updateItem(long itemId, PurchaseItemRequest request) {
        PurchaseItem stored = requireItem(itemId);
        lockPurchase(stored.getPurchaseId());
        batchInventoryLedger.lockBatches(List.of(itemId));
        validateItem(request.getItem());
        batchInventoryLedger.checkResize(itemId, request.getItem().getAmount(), request.getItem().getUnitId());
        purchaseRepository.updateItem(toItem(itemId, stored.getPurchaseId(), request.getItem()));
        purchaseRepository.recomputeTotal(stored.getPurchaseId());
        return requireItem(itemId);
    }

    @Transactional
    public void deleteItem(long itemId) {
        PurchaseItem stored = requireItem(itemId);
        lockPurchase(stored.getPurchaseId());
        batchInventoryLedger.lockBatches(List.of(itemId));
        removeItem(stored);
        purchaseRepository.recomputeTotal(stored.getPurchaseId());
    }

    @Transactional(readOnly = true)
    public List<PurchaseItem> getItems(long purchaseId) {
        get(purchaseId);
        return purchaseRepository.findItems(purchaseId);
    }

    // ==================== Additional costs ====================

    @Transactional
    public AdditionalCost createAdditionalCost(PurchaseAdditionalCostRequest request) {
        if (request.getPurchaseId() == null) {
            throw new ValidationFailedException("Purchase is required");
        }
        long purchaseId = request.getPurchaseId();
        lockPurchase(purchaseId);
        long id = purchaseRepository.insertAdditionalCost(purchaseId, request.getName(),
            Money.orZero(request.getAmount()));
        purchaseRepository.recomputeTotal(purchaseId);
        return requireCost(id);
    }

    @Transactional
    public AdditionalCost updateAdditionalCost(long costId, PurchaseAdditionalCostRequest request) {
        AdditionalCost existing = requireCost(costId);
        lockPurchase(existing.getOwnerId());
        purchaseRepository.updateAdditionalCost(costId, request.getName(), Money.orZero(request.getAmount()));
        purchaseRepository.recomputeTotal(existing.getOwnerId());
        return requireCost(costId);
    }

    @Transactional
    public void deleteAdditionalCost(long costId) {
        AdditionalCost existing = requireCost(costId);
        lockPurchase(existing.getOwnerId());
        purchaseRepository.deleteAdditionalCost(costId);
        purchaseRepository.recomputeTotal(existing.getOwnerId());
    }

    @Transactional(readOnly = true)
    public List<AdditionalCost> getAdditionalCosts(long purchaseId) {
        get(purchaseId);
        return purchaseRepository.findAdditionalCosts(purchaseId);
    }

    private AdditionalCost requireCost(long costId) {
        return purchaseRepository.findAdditionalCost(costId)
            .orElseThrow(() -> NotFoundException.of("Purchase additional cost", costId));
    }

    private void removeItem(PurchaseItem stored) {
        if (purchaseRepository.countSaleItemsReferencing(stored.getId()) > 0) {
            throw new ReferentialConflictException(
                "Purchase item " + stored.getId() + " has been sold and cannot be removed");
        }
        purchaseRepository.deleteItem(stored.getId());
    }

    private PurchaseItem requireItem(long itemId) {
        return purchaseRepository.findItem(itemId).orElseThrow(() -> NotFoundException.of("Purchase item", itemId));
    }

    private Purchase lockPurchase(long purchaseId) {
        if (!purchaseRepository.lock(purchaseId)) {
            throw NotFoundException.of("Purchase", purchaseId);
        }
        return purchaseRepository.findById(purchaseId).orElseThrow(() -> NotFoundException.of("Purchase", purchaseId));
    }

    private void validateHeader(PurchaseRequest request) {
        if (request.getSupplierId() == null) {
            throw new ValidationFailedException("Supplier is required");
        }
        if (request.getDate() == null) {
            throw new ValidationFailedException("Date is required");
        }
        if (request.getItems().isEmpty()) {
            throw new ValidationFailedException("Purchase must have at least one item");
        }
        catalogService.requireParty(PartyKind.SUPPLIER, request.getSupplierId());
        if (request.getCurrencyId() != null) {
            currencyService.get(request.getCurrencyId());
        }
    }

    private void validateItem(PurchaseItemInput item) {
        if (item == null || item.getProductId() == null || item.getUnitId() == null) {
            throw new ValidationFailedException("Purchase item requires a product and a unit");
        }
        if (!Money.isPositive(item.getAmount())) {
            throw new ValidationFailedException("Purchase item amount must be greater than 0");
        }
        if (item.getPerPrice() == null || item.getPerPrice().signum() < 0) {
            throw new ValidationFailedException("Purchase item price cannot be negative");
        }
        catalogService.requireProduct(item.getProductId());
        unitConversion.unitRatio(item.getUnitId());
    }

    private void insertCosts(long purchaseId, List<AdditionalCostInput> costs) {
        for (AdditionalCostInput cost : costs) {
            purchaseRepository.insertAdditionalCost(purchaseId, cost.getName(), Money.orZero(cost.getAmount()));
        }
    }

    private static PurchaseItem toItem(Long id, long purchaseId, PurchaseItemInput item) {
        return PurchaseItem.builder()
            .id(id)
            .purchaseId(purchaseId)
            .productId(item.getProductId())
            .unitId(item.getUnitId())
            .perPrice(item.getPerPrice())
            .amount(item.getAmount())
            .total(lineTotal(item))
            .perUnit(item.getPerUnit())
            .costPrice(item.getCostPrice())
            .wholesalePrice(item.getWholesalePrice())
            .retailPrice(item.getRetailPrice())
            .expiryDate(item.getExpiryDate())
            .build();
    }

    static BigDecimal lineTotal(PurchaseItemInput item) {
        return Money.round6(item.getPerPrice().multiply(item.getAmount()));
    }

    static BigDecimal sumCosts(List<AdditionalCostInput> costs) {
        return costs.stream()
            .map(cost -> Money.orZero(cost.getAmount()))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
