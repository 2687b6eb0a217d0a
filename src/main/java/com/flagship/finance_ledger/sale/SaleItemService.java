package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.catalog.CatalogService;
import com.flagship.finance_ledger.catalog.ServiceOffering;
import com.flagship.finance_ledger.common.AdditionalCost;
import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.inventory.BatchDemand;
import com.flagship.finance_ledger.inventory.BatchInventoryLedger;
import com.flagship.finance_ledger.sale.dto.SaleAdditionalCostRequest;
import com.flagship.finance_ledger.sale.dto.SaleItemInput;
import com.flagship.finance_ledger.sale.dto.SaleItemRequest;
import com.flagship.finance_ledger.sale.dto.SaleServiceItemInput;
import com.flagship.finance_ledger.sale.dto.SaleServiceItemRequest;
import com.flagship.finance_ledger.unit.UnitConversion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Incremental edits of one sale: product lines, service lines and additional
 * costs. Every edit ends with {@link #recompute}, which derives the sale's
 * totals from the stored rows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SaleItemService {

    private final SaleRepository saleRepository;
    private final BatchInventoryLedger batchInventoryLedger;
    private final CatalogService catalogService;
    private final UnitConversion unitConversion;

    // ==================== Product lines ====================

    @Transactional
    public SaleItem createItem(SaleItemRequest request) {
        long saleId = requireSaleId(request.getSaleId());
        lockSale(saleId);
        SaleItemInput input = request.getItem();
        validateItem(input);

        if (input.getPurchaseItemId() != null) {
            batchInventoryLedger.lockBatches(List.of(input.getPurchaseItemId()));
            batchInventoryLedger.checkLine(demand(input), BigDecimal.ZERO);
        }

        long itemId = saleRepository.insertItem(toItem(null, saleId, input));
        recompute(saleId);
        log.info("Sale item created: id={}, sale={}, batch={}", itemId, saleId, input.getPurchaseItemId());
        return requireItem(itemId);
    }

    /**
     * Replaces one line. When the line stays on the same batch, what it
     * already consumed is given back before the new amount is checked.
     */
    @Transactional
    public SaleItem updateItem(long itemId, SaleItemRequest request) {
        SaleItem existing = requireItem(itemId);
        lockSale(existing.getSaleId());
        SaleItemInput input = request.getItem();
        validateItem(input);

        if (input.getPurchaseItemId() != null) {
            List<Long> batches = new ArrayList<>();
            batches.add(input.getPurchaseItemId());
            batches.add(existing.getPurchaseItemId());
            batchInventoryLedger.lockBatches(batches);

            BigDecimal giveBack = Objects.equals(existing.getPurchaseItemId(), input.getPurchaseItemId())
                ? batchInventoryLedger.consumedBase(existing.getAmount(), existing.getUnitId())
                : BigDecimal.ZERO;
            batchInventoryLedger.checkLine(demand(input), giveBack);
        }

        saleRepository.updateItem(toItem(itemId, existing.getSaleId(), input));
        recompute(existing.getSaleId());
        log.info("Sale item updated: id={}, sale={}", itemId, existing.getSaleId());
        return requireItem(itemId);
    }

    @Transactional
    public void deleteItem(long itemId) {
        SaleItem existing = requireItem(itemId);
        lockSale(existing.getSaleId());
        requireAnotherLine(existing.getSaleId());
        saleRepository.deleteItem(itemId);
        recompute(existing.getSaleId());
        log.info("Sale item deleted: id={}, sale={}", itemId, existing.getSaleId());
    }

    @Transactional(readOnly = true)
    public List<SaleItem> getItems(long saleId) {
        requireSale(saleId);
        return saleRepository.findItems(saleId);
    }

    // ==================== Service lines ====================

    @Transactional
    public SaleServiceItem createServiceItem(SaleServiceItemRequest request) {
        long saleId = requireSaleId(request.getSaleId());
        lockSale(saleId);
        long id = saleRepository.insertServiceItem(toServiceItem(null, saleId, request.getItem()));
        recompute(saleId);
        return requireServiceItem(id);
    }

    @Transactional
    public SaleServiceItem updateServiceItem(long serviceItemId, SaleServiceItemRequest request) {
        SaleServiceItem existing = requireServiceItem(serviceItemId);
        lockSale(existing.getSaleId());
        saleRepository.updateServiceItem(toServiceItem(serviceItemId, existing.getSaleId(), request.getItem()));
        recompute(existing.getSaleId());
        return requireServiceItem(serviceItemId);
    }

    @Transactional
    public void deleteServiceItem(long serviceItemId) {
        SaleServiceItem existing = requireServiceItem(serviceItemId);
        lockSale(existing.getSaleId());
        requireAnotherLine(existing.getSaleId());
        saleRepository.deleteServiceItem(serviceItemId);
        recompute(existing.getSaleId());
    }

    @Transactional(readOnly = true)
    public List<SaleServiceItem> getServiceItems(long saleId) {
        requireSale(saleId);
        return saleRepository.findServiceItems(saleId);
    }

    // ==================== Additional costs ====================

    @Transactional
    public AdditionalCost createAdditionalCost(SaleAdditionalCostRequest request) {
        long saleId = requireSaleId(request.getSaleId());
        lockSale(saleId);
        long id = saleRepository.insertAdditionalCost(saleId, request.getName(), Money.orZero(request.getAmount()));
        recompute(saleId);
        return requireCost(id);
    }

    @Transactional
    public AdditionalCost updateAdditionalCost(long costId, SaleAdditionalCostRequest request) {
        AdditionalCost existing = requireCost(costId);
        lockSale(existing.getOwnerId());
        saleRepository.updateAdditionalCost(costId, request.getName(), Money.orZero(request.getAmount()));
        recompute(existing.getOwnerId());
        return requireCost(costId);
    }

    @Transactional
    public void deleteAdditionalCost(long costId) {
        AdditionalCost existing = requireCost(costId);
        lockSale(existing.getOwnerId());
        saleRepository.deleteAdditionalCost(costId);
        recompute(existing.getOwnerId());
    }

    @Transactional(readOnly = true)
    public List<AdditionalCost> getAdditionalCosts(long saleId) {
        requireSale(saleId);
        return saleRepository.findAdditionalCosts(saleId);
    }

    /**
     * Derives additional_cost, order_discount_amount, total_amount and
     * base_amount from the stored rows and the sale's order discount.
     * Running it twice without line changes writes the same values.
     */
    @Transactional
    public Sale recompute(long saleId) {
        Sale sale = requireSale(saleId);
        SalePricing.Totals totals = SalePricing.totals(
            saleRepository.sumLineTotals(saleId),
            sale.getOrderDiscountType(),
            sale.getOrderDiscountValue(),
            saleRepository.sumAdditionalCosts(saleId),
            sale.getExchangeRate());
        saleRepository.updateTotals(saleId, totals);
        log.debug("Sale totals recomputed: sale={}, total={}", saleId, totals.getTotalAmount());
        return requireSale(saleId);
    }

    SaleItem toItem(Long id, long saleId, SaleItemInput input) {
        return SaleItem.builder()
            .id(id)
            .saleId(saleId)
            .productId(input.getProductId())
            .unitId(input.getUnitId())
            .perPrice(input.getPerPrice())
            .amount(input.getAmount())
            .total(SalePricing.lineTotal(input.getPerPrice(), input.getAmount(),
                input.getDiscountType(), input.getDiscountValue()))
            .purchaseItemId(input.getPurchaseItemId())
            .saleType(input.getSaleType())
            .discountType(input.getDiscountType())
            .discountValue(Money.orZero(input.getDiscountValue()))
            .build();
    }

    SaleServiceItem toServiceItem(Long id, long saleId, SaleServiceItemInput input) {
        if (input == null || input.getServiceId() == null) {
            throw new ValidationFailedException("Service is required");
        }
        ServiceOffering service = catalogService.requireService(input.getServiceId());
        BigDecimal price = Money.orZero(input.getPrice());
        String name = input.getName() != null && !input.getName().isBlank() ? input.getName() : service.getName();
        return SaleServiceItem.builder()
            .id(id)
            .saleId(saleId)
            .serviceId(input.getServiceId())
            .name(name)
            .price(price)
            .quantity(input.getQuantity())
            .total(SalePricing.lineTotal(price, input.getQuantity(), input.getDiscountType(),
                input.getDiscountValue()))
            .discountType(input.getDiscountType())
            .discountValue(Money.orZero(input.getDiscountValue()))
            .build();
    }

    void validateItem(SaleItemInput input) {
        if (input == null || input.getProductId() == null || input.getUnitId() == null) {
            throw new ValidationFailedException("Sale item requires a product and a unit");
        }
        if (!Money.isPositive(input.getAmount())) {
            throw new ValidationFailedException("Sale item amount must be greater than 0");
        }
        if (input.getPerPrice() == null || input.getPerPrice().signum() < 0) {
            throw new ValidationFailedException("Sale item price cannot be negative");
        }
        catalogService.requireProduct(input.getProductId());
        unitConversion.unitRatio(input.getUnitId());
    }

    static BatchDemand demand(SaleItemInput input) {
        return new BatchDemand(input.getPurchaseItemId(), input.getProductId(), input.getUnitId(), input.getAmount());
    }

    private void requireAnotherLine(long saleId) {
        if (saleRepository.countLines(saleId) <= 1) {
            throw new ValidationFailedException("Sale must have at least one item or service");
        }
    }

    private long requireSaleId(Long saleId) {
        if (saleId == null) {
            throw new ValidationFailedException("Sale is required");
        }
        return saleId;
    }

    private void lockSale(long saleId) {
        if (!saleRepository.lock(saleId)) {
            throw NotFoundException.of("Sale", saleId);
        }
    }

    private Sale requireSale(long saleId) {
        return saleRepository.findById(saleId).orElseThrow(() -> NotFoundException.of("Sale", saleId));
    }

    private SaleItem requireItem(long itemId) {
        return saleRepository.findItem(itemId).orElseThrow(() -> NotFoundException.of("Sale item", itemId));
    }

    private SaleServiceItem requireServiceItem(long id) {
        return saleRepository.findServiceItem(id).orElseThrow(() -> NotFoundException.of("Sale service item", id));
    }

    private AdditionalCost requireCost(long id) {
        return saleRepository.findAdditionalCost(id)
            .orElseThrow(() -> NotFoundException.of("Sale additional cost", id));
    }
}
