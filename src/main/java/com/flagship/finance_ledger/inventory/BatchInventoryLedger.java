package com.flagship.finance_ledger.inventory;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.exception.InsufficientStockException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.unit.UnitConversion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Remaining stock per purchase-item batch and the no-oversell rule.
 *
 * Invariant: for every batch, &Sigma;(sale_item.amount &times; unit ratio) over
 * the sale items referencing it never exceeds the purchased amount in base
 * units (plus {@link #EPSILON}). Checks run before any write; callers hold
 * {@link #lockBatches} so the check and the insert see the same stock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchInventoryLedger {

    static final BigDecimal EPSILON = new BigDecimal("1e-9");

    private final BatchRepository batchRepository;
    private final UnitConversion unitConversion;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Purchased base quantity minus everything sold against the batch.
     *
     * @throws NotFoundException if the batch does not exist
     */
    public BigDecimal remainingBase(long purchaseItemId) {
        return requireStock(purchaseItemId).getRemainingBase();
    }

    /**
     * Locks the referenced batches, ascending by id, until the transaction ends.
     *
     * @throws NotFoundException if any referenced batch does not exist
     */
    public void lockBatches(Collection<Long> purchaseItemIds) {
        TreeSet<Long> ids = new TreeSet<>();
        purchaseItemIds.stream().filter(Objects::nonNull).forEach(ids::add);
        List<Long> locked = batchRepository.lockBatches(ids);
        if (locked.size() != ids.size()) {
            ids.removeAll(locked);
            throw NotFoundException.of("Batch", ids.first());
        }
    }

    /**
     * Checks one sale line against its batch. {@code giveBackBase} is what the
     * line already consumes from the same batch when it is being edited; it is
     * 0 for a new line or when the batch reference changed.
     */
    public void checkLine(BatchDemand demand, BigDecimal giveBackBase) {
        if (demand.getPurchaseItemId() == null) {
            return;
        }
        BatchStock stock = requireStock(demand.getPurchaseItemId());
        requireSameProduct(demand, stock);
        BigDecimal requested = unitConversion.toBase(demand.getAmount(), demand.getUnitId());
        BigDecimal allowed = stock.getRemainingBase().add(Money.orZero(giveBackBase));
        requireAvailable(stock, allowed, requested);
    }

    /**
     * Checks all lines of one sale together, so several lines cannot jointly
     * oversell a batch. Runs before any line is inserted.
     */
    public void checkLines(List<BatchDemand> demands) {
        Map<Long, BigDecimal> requestedByBatch = new LinkedHashMap<>();
        for (BatchDemand demand : demands) {
            if (demand.getPurchaseItemId() == null) {
                continue;
            }
            BigDecimal base = unitConversion.toBase(demand.getAmount(), demand.getUnitId());
            requestedByBatch.merge(demand.getPurchaseItemId(), base, BigDecimal::add);
        }

        for (BatchDemand demand : demands) {
            if (demand.getPurchaseItemId() != null) {
                requireSameProduct(demand, requireStock(demand.getPurchaseItemId()));
            }
        }

        for (Map.Entry<Long, BigDecimal> entry : requestedByBatch.entrySet()) {
            BatchStock stock = requireStock(entry.getKey());
            requireAvailable(stock, stock.getRemainingBase(), entry.getValue());
        }
    }

    /**
     * Checks that a batch being edited on its purchase still covers what has
     * been sold from it.
     */
    public void checkResize(long purchaseItemId, BigDecimal newAmount, long unitId) {
        BatchStock stock = requireStock(purchaseItemId);
        BigDecimal newBase = unitConversion.toBase(newAmount, unitId);
        if (newBase.add(EPSILON).compareTo(stock.getConsumedBase()) < 0) {
            ledgerMetrics.recordRejectedCheck("stock");
            log.warn("Batch resize rejected: batch={}, sold={}, newBase={}",
                purchaseItemId, stock.getConsumedBase(), newBase);
            throw new InsufficientStockException(
                "Batch " + stock.label() + " has already sold " + plain(stock.getConsumedBase())
                    + " base units and cannot be reduced to " + plain(newBase));
        }
    }

    /**
     * Base quantity a stored line takes from its batch.
     */
    public BigDecimal consumedBase(BigDecimal amount, long unitId) {
        return unitConversion.toBase(amount, unitId);
    }

    @Transactional(readOnly = true)
    public List<ProductBatch> getProductBatches(long productId) {
        return batchRepository.findOpenBatches(productId);
    }

    /**
     * Total remaining stock of a product in base units, optionally also
     * expressed in {@code unitId}.
     */
    @Transactional(readOnly = true)
    public ProductStock getProductStock(long productId, Long unitId) {
        BigDecimal totalBase = batchRepository.totalRemainingBase(productId);
        BigDecimal inUnit = null;
        if (unitId != null) {
            inUnit = Money.divide(totalBase, unitConversion.unitRatio(unitId));
        }
        return new ProductStock(productId, Money.round6(totalBase), inUnit);
    }

    @Transactional(readOnly = true)
    public List<StockBatchRow> getStockByBatches() {
        return batchRepository.findStockByBatches();
    }

    private BatchStock requireStock(long purchaseItemId) {
        return batchRepository.findStock(purchaseItemId)
            .orElseThrow(() -> NotFoundException.of("Batch", purchaseItemId));
    }

    private void requireSameProduct(BatchDemand demand, BatchStock stock) {
        if (demand.getProductId() != null && !demand.getProductId().equals(stock.getProductId())) {
            throw new ValidationFailedException(
                "Batch " + stock.label() + " does not belong to product " + demand.getProductId());
        }
    }

    private void requireAvailable(BatchStock stock, BigDecimal allowed, BigDecimal requested) {
        if (requested.compareTo(allowed.add(EPSILON)) > 0) {
            ledgerMetrics.recordRejectedCheck("stock");
            log.warn("Insufficient stock: batch={}, available={}, requested={}",
                stock.getPurchaseItemId(), allowed, requested);
            throw new InsufficientStockException(
                "Insufficient stock in batch " + stock.label() + ": available "
                    + plain(allowed.max(BigDecimal.ZERO)) + ", requested " + plain(requested));
        }
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
