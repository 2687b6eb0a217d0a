package com.flagship.finance_ledger.purchase;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.ledger.AccountTransactionService;
import com.flagship.finance_ledger.purchase.dto.PurchasePaymentRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Payments toward purchases. A payment made from an account withdraws the
 * amount from that account (both funds checks apply); deleting it deposits
 * the amount back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchasePaymentService {

    private final PurchaseRepository purchaseRepository;
    private final AccountTransactionService accountTransactionService;
    private final CurrencyService currencyService;

    @Transactional
    public PurchasePayment create(PurchasePaymentRequest request) {
        long purchaseId = request.getPurchaseId();
        lockPurchase(purchaseId);
        Currency currency = validatedCurrency(request);
        BigDecimal rate = rate(request, currency);

        if (request.getAccountId() != null) {
            accountTransactionService.debit(request.getAccountId(), currency, request.getAmount(), rate,
                request.getDate(), notes(purchaseId));
        }

        long id = purchaseRepository.insertPayment(toPayment(null, purchaseId, request, currency, rate));

        log.info("Purchase payment created: id={}, purchase={}, account={}, amount={} {}",
            id, purchaseId, request.getAccountId(), request.getAmount(), currency.getName());
        return requirePayment(id);
    }

    /**
     * Replaces a payment's amount, currency, account and date. The old
     * withdrawal is deposited back before the new one is checked and applied.
     */
    @Transactional
    public PurchasePayment update(long paymentId, PurchasePaymentRequest request) {
        PurchasePayment existing = requirePayment(paymentId);
        long purchaseId = existing.getPurchaseId();
        lockPurchase(purchaseId);
        Currency currency = validatedCurrency(request);
        BigDecimal rate = rate(request, currency);

        reverse(existing);
        if (request.getAccountId() != null) {
            accountTransactionService.debit(request.getAccountId(), currency, request.getAmount(), rate,
                request.getDate(), notes(purchaseId));
        }
        purchaseRepository.updatePayment(toPayment(paymentId, purchaseId, request, currency, rate));

        log.info("Purchase payment updated: id={}, purchase={}, amount={} {}",
            paymentId, purchaseId, request.getAmount(), currency.getName());
        return requirePayment(paymentId);
    }

    @Transactional
    public void delete(long paymentId) {
        PurchasePayment payment = requirePayment(paymentId);
        lockPurchase(payment.getPurchaseId());
        reverse(payment);
        purchaseRepository.deletePayment(paymentId);
        log.info("Purchase payment deleted: id={}, purchase={}", paymentId, payment.getPurchaseId());
    }

    @Transactional(readOnly = true)
    public List<PurchasePayment> getPayments(long purchaseId) {
        purchaseRepository.findById(purchaseId).orElseThrow(() -> NotFoundException.of("Purchase", purchaseId));
        return purchaseRepository.findPayments(purchaseId);
    }

    /**
     * Reverses the account effect of every payment of a purchase that is
     * about to be deleted. The rows themselves go with the purchase.
     */
    void reverseAll(long purchaseId) {
        purchaseRepository.findPayments(purchaseId).forEach(this::reverse);
    }

    private void reverse(PurchasePayment payment) {
        if (payment.getAccountId() == null) {
            return;
        }
        Currency currency = currencyService.requireByName(payment.getCurrency());
        accountTransactionService.reverseDebit(payment.getAccountId(), currency, payment.getAmount(),
            payment.getRate(), payment.getDate(), notes(payment.getPurchaseId()));
    }

    private void lockPurchase(long purchaseId) {
        if (!purchaseRepository.lock(purchaseId)) {
            throw NotFoundException.of("Purchase", purchaseId);
        }
    }

    private PurchasePayment requirePayment(long paymentId) {
        return purchaseRepository.findPayment(paymentId)
            .orElseThrow(() -> NotFoundException.of("Purchase payment", paymentId));
    }

    private Currency validatedCurrency(PurchasePaymentRequest request) {
        if (!Money.isPositive(request.getAmount())) {
            throw new ValidationFailedException("Amount must be greater than 0");
        }
        return currencyService.requireByName(request.getCurrency());
    }

    private static BigDecimal rate(PurchasePaymentRequest request, Currency currency) {
        BigDecimal rate = request.getRate() != null ? request.getRate() : currency.getRate();
        if (rate == null || rate.signum() <= 0) {
            throw new ValidationFailedException("Rate must be greater than 0");
        }
        return rate;
    }

    private static PurchasePayment toPayment(Long id, long purchaseId, PurchasePaymentRequest request,
                                             Currency currency, BigDecimal rate) {
        return PurchasePayment.builder()
            .id(id)
            .purchaseId(purchaseId)
            .accountId(request.getAccountId())
            .amount(request.getAmount())
            .currency(currency.getName())
            .rate(rate)
            .total(request.getAmount().multiply(rate))
            .date(request.getDate())
            .notes(request.getNotes())
            .build();
    }

    private static String notes(long purchaseId) {
        return "Purchase payment: Purchase #" + purchaseId;
    }
}
