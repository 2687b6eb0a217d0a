package com.flagship.finance_ledger.sale;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.currency.Currency;
import com.flagship.finance_ledger.currency.CurrencyService;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.ledger.AccountTransactionService;
import com.flagship.finance_ledger.sale.dto.SalePaymentRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Payments received for sales. A payment into an account deposits the amount
 * in the payment currency; deleting it withdraws the amount again.
 * paid_amount is always &Sigma; payment amounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SalePaymentService {

    private final SaleRepository saleRepository;
    private final AccountTransactionService accountTransactionService;
    private final CurrencyService currencyService;

    @Transactional
    public SalePayment create(SalePaymentRequest request) {
        long saleId = request.getSaleId();
        Sale sale = lockSale(saleId);
        if (!Money.isPositive(request.getAmount())) {
            throw new ValidationFailedException("Amount must be greater than 0");
        }

        Currency currency = resolveCurrency(request.getCurrencyId(), sale.getCurrencyId());
        BigDecimal rate = request.getExchangeRate() != null ? request.getExchangeRate() : currency.getRate();
        if (rate == null || rate.signum() <= 0) {
            throw new ValidationFailedException("Exchange rate must be greater than 0");
        }

        if (request.getAccountId() != null) {
            accountTransactionService.credit(request.getAccountId(), currency, request.getAmount(), rate,
                request.getDate(), notes(saleId));
        }

        long id = saleRepository.insertPayment(SalePayment.builder()
            .saleId(saleId)
            .accountId(request.getAccountId())
            .currencyId(currency.getId())
            .exchangeRate(rate)
            .amount(request.getAmount())
            .baseAmount(Money.round6(request.getAmount().multiply(rate)))
            .date(request.getDate())
            .build());
        BigDecimal paid = saleRepository.recomputePaidAmount(saleId);

        log.info("Sale payment created: id={}, sale={}, account={}, amount={} {}, paid={}",
            id, saleId, request.getAccountId(), request.getAmount(), currency.getName(), paid);
        return requirePayment(id);
    }

    @Transactional
    public void delete(long paymentId) {
        SalePayment payment = requirePayment(paymentId);
        lockSale(payment.getSaleId());
        reverse(payment);
        saleRepository.deletePayment(paymentId);
        saleRepository.recomputePaidAmount(payment.getSaleId());
        log.info("Sale payment deleted: id={}, sale={}", paymentId, payment.getSaleId());
    }

    @Transactional(readOnly = true)
    public List<SalePayment> getPayments(long saleId) {
        saleRepository.findById(saleId).orElseThrow(() -> NotFoundException.of("Sale", saleId));
        return saleRepository.findPayments(saleId);
    }

    /**
     * Records the payment taken when the sale was created. No account is
     * involved, so balances do not move.
     */
    void recordInitialPayment(long saleId, Long currencyId, BigDecimal rate, BigDecimal amount, LocalDate date) {
        Currency currency = resolveCurrency(null, currencyId);
        saleRepository.insertPayment(SalePayment.builder()
            .saleId(saleId)
            .currencyId(currency.getId())
            .exchangeRate(rate)
            .amount(amount)
            .baseAmount(Money.round6(amount.multiply(rate)))
            .date(date)
            .build());
        saleRepository.recomputePaidAmount(saleId);
    }

    /**
     * Withdraws again whatever the sale's account-linked payments deposited.
     * The payment rows go with the sale.
     */
    void reverseAll(long saleId) {
        saleRepository.findPayments(saleId).forEach(this::reverse);
    }

    private void reverse(SalePayment payment) {
        if (payment.getAccountId() == null) {
            return;
        }
        Currency currency = currencyService.get(payment.getCurrencyId());
        accountTransactionService.reverseCredit(payment.getAccountId(), currency, payment.getAmount(),
            payment.getExchangeRate(), payment.getDate(), notes(payment.getSaleId()));
    }

    /**
     * Explicit currency first, then the sale's, then the base currency.
     */
    private Currency resolveCurrency(Long explicitCurrencyId, Long saleCurrencyId) {
        if (explicitCurrencyId != null) {
            return currencyService.get(explicitCurrencyId);
        }
        if (saleCurrencyId != null) {
            return currencyService.get(saleCurrencyId);
        }
        return currencyService.findBase()
            .orElseThrow(() -> new ValidationFailedException("No currency given and no base currency is set"));
    }

    private Sale lockSale(long saleId) {
        if (!saleRepository.lock(saleId)) {
            throw NotFoundException.of("Sale", saleId);
        }
        return saleRepository.findById(saleId).orElseThrow(() -> NotFoundException.of("Sale", saleId));
    }

    private SalePayment requirePayment(long id) {
        return saleRepository.findPayment(id).orElseThrow(() -> NotFoundException.of("Sale payment", id));
    }

    private static String notes(long saleId) {
        return "Sale payment: Sale #" + saleId;
    }
}
