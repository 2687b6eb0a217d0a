package com.flagship.finance_ledger.discount;

import com.flagship.finance_ledger.common.Money;
import com.flagship.finance_ledger.discount.dto.DiscountCodeRequest;
import com.flagship.finance_ledger.exception.DuplicateEntryException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Discount codes: CRUD, validation against a subtotal, and redemption.
 *
 * Validation is a pure read. A use is consumed only by {@link #redeem(long)},
 * which sale creation calls once the code has been applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscountCodeService {

    private final DiscountCodeRepository discountCodeRepository;
    private final Clock clock;

    @Transactional
    public DiscountCode create(DiscountCodeRequest request) {
        DiscountCode code = toCode(null, request);
        try {
            long id = discountCodeRepository.insert(code);
            log.info("Discount code created: id={}, code={}", id, code.getCode());
            return get(id);
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Discount code already exists", e);
        }
    }

    @Transactional
    public DiscountCode update(long id, DiscountCodeRequest request) {
        get(id);
        try {
            discountCodeRepository.update(toCode(id, request));
        } catch (DuplicateKeyException e) {
            throw new DuplicateEntryException("Discount code already exists", e);
        }
        return get(id);
    }

    @Transactional
    public void delete(long id) {
        if (discountCodeRepository.delete(id) == 0) {
            throw NotFoundException.of("Discount code", id);
        }
    }

    @Transactional(readOnly = true)
    public DiscountCode get(long id) {
        return discountCodeRepository.findById(id)
            .orElseThrow(() -> NotFoundException.of("Discount code", id));
    }

    @Transactional(readOnly = true)
    public List<DiscountCode> list(String search) {
        return discountCodeRepository.findAll(search);
    }

    /**
     * Checks a code against today's date, its use limit and the minimum
     * purchase, and returns the discount it yields on {@code subtotal}.
     */
    @Transactional(readOnly = true)
    public DiscountValidation validate(String rawCode, BigDecimal subtotal) {
        String normalized = normalize(rawCode);
        DiscountCode code = discountCodeRepository.findByCode(normalized)
            .orElseThrow(() -> new NotFoundException("Invalid discount code: " + normalized));

        LocalDate today = LocalDate.now(clock);
        if (code.getValidFrom() != null && today.isBefore(code.getValidFrom())) {
            throw new ValidationFailedException("Discount code is not yet valid");
        }
        if (code.getValidTo() != null && today.isAfter(code.getValidTo())) {
            throw new ValidationFailedException("Discount code has expired");
        }
        if (code.isExhausted()) {
            throw new ValidationFailedException("Discount code has reached its usage limit");
        }
        BigDecimal checkedSubtotal = Money.orZero(subtotal);
        BigDecimal minPurchase = Money.orZero(code.getMinPurchase());
        if (checkedSubtotal.compareTo(minPurchase) < 0) {
            throw new ValidationFailedException(
                "Minimum purchase of " + minPurchase.stripTrailingZeros().toPlainString() + " required for this code");
        }

        BigDecimal discount = DiscountCalculator.computeDiscount(checkedSubtotal, code.getType(), code.getValue());
        return new DiscountValidation(code.getId(), code.getType(), discount);
    }

    /**
     * Consumes one use of the code.
     *
     * @throws ValidationFailedException if the code has no uses left
     */
    @Transactional
    public void redeem(long id) {
        get(id);
        if (!discountCodeRepository.incrementUseCount(id)) {
            throw new ValidationFailedException("Discount code has reached its usage limit");
        }
        log.info("Discount code redeemed: id={}", id);
    }

    private DiscountCode toCode(Long id, DiscountCodeRequest request) {
        if (request.getType() == null) {
            throw new ValidationFailedException("Discount type must be percent or fixed");
        }
        return DiscountCode.builder()
            .id(id)
            .code(normalize(request.getCode()))
            .type(request.getType())
            .value(Money.orZero(request.getValue()))
            .minPurchase(Money.orZero(request.getMinPurchase()))
            .validFrom(request.getValidFrom())
            .validTo(request.getValidTo())
            .maxUses(request.getMaxUses())
            .build();
    }

    static String normalize(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationFailedException("Discount code is required");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
