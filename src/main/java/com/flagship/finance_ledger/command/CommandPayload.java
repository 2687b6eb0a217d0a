package com.flagship.finance_ledger.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_ledger.common.PageQuery;
import com.flagship.finance_ledger.exception.CommandPayloadException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The JSON body of one command, with typed accessors.
 *
 * Request objects are read from the whole body, so {@code {"cmd": "create_sale",
 * "customer_id": 3, ...}} binds straight to a sale request. Scalar arguments
 * such as ids are read by field name.
 */
public class CommandPayload {

    private final JsonNode body;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public CommandPayload(JsonNode body, ObjectMapper objectMapper, Validator validator) {
        this.body = body;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * Binds the whole body to {@code type} and runs bean validation on it.
     *
     * @throws CommandPayloadException if the body does not fit the type or
     *         violates a constraint
     */
    public <T> T as(Class<T> type) {
        return validated(read(body, type));
    }

    public long id(String name) {
        return optionalLong(name)
            .orElseThrow(() -> new ValidationFailedException(name + " is required"));
    }

    public Optional<Long> optionalLong(String name) {
        JsonNode node = body.get(name);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        if (!node.canConvertToLong() && !node.isTextual()) {
            throw new ValidationFailedException(name + " must be a number");
        }
        try {
            return Optional.of(node.isTextual() ? Long.parseLong(node.asText().trim()) : node.asLong());
        } catch (NumberFormatException e) {
            throw new ValidationFailedException(name + " must be a number");
        }
    }

    public Optional<Integer> optionalInt(String name) {
        return optionalLong(name).map(Long::intValue);
    }

    public BigDecimal decimal(String name) {
        JsonNode node = body.get(name);
        if (node == null || node.isNull()) {
            throw new ValidationFailedException(name + " is required");
        }
        try {
            return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ValidationFailedException(name + " must be a number");
        }
    }

    public Optional<String> text(String name) {
        JsonNode node = body.get(name);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    public String requiredText(String name) {
        return text(name)
            .filter(value -> !value.isBlank())
            .orElseThrow(() -> new ValidationFailedException(name + " is required"));
    }

    public LocalDate date(String name) {
        String value = requiredText(name);
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationFailedException(name + " must be a date in YYYY-MM-DD form");
        }
    }

    /**
     * Paging parameters; a missing {@code page}/{@code per_page} falls back to defaults.
     */
    public PageQuery page() {
        return read(body, PageQuery.class);
    }

    private <T> T read(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new CommandPayloadException("Invalid payload for " + type.getSimpleName()
                + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new CommandPayloadException("Invalid payload for " + type.getSimpleName(), e);
        }
    }

    private <T> T validated(T value) {
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (violations.isEmpty()) {
            return value;
        }
        Map<String, String> details = new TreeMap<>();
        for (ConstraintViolation<T> violation : violations) {
            details.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage());
        }
        String first = details.values().iterator().next();
        throw new CommandPayloadException(first, details);
    }
}
