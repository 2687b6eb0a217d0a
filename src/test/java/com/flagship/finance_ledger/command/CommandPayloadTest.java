package com.flagship.finance_ledger.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_ledger.common.PageQuery;
import com.flagship.finance_ledger.config.JacksonConfig;
import com.flagship.finance_ledger.discount.DiscountType;
import com.flagship.finance_ledger.exception.CommandPayloadException;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.sale.dto.SaleRequest;
import jakarta.validation.Validation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CommandPayloadTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    private CommandPayload payload(String json) throws Exception {
        return new CommandPayload(objectMapper.readTree(json), objectMapper,
            Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    @DisplayName("The whole body binds to a request with snake_case keys")
    void bindsSnakeCaseBody() throws Exception {
        CommandPayload payload = payload("""
            {"cmd": "create_sale", "customer_id": 3, "date": "2024-05-02",
             "order_discount_type": "percent", "order_discount_value": 10,
             "items": [{"product_id": 7, "unit_id": 1, "per_price": 100, "amount": 1}]}
            """);

        SaleRequest request = payload.as(SaleRequest.class);

        assertEquals(3L, request.getCustomerId());
        assertEquals(LocalDate.of(2024, 5, 2), request.getDate());
        assertEquals(DiscountType.PERCENT, request.getOrderDiscountType());
        assertEquals(1, request.getItems().size());
        assertEquals(0, new BigDecimal("100").compareTo(request.getItems().get(0).getPerPrice()));
        assertTrue(request.getServiceItems().isEmpty());
    }

    @Test
    @DisplayName("Constraint violations are reported per field")
    void constraintViolations() throws Exception {
        CommandPayload payload = payload("{\"cmd\": \"create_sale\", \"date\": \"2024-05-02\"}");

        CommandPayloadException e = assertThrows(CommandPayloadException.class, () -> payload.as(SaleRequest.class));

        assertTrue(e.getDetails().containsKey("customerId"), e.getDetails().toString());
    }

    @Test
    @DisplayName("Malformed values are reported as payload errors")
    void malformedValues() throws Exception {
        CommandPayload payload = payload("{\"customer_id\": 1, \"date\": \"not-a-date\"}");

        assertThrows(CommandPayloadException.class, () -> payload.as(SaleRequest.class));
    }

    @Test
    @DisplayName("Scalar accessors read ids, text, numbers and dates")
    void scalarAccessors() throws Exception {
        CommandPayload payload = payload(
            "{\"id\": 12, \"sale_id\": \"15\", \"code\": \"SPRING\", \"subtotal\": 250.5, \"date\": \"2024-01-31\"}");

        assertEquals(12L, payload.id("id"));
        assertEquals(15L, payload.id("sale_id"));
        assertTrue(payload.optionalLong("unit_id").isEmpty());
        assertEquals("SPRING", payload.requiredText("code"));
        assertEquals(new BigDecimal("250.5"), payload.decimal("subtotal"));
        assertEquals(LocalDate.of(2024, 1, 31), payload.date("date"));
    }

    @Test
    @DisplayName("Missing or malformed scalars are validation failures")
    void missingScalars() throws Exception {
        CommandPayload payload = payload("{\"id\": \"abc\", \"date\": \"31/01/2024\"}");

        assertEquals("id must be a number", assertThrows(ValidationFailedException.class,
            () -> payload.id("id")).getMessage());
        assertEquals("account_id is required", assertThrows(ValidationFailedException.class,
            () -> payload.id("account_id")).getMessage());
        assertThrows(ValidationFailedException.class, () -> payload.date("date"));
    }

    @Test
    @DisplayName("Paging parameters fall back to defaults")
    void pageDefaults() throws Exception {
        PageQuery defaults = payload("{\"cmd\": \"get_sales\"}").page();
        PageQuery explicit = payload("{\"page\": 3, \"per_page\": 10, \"search\": \"acme\"}").page();

        assertEquals(1, defaults.getPage());
        assertEquals(20, defaults.getPerPage());
        assertEquals(20, explicit.offset());
        assertTrue(explicit.hasSearch());
    }
}
