package com.flagship.finance_ledger.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Single command-dispatch endpoint.
 *
 * Body: {"cmd": "create_sale", ...arguments}. The result of the handler is
 * returned as JSON; failures go through GlobalExceptionHandler.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class InvokeController {

    private static final String COMMAND_FIELD = "cmd";

    private final CommandRegistry commandRegistry;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final LedgerMetrics ledgerMetrics;

    @PostMapping("/invoke")
    public ResponseEntity<Object> invoke(@RequestBody JsonNode body) {
        JsonNode cmdNode = body == null ? null : body.get(COMMAND_FIELD);
        if (cmdNode == null || !cmdNode.isTextual() || cmdNode.asText().isBlank()) {
            throw new ValidationFailedException("Command is required");
        }
        String command = cmdNode.asText();

        MDC.put(CorrelationContext.COMMAND_MDC_KEY, command);
        long startTime = System.currentTimeMillis();
        try {
            log.debug("Dispatching command");
            CommandPayload payload = new CommandPayload(body, objectMapper, validator);
            Object result = ledgerMetrics.timeCommand(command, () -> commandRegistry.dispatch(command, payload));

            log.info("Command handled: duration={}ms", System.currentTimeMillis() - startTime);
            return ResponseEntity.ok(result);
        } finally {
            CorrelationContext.clearCommandScope();
        }
    }
}
