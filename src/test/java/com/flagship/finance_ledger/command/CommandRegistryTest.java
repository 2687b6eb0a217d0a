package com.flagship.finance_ledger.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_ledger.config.JacksonConfig;
import com.flagship.finance_ledger.exception.ValidationFailedException;
import jakarta.validation.Validation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandRegistryTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    private CommandPayload payload(String json) throws Exception {
        return new CommandPayload(objectMapper.readTree(json), objectMapper,
            Validation.buildDefaultValidatorFactory().getValidator());
    }

    @Test
    @DisplayName("Commands from every module are dispatched by name")
    void dispatch() throws Exception {
        CommandModule echo = () -> Map.of("echo_id", p -> p.id("id"));
        CommandModule hello = () -> Map.of("say_hello", p -> CommandHandler.message("hello"));
        CommandRegistry registry = new CommandRegistry(List.of(echo, hello));

        assertEquals(42L, registry.dispatch("echo_id", payload("{\"cmd\":\"echo_id\",\"id\":42}")));
        assertEquals(Map.of("message", "hello"), registry.dispatch("say_hello", payload("{}")));
        assertEquals(2, registry.names().size());
    }

    @Test
    @DisplayName("Unknown commands are rejected with the command name")
    void unknownCommand() throws Exception {
        CommandRegistry registry = new CommandRegistry(List.of());

        ValidationFailedException e = assertThrows(ValidationFailedException.class,
            () -> registry.dispatch("drop_tables", payload("{}")));
        assertEquals("Unknown command: drop_tables", e.getMessage());
    }

    @Test
    @DisplayName("Two modules registering the same name fail at startup")
    void duplicateName() {
        CommandModule first = () -> Map.of("get_sale", p -> "a");
        CommandModule second = () -> Map.of("get_sale", p -> "b");

        assertThrows(IllegalStateException.class, () -> new CommandRegistry(List.of(first, second)));
    }
}
