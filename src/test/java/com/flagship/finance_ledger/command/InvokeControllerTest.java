package com.flagship.finance_ledger.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end checks of the command endpoint: dispatch, JSON naming and the
 * error body.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class InvokeControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("finance_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private ResultActions invoke(Map<String, Object> body) throws Exception {
        return mockMvc.perform(post("/api/invoke")
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(body)));
    }

    @Test
    @DisplayName("create_currency returns the stored currency in snake_case")
    void createAndFetchCurrency() throws Exception {
        printTestHeader("Create currency through the command endpoint");
        String name = "EUR-" + UUID.randomUUID().toString().substring(0, 6);

        String json = invoke(Map.of("cmd", "create_currency", "name", name, "rate", 1.5))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.name").value(name))
            .andExpect(jsonPath("$.is_base").value(false))
            .andReturn()
            .getResponse()
            .getContentAsString();
        long id = objectMapper.readTree(json).get("id").asLong();
        printOutput("Created", json);

        JsonNode fetched = objectMapper.readTree(invoke(Map.of("cmd", "get_currency", "id", id))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString());
        assertEquals(name, fetched.get("name").asText());
        assertEquals(0, new BigDecimal("1.5").compareTo(fetched.get("rate").decimalValue()));
    }

    @Test
    @DisplayName("Unknown command is a 400 naming the command")
    void unknownCommand() throws Exception {
        invoke(Map.of("cmd", "launch_rockets"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown command: launch_rockets"))
            .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("Body without cmd is rejected")
    void missingCommand() throws Exception {
        invoke(Map.of("name", "USD"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Command is required"));
    }

    @Test
    @DisplayName("Bean validation failures come back with per-field details")
    void validationDetails() throws Exception {
        invoke(Map.of("cmd", "create_currency", "rate", 1))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Currency name is required"))
            .andExpect(jsonPath("$.details.name").value("Currency name is required"));
    }

    @Test
    @DisplayName("Missing record maps to 404")
    void notFound() throws Exception {
        invoke(Map.of("cmd", "get_currency", "id", 987654321))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").exists());
    }

    @Test
    @DisplayName("Malformed JSON is a 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/invoke")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cmd\": "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Request body is not valid JSON"));
    }
}
