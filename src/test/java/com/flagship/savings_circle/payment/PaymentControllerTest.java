package com.flagship.savings_circle.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.group.Frequency;
import com.flagship.savings_circle.group.GroupEntity;
import com.flagship.savings_circle.support.AbstractIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Payment API tests.
 *
 * These tests verify:
 * - Initiation computes the amount server-side and returns 201
 * - A repeated Idempotency-Key returns the original payment with 200
 * - Invalid requests are rejected before anything is recorded
 * - Verify settles the payment and reports the outcome
 */
class PaymentControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Initiating an entry payment should return 201 with the entry amount")
    void testInitiate_EntryPayment() throws Exception {
        printTestHeader("Initiate Entry Payment");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        UUID userId = UUID.randomUUID();

        mockMvc.perform(post("/api/payments/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryRequest(group.getId(), userId, 2)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.purpose").value("ENTRY_PAYMENT"))
            .andExpect(jsonPath("$.amount").value(1100))
            .andExpect(jsonPath("$.currency").value("NGN"))
            .andExpect(jsonPath("$.preferred_slot").value(2))
            .andExpect(jsonPath("$.verification_status").value("PENDING"))
            .andExpect(jsonPath("$.processed").value(false));

        printSuccess("Entry payment initiated for 1100");
    }

    @Test
    @DisplayName("Same Idempotency-Key should return the original payment with 200")
    void testInitiate_IdempotencyKeyReplay() throws Exception {
        printTestHeader("Idempotency-Key Replay");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        String body = entryRequest(group.getId(), UUID.randomUUID(), null);
        String key = "key-" + UUID.randomUUID();

        MvcResult first = mockMvc.perform(post("/api/payments/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", key)
                .content(body))
            .andExpect(status().isCreated())
            .andReturn();

        MvcResult second = mockMvc.perform(post("/api/payments/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .header("Idempotency-Key", key)
                .content(body))
            .andExpect(status().isOk())
            .andReturn();

        String firstReference = referenceOf(first);
        String secondReference = referenceOf(second);
        printOutput("First reference", firstReference);
        printOutput("Second reference", secondReference);

        assertEquals(firstReference, secondReference);
        assertTrue(firstReference.startsWith("AJO-ENT-"));
        assertEquals(1, jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM payment_records WHERE idempotency_key = ?", Integer.class, key));

        printSuccess("One payment for one key");
    }

    @Test
    @DisplayName("Entry payment into a group that is not forming should return 409")
    void testInitiate_GroupNotForming() throws Exception {
        printTestHeader("Initiate: Group Not Forming");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        groupService.cancel(group.getId());

        mockMvc.perform(post("/api/payments/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryRequest(group.getId(), UUID.randomUUID(), null)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Invalid State"));

        printSuccess("Cancelled group refused");
    }

    @Test
    @DisplayName("Missing fields and impossible slots should return 400")
    void testInitiate_ValidationErrors() throws Exception {
        printTestHeader("Initiate: Validation");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");

        mockMvc.perform(post("/api/payments/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"group_id\":\"" + group.getId() + "\",\"purpose\":\"ENTRY_PAYMENT\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.userId").value("User ID is required"));

        mockMvc.perform(post("/api/payments/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryRequest(group.getId(), UUID.randomUUID(), 9)))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/payments/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"group_id\":\"" + group.getId() + "\",\"user_id\":\"" + UUID.randomUUID()
                    + "\",\"purpose\":\"RECURRING_CONTRIBUTION\"}"))
            .andExpect(status().isBadRequest());

        printSuccess("Invalid requests rejected");
    }

    @Test
    @DisplayName("Unknown group should return 404")
    void testInitiate_UnknownGroup() throws Exception {
        mockMvc.perform(post("/api/payments/initiate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryRequest(UUID.randomUUID(), UUID.randomUUID(), null)))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET should return a known payment and 404 otherwise")
    void testGetPayment() throws Exception {
        printTestHeader("Get Payment");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        PaymentRecord record = initiateEntry(group.getId(), UUID.randomUUID(), null);

        mockMvc.perform(get("/api/payments/{reference}", record.getReference()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reference").value(record.getReference()))
            .andExpect(jsonPath("$.group_id").value(group.getId().toString()));

        mockMvc.perform(get("/api/payments/{reference}", "AJO-ENT-UNKNOWN"))
            .andExpect(status().isNotFound());

        printSuccess("Lookup by reference works");
    }

    @Test
    @DisplayName("Verify should settle the entry payment and report the slot")
    void testVerify_SettlesEntry() throws Exception {
        printTestHeader("Verify Endpoint");

        gatewayPaysInFull();
        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");
        PaymentRecord record = initiateEntry(group.getId(), UUID.randomUUID(), 2);

        mockMvc.perform(post("/api/payments/{reference}/verify", record.getReference()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verification").value("VERIFIED"))
            .andExpect(jsonPath("$.status").value("MEMBERSHIP_ACTIVATED"))
            .andExpect(jsonPath("$.slot_number").value(2))
            .andExpect(jsonPath("$.group_activated").value(false));

        mockMvc.perform(post("/api/payments/{reference}/verify", record.getReference()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ALREADY_PROCESSED"));

        mockMvc.perform(post("/api/payments/{reference}/verify", "AJO-ENT-UNKNOWN"))
            .andExpect(status().isNotFound());

        printSuccess("Settled once, replay reported");
    }

    private String referenceOf(MvcResult result) throws Exception {
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.get("reference").asText();
    }

    private static String entryRequest(UUID groupId, UUID userId, Integer preferredSlot) {
        return "{\"group_id\":\"" + groupId + "\",\"user_id\":\"" + userId
            + "\",\"purpose\":\"ENTRY_PAYMENT\""
            + (preferredSlot != null ? ",\"preferred_slot\":" + preferredSlot : "")
            + "}";
    }
}
