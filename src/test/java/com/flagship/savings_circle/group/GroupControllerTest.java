package com.flagship.savings_circle.group;

import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Group API tests: creation, lookup and operator status changes.
 */
class GroupControllerTest extends AbstractIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Creating a group should return 201 with a FORMING group and its slots")
    void testCreateGroup() throws Exception {
        printTestHeader("Create Group");

        String body = "{\"name\":\"Market women\",\"contribution_amount\":5000,\"frequency\":\"WEEKLY\","
            + "\"total_slots\":4,\"created_by\":\"" + UUID.randomUUID() + "\"}";

        MvcResult result = mockMvc.perform(post("/api/groups")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("FORMING"))
            .andExpect(jsonPath("$.contribution_amount").value(5000))
            .andExpect(jsonPath("$.entry_amount").value(5500))
            .andExpect(jsonPath("$.total_slots").value(4))
            .andExpect(jsonPath("$.current_member_count").value(0))
            .andReturn();

        UUID groupId = UUID.fromString(objectMapper.readTree(result.getResponse().getContentAsString())
            .get("id").asText());
        printOutput("Group", groupId);

        mockMvc.perform(get("/api/groups/{groupId}", groupId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("Market women"));
        mockMvc.perform(get("/api/groups/{groupId}/slots", groupId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(4))
            .andExpect(jsonPath("$[0].status").value("AVAILABLE"));

        printSuccess("Group and four slots created");
    }

    @Test
    @DisplayName("Invalid groups should return 400")
    void testCreateGroup_Invalid() throws Exception {
        mockMvc.perform(post("/api/groups")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Solo\",\"contribution_amount\":5000,\"frequency\":\"WEEKLY\","
                    + "\"total_slots\":1,\"created_by\":\"" + UUID.randomUUID() + "\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.totalSlots").exists());

        mockMvc.perform(post("/api/groups")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Odd\",\"contribution_amount\":5000,\"frequency\":\"YEARLY\","
                    + "\"total_slots\":3,\"created_by\":\"" + UUID.randomUUID() + "\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Pause and resume should return a forming group to FORMING")
    void testPauseResume_Forming() throws Exception {
        printTestHeader("Pause and Resume");

        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");

        mockMvc.perform(post("/api/groups/{groupId}/pause", group.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("PAUSED"));
        mockMvc.perform(post("/api/groups/{groupId}/resume", group.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FORMING"));
        mockMvc.perform(post("/api/groups/{groupId}/resume", group.getId()))
            .andExpect(status().isConflict());

        printSuccess("PAUSED -> FORMING");
    }

    @Test
    @DisplayName("Resuming a started group should return it to ACTIVE")
    void testPauseResume_Active() {
        gatewayPaysInFull();
        GroupEntity group = createGroup(2, 1000, Frequency.WEEKLY, "2.00");
        fillGroup(group);

        assertEquals(GroupStatus.PAUSED, groupService.pause(group.getId()).getStatus());
        assertEquals(GroupStatus.ACTIVE, groupService.resume(group.getId()).getStatus());
    }

    @Test
    @DisplayName("Cancelled groups should accept no further transitions")
    void testCancel_Terminal() throws Exception {
        GroupEntity group = createGroup(3, 1000, Frequency.WEEKLY, "2.00");

        mockMvc.perform(post("/api/groups/{groupId}/cancel", group.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));
        mockMvc.perform(post("/api/groups/{groupId}/pause", group.getId()))
            .andExpect(status().isConflict());
        mockMvc.perform(get("/api/groups/{groupId}", UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }
}
