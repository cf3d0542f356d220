package com.flagship.savings_circle.slot;

import com.flagship.savings_circle.config.SettlementProperties;
import com.flagship.savings_circle.slot.dto.ReserveSlotRequest;
import com.flagship.savings_circle.slot.dto.SlotReservationResponse;
import com.flagship.savings_circle.slot.dto.SlotView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Slot query and join-request endpoints.
 *
 * A join request only reserves a slot. Membership is created later, once the
 * entry payment for that user is verified.
 */
@RestController
@RequestMapping("/api/groups/{groupId}/slots")
@RequiredArgsConstructor
@Slf4j
public class SlotController {

    private final SlotRegistry slotRegistry;
    private final SettlementProperties settlementProperties;

    @GetMapping
    public ResponseEntity<List<SlotView>> getSlots(@PathVariable("groupId") UUID groupId) {
        Instant now = slotRegistry.now();
        List<SlotView> slots = slotRegistry.getSlots(groupId).stream()
            .map(slot -> SlotView.from(slot, now))
            .toList();
        return ResponseEntity.ok(slots);
    }

    @PostMapping("/reservations")
    public ResponseEntity<SlotReservationResponse> reserve(@PathVariable("groupId") UUID groupId,
                                                           @Valid @RequestBody ReserveSlotRequest request) {
        log.info("Reservation requested: groupId={}, userId={}, slot={}",
            groupId, request.getUserId(), request.getSlotNumber() != null ? request.getSlotNumber() : "any");
        SlotReservation reservation = slotRegistry.reserveSlot(
            groupId, request.getSlotNumber(), request.getUserId(), settlementProperties.getReservationTtl());
        return ResponseEntity.status(HttpStatus.CREATED).body(SlotReservationResponse.from(reservation));
    }

    @DeleteMapping("/{slotNumber}/reservation")
    public ResponseEntity<Map<String, Object>> release(@PathVariable("groupId") UUID groupId,
                                                       @PathVariable("slotNumber") int slotNumber) {
        boolean released = slotRegistry.releaseSlot(groupId, slotNumber);
        return ResponseEntity.ok(Map.of("slot_number", slotNumber, "released", released));
    }
}
