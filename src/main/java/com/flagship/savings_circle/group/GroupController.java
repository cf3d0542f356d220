package com.flagship.savings_circle.group;

import com.flagship.savings_circle.group.dto.CreateGroupRequest;
import com.flagship.savings_circle.group.dto.GroupResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
public class GroupController {

    private final GroupService groupService;

    @PostMapping
    public ResponseEntity<GroupResponse> createGroup(@Valid @RequestBody CreateGroupRequest request) {
        GroupEntity group = groupService.createGroup(
            request.getName(),
            request.getContributionAmount(),
            request.getFrequency(),
            request.getTotalSlots(),
            request.getServiceFeePercentage(),
            request.getSecurityDepositPercentage(),
            request.getCreatedBy()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(GroupResponse.from(group));
    }

    @GetMapping("/{groupId}")
    public ResponseEntity<GroupResponse> getGroup(@PathVariable("groupId") UUID groupId) {
        return ResponseEntity.ok(GroupResponse.from(groupService.getGroup(groupId)));
    }

    @PostMapping("/{groupId}/pause")
    public ResponseEntity<GroupResponse> pause(@PathVariable("groupId") UUID groupId) {
        return ResponseEntity.ok(GroupResponse.from(groupService.pause(groupId)));
    }

    @PostMapping("/{groupId}/resume")
    public ResponseEntity<GroupResponse> resume(@PathVariable("groupId") UUID groupId) {
        return ResponseEntity.ok(GroupResponse.from(groupService.resume(groupId)));
    }

    @PostMapping("/{groupId}/cancel")
    public ResponseEntity<GroupResponse> cancel(@PathVariable("groupId") UUID groupId) {
        return ResponseEntity.ok(GroupResponse.from(groupService.cancel(groupId)));
    }
}
