package com.flagship.savings_circle.cycle;

import com.flagship.savings_circle.cycle.dto.ContributionView;
import com.flagship.savings_circle.cycle.dto.CycleView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read-only views of a group's rotation.
 */
@RestController
@RequestMapping("/api/groups/{groupId}")
@RequiredArgsConstructor
public class CycleController {

    private final ContributionService contributionService;

    @GetMapping("/cycles")
    public ResponseEntity<List<CycleView>> getCycles(@PathVariable("groupId") UUID groupId) {
        return ResponseEntity.ok(contributionService.getCycles(groupId).stream().map(CycleView::from).toList());
    }

    @GetMapping("/cycles/{cycleNumber}/contributions")
    public ResponseEntity<List<ContributionView>> getCycleContributions(@PathVariable("groupId") UUID groupId,
                                                                        @PathVariable("cycleNumber") int cycleNumber) {
        return ResponseEntity.ok(contributionService.getContributions(groupId, cycleNumber).stream()
            .map(ContributionView::from)
            .toList());
    }

    @GetMapping("/contributions")
    public ResponseEntity<List<ContributionView>> getMemberContributions(@PathVariable("groupId") UUID groupId,
                                                                         @RequestParam("userId") UUID userId) {
        return ResponseEntity.ok(contributionService.getContributionsForUser(groupId, userId).stream()
            .map(ContributionView::from)
            .toList());
    }
}
