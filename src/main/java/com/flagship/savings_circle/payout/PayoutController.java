package com.flagship.savings_circle.payout;

import com.flagship.savings_circle.ledger.LedgerService;
import com.flagship.savings_circle.payout.dto.PayoutView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class PayoutController {

    private final PayoutEngine payoutEngine;
    private final LedgerService ledgerService;

    @GetMapping("/api/groups/{groupId}/payouts")
    public ResponseEntity<List<PayoutView>> getPayouts(@PathVariable("groupId") UUID groupId) {
        return ResponseEntity.ok(payoutEngine.getPayouts(groupId).stream().map(PayoutView::from).toList());
    }

    @GetMapping("/api/users/{userId}/wallet")
    public ResponseEntity<Map<String, Object>> getWallet(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(Map.of("user_id", userId, "balance", ledgerService.getWalletBalance(userId)));
    }
}
