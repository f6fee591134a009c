package com.sandkev.poolfees.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
class TransactionFeeController {

    private final FeeQueryService fees;

    TransactionFeeController(FeeQueryService fees) { this.fees = fees; }

    // GET /transaction_fee?txn_hash=0x...
    @GetMapping("/transaction_fee")
    ResponseEntity<Map<String, Object>> transactionFee(@RequestParam("txn_hash") String txnHash) {
        return fees.feeFor(txnHash)
                .map(fee -> ResponseEntity.ok(Map.<String, Object>of("message", fee)))
                .orElseGet(() -> ResponseEntity.badRequest().body(Map.of(
                        "error", "txn_hash=" + txnHash + " not found. This is not a valid transaction.")));
    }
}
