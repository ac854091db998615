package com.flagship.lending_pool.custody;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_pool.accounting.AssetKind;
import com.flagship.lending_pool.pool.PoolAdminService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Map;

/**
 * Balances held by the in-memory custody, and owner-only funding for
 * development and test environments.
 */
@RestController
@RequestMapping("/api/custody")
@RequiredArgsConstructor
public class CustodyController {

    private final InMemoryAssetCustody custody;
    private final PoolAdminService adminService;

    @PostMapping("/credit")
    public Map<String, Object> credit(@Valid @RequestBody CreditRequest request,
                                      @RequestHeader("X-Principal-Id") String caller) {
        adminService.requireOwner(caller);
        custody.credit(request.getAsset(), request.getPrincipal(), request.getAmount());
        return balance(request.getAsset(), request.getPrincipal());
    }

    @GetMapping("/balances/{asset}/{principal}")
    public Map<String, Object> balance(@PathVariable("asset") AssetKind asset,
                                       @PathVariable("principal") String principal) {
        return Map.of(
            "asset", asset,
            "principal", principal,
            "balance", custody.balanceOf(asset, principal).toString());
    }

    @GetMapping("/vault/{asset}")
    public Map<String, Object> vault(@PathVariable("asset") AssetKind asset) {
        return Map.of(
            "asset", asset,
            "balance", custody.vaultBalance(asset).toString());
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreditRequest {
        @NotNull
        @JsonProperty("asset")
        private AssetKind asset;

        @NotBlank
        @JsonProperty("principal")
        private String principal;

        @NotNull
        @Positive
        @JsonProperty("amount")
        private BigInteger amount;
    }
}
