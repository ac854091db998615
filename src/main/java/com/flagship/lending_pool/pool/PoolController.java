package com.flagship.lending_pool.pool;

import com.flagship.lending_pool.operation.LendingQueryService;
import com.flagship.lending_pool.pool.dto.CreatePoolRequest;
import com.flagship.lending_pool.pool.dto.PoolResponse;
import com.flagship.lending_pool.pool.dto.UpdatePoolParametersRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Pool listing and administration endpoints.
 * Creating and updating pools is owner-only.
 */
@RestController
@RequestMapping("/api/pools")
@RequiredArgsConstructor
public class PoolController {

    public static final String PRINCIPAL_HEADER = "X-Principal-Id";

    private final PoolAdminService adminService;
    private final LendingQueryService queryService;

    @PostMapping
    public ResponseEntity<PoolResponse> createPool(
            @Valid @RequestBody CreatePoolRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String principal) {
        Pool pool = adminService.createPool(principal, request.getOrientation(),
            new PoolParameters(request.getInterestRate(), request.getCollateralFactor(), request.getReserveFeeRate()));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(pool));
    }

    @PutMapping("/{id}/parameters")
    public ResponseEntity<PoolResponse> updateParameters(
            @PathVariable("id") long id,
            @Valid @RequestBody UpdatePoolParametersRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String principal) {
        Pool pool = adminService.updateParameters(principal, id,
            new PoolParameters(request.getInterestRate(), request.getCollateralFactor(), request.getReserveFeeRate()));
        return ResponseEntity.ok(toResponse(pool));
    }

    @GetMapping
    public List<PoolResponse> listPools() {
        return queryService.listPools().stream().map(this::toResponse).toList();
    }

    @GetMapping("/{id}")
    public PoolResponse getPool(@PathVariable("id") long id) {
        return toResponse(queryService.getPool(id));
    }

    private PoolResponse toResponse(Pool pool) {
        return PoolResponse.from(pool,
            queryService.depositorCount(pool.getId()),
            queryService.openLoanCount(pool.getId()));
    }
}
