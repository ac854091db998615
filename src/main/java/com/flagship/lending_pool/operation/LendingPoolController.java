package com.flagship.lending_pool.operation;

import com.flagship.lending_pool.ledger.Loan;
import com.flagship.lending_pool.operation.dto.BorrowQuoteResponse;
import com.flagship.lending_pool.operation.dto.BorrowRequest;
import com.flagship.lending_pool.operation.dto.DepositRequest;
import com.flagship.lending_pool.operation.dto.DepositorResponse;
import com.flagship.lending_pool.operation.dto.LiquidateRequest;
import com.flagship.lending_pool.operation.dto.LoanResponse;
import com.flagship.lending_pool.operation.dto.PayoffQuoteResponse;
import com.flagship.lending_pool.operation.dto.RepayRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;

/**
 * REST controller for depositor and borrower operations on a pool.
 *
 * The calling principal comes from the identity layer in the
 * {@value #PRINCIPAL_HEADER} header.
 */
@RestController
@RequestMapping("/api/pools/{poolId}")
@RequiredArgsConstructor
@Slf4j
public class LendingPoolController {

    public static final String PRINCIPAL_HEADER = "X-Principal-Id";

    private final LendingPoolService lendingPoolService;
    private final LendingQueryService queryService;

    @PostMapping("/deposits")
    public ResponseEntity<DepositReceipt> deposit(
            @PathVariable("poolId") long poolId,
            @Valid @RequestBody DepositRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String principal) {
        log.info("Received deposit request: poolId={}, amount={}", poolId, request.getAmount());
        DepositReceipt receipt = lendingPoolService.deposit(poolId, principal, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @PostMapping("/withdrawals")
    public WithdrawalReceipt withdraw(
            @PathVariable("poolId") long poolId,
            @RequestHeader(PRINCIPAL_HEADER) String principal) {
        log.info("Received withdrawal request: poolId={}", poolId);
        return lendingPoolService.withdraw(poolId, principal);
    }

    @PostMapping("/loans")
    public ResponseEntity<BorrowReceipt> borrow(
            @PathVariable("poolId") long poolId,
            @Valid @RequestBody BorrowRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String principal) {
        log.info("Received borrow request: poolId={}, collateral={}, duration={}s",
                poolId, request.getCollateralAmount(), request.getDurationSeconds());
        BorrowReceipt receipt = lendingPoolService.borrow(poolId, principal,
                request.getCollateralAmount(), request.getDurationSeconds());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @PostMapping("/repayments")
    public RepaymentReceipt repay(
            @PathVariable("poolId") long poolId,
            @Valid @RequestBody RepayRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String principal) {
        log.info("Received repay request: poolId={}, amount={}", poolId, request.getAmount());
        return lendingPoolService.repay(poolId, principal, request.getAmount());
    }

    @PostMapping("/liquidations")
    public LiquidationReceipt liquidate(
            @PathVariable("poolId") long poolId,
            @Valid @RequestBody LiquidateRequest request,
            @RequestHeader(PRINCIPAL_HEADER) String principal) {
        log.info("Received liquidation request: poolId={}, borrower={}", poolId, request.getBorrower());
        return lendingPoolService.liquidate(poolId, principal, request.getBorrower());
    }

    @GetMapping("/loans/{principal}")
    public LoanResponse getLoan(@PathVariable("poolId") long poolId, @PathVariable("principal") String principal) {
        Loan loan = queryService.getLoan(poolId, principal);
        return LoanResponse.from(poolId, principal, loan, queryService.loanStatus(loan));
    }

    @GetMapping("/depositors/{principal}")
    public DepositorResponse getDepositor(@PathVariable("poolId") long poolId,
                                          @PathVariable("principal") String principal) {
        return new DepositorResponse(poolId, principal,
                queryService.sharesOf(poolId, principal),
                queryService.redeemableAmount(poolId, principal));
    }

    @GetMapping("/quotes/borrow")
    public BorrowQuoteResponse quoteBorrow(@PathVariable("poolId") long poolId,
                                           @RequestParam("collateral_amount") BigInteger collateralAmount,
                                           @RequestParam("duration_seconds") long durationSeconds) {
        return BorrowQuoteResponse.from(queryService.quoteBorrow(poolId, collateralAmount, durationSeconds));
    }

    @GetMapping("/quotes/payoff/{borrower}")
    public PayoffQuoteResponse quotePayoff(@PathVariable("poolId") long poolId,
                                           @PathVariable("borrower") String borrower) {
        return new PayoffQuoteResponse(poolId, borrower, queryService.getPayoffQuote(poolId, borrower));
    }
}
