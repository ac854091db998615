package com.flagship.lending_pool.custody;

import com.flagship.lending_pool.accounting.AssetKind;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balance-sheet custody kept in memory: one balance per (asset kind, principal)
 * plus the pool vault per asset kind.
 *
 * The vault is a separate account, not a principal, so no caller id can
 * address pool holdings.
 */
@Component
@Slf4j
public class InMemoryAssetCustody implements AssetCustody {

    private final Map<Holding, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<AssetKind, BigInteger> vault = new EnumMap<>(AssetKind.class);

    @Override
    public BigInteger balanceOf(AssetKind kind, String principal) {
        return balances.getOrDefault(new Holding(kind, principal), BigInteger.ZERO);
    }

    /**
     * Assets of this kind held for all pools together.
     */
    public synchronized BigInteger vaultBalance(AssetKind kind) {
        return vault.getOrDefault(kind, BigInteger.ZERO);
    }

    @Override
    public synchronized void transferIn(AssetKind kind, String from, BigInteger amount) {
        requireNonNegative(amount);
        Holding holding = new Holding(kind, from);
        BigInteger available = balanceOf(kind, from);
        if (available.compareTo(amount) < 0) {
            throw new InsufficientFundsException(kind, from, amount, available);
        }
        balances.put(holding, available.subtract(amount));
        vault.merge(kind, amount, BigInteger::add);
        log.debug("Moved {} {} from {} into the vault", amount, kind, from);
    }

    @Override
    public synchronized void transferOut(AssetKind kind, String to, BigInteger amount) {
        requireNonNegative(amount);
        BigInteger available = vaultBalance(kind);
        if (available.compareTo(amount) < 0) {
            throw new InsufficientFundsException(kind, "vault", amount, available);
        }
        vault.put(kind, available.subtract(amount));
        balances.merge(new Holding(kind, to), amount, BigInteger::add);
        log.debug("Moved {} {} from the vault to {}", amount, kind, to);
    }

    /**
     * Mints funds to a principal. Used to fund accounts in development and tests.
     */
    public synchronized void credit(AssetKind kind, String principal, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        balances.merge(new Holding(kind, principal), amount, BigInteger::add);
        log.info("Credited {} {} to {}", amount, kind, principal);
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Transfer amount must not be negative");
        }
    }

    @Value
    private static class Holding {
        AssetKind kind;
        String holder;
    }
}
