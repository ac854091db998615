package com.flagship.lending_pool.pool;

import com.flagship.lending_pool.accounting.AssetOrientation;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the set of pools. Pool ids are sequential, starting at 1.
 *
 * Writes happen only under the execution guard; reads may happen at any time
 * and see the last committed Pool instance.
 */
@Component
public class PoolRegistry {

    private final Map<Long, Pool> pools = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public Pool create(AssetOrientation orientation, PoolParameters parameters) {
        if (orientation == null || parameters == null) {
            throw new LendingException(LendingErrorCode.INVALID_PARAMETER, "Orientation and parameters are required");
        }
        Pool pool = Pool.create(sequence.incrementAndGet(), orientation, parameters);
        pools.put(pool.getId(), pool);
        return pool;
    }

    public Optional<Pool> find(long poolId) {
        return Optional.ofNullable(pools.get(poolId));
    }

    public Pool require(long poolId) {
        return find(poolId)
            .orElseThrow(() -> new LendingException(LendingErrorCode.POOL_NOT_FOUND, "Pool not found: " + poolId));
    }

    /**
     * Replaces the stored state of an existing pool.
     */
    public void put(Pool pool) {
        if (!pools.containsKey(pool.getId())) {
            throw new LendingException(LendingErrorCode.POOL_NOT_FOUND, "Pool not found: " + pool.getId());
        }
        pools.put(pool.getId(), pool);
    }

    public List<Pool> findAll() {
        return pools.values().stream()
            .sorted(Comparator.comparingLong(Pool::getId))
            .toList();
    }

    public int count() {
        return pools.size();
    }
}
