package com.driftguard.core.reference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Holds the current {@link ReferenceData} snapshot for concurrent readers.
 *
 * <p>
 * Readers call {@link #current()} once per record and work on that snapshot.
 * {@link #reload(Supplier)} builds the replacement completely before
 * publishing it, so a reader never sees a partly loaded table. Reloads are
 * serialized.
 * </p>
 *
 * @since 1.0.0
 */
public class ReferenceDataRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceDataRegistry.class);

    private volatile ReferenceData current;

    public ReferenceDataRegistry() {
        this(ReferenceData.empty());
    }

    public ReferenceDataRegistry(ReferenceData initial) {
        this.current = Objects.requireNonNull(initial, "Initial reference data must not be null");
    }

    public ReferenceData current() {
        return current;
    }

    /**
     * Replace the snapshot with one produced by {@code loader}. If the loader
     * throws, the previous snapshot stays in place and the exception
     * propagates.
     *
     * @param loader produces the new snapshot; must not return {@code null}
     * @return the published snapshot
     */
    public synchronized ReferenceData reload(Supplier<ReferenceData> loader) {
        Objects.requireNonNull(loader, "loader must not be null");
        ReferenceData next = Objects.requireNonNull(loader.get(), "loader returned null reference data");
        current = next;
        LOG.info("Reference data swapped: {}", next);
        return next;
    }
}
