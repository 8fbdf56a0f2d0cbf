package com.fabric.shared.saga;

/**
 * Exclusive right to write one execution's WAL. Held for a whole drive.
 */
public interface ExecutionLease extends AutoCloseable {

    /** Extends the lease; false if it was lost to another owner. */
    boolean renew();

    @Override
    void close();
}
