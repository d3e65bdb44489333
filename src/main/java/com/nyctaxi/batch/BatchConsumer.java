package com.nyctaxi.batch;

import com.nyctaxi.error.ProcessingException;
import com.nyctaxi.model.TaxiTrip;

import java.util.List;

/**
 * Callback invoked by {@link BatchSource} for every full or final batch.
 *
 * <p>The batch is a read-only view that is cleared once the callback returns;
 * copy it if it has to outlive the call.
 */
@FunctionalInterface
public interface BatchConsumer {

    void accept(List<TaxiTrip> batch) throws ProcessingException;
}
