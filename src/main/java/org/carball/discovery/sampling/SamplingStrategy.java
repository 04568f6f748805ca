package org.carball.discovery.sampling;

import org.carball.discovery.client.QueryException;
import org.carball.discovery.model.sample.DataSample;

/**
 * Turns a time range and a size budget into a representative sample of one event type.
 */
public interface SamplingStrategy {

    DataSample sample(SamplingParams params) throws QueryException;

    /**
     * Sample size this strategy would aim for given the population size.
     */
    long estimateSampleSize(long totalRecords);

    String getName();
}
