package com.phillippitts.providerrouter.service.cost;

import com.phillippitts.providerrouter.domain.BillingMode;
import com.phillippitts.providerrouter.domain.CapabilityRequest;
import com.phillippitts.providerrouter.domain.ProviderCandidate;

import java.util.Objects;

/**
 * Estimates the USD cost of calling a candidate. Pure and stateless.
 *
 * <ul>
 *   <li>TOKEN: {@code costPerUnitIn * inputSize + costPerUnitOut * outputSize}</li>
 *   <li>PER_OPERATION: {@code costPerOperation}, sizes ignored</li>
 * </ul>
 */
public class CostEstimator {

    public double estimate(ProviderCandidate candidate, long inputSize, long outputSize) {
        Objects.requireNonNull(candidate, "candidate");
        if (inputSize < 0 || outputSize < 0) {
            throw new IllegalArgumentException("Sizes must not be negative");
        }
        if (candidate.billingMode() == BillingMode.PER_OPERATION) {
            return candidate.costPerOperation();
        }
        return candidate.costPerUnitIn() * inputSize + candidate.costPerUnitOut() * outputSize;
    }

    public double estimate(ProviderCandidate candidate, CapabilityRequest<?> request) {
        return estimate(candidate, request.estimatedInputSize(), request.estimatedOutputSize());
    }
}
