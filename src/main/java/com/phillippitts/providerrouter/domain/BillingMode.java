package com.phillippitts.providerrouter.domain;

/** How a provider bills a call. */
public enum BillingMode {
    /** Billed per input and output unit (tokens, characters). */
    TOKEN,
    /** Billed a flat amount per operation (e.g. one generated image). */
    PER_OPERATION
}
