package com.phillippitts.providerrouter.domain;

/**
 * Circuit-breaker state of a provider.
 *
 * <ul>
 *   <li>CLOSED: healthy, routed normally</li>
 *   <li>OPEN: failure threshold reached, skipped until the cooldown elapses</li>
 *   <li>HALF_OPEN: cooldown elapsed, routable again; next success closes, next failure reopens</li>
 * </ul>
 */
public enum CircuitState { CLOSED, OPEN, HALF_OPEN }
