/**
 * Provider-router exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.providerrouter.exception.ProviderRouterException} - Base exception
 *       for all router errors</li>
 *   <li>{@link com.phillippitts.providerrouter.exception.ConfigurationException} - Empty or malformed
 *       candidate list; fatal at startup</li>
 *   <li>{@link com.phillippitts.providerrouter.exception.NoProviderAvailableException} - Every candidate
 *       was unhealthy or filtered out, even after one health reset</li>
 *   <li>{@link com.phillippitts.providerrouter.exception.AllProvidersFailedException} - Every attempted
 *       candidate failed; carries the full trace</li>
 *   <li>{@link com.phillippitts.providerrouter.exception.TransientProviderException} - A single provider
 *       call failed; internal to a dispatch and never surfaced</li>
 * </ul>
 *
 * <p>Only {@code NoProviderAvailableException} and {@code AllProvidersFailedException} escape a dispatch.
 * Both map to HTTP 503 via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.providerrouter.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.providerrouter.exception;
