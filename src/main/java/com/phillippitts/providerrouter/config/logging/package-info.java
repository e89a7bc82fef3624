/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Router logs use Log4j2 with MDC for request correlation across the asynchronous hop
 * into provider adapters (see {@code ThreadPoolConfig}).
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - identifier of the HTTP request (header or UUID)</li>
 *   <li>{@code caller} - calling service, when the X-Caller header is present</li>
 *   <li>{@code capability} - capability being dispatched, added by the dispatcher</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] [capability] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.providerrouter.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.providerrouter.config.logging;
