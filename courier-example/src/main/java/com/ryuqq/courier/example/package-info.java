/**
 * Prime checker reference workload.
 *
 * <p>Checker handlers and a printer handler communicate only through an
 * {@link com.ryuqq.courier.adapter.inmemory.bus.InMemoryMessageBus}; the printer doubles as the
 * producer of new candidates when idle.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
package com.ryuqq.courier.example;
