/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the bus contract that adapters implement and that application code
 * programs against.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.courier.core.spi.MessageBus} - typed send/receive, handlers, delayed sends, disposal</li>
 *   <li>{@link com.ryuqq.courier.core.spi.MessageLogger} - per-type traffic observer</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., courier-adapter-inmemory) provide concrete implementations. The
 * {@code courier-testkit} module ships a contract test suite every implementation should pass.</p>
 *
 * @since 1.0.0
 * @author Courier Team
 */
package com.ryuqq.courier.core.spi;
