/**
 * Reusable contract test suite for {@link com.ryuqq.courier.core.spi.MessageBus} implementations.
 *
 * <p>Adapter modules depend on this module in test scope and extend
 * {@link com.ryuqq.courier.testkit.contract.AbstractMessageBusContractTest}.</p>
 *
 * @author Courier Team
 * @since 1.0.0
 */
package com.ryuqq.courier.testkit.contract;
