/**
 * In-memory typed message bus.
 *
 * <p>This package contains the reference implementation of the
 * {@link com.ryuqq.courier.core.spi.MessageBus} SPI. Messages never leave the JVM.</p>
 *
 * <h2>Architecture</h2>
 *
 * <ul>
 *   <li><strong>{@link com.ryuqq.courier.adapter.inmemory.bus.InMemoryMessageBus}:</strong> per-type
 *       queues behind one lock and one condition</li>
 *   <li><strong>MessageQueue:</strong> FIFO of (payload, target) entries with targeted removal</li>
 *   <li><strong>HandlerWorker:</strong> one background thread per registered handler</li>
 *   <li><strong>{@link com.ryuqq.courier.adapter.inmemory.bus.MessageBusConfig}:</strong> thread naming,
 *       join timeout and delayed-send pool size</li>
 * </ul>
 *
 * <h2>Message Lifecycle</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │    send     │ (blocks while queue length &gt;= maxQueued)
 * └──────┬──────┘
 *        │
 *        ▼
 * ┌─────────────┐
 * │ type queue  │ (FIFO, entries tagged with a TargetId)
 * └──────┬──────┘
 *        │
 *        ├──► receive / handler ─────────────────────► [Delivered once]
 *        │
 *        └──► dispose ───────────────────────────────► [Dropped]
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>No per-call timeout:</strong> disposal is the only way to release a blocked call</li>
 *   <li><strong>Shutdown ordering:</strong> stop throttled producers before their consumers</li>
 * </ul>
 *
 * @see com.ryuqq.courier.core.spi.MessageBus
 * @author Courier Team
 * @since 1.0.0
 */
package com.ryuqq.courier.adapter.inmemory.bus;
