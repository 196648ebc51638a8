/**
 * Delayed-send scheduling backed by a small timer pool.
 *
 * @author Courier Team
 * @since 1.0.0
 */
package com.ryuqq.courier.adapter.inmemory.scheduler;
