/**
 * Test message types and recording collaborators shared by contract tests.
 *
 * @author Courier Team
 * @since 1.0.0
 */
package com.ryuqq.courier.testkit.support;
