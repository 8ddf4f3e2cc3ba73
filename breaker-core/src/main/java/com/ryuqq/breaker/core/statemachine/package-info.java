/**
 * Circuit breaker state machine package.
 *
 * <p>This package holds the current breaker state, applies transitions and invokes
 * a hook synchronously for every effective transition.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.breaker.core.statemachine.StateMachine} - State holder and transition application</li>
 *   <li>{@link com.ryuqq.breaker.core.statemachine.TransitionHook} - Callback invoked on every effective transition</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StateMachine machine = new StateMachine(clock, (from, to) -&gt; log.info("{} -&gt; {}", from, to));
 * machine.transitionTo(CircuitBreakerState.OPEN);      // hook called
 * machine.transitionTo(CircuitBreakerState.OPEN);      // no-op, hook not called
 * machine.compareAndTransition(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Idempotence:</strong> Transition to the current state changes nothing</li>
 *   <li><strong>Serialization:</strong> Transition and hook run under one lock</li>
 *   <li><strong>No legality check:</strong> The engine requests legal transitions only</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Breaker Team
 */
package com.ryuqq.breaker.core.statemachine;
