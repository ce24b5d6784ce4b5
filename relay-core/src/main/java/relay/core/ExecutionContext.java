/*
 * Copyright (c) 2024 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package relay.core;

import relay.core.scheduler.Scheduler;

/**
 * An object with a finite lifetime that channel transforms can be bound to.
 * <p>
 * Channels derived with a context only keep a weak reference to it: a context that has
 * been garbage collected, or that reports {@link #isAlive() not alive}, stops any further
 * transform and cancels the derived channel.
 *
 * @see LifecycleContext
 */
public interface ExecutionContext {

	/**
	 * @return the {@link Scheduler} transforms bound to this context run on, unless
	 * overridden at derivation time
	 */
	Scheduler scheduler();

	/**
	 * Non-blocking liveness check performed before each transform.
	 *
	 * @return false once the context has been released
	 */
	default boolean isAlive() {
		return true;
	}

	/**
	 * Register an action to run when the context is released, allowing derived channels
	 * to be cancelled eagerly rather than at their next event. Contexts that never
	 * notify release return a {@link Disposable} that does nothing.
	 *
	 * @param action the action to run on release
	 * @return a {@link Disposable} unregistering the action
	 */
	default Disposable onRelease(Runnable action) {
		return Disposables.never();
	}
}
