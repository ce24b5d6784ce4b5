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

import java.util.Objects;

import relay.core.scheduler.Scheduler;
import relay.core.scheduler.Schedulers;

/**
 * An {@link ExecutionContext} whose end of life is explicit: {@link #dispose()} marks it
 * as released and runs the registered {@link #onRelease(Runnable) release actions} once.
 * Can be used as is, or extended by objects owning channels bound to their lifetime.
 */
public class LifecycleContext implements ExecutionContext, Disposable {

	/**
	 * Create a context running its transforms on {@link Schedulers#primary()}.
	 *
	 * @return a new live context
	 */
	public static LifecycleContext create() {
		return new LifecycleContext(Schedulers.primary());
	}

	/**
	 * Create a context running its transforms on the given {@link Scheduler}.
	 *
	 * @param scheduler the default scheduler of the context
	 * @return a new live context
	 */
	public static LifecycleContext create(Scheduler scheduler) {
		return new LifecycleContext(scheduler);
	}

	final Scheduler         scheduler;
	final CancellationToken releaseToken = CancellationToken.create();

	protected LifecycleContext(Scheduler scheduler) {
		this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
	}

	@Override
	public Scheduler scheduler() {
		return scheduler;
	}

	@Override
	public boolean isAlive() {
		return !releaseToken.isCancelled();
	}

	@Override
	public Disposable onRelease(Runnable action) {
		return releaseToken.onCancel(action);
	}

	/**
	 * Release the context: it stops being {@link #isAlive() alive} and its release
	 * actions run once, on the calling thread.
	 *
	 * @return true if this call released the context, false if it was already released
	 */
	public boolean release() {
		return releaseToken.cancel();
	}

	@Override
	public void dispose() {
		release();
	}

	@Override
	public boolean isDisposed() {
		return !isAlive();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{" + scheduler + (isAlive() ? "" : ", released") + "}";
	}
}
