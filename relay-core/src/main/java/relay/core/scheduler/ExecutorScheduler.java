/*
 * Copyright (c) 2016-2024 VMware Inc. or its affiliates, All Rights Reserved.
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

package relay.core.scheduler;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import relay.core.Disposable;
import relay.core.Exceptions;

/**
 * Wraps a {@link Executor} and provides the Scheduler API over it.
 * <p>
 * When the scheduler owns the executor (it was created by {@link Schedulers}), disposing
 * the scheduler also shuts the underlying {@link ExecutorService} down.
 */
final class ExecutorScheduler implements Scheduler {

	final Executor executor;
	final String   name;
	final boolean  owned;

	volatile boolean terminated;

	ExecutorScheduler(Executor executor, String name, boolean owned) {
		this.executor = executor;
		this.name = name;
		this.owned = owned;
	}

	@Override
	public Disposable schedule(Runnable task) {
		if (terminated) {
			throw Exceptions.failWithRejected();
		}
		Objects.requireNonNull(task, "task");
		ExecutorPlainRunnable r = new ExecutorPlainRunnable(task);
		//RejectedExecutionException are propagated up, but since Executor doesn't from
		//failing tasks we'll also wrap the execute call in a try catch:
		try {
			executor.execute(r);
		}
		catch (Throwable ex) {
			if (executor instanceof ExecutorService && ((ExecutorService) executor).isShutdown()) {
				terminated = true;
			}
			Schedulers.handleError(ex);
			throw Exceptions.failWithRejected(ex);
		}
		return r;
	}

	@Override
	public void dispose() {
		terminated = true;
		if (owned && executor instanceof ExecutorService) {
			((ExecutorService) executor).shutdownNow();
		}
	}

	@Override
	public boolean isDisposed() {
		return terminated;
	}

	@Override
	public String toString() {
		return name + "(" + executor + ")";
	}

	/**
	 * A non-tracked runnable that wraps a task and offers cancel support in the form
	 * of not executing the task.
	 * <p>Since Executor doesn't have cancellation support of its own, the
	 * ExecutorPlainRunnable will stay in the Executor's queue and be always executed.
	 */
	static final class ExecutorPlainRunnable extends AtomicBoolean
			implements Runnable, Disposable {

		private static final long serialVersionUID = 5116223460201378097L;

		final Runnable task;

		ExecutorPlainRunnable(Runnable task) {
			this.task = task;
		}

		@Override
		public void run() {
			if (!get()) {
				try {
					task.run();
				}
				catch (Throwable ex) {
					Schedulers.handleError(ex);
				}
				finally {
					lazySet(true);
				}
			}
		}

		@Override
		public boolean isDisposed() {
			return get();
		}

		@Override
		public void dispose() {
			set(true);
		}
	}
}
