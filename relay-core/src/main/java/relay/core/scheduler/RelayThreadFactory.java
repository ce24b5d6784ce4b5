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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

import org.jspecify.annotations.Nullable;

/**
 * The {@link ThreadFactory} used by the {@link Schedulers} factories, creating
 * {@link Thread threads} named after the scheduler with an increasing suffix.
 */
final class RelayThreadFactory implements ThreadFactory, Thread.UncaughtExceptionHandler {

	final private String      name;
	final private AtomicLong  counterReference;
	final private boolean     daemon;

	@Nullable
	final private BiConsumer<Thread, Throwable> uncaughtExceptionHandler;

	RelayThreadFactory(String name,
			AtomicLong counterReference,
			boolean daemon,
			@Nullable BiConsumer<Thread, Throwable> uncaughtExceptionHandler) {
		this.name = name;
		this.counterReference = counterReference;
		this.daemon = daemon;
		this.uncaughtExceptionHandler = uncaughtExceptionHandler;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread t = new Thread(runnable, name + "-" + counterReference.incrementAndGet());
		if (daemon) {
			t.setDaemon(true);
		}
		if (uncaughtExceptionHandler != null) {
			t.setUncaughtExceptionHandler(this);
		}
		return t;
	}

	@Override
	public void uncaughtException(Thread t, Throwable e) {
		if (uncaughtExceptionHandler == null) {
			return;
		}
		uncaughtExceptionHandler.accept(t, e);
	}
}
