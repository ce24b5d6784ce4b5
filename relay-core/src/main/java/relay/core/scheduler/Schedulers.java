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
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import relay.core.Exceptions;
import relay.util.Logger;
import relay.util.Loggers;

/**
 * {@link Schedulers} provides various {@link Scheduler} flavors usable by channel
 * operators:
 *
 * <ul>
 *     <li>{@link #primary()}: the default, general purpose scheduler, backed by a fixed
 *     pool of daemon threads.</li>
 *     <li>{@link #immediate()}: runs tasks on the calling thread, without any scheduling
 *     latency.</li>
 *     <li>{@link #single()}: a shared single-threaded scheduler.</li>
 *     <li>{@link #fromExecutor(Executor)} / {@link #fromExecutorService(ExecutorService)}:
 *     adapt an existing {@link Executor}.</li>
 * </ul>
 * <p>
 * Factories prefixed with {@code new} (eg. {@link #newSingle(String)}) return a new
 * instance that the caller is responsible for disposing.
 */
public abstract class Schedulers {

	/**
	 * Default pool size of {@link #primary()}, initialized by system property
	 * {@code relay.schedulers.primaryPoolSize} and falls back to the number of processors
	 * available to the runtime on init.
	 *
	 * @see Runtime#availableProcessors()
	 */
	public static final int DEFAULT_POOL_SIZE =
			Optional.ofNullable(System.getProperty("relay.schedulers.primaryPoolSize"))
			        .map(Integer::parseInt)
			        .orElseGet(() -> Runtime.getRuntime().availableProcessors());

	static final String PRIMARY       = "primary";
	static final String SINGLE        = "single";
	static final String IMMEDIATE     = "immediate";
	static final String FROM_EXECUTOR = "fromExecutor";

	static final Logger log = Loggers.getLogger(Schedulers.class);

	static final AtomicReference<Scheduler> CACHED_PRIMARY = new AtomicReference<>();
	static final AtomicReference<Scheduler> CACHED_SINGLE  = new AtomicReference<>();

	static volatile @Nullable BiConsumer<Thread, ? super Throwable> onHandleErrorHook;

	/**
	 * The common, general purpose {@link Scheduler}. Its threads are daemon threads
	 * and its pool size is {@link #DEFAULT_POOL_SIZE}. Tasks submitted independently may
	 * run concurrently and in any order.
	 *
	 * @return the shared primary {@link Scheduler}
	 */
	public static Scheduler primary() {
		return cache(CACHED_PRIMARY, () -> newParallel(PRIMARY, DEFAULT_POOL_SIZE));
	}

	/**
	 * Executes tasks immediately on the caller thread.
	 *
	 * @return the shared immediate {@link Scheduler}
	 */
	public static Scheduler immediate() {
		return ImmediateScheduler.INSTANCE;
	}

	/**
	 * A shared single-threaded {@link Scheduler}: tasks run one at a time, in
	 * submission order.
	 *
	 * @return the shared single {@link Scheduler}
	 */
	public static Scheduler single() {
		return cache(CACHED_SINGLE, () -> newSingle(SINGLE));
	}

	/**
	 * Create a new single-threaded {@link Scheduler} backed by a daemon thread.
	 *
	 * @param name the thread name prefix
	 * @return a new {@link Scheduler}, to be disposed by the caller
	 */
	public static Scheduler newSingle(String name) {
		return newParallel(name, 1);
	}

	/**
	 * Create a new {@link Scheduler} backed by a fixed pool of daemon threads.
	 *
	 * @param name the thread name prefix
	 * @param parallelism the number of threads
	 * @return a new {@link Scheduler}, to be disposed by the caller
	 */
	public static Scheduler newParallel(String name, int parallelism) {
		if (parallelism <= 0) {
			throw new IllegalArgumentException("parallelism must be strictly positive, was: " + parallelism);
		}
		RelayThreadFactory factory = new RelayThreadFactory(name, new AtomicLong(), true,
				Schedulers::defaultUncaughtException);
		return new ExecutorScheduler(Executors.newFixedThreadPool(parallelism, factory), name, true);
	}

	/**
	 * Create a {@link Scheduler} which uses a backing {@link Executor} to schedule
	 * tasks. Disposing the returned scheduler does not shut the executor down.
	 *
	 * @param executor an {@link Executor}
	 * @return a new {@link Scheduler}
	 */
	public static Scheduler fromExecutor(Executor executor) {
		Objects.requireNonNull(executor, "executor");
		return new ExecutorScheduler(executor, FROM_EXECUTOR, false);
	}

	/**
	 * Create a {@link Scheduler} which uses a backing {@link ExecutorService} to schedule
	 * tasks. Disposing the returned scheduler shuts the executor service down.
	 *
	 * @param executorService an {@link ExecutorService}
	 * @return a new {@link Scheduler}
	 */
	public static Scheduler fromExecutorService(ExecutorService executorService) {
		Objects.requireNonNull(executorService, "executorService");
		return new ExecutorScheduler(executorService, FROM_EXECUTOR, true);
	}

	/**
	 * Define a hook that is executed when a {@link Scheduler} has
	 * {@link #handleError(Throwable) handled an error}. Note that it is executed after
	 * the error has been passed to the thread uncaughtErrorHandler, which is not the
	 * case when a fatal error occurs (see {@link Exceptions#throwIfJvmFatal(Throwable)}).
	 *
	 * @param c the new hook to set.
	 */
	public static void onHandleError(BiConsumer<Thread, ? super Throwable> c) {
		if (log.isDebugEnabled()) {
			log.debug("Hooking new default: onHandleError");
		}
		onHandleErrorHook = Objects.requireNonNull(c, "onHandleError");
	}

	/**
	 * Reset the {@link #onHandleError(BiConsumer)} hook to the default no-op behavior.
	 */
	public static void resetOnHandleError() {
		if (log.isDebugEnabled()) {
			log.debug("Reset to factory defaults: onHandleError");
		}
		onHandleErrorHook = null;
	}

	/**
	 * Clear any cached {@link Scheduler} and call dispose on them.
	 */
	public static void shutdownNow() {
		Scheduler primary = CACHED_PRIMARY.getAndSet(null);
		if (primary != null) {
			primary.dispose();
		}
		Scheduler single = CACHED_SINGLE.getAndSet(null);
		if (single != null) {
			single.dispose();
		}
	}

	static Scheduler cache(AtomicReference<Scheduler> reference, Supplier<Scheduler> supplier) {
		for (;;) {
			Scheduler s = reference.get();
			if (s != null) {
				return s;
			}
			Scheduler created = supplier.get();
			if (reference.compareAndSet(null, created)) {
				return created;
			}
			//the race was lost
			created.dispose();
		}
	}

	static void defaultUncaughtException(Thread t, Throwable e) {
		log.error("Scheduler worker in group " + t.getThreadGroup().getName()
				+ " failed with an uncaught exception", e);
	}

	static void handleError(Throwable ex) {
		Thread thread = Thread.currentThread();
		Throwable t = Exceptions.unwrap(ex);
		Thread.UncaughtExceptionHandler x = thread.getUncaughtExceptionHandler();
		if (x != null) {
			x.uncaughtException(thread, t);
		}
		else {
			log.error("Scheduler worker failed with an uncaught exception", t);
		}
		BiConsumer<Thread, ? super Throwable> hook = onHandleErrorHook;
		if (hook != null) {
			hook.accept(thread, t);
		}
	}

	Schedulers() {
	}
}
