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

package relay.util.concurrent;

import java.util.Locale;
import java.util.Objects;
import java.util.function.UnaryOperator;

import org.jspecify.annotations.Nullable;
import relay.util.Logger;
import relay.util.Loggers;

/**
 * A thread-safe container with a single, optional head that can only be changed by
 * atomically applying a function to the current head.
 * <p>
 * Several backends are available, see {@link Strategy}. They all expose the same
 * behavior and only differ in their liveness characteristics. The backend used by
 * {@link #create()} is chosen once, when this class is initialized, and can be forced
 * with the {@value #STRATEGY_PROPERTY} {@link System#getProperty(String) System property}.
 * <p>
 * Heads are expected to be immutable (typically the first node of a persistent linked
 * list). Since every head installed by {@link #update(UnaryOperator)} is a distinct
 * allocation, comparing heads by identity is enough to detect a concurrent change.
 *
 * @param <T> the type of the head
 */
public abstract class AtomicSlot<T> {

	/**
	 * The system property used to force the {@link Strategy} picked by {@link #create()}.
	 * Accepted values are the {@link Strategy} names, case-insensitive.
	 */
	public static final String STRATEGY_PROPERTY = "relay.atomicSlot.strategy";

	static final Logger log = Loggers.getLogger(AtomicSlot.class);

	/**
	 * The {@link Strategy} used by {@link #create()} and {@link #create(Object)}.
	 */
	public static final Strategy DEFAULT_STRATEGY = detectStrategy(System.getProperty(STRATEGY_PROPERTY));

	/**
	 * The synchronization strategies an {@link AtomicSlot} can be backed by.
	 */
	public enum Strategy {
		/**
		 * A compare-and-swap retry loop, never blocks. The update function may run
		 * more than once per call under contention.
		 */
		LOCK_FREE,
		/**
		 * The JVM lightweight monitor ({@code synchronized}).
		 */
		MONITOR,
		/**
		 * A busy-spinning lock over an int flag.
		 */
		SPIN_LOCK,
		/**
		 * A single-permit {@link java.util.concurrent.Semaphore} used as a mutex.
		 */
		SEMAPHORE
	}

	static Strategy detectStrategy(@Nullable String requested) {
		if (requested == null || requested.isEmpty()) {
			// field updaters CAS references natively on every supported JVM
			return Strategy.LOCK_FREE;
		}
		try {
			Strategy strategy = Strategy.valueOf(requested.trim().toUpperCase(Locale.ROOT));
			log.debug("Using {} atomic slots as requested by {}", strategy, STRATEGY_PROPERTY);
			return strategy;
		}
		catch (IllegalArgumentException e) {
			log.warn("Unknown value '{}' for {}, falling back to {}", requested, STRATEGY_PROPERTY, Strategy.LOCK_FREE);
			return Strategy.LOCK_FREE;
		}
	}

	/**
	 * Create an empty {@link AtomicSlot} backed by the {@link #DEFAULT_STRATEGY}.
	 *
	 * @param <T> the type of the head
	 * @return a new empty slot
	 */
	public static <T> AtomicSlot<T> create() {
		return create(DEFAULT_STRATEGY, null);
	}

	/**
	 * Create an {@link AtomicSlot} backed by the {@link #DEFAULT_STRATEGY}.
	 *
	 * @param initialHead the initial head, possibly null
	 * @param <T> the type of the head
	 * @return a new slot
	 */
	public static <T> AtomicSlot<T> create(@Nullable T initialHead) {
		return create(DEFAULT_STRATEGY, initialHead);
	}

	/**
	 * Create an {@link AtomicSlot} backed by the given {@link Strategy}.
	 *
	 * @param strategy the backend to use
	 * @param initialHead the initial head, possibly null
	 * @param <T> the type of the head
	 * @return a new slot
	 */
	public static <T> AtomicSlot<T> create(Strategy strategy, @Nullable T initialHead) {
		Objects.requireNonNull(strategy, "strategy");
		switch (strategy) {
			case MONITOR:
				return new MonitorAtomicSlot<>(initialHead);
			case SPIN_LOCK:
				return new SpinLockAtomicSlot<>(initialHead);
			case SEMAPHORE:
				return new SemaphoreAtomicSlot<>(initialHead);
			case LOCK_FREE:
			default:
				return new LockFreeAtomicSlot<>(initialHead);
		}
	}

	/**
	 * Return the current head. The value was the head at some instant during the call,
	 * it may have been replaced by the time the caller looks at it.
	 *
	 * @return the current head, possibly null
	 */
	@Nullable
	public abstract T head();

	/**
	 * Atomically replace the head with the result of the given function.
	 * <p>
	 * The function receives the current head (possibly null) and returns the new head
	 * (possibly null). It must be free of side effects: depending on the backend it can
	 * be invoked several times, in which case only the last invocation's result is
	 * installed. If the function throws, the head is left unchanged and the exception
	 * is propagated.
	 *
	 * @param transform the pure function computing the new head from the old one
	 * @return the {@link Swap} describing the replacement that took place
	 */
	public abstract Swap<T> update(UnaryOperator<@Nullable T> transform);

	/**
	 * @return the {@link Strategy} backing this slot
	 */
	public abstract Strategy strategy();

	@Override
	public String toString() {
		return "AtomicSlot{" + strategy().name().toLowerCase(Locale.ROOT) + ", head=" + head() + "}";
	}

	/**
	 * The result of an {@link #update(UnaryOperator)}: the head that the winning
	 * invocation of the function observed, and the head it produced.
	 *
	 * @param <T> the type of the head
	 */
	public static final class Swap<T> {

		@Nullable
		final T oldHead;
		@Nullable
		final T newHead;

		Swap(@Nullable T oldHead, @Nullable T newHead) {
			this.oldHead = oldHead;
			this.newHead = newHead;
		}

		/**
		 * @return the replaced head, possibly null
		 */
		@Nullable
		public T oldHead() {
			return oldHead;
		}

		/**
		 * @return the installed head, possibly null
		 */
		@Nullable
		public T newHead() {
			return newHead;
		}

		/**
		 * @return true if the installed head is a different reference than the replaced one
		 */
		public boolean changed() {
			return oldHead != newHead;
		}

		@Override
		public String toString() {
			return "Swap{" + oldHead + " -> " + newHead + "}";
		}
	}
}
