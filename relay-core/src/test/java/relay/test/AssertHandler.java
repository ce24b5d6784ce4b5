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

package relay.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.jspecify.annotations.Nullable;
import relay.core.channel.Event;
import relay.core.channel.EventHandler;
import relay.core.channel.Fallible;
import relay.core.scheduler.Scheduler;

/**
 * An {@link EventHandler} recording every event it receives, with blocking waits and
 * assertions. It also records protocol violations: events delivered concurrently,
 * events after the completion, or a second completion.
 *
 * @param <U> the type of update values
 * @param <S> the type of the success value of the completion
 */
public class AssertHandler<U, S> implements EventHandler<U, S> {

	/**
	 * Default timeout for waiting on the completion or on values.
	 */
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

	public static <U, S> AssertHandler<U, S> create() {
		return new AssertHandler<>();
	}

	final List<U>                    values      = new CopyOnWriteArrayList<>();
	final List<Fallible<S>>          completions = new CopyOnWriteArrayList<>();
	final List<@Nullable Scheduler>  origins     = new CopyOnWriteArrayList<>();
	final List<String>               violations  = new CopyOnWriteArrayList<>();
	final CountDownLatch             completed   = new CountDownLatch(1);
	final AtomicInteger              inFlight    = new AtomicInteger();

	@Override
	public void onEvent(Event<U, S> event, @Nullable Scheduler origin) {
		if (inFlight.incrementAndGet() != 1) {
			violations.add("concurrent delivery of " + event);
		}
		try {
			if (!completions.isEmpty()) {
				violations.add("event after completion: " + event);
			}
			origins.add(origin);
			if (event.isUpdate()) {
				values.add(event.update());
			}
			else {
				completions.add(event.completion());
				completed.countDown();
			}
		}
		finally {
			inFlight.decrementAndGet();
		}
	}

	public List<U> values() {
		return new ArrayList<>(values);
	}

	@Nullable
	public Fallible<S> completion() {
		return completions.isEmpty() ? null : completions.get(0);
	}

	public List<@Nullable Scheduler> origins() {
		return new ArrayList<>(origins);
	}

	public boolean isCompleted() {
		return completed.getCount() == 0;
	}

	public final AssertHandler<U, S> await() {
		return await(DEFAULT_TIMEOUT);
	}

	/**
	 * Blocking method that waits until the completion is received.
	 *
	 * @param timeout the maximum time to wait
	 * @return this
	 */
	public final AssertHandler<U, S> await(Duration timeout) {
		if (completed.getCount() == 0) {
			return this;
		}
		try {
			if (!completed.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
				throw new AssertionError("No completion before timeout, values received: " + values);
			}
			return this;
		}
		catch (InterruptedException ex) {
			throw new AssertionError("Wait interrupted", ex);
		}
	}

	/**
	 * Blocking method that waits until at least {@code n} values have been received.
	 *
	 * @param n the number of values to wait for
	 * @return this
	 */
	public final AssertHandler<U, S> awaitValueCount(int n) {
		long deadline = System.nanoTime() + DEFAULT_TIMEOUT.toNanos();
		while (values.size() < n) {
			if (System.nanoTime() > deadline) {
				throw new AssertionError(String.format("%d out of %d values received within %d ms",
						values.size(), n, DEFAULT_TIMEOUT.toMillis()));
			}
			Thread.onSpinWait();
		}
		return this;
	}

	@SafeVarargs
	public final AssertHandler<U, S> assertValues(U... expectedValues) {
		List<U> expected = Arrays.asList(expectedValues);
		List<U> actual = values();
		if (!expected.equals(actual)) {
			throw new AssertionError("Expected values " + expected + " but received " + actual);
		}
		return this;
	}

	public final AssertHandler<U, S> assertNoValues() {
		if (!values.isEmpty()) {
			throw new AssertionError("Expected no values but received " + values);
		}
		return this;
	}

	public final AssertHandler<U, S> assertNotCompleted() {
		if (!completions.isEmpty()) {
			throw new AssertionError("Expected no completion but received " + completions);
		}
		return this;
	}

	public final AssertHandler<U, S> assertSuccess(@Nullable S expected) {
		Fallible<S> c = assertCompletedOnce();
		if (!c.isSuccess() || !Objects.equals(c.getSuccess(), expected)) {
			throw new AssertionError("Expected success(" + expected + ") but received " + c);
		}
		return this;
	}

	public final AssertHandler<U, S> assertFailure(Class<? extends Throwable> type) {
		Fallible<S> c = assertCompletedOnce();
		if (!type.isInstance(c.getFailure())) {
			throw new AssertionError("Expected failure of type " + type.getName() + " but received " + c);
		}
		return this;
	}

	public final AssertHandler<U, S> assertFailureMessage(String message) {
		Fallible<S> c = assertCompletedOnce();
		Throwable failure = c.getFailure();
		if (failure == null || !message.equals(failure.getMessage())) {
			throw new AssertionError("Expected failure with message <" + message + "> but received " + c);
		}
		return this;
	}

	public final AssertHandler<U, S> assertCancelled() {
		Fallible<S> c = assertCompletedOnce();
		if (!c.isCancellation()) {
			throw new AssertionError("Expected a cancellation but received " + c);
		}
		return this;
	}

	/**
	 * Assert no protocol violation was recorded.
	 *
	 * @return this
	 */
	public final AssertHandler<U, S> assertWellFormed() {
		if (!violations.isEmpty()) {
			throw new AssertionError("Protocol violations: " + violations);
		}
		if (completions.size() > 1) {
			throw new AssertionError("Completion received " + completions.size() + " times: " + completions);
		}
		return this;
	}

	Fallible<S> assertCompletedOnce() {
		assertWellFormed();
		if (completions.isEmpty()) {
			throw new AssertionError("Expected a completion, none received");
		}
		return completions.get(0);
	}
}
