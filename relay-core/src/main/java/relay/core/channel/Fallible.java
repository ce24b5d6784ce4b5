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

package relay.core.channel;

import java.util.Objects;
import java.util.concurrent.Callable;

import org.jspecify.annotations.Nullable;
import relay.core.Exceptions;

/**
 * The outcome of a computation: either a success holding a value (which may be
 * {@code null}, typically for {@code Fallible<Void>}) or a failure holding a non-null
 * {@link Throwable}. There is no third state.
 * <p>
 * Used as the completion of every {@link Channel}, and as an update type that
 * {@link Channel#unwrapped(Channel)} and {@link Channel#unsafelyUnwrapped(Channel)} can
 * flatten.
 *
 * @param <T> the type of the success value
 */
public final class Fallible<T> {

	static final Fallible<?> NULL_SUCCESS = new Fallible<>(null, null);

	/**
	 * @param value the success value, possibly null
	 * @param <T> the type of the success value
	 * @return a successful {@link Fallible}
	 */
	@SuppressWarnings("unchecked")
	public static <T> Fallible<T> success(@Nullable T value) {
		if (value == null) {
			return (Fallible<T>) NULL_SUCCESS;
		}
		return new Fallible<>(value, null);
	}

	/**
	 * @param error the cause of the failure
	 * @param <T> the type of the success value
	 * @return a failed {@link Fallible}
	 */
	public static <T> Fallible<T> failure(Throwable error) {
		return new Fallible<>(null, Objects.requireNonNull(error, "error"));
	}

	/**
	 * Run the given {@link Callable} and capture its outcome. Fatal errors as defined by
	 * {@link Exceptions#throwIfFatal(Throwable)} are thrown rather than captured.
	 *
	 * @param callable the computation to run
	 * @param <T> the type of the success value
	 * @return a success holding the returned value, or a failure holding the thrown error
	 */
	public static <T> Fallible<T> of(Callable<? extends T> callable) {
		try {
			return success(callable.call());
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			return failure(t);
		}
	}

	@Nullable
	final T         value;
	@Nullable
	final Throwable failure;

	Fallible(@Nullable T value, @Nullable Throwable failure) {
		this.value = value;
		this.failure = failure;
	}

	public boolean isSuccess() {
		return failure == null;
	}

	public boolean isFailure() {
		return failure != null;
	}

	/**
	 * @return true if this is a failure caused by a cancellation
	 * @see Exceptions#isCancel(Throwable)
	 */
	public boolean isCancellation() {
		return Exceptions.isCancel(failure);
	}

	/**
	 * @return the success value, null if this is a failure or a success without value
	 */
	@Nullable
	public T getSuccess() {
		return value;
	}

	/**
	 * @return the failure, null if this is a success
	 */
	@Nullable
	public Throwable getFailure() {
		return failure;
	}

	/**
	 * Return the success value or throw the failure, wrapped in an unchecked exception if
	 * it is a checked one.
	 *
	 * @return the success value
	 * @see Exceptions#propagate(Throwable)
	 */
	@Nullable
	public T orThrow() {
		if (failure != null) {
			throw Exceptions.propagate(failure);
		}
		return value;
	}

	/**
	 * Return the success value. Calling this on a failure is a programming error: the
	 * failure is thrown wrapped in a {@link Exceptions#bubble(Throwable) bubbling}
	 * exception, which the channel machinery lets escape to the thread that emitted the
	 * event instead of turning it into a failed completion.
	 *
	 * @return the success value
	 */
	@Nullable
	public T unsafeSuccess() {
		if (failure != null) {
			throw Exceptions.bubble(failure);
		}
		return value;
	}

	/**
	 * Transform the success value, keeping failures as they are. An error thrown by the
	 * transform yields a failure.
	 *
	 * @param transform the function to apply to the success value
	 * @param <R> the type of the new success value
	 * @return the transformed {@link Fallible}
	 */
	@SuppressWarnings("unchecked")
	public <R> Fallible<R> map(Transform<? super T, ? extends R> transform) {
		if (failure != null) {
			return (Fallible<R>) this;
		}
		return of(() -> transform.apply(value));
	}

	@Override
	public boolean equals(@Nullable Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Fallible)) {
			return false;
		}
		Fallible<?> other = (Fallible<?>) o;
		return Objects.equals(value, other.value) && Objects.equals(failure, other.failure);
	}

	@Override
	public int hashCode() {
		return 31 * Objects.hashCode(value) + Objects.hashCode(failure);
	}

	@Override
	public String toString() {
		if (failure != null) {
			return String.format("failure(%s)", failure);
		}
		return String.format("success(%s)", value);
	}
}
