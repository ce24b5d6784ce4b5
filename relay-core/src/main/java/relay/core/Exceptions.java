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

package relay.core;

import java.util.concurrent.CancellationException;
import java.util.concurrent.RejectedExecutionException;

import org.jspecify.annotations.Nullable;

/**
 * Global Relay exception handling and utils to operate on.
 * <p>
 * Errors raised by user-provided transforms are never thrown across the channel
 * machinery, they become failed completions. The only exceptions allowed to escape
 * are the "fatal" ones recognized by {@link #throwIfFatal(Throwable)}.
 */
public abstract class Exceptions {

	static final RejectedExecutionException REJECTED_EXECUTION = new StaticRejectedExecutionException("Scheduler unavailable");

	/**
	 * Return a new {@link CancellationException} used as the failure of a cancelled
	 * channel. Such errors are recognized by {@link #isCancel(Throwable)}.
	 *
	 * @param reason a description of what triggered the cancellation
	 * @return a new {@link CancellationException}
	 */
	public static CancellationException failWithCancel(String reason) {
		return new ChannelCancelledException(reason);
	}

	/**
	 * Check if the given error is a {@link #failWithCancel(String) cancellation}.
	 * Any {@link CancellationException} qualifies.
	 *
	 * @param t the {@link Throwable} error to check
	 * @return true if given {@link Throwable} is a cancellation.
	 */
	public static boolean isCancel(@Nullable Throwable t) {
		return t instanceof CancellationException;
	}

	/**
	 * Return a singleton {@link RejectedExecutionException}
	 *
	 * @return a singleton {@link RejectedExecutionException}
	 */
	public static RejectedExecutionException failWithRejected() {
		return REJECTED_EXECUTION;
	}

	/**
	 * Return a new {@link RejectedExecutionException} with standard message and cause,
	 * unless the {@code cause} is already a {@link RejectedExecutionException}.
	 *
	 * @param cause the original exception that caused the rejection
	 * @return a new {@link RejectedExecutionException} with standard message and cause
	 */
	public static RejectedExecutionException failWithRejected(Throwable cause) {
		if (cause instanceof RejectedExecutionException) {
			return (RejectedExecutionException) cause;
		}
		return new RejectedExecutionException("Scheduler unavailable", cause);
	}

	/**
	 * Prepare an unchecked {@link RuntimeException} that is considered fatal by
	 * {@link #throwIfFatal(Throwable)}, and as such escapes the channel machinery up to
	 * the thread that emitted the event.
	 * <p>This method invokes {@link #throwIfFatal(Throwable)}.
	 *
	 * @param t the root cause
	 * @return an unchecked exception that should choose bubbling up over the failure path
	 */
	public static RuntimeException bubble(Throwable t) {
		throwIfFatal(t);
		return new BubblingException(t);
	}

	/**
	 * Check if the given exception is a {@link #bubble(Throwable) bubbled} wrapped exception.
	 *
	 * @param t the {@link Throwable} error to check
	 * @return true if given {@link Throwable} is a bubbled wrapped exception.
	 */
	public static boolean isBubbling(@Nullable Throwable t) {
		return t instanceof BubblingException;
	}

	/**
	 * Prepare an unchecked {@link RuntimeException} that should be propagated
	 * downstream as a failure. Checked exceptions are wrapped.
	 * <p>This method invokes {@link #throwIfFatal(Throwable)}.
	 *
	 * @param t the root cause
	 * @return an unchecked exception to propagate
	 */
	public static RuntimeException propagate(Throwable t) {
		throwIfFatal(t);
		if (t instanceof RuntimeException) {
			return (RuntimeException) t;
		}
		return new RelayException(t);
	}

	/**
	 * Unwrap a particular {@code Throwable} only if it is was wrapped via
	 * {@link #bubble(Throwable) bubble} or {@link #propagate(Throwable) propagate}.
	 *
	 * @param t the exception to unwrap
	 * @return the unwrapped exception or current one if null
	 */
	public static Throwable unwrap(Throwable t) {
		Throwable _t = t;
		while (_t instanceof RelayException) {
			_t = _t.getCause();
		}
		return _t == null ? t : _t;
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error
	 * varieties. These varieties are as follows: <ul>
	 *     <li>{@code BubblingException} (as detectable by {@link #isBubbling(Throwable)})</li>
	 *     <li>any exception thrown by {@link #throwIfJvmFatal(Throwable)}</li></ul>
	 *
	 * @param t the exception to evaluate
	 */
	public static void throwIfFatal(@Nullable Throwable t) {
		if (t instanceof BubblingException) {
			throw (BubblingException) t;
		}
		throwIfJvmFatal(t);
	}

	/**
	 * Throws a particular {@code Throwable} only if it belongs to a set of "fatal" error
	 * varieties native to the JVM. These varieties are as follows:
	 * <ul> <li>{@link VirtualMachineError}</li> <li>{@link LinkageError}</li> </ul>
	 *
	 * @param t the exception to evaluate
	 */
	public static void throwIfJvmFatal(@Nullable Throwable t) {
		if (t instanceof VirtualMachineError) {
			throw (VirtualMachineError) t;
		}
		if (t instanceof LinkageError) {
			throw (LinkageError) t;
		}
	}

	Exceptions() {
	}

	/**
	 * A wrapper for checked exceptions propagated as failures.
	 */
	static class RelayException extends RuntimeException {

		RelayException(Throwable cause) {
			super(cause);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return getCause() != null ? getCause().fillInStackTrace() :
					super.fillInStackTrace();
		}

		private static final long serialVersionUID = 2491425227432776143L;
	}

	/**
	 * An exception that is propagated upward and considered as "fatal".
	 */
	static final class BubblingException extends RelayException {

		BubblingException(Throwable cause) {
			super(cause);
		}

		private static final long serialVersionUID = 2491425277432776142L;
	}

	static final class ChannelCancelledException extends CancellationException {

		ChannelCancelledException(String reason) {
			super(reason);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return this;
		}

		private static final long serialVersionUID = 2491425227432776144L;
	}

	static final class StaticRejectedExecutionException extends RejectedExecutionException {

		StaticRejectedExecutionException(String message) {
			super(message);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return this;
		}

		private static final long serialVersionUID = 3503344795919906192L;
	}
}
