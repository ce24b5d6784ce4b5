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
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;
import relay.util.Logger;
import relay.util.Loggers;
import relay.util.concurrent.AtomicSlot;
import relay.util.concurrent.Chain;

/**
 * A cooperative stop signal. Channels derived with a token stop delivering updates and
 * complete with a cancellation failure once {@link #cancel()} is called.
 * <p>
 * Callbacks registered with {@link #onCancel(Runnable)} run at most once, on the thread
 * that cancels the token, or immediately on the registering thread if the token is
 * already cancelled.
 */
public final class CancellationToken {

	static final Logger log = Loggers.getLogger(CancellationToken.class);

	/**
	 * Create a new, not yet cancelled, token.
	 *
	 * @return a new {@link CancellationToken}
	 */
	public static CancellationToken create() {
		return new CancellationToken();
	}

	final AtomicSlot<Chain<Callback>> callbacks = AtomicSlot.create();

	volatile int cancelled;
	static final AtomicIntegerFieldUpdater<CancellationToken> CANCELLED =
			AtomicIntegerFieldUpdater.newUpdater(CancellationToken.class, "cancelled");

	CancellationToken() {
	}

	/**
	 * @return true once {@link #cancel()} has been called
	 */
	public boolean isCancelled() {
		return cancelled == 1;
	}

	/**
	 * Request cancellation and run the registered callbacks. Only the first call has
	 * an effect.
	 *
	 * @return true if this call cancelled the token, false if it was already cancelled
	 */
	public boolean cancel() {
		if (!CANCELLED.compareAndSet(this, 0, 1)) {
			return false;
		}
		Chain<Callback> registered = callbacks.update(h -> null).oldHead();
		Chain.forEach(registered, Callback::fire);
		return true;
	}

	/**
	 * Register a callback to run on cancellation. If the token is already cancelled the
	 * callback runs right away.
	 *
	 * @param action the action to run once on cancellation
	 * @return a {@link Disposable} unregistering the callback, a no-op once it has run
	 */
	public Disposable onCancel(Runnable action) {
		Objects.requireNonNull(action, "action");
		Callback callback = new Callback(this, action);
		if (isCancelled()) {
			callback.fire();
			return callback;
		}
		callbacks.update(h -> Chain.prepend(h, callback));
		if (isCancelled()) {
			// raced with cancel(), which may have swapped the chain out before our node got in
			callback.fire();
			callbacks.update(h -> Chain.remove(h, callback));
		}
		return callback;
	}

	/**
	 * @return the number of callbacks waiting for cancellation
	 */
	public int pendingCallbacks() {
		return Chain.size(callbacks.head());
	}

	@Override
	public String toString() {
		return "CancellationToken{" + (isCancelled() ? "cancelled" : "active") + "}";
	}

	static final class Callback implements Disposable {

		final CancellationToken parent;

		@Nullable
		volatile Runnable action;
		static final AtomicReferenceFieldUpdater<Callback, Runnable> ACTION =
				AtomicReferenceFieldUpdater.newUpdater(Callback.class, Runnable.class, "action");

		Callback(CancellationToken parent, Runnable action) {
			this.parent = parent;
			this.action = action;
		}

		void fire() {
			Runnable a = ACTION.getAndSet(this, null);
			if (a == null) {
				return;
			}
			try {
				a.run();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				log.error("Cancellation callback failed", t);
			}
		}

		@Override
		public void dispose() {
			if (ACTION.getAndSet(this, null) != null) {
				parent.callbacks.update(h -> Chain.remove(h, this));
			}
		}

		@Override
		public boolean isDisposed() {
			return action == null;
		}
	}
}
