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
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import org.jspecify.annotations.Nullable;
import relay.core.Disposable;
import relay.core.Exceptions;
import relay.core.scheduler.Scheduler;
import relay.util.Logger;
import relay.util.Loggers;
import relay.util.concurrent.AtomicSlot;
import relay.util.concurrent.Chain;

/**
 * The write side of a {@link Channel}: emits updates, then exactly one completion, to
 * every subscribed {@link EventHandler}.
 * <p>
 * All emission methods are thread-safe. Concurrent emissions are serialized by a
 * work-in-progress loop: whichever caller gets in first delivers the events queued by
 * the others, so every handler sees events one at a time in a single global order, with
 * the completion last. A handler only receives the updates emitted after it subscribed,
 * whether or not earlier emissions are still being delivered. Only the first terminal
 * call has an effect, later {@code update} and {@code complete} calls are ignored and
 * return {@code false}.
 * <p>
 * A handler throwing an exception is logged and unsubscribed, other handlers keep
 * receiving events. Fatal errors as defined by {@link Exceptions#throwIfFatal(Throwable)}
 * are rethrown to the emitting thread. The emit loop is then left mid-drain and the
 * producer stops delivering events to all of its subscribers.
 *
 * @param <U> the type of update values
 * @param <S> the type of the success value of the completion
 */
public class Producer<U, S> extends Channel<U, S> {

	static final Logger log = Loggers.getLogger(Producer.class);

	/**
	 * @param <U> the type of update values
	 * @param <S> the type of the success value of the completion
	 * @return a new active {@link Producer} without subscribers
	 */
	public static <U, S> Producer<U, S> create() {
		return new Producer<>();
	}

	final AtomicSlot<Chain<Registration<U, S>>> subscribers = AtomicSlot.create();
	final Queue<Emission<U, S>>                 emissions   = new ConcurrentLinkedQueue<>();

	volatile int wip;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<Producer> WIP =
			AtomicIntegerFieldUpdater.newUpdater(Producer.class, "wip");

	volatile int completing;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<Producer> COMPLETING =
			AtomicIntegerFieldUpdater.newUpdater(Producer.class, "completing");

	@Nullable
	volatile Fallible<S> completion;

	/**
	 * Set by the emit loop once the completion has been handed over to the subscribers.
	 */
	volatile boolean delivered;

	Producer() {
	}

	@Override
	public Disposable subscribe(EventHandler<U, S> handler) {
		Objects.requireNonNull(handler, "handler");
		Registration<U, S> registration = new Registration<>(this, handler);
		if (delivered) {
			registration.complete(Event.completion(completionOrThrow()), null);
			return registration;
		}
		subscribers.update(h -> Chain.prepend(h, registration));
		if (delivered) {
			// the emit loop may have swapped the subscribers out before our node got in
			subscribers.update(h -> Chain.remove(h, registration));
			registration.complete(Event.completion(completionOrThrow()), null);
		}
		return registration;
	}

	public boolean update(U value) {
		return update(value, null);
	}

	/**
	 * Emit an update.
	 *
	 * @param value the update value
	 * @param from the {@link Scheduler} the update is emitted from, if known
	 * @return false if the producer is already completing, in which case nothing is
	 * emitted
	 */
	public boolean update(U value, @Nullable Scheduler from) {
		Event<U, S> event = Event.update(value);
		if (completing != 0) {
			discarded(event);
			return false;
		}
		emissions.offer(new Emission<>(event, from, subscribers.head()));
		drain();
		return true;
	}

	/**
	 * Emit an update for each value, in iteration order.
	 *
	 * @param values the update values
	 * @param from the {@link Scheduler} the updates are emitted from, if known
	 * @return false if the producer is already completing, in which case nothing is
	 * emitted
	 */
	public boolean updateAll(Iterable<? extends U> values, @Nullable Scheduler from) {
		Objects.requireNonNull(values, "values");
		if (completing != 0) {
			if (log.isDebugEnabled()) {
				log.debug("Updates discarded, producer already completing: {}", values);
			}
			return false;
		}
		Chain<Registration<U, S>> targets = subscribers.head();
		for (U value : values) {
			emissions.offer(new Emission<>(Event.update(value), from, targets));
		}
		drain();
		return true;
	}

	public boolean complete(Fallible<S> completion) {
		return complete(completion, null);
	}

	/**
	 * Emit the completion. Only the first call of this method, or of the shortcuts
	 * {@link #succeed(Object)}, {@link #fail(Throwable)} and {@link #cancel()}, has an
	 * effect.
	 *
	 * @param completion the final outcome
	 * @param from the {@link Scheduler} the completion is emitted from, if known
	 * @return true if this call completed the producer
	 */
	public boolean complete(Fallible<S> completion, @Nullable Scheduler from) {
		Event<U, S> event = Event.completion(completion);
		if (!COMPLETING.compareAndSet(this, 0, 1)) {
			discarded(event);
			return false;
		}
		this.completion = completion;
		emissions.offer(new Emission<>(event, from, null));
		drain();
		onTerminate();
		return true;
	}

	public boolean succeed(@Nullable S value) {
		return complete(Fallible.success(value), null);
	}

	public boolean fail(Throwable error) {
		return fail(error, null);
	}

	public boolean fail(Throwable error, @Nullable Scheduler from) {
		return complete(Fallible.failure(error), from);
	}

	/**
	 * Complete with a cancellation failure.
	 *
	 * @return true if this call completed the producer
	 * @see Exceptions#failWithCancel(String)
	 */
	public boolean cancel() {
		return cancel("Producer cancelled");
	}

	boolean cancel(String reason) {
		return complete(Fallible.failure(Exceptions.failWithCancel(reason)), null);
	}

	/**
	 * Emit the given event: an update or the completion.
	 *
	 * @param event the event to emit
	 * @param from the {@link Scheduler} the event is emitted from, if known
	 * @return false if the event was discarded because the producer is completing
	 */
	public boolean apply(Event<U, S> event, @Nullable Scheduler from) {
		Objects.requireNonNull(event, "event");
		if (event.isUpdate()) {
			return update(Objects.requireNonNull(event.update()), from);
		}
		return complete(Objects.requireNonNull(event.completion()), from);
	}

	/**
	 * @return true once a completion has been emitted, even if it is still being
	 * delivered
	 */
	public boolean isCompleted() {
		return completion != null;
	}

	/**
	 * @return the completion, null while the producer is active
	 */
	@Nullable
	public Fallible<S> completion() {
		return completion;
	}

	/**
	 * @return the number of currently subscribed handlers
	 */
	public int subscriberCount() {
		return Chain.size(subscribers.head());
	}

	/**
	 * Called once, on the thread that completed the producer, after the completion has
	 * been queued for delivery.
	 */
	void onTerminate() {
	}

	void drain() {
		if (WIP.getAndIncrement(this) != 0) {
			return;
		}
		int missed = 1;
		for (;;) {
			for (;;) {
				Emission<U, S> e = emissions.poll();
				if (e == null) {
					break;
				}
				if (delivered) {
					discarded(e.event);
					continue;
				}
				if (e.event.isUpdate()) {
					Chain.forEach(e.targets, r -> r.deliver(e.event, e.from));
				}
				else {
					delivered = true;
					Chain<Registration<U, S>> registered = subscribers.update(h -> null).oldHead();
					Chain.forEach(registered, r -> r.complete(e.event, e.from));
				}
			}
			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
	}

	Fallible<S> completionOrThrow() {
		Fallible<S> c = completion;
		if (c == null) {
			throw new IllegalStateException("Completion delivered but not set");
		}
		return c;
	}

	void discarded(Event<U, S> event) {
		if (log.isDebugEnabled()) {
			log.debug("Event discarded, producer already completing: {}", event);
		}
	}

	@Override
	public String toString() {
		Fallible<S> c = completion;
		return getClass().getSimpleName() + "{" + (c == null ? "active" : c) + ", subscribers=" + subscriberCount() + "}";
	}

	static final class Emission<U, S> {

		final Event<U, S> event;
		@Nullable
		final Scheduler   from;
		/**
		 * Subscribers at the time an update was emitted, unused for the completion.
		 */
		@Nullable
		final Chain<Registration<U, S>> targets;

		Emission(Event<U, S> event, @Nullable Scheduler from, @Nullable Chain<Registration<U, S>> targets) {
			this.event = event;
			this.from = from;
			this.targets = targets;
		}
	}

	static final class Registration<U, S> implements Disposable {

		static final int ACTIVE     = 0;
		static final int TERMINATED = 1;
		static final int DISPOSED   = 2;

		final Producer<U, S>     parent;
		final EventHandler<U, S> handler;

		volatile int state;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<Registration> STATE =
				AtomicIntegerFieldUpdater.newUpdater(Registration.class, "state");

		Registration(Producer<U, S> parent, EventHandler<U, S> handler) {
			this.parent = parent;
			this.handler = handler;
		}

		void deliver(Event<U, S> event, @Nullable Scheduler from) {
			if (state != ACTIVE) {
				return;
			}
			try {
				handler.onEvent(event, from);
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				log.error("Event handler " + handler + " failed and has been unsubscribed", t);
				dispose();
			}
		}

		void complete(Event<U, S> event, @Nullable Scheduler from) {
			if (!STATE.compareAndSet(this, ACTIVE, TERMINATED)) {
				return;
			}
			try {
				handler.onEvent(event, from);
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				log.error("Event handler " + handler + " failed on completion", t);
			}
		}

		@Override
		public void dispose() {
			if (STATE.compareAndSet(this, ACTIVE, DISPOSED)) {
				parent.subscribers.update(h -> Chain.remove(h, this));
			}
		}

		@Override
		public boolean isDisposed() {
			return state != ACTIVE;
		}
	}
}
