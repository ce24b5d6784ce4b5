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

import java.lang.ref.WeakReference;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;
import relay.core.CancellationToken;
import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.ExecutionContext;
import relay.core.Exceptions;
import relay.core.scheduler.Scheduler;
import relay.core.scheduler.Schedulers;
import relay.util.Logger;
import relay.util.Loggers;

/**
 * A {@link Producer} fed by running an {@link EventBody} on the events of a source
 * {@link Channel}.
 * <p>
 * Source events are queued and drained on the {@link Scheduler} with a
 * work-in-progress loop, so the body runs once per event, in arrival order, and never
 * concurrently with itself. When more than {@link BufferSize#capacity()} updates are
 * pending the oldest one is dropped. The completion is never dropped.
 *
 * @param <C> the type of the context
 * @param <U> the type of source update values
 * @param <S> the type of the source success value
 * @param <P> the type of derived update values
 * @param <PS> the type of the derived success value
 */
final class DerivedChannel<C extends ExecutionContext, U, S, P, PS> extends Producer<P, PS>
		implements EventHandler<U, S>, Runnable {

	static final Logger log = Loggers.getLogger(DerivedChannel.class);

	@Nullable
	final WeakReference<C>          contextRef;
	final EventBody<C, U, S, P, PS> body;
	final Scheduler                 scheduler;
	final int                       capacity;
	@Nullable
	final CancellationToken         token;

	final Queue<Event<U, S>> pending = new ConcurrentLinkedQueue<>();

	volatile int size;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<DerivedChannel> SIZE =
			AtomicIntegerFieldUpdater.newUpdater(DerivedChannel.class, "size");

	volatile int drainWip;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<DerivedChannel> DRAIN_WIP =
			AtomicIntegerFieldUpdater.newUpdater(DerivedChannel.class, "drainWip");

	@Nullable
	volatile Disposable source;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<DerivedChannel, Disposable> SOURCE =
			AtomicReferenceFieldUpdater.newUpdater(DerivedChannel.class, Disposable.class, "source");

	@Nullable
	volatile Disposable tokenHook;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<DerivedChannel, Disposable> TOKEN_HOOK =
			AtomicReferenceFieldUpdater.newUpdater(DerivedChannel.class, Disposable.class, "tokenHook");

	@Nullable
	volatile Disposable releaseHook;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<DerivedChannel, Disposable> RELEASE_HOOK =
			AtomicReferenceFieldUpdater.newUpdater(DerivedChannel.class, Disposable.class, "releaseHook");

	DerivedChannel(@Nullable C context, Derivation derivation, EventBody<C, U, S, P, PS> body) {
		this.contextRef = context == null ? null : new WeakReference<>(context);
		this.body = body;
		this.token = derivation.token();
		this.capacity = derivation.bufferSize().capacity();
		Scheduler s = derivation.scheduler();
		if (s == null) {
			s = context != null ? context.scheduler() : Schedulers.primary();
		}
		this.scheduler = s;
	}

	/**
	 * Hook the cancellation sources, then subscribe to the source. Any of them may
	 * terminate this channel right away.
	 */
	void connect(Channel<U, S> upstream) {
		CancellationToken t = token;
		if (t != null) {
			Disposables.setOnce(TOKEN_HOOK, this, t.onCancel(() -> cancel("Cancellation token fired")));
		}
		WeakReference<C> ref = contextRef;
		C context = ref != null ? ref.get() : null;
		if (context != null) {
			Disposables.setOnce(RELEASE_HOOK, this, context.onRelease(() -> cancel("Context released")));
		}
		Disposables.setOnce(SOURCE, this, upstream.subscribe(this));
	}

	@Override
	public void onEvent(Event<U, S> event, @Nullable Scheduler origin) {
		if (isCompleted()) {
			return;
		}
		pending.offer(event);
		if (event.isUpdate() && SIZE.incrementAndGet(this) > capacity) {
			Event<U, S> dropped = pending.poll();
			if (dropped != null) {
				SIZE.decrementAndGet(this);
				if (log.isDebugEnabled()) {
					log.debug("Buffer of {} updates full, dropped oldest: {}", capacity, dropped);
				}
			}
		}
		trySchedule();
	}

	void trySchedule() {
		if (DRAIN_WIP.getAndIncrement(this) != 0) {
			return;
		}
		try {
			scheduler.schedule(this);
		}
		catch (RejectedExecutionException ree) {
			pending.clear();
			fail(ree, null);
		}
	}

	@Override
	public void run() {
		int missed = 1;
		for (;;) {
			for (;;) {
				if (isCompleted()) {
					pending.clear();
					break;
				}
				Event<U, S> next = pending.peek();
				if (next == null) {
					break;
				}
				// counted out before being taken, an overflow in between drops it
				// rather than a newer update
				if (next.isUpdate()) {
					SIZE.decrementAndGet(this);
				}
				Event<U, S> event = pending.poll();
				if (event == null) {
					break;
				}
				dispatch(event);
			}
			missed = DRAIN_WIP.addAndGet(this, -missed);
			if (missed == 0) {
				break;
			}
		}
	}

	void dispatch(Event<U, S> event) {
		C context = null;
		WeakReference<C> ref = contextRef;
		if (ref != null) {
			context = ref.get();
			if (context == null || !context.isAlive()) {
				cancel("Context released");
				return;
			}
		}
		CancellationToken t = token;
		if (t != null && t.isCancelled()) {
			cancel("Cancellation token fired");
			return;
		}
		try {
			body.accept(context, event, this, scheduler);
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			fail(e, scheduler);
		}
	}

	@Override
	void onTerminate() {
		Disposables.dispose(SOURCE, this);
		Disposables.dispose(TOKEN_HOOK, this);
		Disposables.dispose(RELEASE_HOOK, this);
	}
}
