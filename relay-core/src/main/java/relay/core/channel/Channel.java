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
import java.util.Optional;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import relay.core.Disposable;
import relay.core.ExecutionContext;
import relay.core.scheduler.Scheduler;
import relay.core.scheduler.Schedulers;

/**
 * A stream of {@link Event events}: any number of updates followed by exactly one
 * completion. This is the read side; values are emitted through a {@link Producer}.
 * <p>
 * Operators derive new channels through {@link #makeProducer(ExecutionContext, Derivation, EventBody)}.
 * Each operator comes in the following flavors:
 * <ul>
 *     <li>{@code op(transform)}: runs on {@link Schedulers#primary()}</li>
 *     <li>{@code op(scheduler, transform)} and {@code op(derivation, transform)}: run
 *     with explicit {@link Derivation} options</li>
 *     <li>{@code op(context, transform)} and {@code op(context, derivation, transform)}:
 *     bound to an {@link ExecutionContext}, which is only weakly referenced. Once the
 *     context is gone or released, the derived channel completes with a cancellation
 *     failure.</li>
 * </ul>
 * The transform of a derived channel runs once per source event, in the order events
 * were emitted and never concurrently, whatever the scheduler. An error thrown by a
 * transform fails the derived channel.
 *
 * @param <U> the type of update values
 * @param <S> the type of the success value of the completion
 */
public abstract class Channel<U, S> {

	/**
	 * Subscribe an {@link EventHandler}. A handler subscribing to a completed channel
	 * receives the completion right away. Updates emitted before subscription are not
	 * replayed.
	 *
	 * @param handler the handler of the events
	 * @return a {@link Disposable} registration, disposing it unsubscribes the handler
	 */
	public abstract Disposable subscribe(EventHandler<U, S> handler);

	/**
	 * Subscribe with one callback for updates and another for the completion.
	 *
	 * @param onUpdate the callback receiving update values
	 * @param onCompletion the callback receiving the completion
	 * @return a {@link Disposable} registration
	 */
	public final Disposable subscribe(Consumer<? super U> onUpdate, Consumer<? super Fallible<S>> onCompletion) {
		Objects.requireNonNull(onUpdate, "onUpdate");
		Objects.requireNonNull(onCompletion, "onCompletion");
		return subscribe((event, origin) -> {
			if (event.isUpdate()) {
				onUpdate.accept(event.update());
			}
			else {
				onCompletion.accept(event.completion());
			}
		});
	}

	/**
	 * Derive a new channel whose events are produced by running {@code body} on every
	 * event of this channel. The body runs on the scheduler of the {@link Derivation}, or
	 * else the scheduler of the context, or else {@link Schedulers#primary()}.
	 * <p>
	 * When a context is given, it is only weakly referenced: before each run of the body
	 * the context is checked and, if it has been collected or is no longer
	 * {@link ExecutionContext#isAlive() alive}, the derived channel is cancelled instead.
	 * The same applies to the {@link Derivation#token() cancellation token}, which also
	 * cancels the derived channel as soon as it fires.
	 *
	 * @param context the context to bind the body to, or null
	 * @param derivation the derivation options
	 * @param body the body producing derived events
	 * @param <C> the type of the context
	 * @param <P> the type of derived update values
	 * @param <PS> the type of the derived success value
	 * @return the derived {@link Channel}
	 */
	public final <C extends ExecutionContext, P, PS> Channel<P, PS> makeProducer(@Nullable C context,
			Derivation derivation,
			EventBody<C, U, S, P, PS> body) {
		Objects.requireNonNull(derivation, "derivation");
		Objects.requireNonNull(body, "body");
		DerivedChannel<C, U, S, P, PS> derived = new DerivedChannel<>(context, derivation, body);
		derived.connect(this);
		return derived;
	}

	/**
	 * Derive a new channel not bound to any context. The body receives a null context.
	 *
	 * @see #makeProducer(ExecutionContext, Derivation, EventBody)
	 */
	public final <P, PS> Channel<P, PS> makeProducer(Derivation derivation,
			EventBody<ExecutionContext, U, S, P, PS> body) {
		return makeProducer(null, derivation, body);
	}

	//==== map ====

	/**
	 * Transform each update value. The completion is forwarded as is.
	 *
	 * @param transform the function to apply to update values
	 * @param <P> the type of derived update values
	 * @return the derived {@link Channel}
	 */
	public final <P> Channel<P, S> map(Transform<? super U, ? extends P> transform) {
		return map(Derivation.defaults(), transform);
	}

	public final <P> Channel<P, S> map(Scheduler scheduler, Transform<? super U, ? extends P> transform) {
		return map(Derivation.on(scheduler), transform);
	}

	public final <P> Channel<P, S> map(Derivation derivation, Transform<? super U, ? extends P> transform) {
		Objects.requireNonNull(transform, "transform");
		return makeProducer(derivation,
				ChannelOperators.<ExecutionContext, U, S, P>map((context, value) -> transform.apply(value)));
	}

	public final <C extends ExecutionContext, P> Channel<P, S> map(C context,
			ContextTransform<? super C, ? super U, ? extends P> transform) {
		return map(context, Derivation.defaults(), transform);
	}

	public final <C extends ExecutionContext, P> Channel<P, S> map(C context,
			Derivation derivation,
			ContextTransform<? super C, ? super U, ? extends P> transform) {
		Objects.requireNonNull(context, "context");
		Objects.requireNonNull(transform, "transform");
		return makeProducer(context, derivation, ChannelOperators.<C, U, S, P>map(transform));
	}

	//==== flatMapOptional ====

	/**
	 * Transform each update value into an {@link Optional}: a present value is
	 * forwarded, an empty one forwards nothing. The completion is forwarded as is.
	 *
	 * @param transform the function to apply to update values
	 * @param <P> the type of derived update values
	 * @return the derived {@link Channel}
	 */
	public final <P> Channel<P, S> flatMapOptional(Transform<? super U, ? extends Optional<? extends P>> transform) {
		return flatMapOptional(Derivation.defaults(), transform);
	}

	public final <P> Channel<P, S> flatMapOptional(Scheduler scheduler,
			Transform<? super U, ? extends Optional<? extends P>> transform) {
		return flatMapOptional(Derivation.on(scheduler), transform);
	}

	public final <P> Channel<P, S> flatMapOptional(Derivation derivation,
			Transform<? super U, ? extends Optional<? extends P>> transform) {
		Objects.requireNonNull(transform, "transform");
		return makeProducer(derivation,
				ChannelOperators.<ExecutionContext, U, S, P>flatMapOptional((context, value) -> transform.apply(value)));
	}

	public final <C extends ExecutionContext, P> Channel<P, S> flatMapOptional(C context,
			ContextTransform<? super C, ? super U, ? extends Optional<? extends P>> transform) {
		return flatMapOptional(context, Derivation.defaults(), transform);
	}

	public final <C extends ExecutionContext, P> Channel<P, S> flatMapOptional(C context,
			Derivation derivation,
			ContextTransform<? super C, ? super U, ? extends Optional<? extends P>> transform) {
		Objects.requireNonNull(context, "context");
		Objects.requireNonNull(transform, "transform");
		return makeProducer(context, derivation, ChannelOperators.<C, U, S, P>flatMapOptional(transform));
	}

	//==== flatMapIterable ====

	/**
	 * Transform each update value into a sequence of values, all forwarded in iteration
	 * order before the next source event is handled. The completion is forwarded as is.
	 *
	 * @param transform the function to apply to update values
	 * @param <P> the type of derived update values
	 * @return the derived {@link Channel}
	 */
	public final <P> Channel<P, S> flatMapIterable(Transform<? super U, ? extends Iterable<? extends P>> transform) {
		return flatMapIterable(Derivation.defaults(), transform);
	}

	public final <P> Channel<P, S> flatMapIterable(Scheduler scheduler,
			Transform<? super U, ? extends Iterable<? extends P>> transform) {
		return flatMapIterable(Derivation.on(scheduler), transform);
	}

	public final <P> Channel<P, S> flatMapIterable(Derivation derivation,
			Transform<? super U, ? extends Iterable<? extends P>> transform) {
		Objects.requireNonNull(transform, "transform");
		return makeProducer(derivation,
				ChannelOperators.<ExecutionContext, U, S, P>flatMapIterable((context, value) -> transform.apply(value)));
	}

	public final <C extends ExecutionContext, P> Channel<P, S> flatMapIterable(C context,
			ContextTransform<? super C, ? super U, ? extends Iterable<? extends P>> transform) {
		return flatMapIterable(context, Derivation.defaults(), transform);
	}

	public final <C extends ExecutionContext, P> Channel<P, S> flatMapIterable(C context,
			Derivation derivation,
			ContextTransform<? super C, ? super U, ? extends Iterable<? extends P>> transform) {
		Objects.requireNonNull(context, "context");
		Objects.requireNonNull(transform, "transform");
		return makeProducer(context, derivation, ChannelOperators.<C, U, S, P>flatMapIterable(transform));
	}

	//==== filter ====

	/**
	 * Forward the update values matching the predicate, unchanged. The completion is
	 * forwarded as is.
	 *
	 * @param predicate the predicate to test update values with
	 * @return the derived {@link Channel}
	 */
	public final Channel<U, S> filter(Transform<? super U, Boolean> predicate) {
		return filter(Derivation.defaults(), predicate);
	}

	public final Channel<U, S> filter(Scheduler scheduler, Transform<? super U, Boolean> predicate) {
		return filter(Derivation.on(scheduler), predicate);
	}

	public final Channel<U, S> filter(Derivation derivation, Transform<? super U, Boolean> predicate) {
		Objects.requireNonNull(predicate, "predicate");
		return makeProducer(derivation,
				ChannelOperators.<ExecutionContext, U, S>filter((context, value) -> predicate.apply(value)));
	}

	public final <C extends ExecutionContext> Channel<U, S> filter(C context,
			ContextTransform<? super C, ? super U, Boolean> predicate) {
		return filter(context, Derivation.defaults(), predicate);
	}

	public final <C extends ExecutionContext> Channel<U, S> filter(C context,
			Derivation derivation,
			ContextTransform<? super C, ? super U, Boolean> predicate) {
		Objects.requireNonNull(context, "context");
		Objects.requireNonNull(predicate, "predicate");
		return makeProducer(context, derivation, ChannelOperators.<C, U, S>filter(predicate));
	}

	//==== mapEvent ====

	/**
	 * Transform whole events, updates and completion alike. Prefer {@link #map(Transform)}
	 * to only transform update values.
	 *
	 * @param transform the function to apply to every event
	 * @param <P> the type of derived update values
	 * @param <PS> the type of the derived success value
	 * @return the derived {@link Channel}
	 */
	public final <P, PS> Channel<P, PS> mapEvent(Transform<? super Event<U, S>, ? extends Event<P, PS>> transform) {
		return mapEvent(Derivation.defaults(), transform);
	}

	public final <P, PS> Channel<P, PS> mapEvent(Scheduler scheduler,
			Transform<? super Event<U, S>, ? extends Event<P, PS>> transform) {
		return mapEvent(Derivation.on(scheduler), transform);
	}

	public final <P, PS> Channel<P, PS> mapEvent(Derivation derivation,
			Transform<? super Event<U, S>, ? extends Event<P, PS>> transform) {
		Objects.requireNonNull(transform, "transform");
		return makeProducer(derivation,
				ChannelOperators.<ExecutionContext, U, S, P, PS>mapEvent((context, event) -> transform.apply(event)));
	}

	public final <C extends ExecutionContext, P, PS> Channel<P, PS> mapEvent(C context,
			ContextTransform<? super C, ? super Event<U, S>, ? extends Event<P, PS>> transform) {
		return mapEvent(context, Derivation.defaults(), transform);
	}

	public final <C extends ExecutionContext, P, PS> Channel<P, PS> mapEvent(C context,
			Derivation derivation,
			ContextTransform<? super C, ? super Event<U, S>, ? extends Event<P, PS>> transform) {
		Objects.requireNonNull(context, "context");
		Objects.requireNonNull(transform, "transform");
		return makeProducer(context, derivation, ChannelOperators.<C, U, S, P, PS>mapEvent(transform));
	}

	//==== unwrapping ====

	/**
	 * For a channel of {@link Fallible} updates, forward the success values and fail the
	 * derived channel with the first failure. A success holding {@code null} fails the
	 * derived channel with a {@link NullPointerException}. Runs on
	 * {@link Schedulers#immediate()}.
	 *
	 * @param source the channel of {@link Fallible} updates
	 * @param <T> the type of the success values held by the updates
	 * @param <S> the type of the success value of the completion
	 * @return the derived {@link Channel}
	 */
	public static <T, S> Channel<T, S> unwrapped(Channel<? extends Fallible<T>, S> source) {
		Objects.requireNonNull(source, "source");
		return unwrap(source, false);
	}

	/**
	 * For a channel of {@link Fallible} updates, forward the success values. A failure
	 * update is a programming error: it is thrown through
	 * {@link Fallible#unsafeSuccess()} as a fatal error that escapes the channel
	 * machinery to the thread that emitted it. The emit loop of the source is left
	 * mid-drain, so the source stops delivering to all of its subscribers, not only to
	 * the derived channel. Use {@link #unwrapped(Channel)} when failures are expected.
	 * Runs on {@link Schedulers#immediate()}.
	 *
	 * @param source the channel of {@link Fallible} updates
	 * @param <T> the type of the success values held by the updates
	 * @param <S> the type of the success value of the completion
	 * @return the derived {@link Channel}
	 */
	public static <T, S> Channel<T, S> unsafelyUnwrapped(Channel<? extends Fallible<T>, S> source) {
		Objects.requireNonNull(source, "source");
		return unwrap(source, true);
	}

	static <F extends Fallible<T>, T, S> Channel<T, S> unwrap(Channel<F, S> source, boolean unsafe) {
		return source.makeProducer(Derivation.on(Schedulers.immediate()),
				ChannelOperators.<ExecutionContext, F, T, S>unwrap(unsafe));
	}
}
