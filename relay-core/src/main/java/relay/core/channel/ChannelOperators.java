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

import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * The {@link EventBody bodies} of the {@link Channel} operators. Context-free operators
 * adapt their transform into a {@link ContextTransform} ignoring the context.
 */
final class ChannelOperators {

	static <C, U, S, P> EventBody<C, U, S, P, S> map(ContextTransform<? super C, ? super U, ? extends P> transform) {
		return (context, event, producer, origin) -> {
			if (event.isUpdate()) {
				producer.update(transform.apply(context, event.update()), origin);
			}
			else {
				producer.complete(event.completion(), origin);
			}
		};
	}

	static <C, U, S, P> EventBody<C, U, S, P, S> flatMapOptional(
			ContextTransform<? super C, ? super U, ? extends Optional<? extends P>> transform) {
		return (context, event, producer, origin) -> {
			if (event.isUpdate()) {
				Optional<? extends P> result = transform.apply(context, event.update());
				if (result.isPresent()) {
					producer.update(result.get(), origin);
				}
			}
			else {
				producer.complete(event.completion(), origin);
			}
		};
	}

	static <C, U, S, P> EventBody<C, U, S, P, S> flatMapIterable(
			ContextTransform<? super C, ? super U, ? extends Iterable<? extends P>> transform) {
		return (context, event, producer, origin) -> {
			if (event.isUpdate()) {
				producer.updateAll(transform.apply(context, event.update()), origin);
			}
			else {
				producer.complete(event.completion(), origin);
			}
		};
	}

	static <C, U, S> EventBody<C, U, S, U, S> filter(ContextTransform<? super C, ? super U, Boolean> predicate) {
		return (context, event, producer, origin) -> {
			if (event.isUpdate()) {
				U value = event.update();
				if (predicate.apply(context, value)) {
					producer.update(value, origin);
				}
			}
			else {
				producer.complete(event.completion(), origin);
			}
		};
	}

	static <C, U, S, P, PS> EventBody<C, U, S, P, PS> mapEvent(
			ContextTransform<? super C, ? super Event<U, S>, ? extends Event<P, PS>> transform) {
		return (context, event, producer, origin) -> producer.apply(transform.apply(context, event), origin);
	}

	static <C, F extends Fallible<T>, T, S> EventBody<C, F, S, T, S> unwrap(boolean unsafe) {
		return (context, event, producer, origin) -> {
			if (event.isCompletion()) {
				producer.complete(event.completion(), origin);
				return;
			}
			Fallible<T> payload = event.update();
			if (unsafe) {
				producer.update(requireSuccess(payload.unsafeSuccess()), origin);
				return;
			}
			Throwable failure = payload.getFailure();
			if (failure != null) {
				producer.fail(failure, origin);
			}
			else {
				producer.update(requireSuccess(payload.getSuccess()), origin);
			}
		};
	}

	static <T> T requireSuccess(@Nullable T value) {
		if (value == null) {
			throw new NullPointerException("Unwrapped a success without value");
		}
		return value;
	}

	ChannelOperators() {
	}
}
