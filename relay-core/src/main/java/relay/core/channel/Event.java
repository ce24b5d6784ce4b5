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

import org.jspecify.annotations.Nullable;

/**
 * An immutable event travelling through a {@link Channel}: either an update holding a
 * non-null value, or the completion holding the final {@link Fallible} outcome. A
 * channel emits any number of updates followed by exactly one completion.
 *
 * @param <U> the type of update values
 * @param <S> the type of the success value of the completion
 */
public final class Event<U, S> {

	/**
	 * The two kinds of {@link Event}.
	 */
	public enum Type {
		UPDATE,
		COMPLETION
	}

	/**
	 * @param value the update value
	 * @param <U> the type of update values
	 * @param <S> the type of the success value of the completion
	 * @return an update event
	 */
	public static <U, S> Event<U, S> update(U value) {
		return new Event<>(Type.UPDATE, Objects.requireNonNull(value, "value"), null);
	}

	/**
	 * @param completion the final outcome
	 * @param <U> the type of update values
	 * @param <S> the type of the success value of the completion
	 * @return a completion event
	 */
	public static <U, S> Event<U, S> completion(Fallible<S> completion) {
		return new Event<>(Type.COMPLETION, null, Objects.requireNonNull(completion, "completion"));
	}

	/**
	 * Shortcut for {@code completion(Fallible.success(value))}.
	 */
	public static <U, S> Event<U, S> success(@Nullable S value) {
		return completion(Fallible.success(value));
	}

	/**
	 * Shortcut for {@code completion(Fallible.failure(error))}.
	 */
	public static <U, S> Event<U, S> failure(Throwable error) {
		return completion(Fallible.failure(error));
	}

	final Type type;
	@Nullable
	final U           update;
	@Nullable
	final Fallible<S> completion;

	Event(Type type, @Nullable U update, @Nullable Fallible<S> completion) {
		this.type = type;
		this.update = update;
		this.completion = completion;
	}

	public Type getType() {
		return type;
	}

	public boolean isUpdate() {
		return type == Type.UPDATE;
	}

	public boolean isCompletion() {
		return type == Type.COMPLETION;
	}

	/**
	 * @return the update value, null if this is a completion
	 */
	@Nullable
	public U update() {
		return update;
	}

	/**
	 * @return the completion, null if this is an update
	 */
	@Nullable
	public Fallible<S> completion() {
		return completion;
	}

	@Override
	public boolean equals(@Nullable Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Event)) {
			return false;
		}
		Event<?, ?> event = (Event<?, ?>) o;
		if (type != event.type) {
			return false;
		}
		if (isUpdate()) {
			return Objects.equals(update, event.update);
		}
		return Objects.equals(completion, event.completion);
	}

	@Override
	public int hashCode() {
		int result = type.hashCode();
		return 31 * result + (isUpdate() ? Objects.hashCode(update) : Objects.hashCode(completion));
	}

	@Override
	public String toString() {
		if (isUpdate()) {
			return String.format("update(%s)", update);
		}
		return String.format("completion(%s)", completion);
	}
}
