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

import org.jspecify.annotations.Nullable;

/**
 * The number of source updates a derived channel keeps pending while its body is busy.
 * When the buffer is full the oldest pending update is dropped to make room for the new
 * one. Completions are never dropped.
 */
public final class BufferSize {

	/**
	 * Capacity of {@link #DEFAULT}, initialized by system property
	 * {@code relay.bufferSize.default}, 256 when unset.
	 */
	public static final int DEFAULT_CAPACITY = Math.max(1,
			Integer.parseInt(System.getProperty("relay.bufferSize.default", "256")));

	/**
	 * The buffer size used unless a {@link Derivation} says otherwise.
	 */
	public static final BufferSize DEFAULT = new BufferSize(DEFAULT_CAPACITY);

	/**
	 * A buffer that never drops updates.
	 */
	public static final BufferSize UNLIMITED = new BufferSize(Integer.MAX_VALUE);

	/**
	 * @param capacity the maximum number of pending updates, strictly positive
	 * @return a bounded {@link BufferSize}
	 * @throws IllegalArgumentException if capacity is not strictly positive
	 */
	public static BufferSize of(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be strictly positive, was: " + capacity);
		}
		if (capacity == DEFAULT_CAPACITY) {
			return DEFAULT;
		}
		return new BufferSize(capacity);
	}

	final int capacity;

	BufferSize(int capacity) {
		this.capacity = capacity;
	}

	/**
	 * @return the maximum number of pending updates, {@link Integer#MAX_VALUE} if unlimited
	 */
	public int capacity() {
		return capacity;
	}

	public boolean isUnlimited() {
		return capacity == Integer.MAX_VALUE;
	}

	@Override
	public boolean equals(@Nullable Object o) {
		return o instanceof BufferSize && ((BufferSize) o).capacity == capacity;
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(capacity);
	}

	@Override
	public String toString() {
		return isUnlimited() ? "BufferSize{unlimited}" : "BufferSize{" + capacity + "}";
	}
}
