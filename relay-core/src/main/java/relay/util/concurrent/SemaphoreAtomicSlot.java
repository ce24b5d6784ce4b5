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

package relay.util.concurrent;

import java.util.concurrent.Semaphore;
import java.util.function.UnaryOperator;

import org.jspecify.annotations.Nullable;

/**
 * {@link AtomicSlot} guarded by a single-permit {@link Semaphore}.
 *
 * @param <T> the type of the head
 */
final class SemaphoreAtomicSlot<T> extends AtomicSlot<T> {

	final Semaphore mutex = new Semaphore(1);

	@Nullable
	volatile T head;

	SemaphoreAtomicSlot(@Nullable T initialHead) {
		this.head = initialHead;
	}

	@Override
	@Nullable
	public T head() {
		return head;
	}

	@Override
	public Swap<T> update(UnaryOperator<@Nullable T> transform) {
		mutex.acquireUninterruptibly();
		try {
			T current = head;
			T next = transform.apply(current);
			head = next;
			return new Swap<>(current, next);
		}
		finally {
			mutex.release();
		}
	}

	@Override
	public Strategy strategy() {
		return Strategy.SEMAPHORE;
	}
}
