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

import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;
import java.util.function.UnaryOperator;

import org.jspecify.annotations.Nullable;

/**
 * {@link AtomicSlot} implemented as a compare-and-swap retry loop on a single volatile
 * reference. Never blocks, some thread always makes progress.
 *
 * @param <T> the type of the head
 */
final class LockFreeAtomicSlot<T> extends AtomicSlot<T> {

	@Nullable
	volatile T head;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<LockFreeAtomicSlot, Object> HEAD =
			AtomicReferenceFieldUpdater.newUpdater(LockFreeAtomicSlot.class, Object.class, "head");

	LockFreeAtomicSlot(@Nullable T initialHead) {
		HEAD.lazySet(this, initialHead);
	}

	@Override
	@Nullable
	public T head() {
		return head;
	}

	@Override
	public Swap<T> update(UnaryOperator<@Nullable T> transform) {
		for (;;) {
			T current = head;
			T next = transform.apply(current);
			if (HEAD.compareAndSet(this, current, next)) {
				return new Swap<>(current, next);
			}
		}
	}

	@Override
	public Strategy strategy() {
		return Strategy.LOCK_FREE;
	}
}
