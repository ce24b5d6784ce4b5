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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.function.UnaryOperator;

import org.jspecify.annotations.Nullable;

/**
 * {@link AtomicSlot} guarded by a busy-spinning lock. Only suitable for very short
 * update functions.
 *
 * @param <T> the type of the head
 */
final class SpinLockAtomicSlot<T> extends AtomicSlot<T> {

	@Nullable
	volatile T head;

	volatile int locked;
	@SuppressWarnings("rawtypes")
	static final AtomicIntegerFieldUpdater<SpinLockAtomicSlot> LOCKED =
			AtomicIntegerFieldUpdater.newUpdater(SpinLockAtomicSlot.class, "locked");

	SpinLockAtomicSlot(@Nullable T initialHead) {
		this.head = initialHead;
	}

	@Override
	@Nullable
	public T head() {
		return head;
	}

	@Override
	public Swap<T> update(UnaryOperator<@Nullable T> transform) {
		while (!LOCKED.compareAndSet(this, 0, 1)) {
			Thread.onSpinWait();
		}
		try {
			T current = head;
			T next = transform.apply(current);
			head = next;
			return new Swap<>(current, next);
		}
		finally {
			LOCKED.set(this, 0);
		}
	}

	@Override
	public Strategy strategy() {
		return Strategy.SPIN_LOCK;
	}
}
