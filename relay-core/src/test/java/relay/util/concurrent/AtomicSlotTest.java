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

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import relay.test.util.RaceTestUtils;
import relay.util.concurrent.AtomicSlot.Strategy;
import relay.util.concurrent.AtomicSlot.Swap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class AtomicSlotTest {

	static final int THREADS    = 4;
	static final int ITERATIONS = 10_000;

	@ParameterizedTest
	@EnumSource(Strategy.class)
	void createWithStrategy(Strategy strategy) {
		AtomicSlot<String> slot = AtomicSlot.create(strategy, "initial");

		assertThat(slot.strategy()).isEqualTo(strategy);
		assertThat(slot.head()).isEqualTo("initial");
	}

	@ParameterizedTest
	@EnumSource(Strategy.class)
	void updateReturnsSwap(Strategy strategy) {
		AtomicSlot<Integer> slot = AtomicSlot.create(strategy, 1);

		Swap<Integer> swap = slot.update(h -> h + 1);

		assertThat(swap.oldHead()).isEqualTo(1);
		assertThat(swap.newHead()).isEqualTo(2);
		assertThat(slot.head()).isEqualTo(2);
	}

	@ParameterizedTest
	@EnumSource(Strategy.class)
	void updateFromAndToNull(Strategy strategy) {
		AtomicSlot<String> slot = AtomicSlot.create(strategy, null);

		assertThat(slot.head()).isNull();
		assertThat(slot.update(h -> h == null ? "a" : h + "b").newHead()).isEqualTo("a");
		Swap<String> cleared = slot.update(h -> null);

		assertThat(cleared.oldHead()).isEqualTo("a");
		assertThat(cleared.newHead()).isNull();
		assertThat(slot.head()).isNull();
	}

	@ParameterizedTest
	@EnumSource(Strategy.class)
	void throwingTransformLeavesHeadUnchanged(Strategy strategy) {
		AtomicSlot<String> slot = AtomicSlot.create(strategy, "kept");

		assertThatExceptionOfType(IllegalStateException.class)
				.isThrownBy(() -> slot.update(h -> {
					throw new IllegalStateException("boom");
				}))
				.withMessage("boom");

		assertThat(slot.head()).isEqualTo("kept");
		//the lock, if any, has been released
		assertThat(slot.update(h -> h + "!").newHead()).isEqualTo("kept!");
	}

	@ParameterizedTest
	@EnumSource(Strategy.class)
	void concurrentIncrementsAreNotLost(Strategy strategy) {
		AtomicSlot<Integer> slot = AtomicSlot.create(strategy, 0);
		Runnable incrementer = () -> {
			for (int i = 0; i < ITERATIONS; i++) {
				slot.update(h -> h + 1);
			}
		};

		RaceTestUtils.race(incrementer, incrementer, incrementer, incrementer);

		assertThat(slot.head()).isEqualTo(THREADS * ITERATIONS);
	}

	@ParameterizedTest
	@EnumSource(Strategy.class)
	void concurrentPrependsAreLinearizable(Strategy strategy) {
		AtomicSlot<Chain<Integer>> slot = AtomicSlot.create(strategy, null);
		AtomicInteger sequence = new AtomicInteger();
		Runnable prepender = () -> {
			for (int i = 0; i < ITERATIONS; i++) {
				int value = sequence.incrementAndGet();
				Swap<Chain<Integer>> swap = slot.update(h -> Chain.prepend(h, value));
				//the winning transform saw exactly the head it replaced
				assertThat(swap.newHead().next()).isSameAs(swap.oldHead());
			}
		};

		RaceTestUtils.race(prepender, prepender, prepender, prepender);

		Set<Integer> seen = new HashSet<>();
		Chain.forEach(slot.head(), seen::add);
		assertThat(seen).hasSize(THREADS * ITERATIONS);
		assertThat(Chain.size(slot.head())).isEqualTo(THREADS * ITERATIONS);
	}

	@Test
	void lockFreeDiscardsLostAttempts() {
		AtomicSlot<Integer> slot = AtomicSlot.create(Strategy.LOCK_FREE, 0);
		AtomicInteger invocations = new AtomicInteger();

		slot.update(h -> {
			//a concurrent writer sneaks in during the first invocation only
			if (invocations.incrementAndGet() == 1) {
				slot.update(x -> x + 10);
			}
			return h + 1;
		});

		assertThat(invocations).hasValue(2);
		assertThat(slot.head()).isEqualTo(11);
	}

	@Test
	void detectStrategyDefaultsToLockFree() {
		assertThat(AtomicSlot.detectStrategy(null)).isEqualTo(Strategy.LOCK_FREE);
		assertThat(AtomicSlot.detectStrategy("")).isEqualTo(Strategy.LOCK_FREE);
	}

	@Test
	void detectStrategyHonorsRequest() {
		assertThat(AtomicSlot.detectStrategy("semaphore")).isEqualTo(Strategy.SEMAPHORE);
		assertThat(AtomicSlot.detectStrategy(" Spin_Lock ")).isEqualTo(Strategy.SPIN_LOCK);
	}

	@Test
	void detectStrategyFallsBackOnUnknownValue() {
		assertThat(AtomicSlot.detectStrategy("quantum")).isEqualTo(Strategy.LOCK_FREE);
	}

	@Test
	void defaultCreateUsesDefaultStrategy() {
		assertThat(AtomicSlot.create().strategy()).isEqualTo(AtomicSlot.DEFAULT_STRATEGY);
	}

	@Test
	void toStringShowsStrategyAndHead() {
		assertThat(AtomicSlot.create(Strategy.MONITOR, "x")).hasToString("AtomicSlot{monitor, head=x}");
	}
}
