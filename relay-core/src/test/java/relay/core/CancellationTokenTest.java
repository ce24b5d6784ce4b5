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

package relay.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import relay.core.scheduler.Scheduler;
import relay.core.scheduler.Schedulers;
import relay.test.util.RaceTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

	@Test
	void newTokenIsNotCancelled() {
		CancellationToken token = CancellationToken.create();

		assertThat(token.isCancelled()).isFalse();
		assertThat(token.pendingCallbacks()).isZero();
		assertThat(token).hasToString("CancellationToken{active}");
	}

	@Test
	void cancelRunsCallbacksOnce() {
		CancellationToken token = CancellationToken.create();
		AtomicInteger first = new AtomicInteger();
		AtomicInteger second = new AtomicInteger();
		token.onCancel(first::incrementAndGet);
		token.onCancel(second::incrementAndGet);

		assertThat(token.cancel()).as("first cancel").isTrue();
		assertThat(token.cancel()).as("second cancel").isFalse();

		assertThat(token.isCancelled()).isTrue();
		assertThat(first).hasValue(1);
		assertThat(second).hasValue(1);
		assertThat(token.pendingCallbacks()).isZero();
	}

	@Test
	void callbackOnCancelledTokenRunsImmediately() {
		CancellationToken token = CancellationToken.create();
		token.cancel();
		List<String> calls = new ArrayList<>();

		Disposable registration = token.onCancel(() -> calls.add("late"));

		assertThat(calls).containsExactly("late");
		assertThat(registration.isDisposed()).isTrue();
		assertThat(token.pendingCallbacks()).isZero();
	}

	@Test
	void disposedCallbackDoesNotRun() {
		CancellationToken token = CancellationToken.create();
		AtomicInteger calls = new AtomicInteger();
		Disposable registration = token.onCancel(calls::incrementAndGet);

		registration.dispose();
		token.cancel();

		assertThat(registration.isDisposed()).isTrue();
		assertThat(calls).hasValue(0);
	}

	@Test
	void disposeUnregisters() {
		CancellationToken token = CancellationToken.create();
		Disposable kept = token.onCancel(() -> { });
		Disposable removed = token.onCancel(() -> { });

		removed.dispose();

		assertThat(token.pendingCallbacks()).isEqualTo(1);
		assertThat(kept.isDisposed()).isFalse();
	}

	@Test
	void failingCallbackDoesNotPreventOthers() {
		CancellationToken token = CancellationToken.create();
		AtomicInteger calls = new AtomicInteger();
		token.onCancel(calls::incrementAndGet);
		token.onCancel(() -> {
			throw new IllegalStateException("boom");
		});
		token.onCancel(calls::incrementAndGet);

		token.cancel();

		assertThat(calls).hasValue(2);
	}

	@Test
	void raceCancelAndRegisterRunsEveryCallbackExactlyOnce() {
		Scheduler racers = Schedulers.newParallel("racers", 3);
		try {
			for (int i = 0; i < 500; i++) {
				CancellationToken token = CancellationToken.create();
				AtomicInteger calls = new AtomicInteger();

				RaceTestUtils.race(racers, token::cancel,
						() -> token.onCancel(calls::incrementAndGet),
						() -> token.onCancel(calls::incrementAndGet));

				assertThat(calls).as("round " + i).hasValue(2);
				assertThat(token.pendingCallbacks()).as("round " + i).isZero();
			}
		}
		finally {
			racers.dispose();
		}
	}
}
