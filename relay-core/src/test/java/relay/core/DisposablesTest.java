/*
 * Copyright (c) 2016-2024 VMware Inc. or its affiliates, All Rights Reserved.
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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

public class DisposablesTest {

	//==== PUBLIC API TESTS ====

	@Test
	public void sequentialEmpty() {
		assertThat(Disposables.disposed().isDisposed()).isTrue();
		assertThat(Disposables.never().isDisposed()).isFalse();
	}

	@Test
	public void neverCannotBeDisposed() {
		Disposable never = Disposables.never();
		never.dispose();

		assertThat(never.isDisposed()).isFalse();
	}

	@Test
	public void lambdaDisposableIsNeverReportedDisposed() {
		AtomicInteger calls = new AtomicInteger();
		Disposable d = calls::incrementAndGet;

		d.dispose();
		d.dispose();

		assertThat(calls).hasValue(2);
		assertThat(d.isDisposed()).isFalse();
	}

	//==== PRIVATE API TESTS ====

	static final AtomicReferenceFieldUpdater<TestDisposable, Disposable> DISPOSABLE_UPDATER =
			AtomicReferenceFieldUpdater.newUpdater(TestDisposable.class, Disposable.class, "disp");

	private static class FakeDisposable implements Disposable {

		int disposed;

		@Override
		public void dispose() {
			disposed++;
		}

		@Override
		public boolean isDisposed() {
			return disposed > 0;
		}
	}

	private static class TestDisposable {

		@Nullable
		volatile Disposable disp;
	}

	@Test
	public void setOnceSetsOnce() {
		TestDisposable holder = new TestDisposable();
		FakeDisposable first = new FakeDisposable();

		assertThat(Disposables.setOnce(DISPOSABLE_UPDATER, holder, first)).isTrue();
		assertThat(holder.disp).isSameAs(first);
		assertThatIllegalStateException()
				.isThrownBy(() -> Disposables.setOnce(DISPOSABLE_UPDATER, holder, new FakeDisposable()))
				.withMessage("Disposable already set");
	}

	@Test
	public void setOnceAfterDisposeDisposesNewValue() {
		TestDisposable holder = new TestDisposable();
		Disposables.dispose(DISPOSABLE_UPDATER, holder);
		FakeDisposable late = new FakeDisposable();

		assertThat(Disposables.setOnce(DISPOSABLE_UPDATER, holder, late)).isFalse();
		assertThat(late.isDisposed()).isTrue();
		assertThat(Disposables.isDisposed(holder.disp)).isTrue();
	}

	@Test
	public void disposeDisposesCurrentOnce() {
		TestDisposable holder = new TestDisposable();
		FakeDisposable current = new FakeDisposable();
		Disposables.setOnce(DISPOSABLE_UPDATER, holder, current);

		assertThat(Disposables.dispose(DISPOSABLE_UPDATER, holder)).isTrue();
		assertThat(Disposables.dispose(DISPOSABLE_UPDATER, holder)).isFalse();

		assertThat(current.disposed).isEqualTo(1);
	}
}
