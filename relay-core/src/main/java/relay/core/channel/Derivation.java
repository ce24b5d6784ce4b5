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
import relay.core.CancellationToken;
import relay.core.scheduler.Scheduler;

/**
 * Immutable options of a derived channel: the {@link Scheduler} its body runs on, the
 * {@link CancellationToken} that can stop it and its {@link BufferSize}.
 * <p>
 * Without an explicit scheduler the body runs on the scheduler of the bound
 * {@link relay.core.ExecutionContext context}, or on
 * {@link relay.core.scheduler.Schedulers#primary()} when there is no context.
 */
public final class Derivation {

	static final Derivation DEFAULTS = new Derivation(null, null, BufferSize.DEFAULT);

	/**
	 * @return the default options: no scheduler override, no token, default buffer size
	 */
	public static Derivation defaults() {
		return DEFAULTS;
	}

	/**
	 * @param scheduler the scheduler to run the body on
	 * @return default options running on the given scheduler
	 */
	public static Derivation on(Scheduler scheduler) {
		return DEFAULTS.withScheduler(scheduler);
	}

	@Nullable
	final Scheduler         scheduler;
	@Nullable
	final CancellationToken token;
	final BufferSize        bufferSize;

	Derivation(@Nullable Scheduler scheduler, @Nullable CancellationToken token, BufferSize bufferSize) {
		this.scheduler = scheduler;
		this.token = token;
		this.bufferSize = bufferSize;
	}

	public Derivation withScheduler(Scheduler scheduler) {
		return new Derivation(Objects.requireNonNull(scheduler, "scheduler"), token, bufferSize);
	}

	public Derivation withToken(CancellationToken token) {
		return new Derivation(scheduler, Objects.requireNonNull(token, "token"), bufferSize);
	}

	public Derivation withBufferSize(BufferSize bufferSize) {
		return new Derivation(scheduler, token, Objects.requireNonNull(bufferSize, "bufferSize"));
	}

	@Nullable
	public Scheduler scheduler() {
		return scheduler;
	}

	@Nullable
	public CancellationToken token() {
		return token;
	}

	public BufferSize bufferSize() {
		return bufferSize;
	}

	@Override
	public String toString() {
		return "Derivation{scheduler=" + scheduler + ", token=" + token + ", " + bufferSize + "}";
	}
}
