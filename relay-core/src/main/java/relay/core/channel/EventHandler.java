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
import relay.core.scheduler.Scheduler;

/**
 * Receives the {@link Event events} of a {@link Channel} it is
 * {@link Channel#subscribe(EventHandler) subscribed} to. Invocations are serialized: a
 * handler never sees two events concurrently, and sees the completion last.
 *
 * @param <U> the type of update values
 * @param <S> the type of the success value of the completion
 */
@FunctionalInterface
public interface EventHandler<U, S> {

	/**
	 * @param event the event
	 * @param origin the {@link Scheduler} the event was emitted from, if known
	 */
	void onEvent(Event<U, S> event, @Nullable Scheduler origin);
}
