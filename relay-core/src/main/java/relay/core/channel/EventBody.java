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
 * The body of a derived channel, run once per source {@link Event}, which emits into
 * the derived {@link Producer}. It is the single primitive every operator of
 * {@link Channel} is built with.
 *
 * @param <C> the type of the context
 * @param <U> the type of source update values
 * @param <S> the type of the source success value
 * @param <P> the type of derived update values
 * @param <PS> the type of the derived success value
 * @see Channel#makeProducer(relay.core.ExecutionContext, Derivation, EventBody)
 */
@FunctionalInterface
public interface EventBody<C, U, S, P, PS> {

	/**
	 * @param context the live context, null for derivations without context
	 * @param event the source event
	 * @param producer the derived producer to emit into
	 * @param origin the {@link Scheduler} the body runs on
	 * @throws Exception failing the derived producer
	 */
	void accept(@Nullable C context, Event<U, S> event, Producer<P, PS> producer, Scheduler origin)
			throws Exception;
}
