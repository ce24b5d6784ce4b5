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

/**
 * Provide the {@link relay.core.channel.Channel} and {@link relay.core.channel.Producer}
 * event streams and their operators.
 *
 * <h2>Channel</h2>
 * A typed stream of any number of updates terminated by exactly one
 * {@link relay.core.channel.Fallible} completion. Derived channels are built with
 * {@link relay.core.channel.Channel#makeProducer(relay.core.ExecutionContext, relay.core.channel.Derivation, relay.core.channel.EventBody)}.
 *
 * <h2>Producer</h2>
 * The thread-safe write side of a channel.
 */
@NullMarked
package relay.core.channel;

import org.jspecify.annotations.NullMarked;
