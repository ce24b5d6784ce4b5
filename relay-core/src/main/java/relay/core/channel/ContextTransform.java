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

/**
 * A {@link Transform} that also receives the live
 * {@link relay.core.ExecutionContext context} it is bound to.
 *
 * @param <C> the type of the context
 * @param <T> the type of the input
 * @param <R> the type of the result
 */
@FunctionalInterface
public interface ContextTransform<C, T, R> {

	R apply(C context, T t) throws Exception;
}
