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

import java.util.Objects;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;

/**
 * An immutable singly-linked list node, meant to be the head of an {@link AtomicSlot}.
 * A {@code null} chain is the empty list. Every operation returns a new head and never
 * mutates existing nodes, which makes them safe to use from the pure update function
 * of {@link AtomicSlot#update(java.util.function.UnaryOperator)}.
 *
 * @param <E> the type of the elements
 */
public final class Chain<E> {

	final E value;
	@Nullable
	final Chain<E> next;

	Chain(E value, @Nullable Chain<E> next) {
		this.value = value;
		this.next = next;
	}

	/**
	 * Return a new head holding {@code value} in front of {@code head}.
	 *
	 * @param head the current head, null for the empty chain
	 * @param value the element to add
	 * @param <E> the type of the elements
	 * @return the new head
	 */
	public static <E> Chain<E> prepend(@Nullable Chain<E> head, E value) {
		return new Chain<>(Objects.requireNonNull(value, "value"), head);
	}

	/**
	 * Return a chain without the first element that is identical to {@code value}.
	 * Nodes after the removed element are shared with the given chain, nodes before it
	 * are copied. If the element is absent the given head is returned as is.
	 *
	 * @param head the current head, null for the empty chain
	 * @param value the element to remove, compared by identity
	 * @param <E> the type of the elements
	 * @return the new head, possibly null
	 */
	@Nullable
	public static <E> Chain<E> remove(@Nullable Chain<E> head, E value) {
		if (head == null) {
			return null;
		}
		if (head.value == value) {
			return head.next;
		}
		Chain<E> rest = remove(head.next, value);
		if (rest == head.next) {
			return head;
		}
		return new Chain<>(head.value, rest);
	}

	/**
	 * @param head the head, null for the empty chain
	 * @return the number of elements
	 */
	public static int size(@Nullable Chain<?> head) {
		int n = 0;
		for (Chain<?> c = head; c != null; c = c.next) {
			n++;
		}
		return n;
	}

	/**
	 * Apply the action to every element, most recently prepended first.
	 *
	 * @param head the head, null for the empty chain
	 * @param action the action to apply
	 * @param <E> the type of the elements
	 */
	public static <E> void forEach(@Nullable Chain<E> head, Consumer<? super E> action) {
		for (Chain<E> c = head; c != null; c = c.next) {
			action.accept(c.value);
		}
	}

	/**
	 * @return the element held by this node
	 */
	public E value() {
		return value;
	}

	/**
	 * @return the rest of the chain, null if this is the last node
	 */
	@Nullable
	public Chain<E> next() {
		return next;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		for (Chain<E> c = this; c != null; c = c.next) {
			sb.append(c.value);
			if (c.next != null) {
				sb.append(", ");
			}
		}
		return sb.append(']').toString();
	}
}
