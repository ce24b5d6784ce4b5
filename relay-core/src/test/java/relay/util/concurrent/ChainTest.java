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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

class ChainTest {

	static List<String> toList(Chain<String> head) {
		List<String> list = new ArrayList<>();
		Chain.forEach(head, list::add);
		return list;
	}

	@Test
	void prependBuildsNewestFirst() {
		Chain<String> head = Chain.prepend(Chain.prepend(Chain.prepend(null, "a"), "b"), "c");

		assertThat(toList(head)).containsExactly("c", "b", "a");
		assertThat(Chain.size(head)).isEqualTo(3);
		assertThat(head).hasToString("[c, b, a]");
	}

	@Test
	void prependRejectsNull() {
		assertThatNullPointerException().isThrownBy(() -> Chain.prepend(null, null));
	}

	@Test
	void emptyChainIsNull() {
		assertThat(Chain.size(null)).isZero();
		assertThat(Chain.remove(null, "a")).isNull();
	}

	@Test
	void removeSharesSuffixAndCopiesPrefix() {
		Chain<String> a = Chain.prepend(null, "a");
		Chain<String> b = Chain.prepend(a, "b");
		Chain<String> c = Chain.prepend(b, "c");

		Chain<String> removed = Chain.remove(c, "b");

		assertThat(toList(removed)).containsExactly("c", "a");
		assertThat(removed).isNotSameAs(c);
		assertThat(removed.next()).isSameAs(a);
		//the original is untouched
		assertThat(toList(c)).containsExactly("c", "b", "a");
	}

	@Test
	void removeHead() {
		Chain<String> a = Chain.prepend(null, "a");
		Chain<String> b = Chain.prepend(a, "b");

		assertThat(Chain.remove(b, "b")).isSameAs(a);
	}

	@Test
	void removeAbsentReturnsSameHead() {
		Chain<String> head = Chain.prepend(Chain.prepend(null, "a"), "b");

		assertThat(Chain.remove(head, "z")).isSameAs(head);
	}

	@Test
	void removeComparesByIdentity() {
		String first = new String("x");
		String second = new String("x");
		Chain<String> head = Chain.prepend(Chain.prepend(null, first), second);

		Chain<String> removed = Chain.remove(head, first);

		assertThat(Chain.size(removed)).isEqualTo(1);
		assertThat(removed.value()).isSameAs(second);
	}
}
