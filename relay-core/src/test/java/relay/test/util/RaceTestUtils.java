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

package relay.test.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import relay.core.Exceptions;
import relay.core.scheduler.Scheduler;
import relay.core.scheduler.Schedulers;

/**
 * Helpers to run several tasks at the same instant and surface their failures.
 */
public class RaceTestUtils {

	/**
	 * Synchronizes the execution of several {@link Runnable}s as much as possible
	 * to test race conditions, each on its own thread. The method blocks until all
	 * have run to completion.
	 *
	 * @param rs the runnables to execute
	 */
	public static void race(final Runnable... rs) {
		Scheduler s = Schedulers.newParallel("race", rs.length);
		try {
			race(s, rs);
		}
		finally {
			s.dispose();
		}
	}

	/**
	 * Synchronizes the execution of several {@link Runnable}s as much as possible
	 * to test race conditions. The method blocks until all have run to completion,
	 * with a 5s timeout. The {@link Scheduler} must be able to run all the runnables
	 * at the same time.
	 *
	 * @param s the {@link Scheduler} on which to execute the runnables
	 * @param rs the runnables to execute
	 */
	public static void race(Scheduler s, final Runnable... rs) {
		race(5, s, rs);
	}

	/**
	 * Synchronizes the execution of several {@link Runnable}s as much as possible
	 * to test race conditions. The method blocks until all have run to completion,
	 * with a configurable timeout (allowing for debugging sessions to use a larger timeout).
	 *
	 * @param timeoutSeconds the number of seconds after which the race is considered timed out
	 * @param s the {@link Scheduler} on which to execute the runnables
	 * @param rs the runnables to execute
	 */
	public static void race(int timeoutSeconds, Scheduler s, final Runnable... rs) {
		final AtomicInteger count = new AtomicInteger(rs.length);
		final CountDownLatch cdl = new CountDownLatch(rs.length);
		final Throwable[] errors = new Throwable[rs.length];
		for (int i = 0; i < rs.length; i++) {
			final int index = i;
			s.schedule(() -> {
				if (count.decrementAndGet() != 0) {
					while (count.get() != 0) {
						Thread.onSpinWait();
					}
				}

				try {
					try {
						rs[index].run();
					}
					catch (Throwable ex) {
						errors[index] = ex;
					}
				}
				finally {
					cdl.countDown();
				}
			});
		}

		try {
			if (!cdl.await(timeoutSeconds, TimeUnit.SECONDS)) {
				throw new AssertionError("RaceTestUtils.race wait timed out after " + timeoutSeconds + "s");
			}
		}
		catch (InterruptedException ex) {
			throw new RuntimeException(ex);
		}

		List<Throwable> es = new ArrayList<>(rs.length);
		for (Throwable t : errors) {
			if (t != null) {
				es.add(t);
			}
		}
		if (es.size() == 1) {
			throw Exceptions.propagate(es.get(0));
		}
		else if (es.size() > 1) {
			AssertionError multiple = new AssertionError(es.size() + " racing tasks failed");
			es.forEach(multiple::addSuppressed);
			throw multiple;
		}
	}
}
