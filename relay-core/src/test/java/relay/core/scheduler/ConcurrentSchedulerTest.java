/*
 * Copyright (c) 2016-2022 VMware Inc. or its affiliates, All Rights Reserved.
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

package relay.core.scheduler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.awaitility.Awaitility.await;

public class ConcurrentSchedulerTest extends AbstractSchedulerTest {

	@Override
	protected Scheduler scheduler() {
		return Schedulers.newConcurrent("ConcurrentSchedulerTest", 4);
	}

	@Override
	protected boolean shouldCheckWorkerTimeScheduling() {
		return false;
	}

	@Test
	public void runsTasksInParallel() throws InterruptedException {
		Scheduler s = afterTest.autoDispose(Schedulers.newConcurrent("parallel", 3));
		CountDownLatch allStarted = new CountDownLatch(3);
		CountDownLatch release = new CountDownLatch(1);

		for (int i = 0; i < 3; i++) {
			s.schedule(() -> {
				allStarted.countDown();
				try {
					release.await(5, TimeUnit.SECONDS);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			});
		}

		try {
			assertThat(allStarted.await(5, TimeUnit.SECONDS)).as("3 tasks running at once").isTrue();
		}
		finally {
			release.countDown();
		}
	}

	@Test
	public void boundedToMaxConcurrency() {
		Scheduler s = afterTest.autoDispose(Schedulers.newConcurrent("bounded", 2));
		AtomicInteger inFlight = new AtomicInteger();
		AtomicInteger maxInFlight = new AtomicInteger();
		AtomicInteger done = new AtomicInteger();
		Set<String> threads = ConcurrentHashMap.newKeySet();

		for (int i = 0; i < 20; i++) {
			s.schedule(() -> {
				int n = inFlight.incrementAndGet();
				maxInFlight.accumulateAndGet(n, Math::max);
				threads.add(Thread.currentThread().getName());
				try {
					Thread.sleep(5);
				}
				catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				inFlight.decrementAndGet();
				done.incrementAndGet();
			});
		}

		await().atMost(5, TimeUnit.SECONDS).until(() -> done.get() == 20);
		assertThat(maxInFlight.get()).isBetween(1, 2);
		assertThat(threads).allMatch(name -> name.startsWith("bounded-"));
		assertThat(threads.size()).isLessThanOrEqualTo(2);
	}

	@Test
	public void defaultBoundIsDefaultPoolSize() {
		assertThat(Schedulers.DEFAULT_POOL_SIZE).isPositive();
		Scheduler s = afterTest.autoDispose(Schedulers.newConcurrent("defaultBound"));

		assertThat(s).hasToString("concurrent(\"defaultBound\")");
	}

	@Test
	public void rejectsNonPositiveConcurrency() {
		assertThatIllegalArgumentException()
				.isThrownBy(() -> Schedulers.newConcurrent("invalid", 0))
				.withMessage("maxConcurrency must be strictly positive, was: 0");
	}
}
