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

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

public class SerialSchedulerTest extends AbstractSchedulerTest {

	@Override
	protected Scheduler scheduler() {
		return Schedulers.newSerial("SerialSchedulerTest");
	}

	@Test
	public void allTasksRunOnTheSameNamedDaemonThread() {
		Scheduler s = afterTest.autoDispose(Schedulers.newSerial("serialNames"));
		Set<Thread> threads = ConcurrentHashMap.newKeySet();

		for (int i = 0; i < 10; i++) {
			s.schedule(() -> threads.add(Thread.currentThread()));
		}

		await().atMost(5, TimeUnit.SECONDS).until(() -> threads.size() == 1);
		Thread t = threads.iterator().next();
		assertThat(t.getName()).isEqualTo("serialNames-1");
		assertThat(t.isDaemon()).isTrue();
	}

	@Test
	public void directTasksRunInSubmissionOrder() {
		Scheduler s = afterTest.autoDispose(Schedulers.newSerial("serialOrder"));
		List<Integer> order = new CopyOnWriteArrayList<>();

		for (int i = 0; i < 100; i++) {
			int v = i;
			s.schedule(() -> order.add(v));
		}

		await().atMost(5, TimeUnit.SECONDS).until(() -> order.size() == 100);
		for (int i = 0; i < 100; i++) {
			assertThat(order.get(i)).isEqualTo(i);
		}
	}

	@Test
	public void nonDaemonVariant() {
		Scheduler s = afterTest.autoDispose(Schedulers.newSerial("serialNonDaemon", false));
		Set<Boolean> daemon = ConcurrentHashMap.newKeySet();

		s.schedule(() -> daemon.add(Thread.currentThread().isDaemon()));

		await().atMost(5, TimeUnit.SECONDS).until(() -> !daemon.isEmpty());
		assertThat(daemon).containsExactly(false);
	}

	@Test
	public void toStringMentionsName() {
		Scheduler s = afterTest.autoDispose(Schedulers.newSerial("serialToString"));

		assertThat(s).hasToString("serial(\"serialToString\")");
	}
}
