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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates the threads of the schedulers built by {@link Schedulers}, named
 * {@code prefix-N}. Anything escaping a task on these threads is reported like a failed
 * task.
 */
final class RelayThreadFactory implements ThreadFactory, Thread.UncaughtExceptionHandler {

	final String     prefix;
	final AtomicLong counter;
	final boolean    daemon;

	RelayThreadFactory(String prefix, AtomicLong counter, boolean daemon) {
		this.prefix = prefix;
		this.counter = counter;
		this.daemon = daemon;
	}

	@Override
	public Thread newThread(Runnable r) {
		Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
		t.setDaemon(daemon);
		t.setUncaughtExceptionHandler(this);
		return t;
	}

	@Override
	public void uncaughtException(Thread t, Throwable e) {
		Schedulers.handleError(e);
	}

	@Override
	public String toString() {
		return "RelayThreadFactory(\"" + prefix + "\")";
	}
}
