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

import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import relay.core.Disposable;

/**
 * A task handed to a plain {@link java.util.concurrent.Executor}. It runs at most once
 * and not at all if disposed first. Failures are reported through
 * {@link Schedulers#handleError(Throwable)}.
 */
final class ExecutorTask implements Runnable, Disposable {

	static final int PENDING = 0;
	static final int CLAIMED = 1;

	final Runnable task;

	volatile int state;
	static final AtomicIntegerFieldUpdater<ExecutorTask> STATE =
			AtomicIntegerFieldUpdater.newUpdater(ExecutorTask.class, "state");

	ExecutorTask(Runnable task) {
		this.task = task;
	}

	@Override
	public void run() {
		if (!STATE.compareAndSet(this, PENDING, CLAIMED)) {
			return;
		}
		try {
			task.run();
		}
		catch (Throwable ex) {
			Schedulers.handleError(ex);
		}
	}

	@Override
	public void dispose() {
		state = CLAIMED;
	}

	@Override
	public boolean isDisposed() {
		return state == CLAIMED;
	}
}
