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

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import relay.core.Disposable;
import relay.core.Exceptions;

/**
 * A {@link Scheduler.Worker} that keeps its tasks serial over an {@link Executor} of any
 * concurrency: tasks are queued and a single drain loop, submitted to the executor
 * whenever the queue goes from idle to busy, runs them in order.
 */
final class TrampolineWorker implements Scheduler.Worker, Runnable {

	final Executor executor;

	final Queue<ExecutorTask> queue = new ConcurrentLinkedQueue<>();

	volatile boolean disposed;

	volatile int wip;
	static final AtomicIntegerFieldUpdater<TrampolineWorker> WIP =
			AtomicIntegerFieldUpdater.newUpdater(TrampolineWorker.class, "wip");

	TrampolineWorker(Executor executor) {
		this.executor = executor;
	}

	@Override
	public Disposable schedule(Runnable task) {
		Objects.requireNonNull(task, "task");
		if (disposed) {
			throw Exceptions.failWithRejected();
		}
		ExecutorTask t = new ExecutorTask(task);
		queue.offer(t);
		if (disposed) {
			t.dispose();
			throw Exceptions.failWithRejected();
		}
		if (WIP.getAndIncrement(this) == 0) {
			try {
				executor.execute(this);
			}
			catch (Throwable ex) {
				// the drain loop never started, so this lane cannot make progress anymore
				dispose();
				Schedulers.handleError(ex);
				throw Exceptions.failWithRejected(ex);
			}
		}
		return t;
	}

	@Override
	public void run() {
		int missed = 1;
		for (;;) {
			ExecutorTask t;
			while ((t = queue.poll()) != null) {
				if (disposed) {
					queue.clear();
					return;
				}
				t.run();
			}
			missed = WIP.addAndGet(this, -missed);
			if (missed == 0) {
				return;
			}
		}
	}

	@Override
	public void dispose() {
		if (disposed) {
			return;
		}
		disposed = true;
		ExecutorTask t;
		while ((t = queue.poll()) != null) {
			t.dispose();
		}
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}
}
