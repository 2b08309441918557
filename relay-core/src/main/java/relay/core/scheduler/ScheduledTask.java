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

import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;
import relay.core.Disposable;

/**
 * A task submitted to a {@link java.util.concurrent.ScheduledExecutorService}, either
 * once or at a fixed rate. The {@link Future} returned by the executor is attached
 * after submission, so a disposal racing with the submission still cancels it.
 * <p>
 * A task scheduled through a worker is owned by that worker's dispose bag and leaves it
 * once it has run or has been disposed.
 */
final class ScheduledTask implements Runnable, Disposable {

	static final Future<?> DONE      = new FutureTask<Void>(() -> null);
	static final Future<?> CANCELLED = new FutureTask<Void>(() -> null);

	final Runnable task;
	final boolean  periodic;

	volatile @Nullable Future<?> future;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<ScheduledTask, Future> FUTURE =
			AtomicReferenceFieldUpdater.newUpdater(ScheduledTask.class, Future.class, "future");

	volatile @Nullable Composite owner;
	static final AtomicReferenceFieldUpdater<ScheduledTask, Composite> OWNER =
			AtomicReferenceFieldUpdater.newUpdater(ScheduledTask.class, Composite.class, "owner");

	volatile @Nullable Thread runner;

	ScheduledTask(Runnable task, boolean periodic, @Nullable Composite owner) {
		this.task = task;
		this.periodic = periodic;
		this.owner = owner;
	}

	@Override
	public void run() {
		if (future == CANCELLED) {
			return;
		}
		runner = Thread.currentThread();
		try {
			task.run();
		}
		catch (Throwable ex) {
			Schedulers.handleError(ex);
		}
		finally {
			runner = null;
			if (!periodic) {
				FUTURE.getAndUpdate(this, f -> f == CANCELLED ? CANCELLED : DONE);
				leaveOwner();
			}
		}
	}

	/**
	 * Attach the executor's handle, or cancel it right away if this task was disposed
	 * while being submitted.
	 */
	void attach(Future<?> f) {
		if (!FUTURE.compareAndSet(this, null, f) && future == CANCELLED) {
			f.cancel(runner != Thread.currentThread());
		}
	}

	@Override
	public void dispose() {
		Future<?> previous = FUTURE.getAndUpdate(this, f -> f == DONE ? DONE : CANCELLED);
		if (previous != null && previous != DONE && previous != CANCELLED) {
			// a task disposing itself from within its run is not interrupted
			previous.cancel(runner != Thread.currentThread());
		}
		leaveOwner();
	}

	@Override
	public boolean isDisposed() {
		Future<?> f = future;
		return f == DONE || f == CANCELLED;
	}

	void leaveOwner() {
		Composite o = OWNER.getAndSet(this, null);
		if (o != null) {
			o.remove(this);
		}
	}
}
