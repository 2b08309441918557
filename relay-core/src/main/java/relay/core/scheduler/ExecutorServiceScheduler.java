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
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.Exceptions;

/**
 * A time-capable {@link Scheduler} owning a {@link ScheduledExecutorService}, which it
 * shuts down when disposed.
 * <p>
 * A <em>serial</em> scheduler runs on a single thread, so its workers submit straight to
 * the executor and only keep track of their pending tasks. A concurrent one runs on a
 * bounded pool and its workers are {@link TrampolineWorker trampolines}, which cannot
 * delay tasks.
 */
final class ExecutorServiceScheduler implements Scheduler {

	final String                   name;
	final ScheduledExecutorService executor;
	final boolean                  serial;

	ExecutorServiceScheduler(String name, ScheduledExecutorService executor, boolean serial) {
		this.name = name;
		this.executor = executor;
		this.serial = serial;
	}

	@Override
	public Disposable schedule(Runnable task) {
		return schedule(task, 0L, TimeUnit.MILLISECONDS);
	}

	@Override
	public Disposable schedule(Runnable task, long delay, TimeUnit unit) {
		return submit(executor, new ScheduledTask(Objects.requireNonNull(task, "task"), false, null), delay, unit);
	}

	@Override
	public Disposable schedulePeriodically(Runnable task,
			long initialDelay,
			long period,
			TimeUnit unit) {
		Objects.requireNonNull(task, "task");
		if (period <= 0L) {
			throw new IllegalArgumentException("period must be strictly positive, was: " + period);
		}
		ScheduledTask t = new ScheduledTask(task, true, null);
		try {
			t.attach(executor.scheduleAtFixedRate(t, initialDelay, period, unit));
		}
		catch (RejectedExecutionException ex) {
			throw Exceptions.failWithRejected(ex);
		}
		return t;
	}

	@Override
	public Worker createWorker() {
		if (executor.isShutdown()) {
			throw Exceptions.failWithRejected();
		}
		return serial ? new TrackingWorker(executor) : new TrampolineWorker(executor);
	}

	@Override
	public void dispose() {
		if (!executor.isShutdown()) {
			Schedulers.log.debug("Disposing scheduler {}", name);
			executor.shutdownNow();
		}
	}

	@Override
	public boolean isDisposed() {
		return executor.isShutdown();
	}

	@Override
	public String toString() {
		return (serial ? Schedulers.SERIAL : Schedulers.CONCURRENT) + "(\"" + name + "\")";
	}

	static Disposable submit(ScheduledExecutorService executor,
			ScheduledTask t,
			long delay,
			TimeUnit unit) {
		try {
			t.attach(delay <= 0L ? executor.submit(t) : executor.schedule(t, delay, unit));
		}
		catch (RejectedExecutionException ex) {
			t.dispose();
			throw Exceptions.failWithRejected(ex);
		}
		return t;
	}

	/**
	 * Worker of a single-threaded executor, which already runs tasks in order. Its
	 * pending tasks sit in a dispose bag so that disposing the worker cancels them.
	 */
	static final class TrackingWorker implements Worker {

		final ScheduledExecutorService executor;

		final Composite pending = Disposables.composite();

		TrackingWorker(ScheduledExecutorService executor) {
			this.executor = executor;
		}

		@Override
		public Disposable schedule(Runnable task) {
			return schedule(task, 0L, TimeUnit.MILLISECONDS);
		}

		@Override
		public Disposable schedule(Runnable task, long delay, TimeUnit unit) {
			ScheduledTask t = new ScheduledTask(Objects.requireNonNull(task, "task"), false, pending);
			if (!pending.add(t)) {
				throw Exceptions.failWithRejected();
			}
			return submit(executor, t, delay, unit);
		}

		@Override
		public void dispose() {
			pending.dispose();
		}

		@Override
		public boolean isDisposed() {
			return pending.isDisposed();
		}
	}
}
