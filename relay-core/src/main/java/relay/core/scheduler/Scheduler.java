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

import java.util.concurrent.TimeUnit;

import relay.core.Disposable;
import relay.core.Exceptions;

/**
 * An execution context for observables: {@link relay.core.observable.Observable#subscribeOn subscribeOn}
 * runs subscriptions on it, {@link relay.core.observable.Observable#observeOn observeOn}
 * and {@link relay.core.observable.Binder} deliver events on it.
 * <p>
 * Tasks handed to {@link #schedule(Runnable)} may run in any order and in parallel. Code
 * that needs events delivered one after the other in arrival order goes through a
 * {@link Worker}. Every scheduling method throws
 * {@link java.util.concurrent.RejectedExecutionException} once the scheduler or worker is
 * disposed.
 */
public interface Scheduler extends Disposable {

	/**
	 * Run a task as soon as possible.
	 *
	 * @param task the task to run
	 * @return a {@link Disposable} preventing the task from running if it has not started yet
	 */
	Disposable schedule(Runnable task);

	/**
	 * Run a task once the delay has elapsed. Schedulers without a notion of time reject
	 * this call.
	 *
	 * @param task the task to run
	 * @param delay the delay, run as soon as possible if not positive
	 * @param unit the unit of {@code delay}
	 * @return a {@link Disposable} cancelling the pending task
	 */
	default Disposable schedule(Runnable task, long delay, TimeUnit unit) {
		throw Exceptions.failWithRejectedNotTimeCapable();
	}

	/**
	 * Run a task repeatedly at a fixed rate, until the returned {@link Disposable} is
	 * disposed. A failing run is reported through {@link Schedulers#onHandleError} and
	 * does not stop the next ones. Schedulers without a notion of time reject this call.
	 *
	 * @param task the task to run
	 * @param initialDelay the delay before the first run
	 * @param period the strictly positive delay between the start of two runs
	 * @param unit the unit of both delays
	 * @return a {@link Disposable} stopping the repetition
	 */
	default Disposable schedulePeriodically(Runnable task, long initialDelay, long period, TimeUnit unit) {
		throw Exceptions.failWithRejectedNotTimeCapable();
	}

	/**
	 * Open a serial lane on this scheduler. The caller owns the returned {@link Worker}
	 * and disposes it once done.
	 *
	 * @return a new {@link Worker}
	 */
	Worker createWorker();

	/**
	 * Stop accepting tasks and release the threads this scheduler owns. Shared
	 * schedulers such as {@link Schedulers#immediate()} ignore it.
	 */
	@Override
	default void dispose() {
	}

	/**
	 * A serial lane of a {@link Scheduler}: its tasks run one at a time, in the order they
	 * were scheduled. Disposing it drops the tasks that have not started yet.
	 */
	interface Worker extends Disposable {

		/**
		 * Queue a task on this lane.
		 *
		 * @param task the task to run
		 * @return a {@link Disposable} removing the task if it has not started yet
		 */
		Disposable schedule(Runnable task);

		/**
		 * Queue a task on this lane once the delay has elapsed. Workers without a notion
		 * of time reject this call.
		 *
		 * @param task the task to run
		 * @param delay the delay, queued right away if not positive
		 * @param unit the unit of {@code delay}
		 * @return a {@link Disposable} cancelling the pending task
		 */
		default Disposable schedule(Runnable task, long delay, TimeUnit unit) {
			throw Exceptions.failWithRejectedNotTimeCapable();
		}

		@Override
		void dispose();
	}
}
