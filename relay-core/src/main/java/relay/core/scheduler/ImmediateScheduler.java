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

import java.util.concurrent.atomic.AtomicBoolean;

import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.Exceptions;

/**
 * Runs every task on the calling thread before returning. Stateless and shared, so
 * {@link #dispose()} has no effect. Not time-capable.
 */
final class ImmediateScheduler implements Scheduler {

	static final ImmediateScheduler INSTANCE = new ImmediateScheduler();

	// handed back for every task, which has always completed by then
	static final Disposable RAN = Disposables.disposed();

	private ImmediateScheduler() {
	}

	@Override
	public Disposable schedule(Runnable task) {
		task.run();
		return RAN;
	}

	@Override
	public Worker createWorker() {
		return new CallerWorker();
	}

	@Override
	public String toString() {
		return Schedulers.IMMEDIATE;
	}

	static final class CallerWorker extends AtomicBoolean implements Worker {

		@Override
		public Disposable schedule(Runnable task) {
			if (get()) {
				throw Exceptions.failWithRejected();
			}
			task.run();
			return RAN;
		}

		@Override
		public void dispose() {
			set(true);
		}

		@Override
		public boolean isDisposed() {
			return get();
		}

		private static final long serialVersionUID = 3061927372146046093L;
	}
}
