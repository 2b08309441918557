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

package relay.core.observable;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;
import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.Exceptions;
import relay.core.scheduler.Scheduler;

/**
 * Subscribes to the source {@link Observable} from a {@link Scheduler.Worker worker} of
 * the given {@link Scheduler}.
 *
 * @param <T> the value type
 * @see Observable#subscribeOn(Scheduler)
 */
final class ObservableSubscribeOn<T> extends Observable<T> {

	final Observable<? extends T> source;

	final Scheduler scheduler;

	ObservableSubscribeOn(Observable<? extends T> source, Scheduler scheduler) {
		this.source = Objects.requireNonNull(source, "source");
		this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
	}

	@Override
	protected void subscribeActual(SafeObserver<T> observer) {
		Scheduler.Worker worker = Objects.requireNonNull(scheduler.createWorker(),
				"The scheduler returned a null Worker");

		SubscribeOnTask<T> parent = new SubscribeOnTask<>(observer, source, worker);
		observer.setUpstream(parent);

		try {
			worker.schedule(parent);
		}
		catch (RejectedExecutionException ree) {
			if (!parent.isDisposed()) {
				observer.onError(Exceptions.failWithRejected(ree));
			}
		}
	}

	static final class SubscribeOnTask<T> implements Runnable, Disposable {

		final SafeObserver<T> actual;

		final Observable<? extends T> source;

		final Scheduler.Worker worker;

		volatile boolean cancelled;

		volatile @Nullable Disposable upstream;
		static final AtomicReferenceFieldUpdater<SubscribeOnTask, Disposable> UPSTREAM =
				AtomicReferenceFieldUpdater.newUpdater(SubscribeOnTask.class, Disposable.class, "upstream");

		SubscribeOnTask(SafeObserver<T> actual, Observable<? extends T> source, Scheduler.Worker worker) {
			this.actual = actual;
			this.source = source;
			this.worker = worker;
		}

		@Override
		public void run() {
			if (cancelled) {
				return;
			}
			Disposables.replace(UPSTREAM, this, source.subscribe(actual));
		}

		@Override
		public void dispose() {
			cancelled = true;
			Disposables.dispose(UPSTREAM, this);
			worker.dispose();
		}

		@Override
		public boolean isDisposed() {
			return cancelled;
		}
	}
}
