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
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;
import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.Event;
import relay.core.Exceptions;
import relay.core.Observer;
import relay.core.scheduler.Scheduler;

/**
 * Emits events of the source on a single {@link Scheduler.Worker worker} of the given
 * {@link Scheduler}, through an unbounded queue drained in order.
 *
 * @param <T> the value type
 * @see Observable#observeOn(Scheduler)
 */
final class ObservableObserveOn<T> extends Observable<T> {

	final Observable<? extends T> source;

	final Scheduler scheduler;

	ObservableObserveOn(Observable<? extends T> source, Scheduler scheduler) {
		this.source = Objects.requireNonNull(source, "source");
		this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
	}

	@Override
	protected void subscribeActual(SafeObserver<T> observer) {
		Scheduler.Worker worker = Objects.requireNonNull(scheduler.createWorker(),
				"The scheduler returned a null Worker");

		ObserveOnObserver<T> parent = new ObserveOnObserver<>(observer, worker);
		observer.setUpstream(parent);
		parent.setUpstream(source.subscribe(parent));
	}

	static final class ObserveOnObserver<T> implements Observer<T>, Disposable, Runnable {

		final SafeObserver<T> actual;

		final Scheduler.Worker worker;

		final Queue<Event<? extends T>> queue = new ConcurrentLinkedQueue<>();

		volatile boolean cancelled;

		volatile int wip;
		static final AtomicIntegerFieldUpdater<ObserveOnObserver> WIP =
				AtomicIntegerFieldUpdater.newUpdater(ObserveOnObserver.class, "wip");

		volatile @Nullable Disposable upstream;
		static final AtomicReferenceFieldUpdater<ObserveOnObserver, Disposable> UPSTREAM =
				AtomicReferenceFieldUpdater.newUpdater(ObserveOnObserver.class, Disposable.class, "upstream");

		ObserveOnObserver(SafeObserver<T> actual, Scheduler.Worker worker) {
			this.actual = actual;
			this.worker = worker;
		}

		void setUpstream(Disposable d) {
			Disposables.replace(UPSTREAM, this, d);
		}

		@Override
		public void onNext(T value) {
			on(Event.next(value));
		}

		@Override
		public void onError(Throwable e) {
			on(Event.error(e));
		}

		@Override
		public void onCompleted() {
			on(Event.completed());
		}

		@Override
		public void on(Event<? extends T> event) {
			if (cancelled) {
				return;
			}
			queue.offer(event);
			trySchedule();
		}

		void trySchedule() {
			if (WIP.getAndIncrement(this) != 0) {
				return;
			}
			try {
				worker.schedule(this);
			}
			catch (RejectedExecutionException ree) {
				queue.clear();
				if (!cancelled) {
					actual.onError(Exceptions.failWithRejected(ree));
				}
			}
		}

		@Override
		public void run() {
			int missed = 1;
			for (;;) {
				Event<? extends T> e;
				while ((e = queue.poll()) != null) {
					if (cancelled) {
						queue.clear();
						return;
					}
					actual.on(e);
				}

				missed = WIP.addAndGet(this, -missed);
				if (missed == 0) {
					break;
				}
			}
		}

		@Override
		public void dispose() {
			if (cancelled) {
				return;
			}
			cancelled = true;
			Disposables.dispose(UPSTREAM, this);
			worker.dispose();
			if (WIP.getAndIncrement(this) == 0) {
				queue.clear();
			}
		}

		@Override
		public boolean isDisposed() {
			return cancelled;
		}
	}
}
