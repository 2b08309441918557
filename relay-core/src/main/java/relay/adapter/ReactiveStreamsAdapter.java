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

package relay.adapter;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.Event;
import relay.core.Observer;
import relay.core.observable.Observable;
import relay.core.observable.SafeObserver;

/**
 * Convert an {@link Observable} to/from a Reactive Streams {@link Publisher}.
 */
public abstract class ReactiveStreamsAdapter {

	/**
	 * Return a {@link Publisher} from an {@link Observable}. Each {@link Subscriber}
	 * gets its own subscription to the source; since an {@link Observable} does not
	 * know about backpressure, values exceeding the requested amount are buffered until
	 * more is requested. Terminal signals are delivered once the values before them have
	 * been.
	 *
	 * @param observable the source to convert
	 * @param <T> the value type
	 * @return a {@link Publisher} subscribing to the given {@link Observable}
	 */
	public static <T> Publisher<T> toPublisher(Observable<T> observable) {
		return new ObservableAsPublisher<>(observable);
	}

	/**
	 * Return an {@link Observable} from a {@link Publisher}. Each subscription requests
	 * an unbounded amount and cancels the {@link Subscription} when disposed.
	 *
	 * @param publisher the source to convert
	 * @param <T> the value type
	 * @return an {@link Observable} subscribing to the given {@link Publisher}
	 */
	public static <T> Observable<T> fromPublisher(Publisher<T> publisher) {
		return new PublisherAsObservable<>(publisher);
	}

	ReactiveStreamsAdapter() {
	}

	static final class ObservableAsPublisher<T> implements Publisher<T> {

		final Observable<T> source;

		ObservableAsPublisher(Observable<T> source) {
			this.source = Objects.requireNonNull(source, "observable");
		}

		@Override
		public void subscribe(Subscriber<? super T> s) {
			Objects.requireNonNull(s, "subscriber");
			ObserverToSubscription<T> parent = new ObserverToSubscription<>(s);
			s.onSubscribe(parent);
			Disposables.replace(ObserverToSubscription.UPSTREAM, parent, source.subscribe(parent));
		}
	}

	static final class ObserverToSubscription<T> implements Observer<T>, Subscription {

		final Subscriber<? super T> actual;

		final Queue<Event<? extends T>> queue = new ConcurrentLinkedQueue<>();

		volatile boolean cancelled;

		volatile @Nullable Throwable badRequest;

		volatile long requested;
		static final AtomicLongFieldUpdater<ObserverToSubscription> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(ObserverToSubscription.class, "requested");

		volatile int wip;
		static final AtomicIntegerFieldUpdater<ObserverToSubscription> WIP =
				AtomicIntegerFieldUpdater.newUpdater(ObserverToSubscription.class, "wip");

		volatile @Nullable Disposable upstream;
		static final AtomicReferenceFieldUpdater<ObserverToSubscription, Disposable> UPSTREAM =
				AtomicReferenceFieldUpdater.newUpdater(ObserverToSubscription.class, Disposable.class, "upstream");

		ObserverToSubscription(Subscriber<? super T> actual) {
			this.actual = actual;
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
			drain();
		}

		@Override
		public void request(long n) {
			if (n <= 0L) {
				Disposables.dispose(UPSTREAM, this);
				badRequest = new IllegalArgumentException(
						"§3.9 violated: positive request amount required but it was " + n);
				drain();
				return;
			}
			for (;;) {
				long r = requested;
				if (r == Long.MAX_VALUE) {
					break;
				}
				long u = r + n;
				if (u < 0L) {
					u = Long.MAX_VALUE;
				}
				if (REQUESTED.compareAndSet(this, r, u)) {
					break;
				}
			}
			drain();
		}

		@Override
		public void cancel() {
			if (cancelled) {
				return;
			}
			cancelled = true;
			Disposables.dispose(UPSTREAM, this);
			if (WIP.getAndIncrement(this) == 0) {
				queue.clear();
			}
		}

		void drain() {
			if (WIP.getAndIncrement(this) != 0) {
				return;
			}
			int missed = 1;
			for (;;) {
				long r = requested;
				long e = 0L;

				for (;;) {
					if (cancelled) {
						queue.clear();
						return;
					}
					Throwable bad = badRequest;
					if (bad != null) {
						cancelled = true;
						queue.clear();
						actual.onError(bad);
						return;
					}
					Event<? extends T> ev = queue.peek();
					if (ev == null) {
						break;
					}
					if (ev.isNext()) {
						if (e == r) {
							break;
						}
						queue.poll();
						actual.onNext(ev.get());
						e++;
					}
					else {
						queue.poll();
						cancelled = true;
						Disposables.dispose(UPSTREAM, this);
						Throwable t = ev.getThrowable();
						if (t != null) {
							actual.onError(t);
						}
						else {
							actual.onComplete();
						}
						return;
					}
				}

				if (e != 0L && r != Long.MAX_VALUE) {
					REQUESTED.addAndGet(this, -e);
				}

				missed = WIP.addAndGet(this, -missed);
				if (missed == 0) {
					break;
				}
			}
		}
	}

	static final class PublisherAsObservable<T> extends Observable<T> {

		final Publisher<T> publisher;

		PublisherAsObservable(Publisher<T> publisher) {
			this.publisher = Objects.requireNonNull(publisher, "publisher");
		}

		@Override
		protected void subscribeActual(SafeObserver<T> observer) {
			SubscriberToObserver<T> parent = new SubscriberToObserver<>(observer);
			observer.setUpstream(parent);
			publisher.subscribe(parent);
		}
	}

	static final class SubscriberToObserver<T> implements Subscriber<T>, Disposable {

		static final Subscription CANCELLED = new Subscription() {
			@Override
			public void request(long n) {
			}

			@Override
			public void cancel() {
			}
		};

		final SafeObserver<T> actual;

		volatile @Nullable Subscription subscription;
		static final AtomicReferenceFieldUpdater<SubscriberToObserver, Subscription> S =
				AtomicReferenceFieldUpdater.newUpdater(SubscriberToObserver.class, Subscription.class, "subscription");

		SubscriberToObserver(SafeObserver<T> actual) {
			this.actual = actual;
		}

		@Override
		public void onSubscribe(Subscription s) {
			Objects.requireNonNull(s, "subscription");
			if (S.compareAndSet(this, null, s)) {
				s.request(Long.MAX_VALUE);
			}
			else {
				s.cancel();
			}
		}

		@Override
		public void onNext(T t) {
			actual.onNext(t);
		}

		@Override
		public void onError(Throwable t) {
			actual.onError(t);
		}

		@Override
		public void onComplete() {
			actual.onCompleted();
		}

		@Override
		public void dispose() {
			Subscription s = S.getAndSet(this, CANCELLED);
			if (s != null && s != CANCELLED) {
				s.cancel();
			}
		}

		@Override
		public boolean isDisposed() {
			return subscription == CANCELLED;
		}
	}
}
