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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.Event;
import relay.core.observable.Observable;
import relay.core.subject.PublishSubject;
import relay.test.RecordingObserver;

import static org.assertj.core.api.Assertions.assertThat;

class ReactiveStreamsAdapterTest {

	static final class TestSubscriber<T> implements Subscriber<T> {

		final long initialRequest;

		final List<T> values = new ArrayList<>();

		@Nullable Subscription subscription;

		@Nullable Throwable error;

		boolean completed;

		TestSubscriber(long initialRequest) {
			this.initialRequest = initialRequest;
		}

		@Override
		public void onSubscribe(Subscription s) {
			subscription = s;
			if (initialRequest > 0) {
				s.request(initialRequest);
			}
		}

		@Override
		public void onNext(T t) {
			values.add(t);
		}

		@Override
		public void onError(Throwable t) {
			error = t;
		}

		@Override
		public void onComplete() {
			completed = true;
		}

		Subscription subscription() {
			assertThat(subscription).as("onSubscribe called").isNotNull();
			return subscription;
		}
	}

	@Test
	void publisherHonorsDemand() {
		TestSubscriber<Integer> subscriber = new TestSubscriber<>(2);

		ReactiveStreamsAdapter.toPublisher(Observable.just(1, 2, 3, 4, 5)).subscribe(subscriber);

		assertThat(subscriber.values).containsExactly(1, 2);
		assertThat(subscriber.completed).isFalse();

		subscriber.subscription().request(2);
		assertThat(subscriber.values).containsExactly(1, 2, 3, 4);
		assertThat(subscriber.completed).isFalse();

		subscriber.subscription().request(Long.MAX_VALUE);
		assertThat(subscriber.values).containsExactly(1, 2, 3, 4, 5);
		assertThat(subscriber.completed).isTrue();
	}

	@Test
	void publisherDeliversErrorAfterQueuedValues() {
		PublishSubject<String> subject = PublishSubject.create();
		TestSubscriber<String> subscriber = new TestSubscriber<>(0);
		ReactiveStreamsAdapter.toPublisher(subject.asObservable()).subscribe(subscriber);
		IllegalStateException boom = new IllegalStateException("boom");

		subject.onNext("a");
		subject.onError(boom);

		assertThat(subscriber.values).isEmpty();
		assertThat(subscriber.error).isNull();

		subscriber.subscription().request(1);

		assertThat(subscriber.values).containsExactly("a");
		assertThat(subscriber.error).isSameAs(boom);
	}

	@Test
	void nonPositiveRequestIsAnError() {
		AtomicBoolean tornDown = new AtomicBoolean();
		TestSubscriber<String> subscriber = new TestSubscriber<>(0);
		ReactiveStreamsAdapter.toPublisher(Observable.<String>create(o -> Disposables.create(() -> tornDown.set(true))))
		                      .subscribe(subscriber);

		subscriber.subscription().request(0);

		assertThat(subscriber.error)
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("§3.9 violated: positive request amount required but it was 0");
		assertThat(tornDown).isTrue();
	}

	@Test
	void cancelDisposesSource() {
		AtomicBoolean tornDown = new AtomicBoolean();
		PublishSubject<String> subject = PublishSubject.create();
		TestSubscriber<String> subscriber = new TestSubscriber<>(Long.MAX_VALUE);
		ReactiveStreamsAdapter.toPublisher(Observable.<String>create(o -> {
			subject.subscribe(o::onNext);
			return Disposables.create(() -> tornDown.set(true));
		})).subscribe(subscriber);

		subject.onNext("a");
		subscriber.subscription().cancel();
		subject.onNext("b");

		assertThat(subscriber.values).containsExactly("a");
		assertThat(tornDown).isTrue();
	}

	static final class RangePublisher implements Publisher<Integer> {

		final int count;

		final AtomicLong totalRequested = new AtomicLong();

		final AtomicBoolean cancelled = new AtomicBoolean();

		RangePublisher(int count) {
			this.count = count;
		}

		@Override
		public void subscribe(Subscriber<? super Integer> s) {
			s.onSubscribe(new Subscription() {
				int index;

				@Override
				public void request(long n) {
					totalRequested.addAndGet(n);
					while (index < count && !cancelled.get()) {
						s.onNext(index++);
					}
					if (!cancelled.get()) {
						s.onComplete();
					}
				}

				@Override
				public void cancel() {
					cancelled.set(true);
				}
			});
		}
	}

	@Test
	void observableRequestsUnboundedAndRelaysEvents() {
		RangePublisher publisher = new RangePublisher(3);
		RecordingObserver<Integer> observer = RecordingObserver.create();

		ReactiveStreamsAdapter.fromPublisher(publisher).subscribe(observer);

		assertThat(publisher.totalRequested).hasValue(Long.MAX_VALUE);
		assertThat(observer.getEvents()).containsExactly(Event.next(0), Event.next(1), Event.next(2), Event.completed());
	}

	@Test
	void disposingObservableCancelsSubscription() {
		List<Subscription> subscriptions = new ArrayList<>();
		AtomicBoolean cancelled = new AtomicBoolean();
		Publisher<String> publisher = s -> {
			Subscription subscription = new Subscription() {
				@Override
				public void request(long n) {
				}

				@Override
				public void cancel() {
					cancelled.set(true);
				}
			};
			subscriptions.add(subscription);
			s.onSubscribe(subscription);
		};

		Disposable disposable = ReactiveStreamsAdapter.fromPublisher(publisher).subscribe(RecordingObserver.create());

		assertThat(subscriptions).hasSize(1);
		disposable.dispose();

		assertThat(cancelled).isTrue();
		assertThat(disposable.isDisposed()).isTrue();
	}

	@Test
	void secondSubscriptionIsCancelled() {
		AtomicBoolean secondCancelled = new AtomicBoolean();
		Publisher<String> misbehaving = s -> {
			s.onSubscribe(new Subscription() {
				@Override
				public void request(long n) {
				}

				@Override
				public void cancel() {
				}
			});
			s.onSubscribe(new Subscription() {
				@Override
				public void request(long n) {
				}

				@Override
				public void cancel() {
					secondCancelled.set(true);
				}
			});
		};

		ReactiveStreamsAdapter.fromPublisher(misbehaving).subscribe(RecordingObserver.create());

		assertThat(secondCancelled).isTrue();
	}
}
