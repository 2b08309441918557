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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.Event;
import relay.core.Observer;
import relay.core.scheduler.Scheduler;
import relay.core.scheduler.Schedulers;
import relay.test.AutoDisposingExtension;
import relay.test.RecordingObserver;

import static org.assertj.core.api.Assertions.assertThat;

public class ObservableObserveOnTest {

	@RegisterExtension
	public AutoDisposingExtension afterTest = new AutoDisposingExtension();

	@Test
	public void eventsAreDeliveredOnSchedulerInOrder() {
		Scheduler scheduler = afterTest.autoDispose(Schedulers.newSerial("observeOn"));
		List<Integer> values = new ArrayList<>();
		for (int i = 0; i < 1000; i++) {
			values.add(i);
		}
		RecordingObserver<Integer> observer = RecordingObserver.create();

		Observable.fromIterable(values).observeOn(scheduler).subscribe(observer);

		observer.block();
		assertThat(observer.getReceivedOnNext()).containsExactlyElementsOf(values);
		assertThat(observer.isTerminatedComplete()).isTrue();
		assertThat(observer.getDeliveryThreads()).allMatch(name -> name.equals("observeOn-1"));
		assertThat(observer.getMaxConcurrentDeliveries()).isEqualTo(1);
	}

	@Test
	public void errorIsDeliveredAfterPendingValues() {
		Scheduler scheduler = afterTest.autoDispose(Schedulers.newConcurrent("observeOnError"));
		IllegalStateException boom = new IllegalStateException("boom");
		RecordingObserver<String> observer = RecordingObserver.create();

		Observable.<String>create(o -> {
			o.onNext("a");
			o.onNext("b");
			o.onError(boom);
			return Disposables.never();
		}).observeOn(scheduler).subscribe(observer);

		observer.block();
		assertThat(observer.getEvents()).containsExactly(Event.next("a"), Event.next("b"), Event.error(boom));
	}

	@Test
	public void nothingIsDeliveredBeforeTheSchedulerRuns() {
		List<Runnable> tasks = new ArrayList<>();
		Scheduler scheduler = Schedulers.fromExecutor(tasks::add);
		AtomicReference<Observer<String>> emitter = new AtomicReference<>();
		RecordingObserver<String> observer = RecordingObserver.create();

		Observable.<String>create(o -> {
			emitter.set(o);
			return Disposables.never();
		}).observeOn(scheduler).subscribe(observer);
		emitter.get().onNext("a");
		emitter.get().onNext("b");

		assertThat(observer.getEvents()).isEmpty();

		tasks.forEach(Runnable::run);

		assertThat(observer.getReceivedOnNext()).containsExactly("a", "b");
		assertThat(observer.getDeliveryThreads()).containsOnly(Thread.currentThread().getName());
	}

	@Test
	public void disposeDropsPendingEventsAndUpstream() {
		List<Runnable> tasks = new ArrayList<>();
		Scheduler scheduler = Schedulers.fromExecutor(tasks::add);
		AtomicReference<Observer<String>> emitter = new AtomicReference<>();
		Disposable teardown = Disposables.single();
		RecordingObserver<String> observer = RecordingObserver.create();

		Disposable subscription = Observable.<String>create(o -> {
			emitter.set(o);
			return teardown;
		}).observeOn(scheduler).subscribe(observer);
		emitter.get().onNext("a");

		subscription.dispose();
		tasks.forEach(Runnable::run);
		emitter.get().onNext("b");

		assertThat(observer.getEvents()).isEmpty();
		assertThat(teardown.isDisposed()).isTrue();
	}

	@Test
	public void immediateSchedulerDeliversSynchronously() {
		RecordingObserver<String> observer = RecordingObserver.create();

		Observable.just("a", "b").observeOn(Schedulers.immediate()).subscribe(observer);

		assertThat(observer.getEvents()).containsExactly(Event.next("a"), Event.next("b"), Event.completed());
	}

	@Test
	public void rejectedSchedulingIsDeliveredAsError() {
		Scheduler scheduler = Schedulers.newSerial("observeOnRejecting");
		scheduler.dispose();
		RecordingObserver<String> observer = RecordingObserver.create();

		Observable.just("a").observeOn(scheduler).subscribe(observer);

		assertThat(observer.expectTerminalError()).isInstanceOf(RejectedExecutionException.class);
	}

	@Test
	public void subscribeOnThenObserveOn() {
		Scheduler background = afterTest.autoDispose(Schedulers.newSerial("background"));
		Scheduler ui = afterTest.autoDispose(Schedulers.newSerial("ui"));
		List<String> producerThreads = new ArrayList<>();
		RecordingObserver<Integer> observer = RecordingObserver.create();

		Observable.<Integer>create(o -> {
			producerThreads.add(Thread.currentThread().getName());
			o.onNext(1);
			o.onCompleted();
			return Disposables.never();
		}).subscribeOn(background).observeOn(ui).subscribe(observer);

		observer.block();
		assertThat(producerThreads).containsExactly("background-1");
		assertThat(observer.getDeliveryThreads()).containsOnly("ui-1");
		assertThat(observer.getEvents()).containsExactly(Event.next(1), Event.completed());
	}
}
