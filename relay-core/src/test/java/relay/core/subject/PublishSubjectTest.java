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

package relay.core.subject;

import java.util.ArrayList;
import java.util.List;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.core.Disposable;
import relay.core.Event;
import relay.core.Hooks;
import relay.core.observable.Observable;
import relay.test.RecordingObserver;
import relay.test.util.RaceTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

public class PublishSubjectTest {

	@AfterEach
	public void resetHooks() {
		Hooks.resetAll();
	}

	@Test
	public void lateSubscriberOnlySeesLaterEvents() {
		PublishSubject<String> subject = PublishSubject.create();
		RecordingObserver<String> s1 = RecordingObserver.create();
		RecordingObserver<String> s2 = RecordingObserver.create();

		subject.subscribe(s1);
		subject.onNext("x");
		subject.onNext("y");
		subject.subscribe(s2);
		subject.onNext("z");
		subject.onCompleted();

		assertThat(s1.getEvents()).containsExactly(
				Event.next("x"), Event.next("y"), Event.next("z"), Event.completed());
		assertThat(s2.getEvents()).containsExactly(Event.next("z"), Event.completed());
	}

	@Test
	public void subscriberAfterTerminationOnlySeesTerminal() {
		PublishSubject<String> subject = PublishSubject.create();
		IllegalStateException boom = new IllegalStateException("boom");
		subject.onNext("lost");
		subject.onError(boom);
		RecordingObserver<String> late = RecordingObserver.create();

		subject.subscribe(late);

		assertThat(late.getEvents()).containsExactly(Event.error(boom));
		assertThat(subject.isTerminated()).isTrue();
		assertThat(subject.getError()).isSameAs(boom);
	}

	@Test
	public void valuesAfterTerminationAreDropped() {
		List<Object> dropped = new ArrayList<>();
		List<Throwable> droppedErrors = new ArrayList<>();
		Hooks.onNextDropped(dropped::add);
		Hooks.onErrorDropped(droppedErrors::add);
		PublishSubject<String> subject = PublishSubject.create();
		RecordingObserver<String> observer = RecordingObserver.create();
		subject.subscribe(observer);
		IllegalStateException late = new IllegalStateException("late");

		subject.onCompleted();
		subject.onNext("after");
		subject.onError(late);
		subject.onCompleted();

		assertThat(observer.getEvents()).containsExactly(Event.completed());
		assertThat(dropped).containsExactly("after");
		assertThat(droppedErrors).containsExactly(late);
		assertThat(subject.getError()).isNull();
	}

	@Test
	public void failingObserverDoesNotStopFanOut() {
		PublishSubject<String> subject = PublishSubject.create();
		List<Throwable> errors = new ArrayList<>();
		RecordingObserver<String> second = RecordingObserver.create();
		subject.subscribe(v -> {
			throw new IllegalStateException("consumer bug");
		}, errors::add);
		subject.subscribe(second);

		subject.onNext("x");
		subject.onNext("y");

		assertThat(second.getReceivedOnNext()).containsExactly("x", "y");
		assertThat(errors).singleElement(InstanceOfAssertFactories.THROWABLE).hasMessage("consumer bug");
		assertThat(subject.observerCount()).isEqualTo(1);
	}

	@Test
	public void disposedObserverIsRemoved() {
		PublishSubject<String> subject = PublishSubject.create();
		RecordingObserver<String> kept = RecordingObserver.create();
		RecordingObserver<String> gone = RecordingObserver.create();
		subject.subscribe(kept);
		Disposable subscription = subject.subscribe(gone);

		assertThat(subject.observerCount()).isEqualTo(2);
		subscription.dispose();
		subject.onNext("a");

		assertThat(subject.observerCount()).isEqualTo(1);
		assertThat(subject.hasObservers()).isTrue();
		assertThat(kept.getReceivedOnNext()).containsExactly("a");
		assertThat(gone.getEvents()).isEmpty();
	}

	@Test
	public void terminationClearsObservers() {
		PublishSubject<String> subject = PublishSubject.create();
		subject.subscribe(RecordingObserver.create());

		subject.onCompleted();

		assertThat(subject.hasObservers()).isFalse();
		assertThat(subject.isTerminated()).isTrue();
	}

	@Test
	public void asObservableHidesIdentity() {
		PublishSubject<String> subject = PublishSubject.create();
		Observable<String> observable = subject.asObservable();
		RecordingObserver<String> observer = RecordingObserver.create();

		observable.subscribe(observer);
		subject.asObserver().onNext("a");

		assertThat(observable).isNotInstanceOf(Subject.class);
		assertThat(subject.asObserver()).isSameAs(subject);
		assertThat(observer.getReceivedOnNext()).containsExactly("a");
	}

	@Test
	public void subscribeRacingTerminationSeesExactlyOneTerminal() {
		for (int i = 0; i < 100; i++) {
			PublishSubject<String> subject = PublishSubject.create();
			RecordingObserver<String> observer = RecordingObserver.create();

			RaceTestUtils.race(() -> subject.subscribe(observer), subject::onCompleted);

			assertThat(observer.getEvents()).containsExactly(Event.completed());
		}
	}

	@Test
	public void disposeRacingEmission() {
		for (int i = 0; i < 100; i++) {
			PublishSubject<Integer> subject = PublishSubject.create();
			RecordingObserver<Integer> observer = RecordingObserver.create();
			Disposable subscription = subject.subscribe(observer);

			RaceTestUtils.race(subscription::dispose, () -> subject.onNext(1));

			assertThat(subject.hasObservers()).isFalse();
			assertThat(observer.getReceivedOnNext()).hasSizeLessThanOrEqualTo(1);
		}
	}
}
