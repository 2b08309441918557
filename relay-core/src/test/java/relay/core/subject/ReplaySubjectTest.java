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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import relay.core.Event;
import relay.core.Observer;
import relay.test.RecordingObserver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class ReplaySubjectTest {

	@Test
	public void boundedBufferReplaysMostRecent() {
		ReplaySubject<String> subject = ReplaySubject.createWithSize(1);
		RecordingObserver<String> s1 = RecordingObserver.create();
		RecordingObserver<String> s2 = RecordingObserver.create();

		subject.subscribe(s1);
		subject.onNext("x");
		subject.onNext("y");
		subject.subscribe(s2);
		subject.onNext("z");

		assertThat(s1.getEvents()).containsExactly(Event.next("x"), Event.next("y"), Event.next("z"));
		assertThat(s2.getEvents()).containsExactly(Event.next("y"), Event.next("z"));
		assertThat(subject.getValues()).containsExactly("z");
	}

	@ParameterizedTest
	@ValueSource(ints = {1, 2, 5, 10})
	public void boundedBufferKeepsLastValues(int size) {
		ReplaySubject<Integer> subject = ReplaySubject.createWithSize(size);
		for (int i = 0; i < 10; i++) {
			subject.onNext(i);
		}
		RecordingObserver<Integer> late = RecordingObserver.create();

		subject.subscribe(late);

		assertThat(late.getReceivedOnNext()).hasSize(size).endsWith(9);
		assertThat(late.getReceivedOnNext().get(0)).isEqualTo(10 - size);
		assertThat(subject.getBufferSize()).isEqualTo(size);
		assertThat(subject).hasToString("ReplaySubject(" + size + ")");
	}

	@Test
	public void unboundedBufferReplaysEverything() {
		ReplaySubject<Integer> subject = ReplaySubject.create();
		for (int i = 0; i < 10; i++) {
			subject.onNext(i);
		}
		RecordingObserver<Integer> late = RecordingObserver.create();

		subject.subscribe(late);

		assertThat(late.getReceivedOnNext()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
		assertThat(subject.getBufferSize()).isEqualTo(Integer.MAX_VALUE);
		assertThat(subject).hasToString("ReplaySubject(unbounded)");
	}

	@Test
	public void replaysBufferThenTerminalAfterTermination() {
		ReplaySubject<String> subject = ReplaySubject.createWithSize(2);
		subject.onNext("a");
		subject.onNext("b");
		subject.onNext("c");
		subject.onCompleted();
		RecordingObserver<String> late = RecordingObserver.create();

		subject.subscribe(late);
		subject.onNext("ignored");

		assertThat(late.getEvents()).containsExactly(Event.next("b"), Event.next("c"), Event.completed());
		assertThat(subject.getValues()).containsExactly("b", "c");
	}

	@Test
	public void replaysBufferThenError() {
		ReplaySubject<String> subject = ReplaySubject.create();
		IllegalStateException boom = new IllegalStateException("boom");
		subject.onNext("a");
		subject.onError(boom);
		RecordingObserver<String> late = RecordingObserver.create();

		subject.subscribe(late);

		assertThat(late.getEvents()).containsExactly(Event.next("a"), Event.error(boom));
	}

	@Test
	public void failingCallbackDuringReplayUnregisters() {
		ReplaySubject<Integer> subject = ReplaySubject.create();
		subject.onNext(1);
		subject.onNext(2);
		subject.onNext(3);
		List<Integer> received = new ArrayList<>();
		List<Throwable> errors = new ArrayList<>();

		subject.subscribe(v -> {
			received.add(v);
			if (v == 2) {
				throw new IllegalStateException("callback failed");
			}
		}, errors::add);

		assertThat(received).containsExactly(1, 2);
		assertThat(errors).singleElement(InstanceOfAssertFactories.THROWABLE).hasMessage("callback failed");
		assertThat(subject.hasObservers()).isFalse();
	}

	@Test
	public void valueEmittedDuringReplayReachesTheReplayingSubscriber() {
		ReplaySubject<Integer> subject = ReplaySubject.create();
		subject.onNext(0);
		List<Integer> seen = new ArrayList<>();

		subject.subscribe(v -> {
			seen.add(v);
			if (v == 0) {
				subject.onNext(1);
			}
		});
		subject.onNext(2);

		assertThat(seen).containsExactly(0, 1, 2);
		assertThat(subject.getValues()).containsExactly(0, 1, 2);
	}

	@Test
	public void completionDuringReplayIsDeliveredAfterIt() {
		ReplaySubject<String> subject = ReplaySubject.create();
		subject.onNext("a");
		subject.onNext("b");
		RecordingObserver<String> observer = RecordingObserver.create();

		subject.subscribe(new Observer<String>() {
			@Override
			public void onNext(String value) {
				observer.onNext(value);
				if (value.equals("a")) {
					subject.onCompleted();
				}
			}

			@Override
			public void onError(Throwable e) {
				observer.onError(e);
			}

			@Override
			public void onCompleted() {
				observer.onCompleted();
			}
		});

		assertThat(observer.getEvents()).containsExactly(Event.next("a"), Event.next("b"), Event.completed());
	}

	@Test
	public void rejectsInvalidBufferSize() {
		assertThatIllegalArgumentException()
				.isThrownBy(() -> ReplaySubject.createWithSize(0))
				.withMessage("bufferSize must be strictly positive, was: 0");
	}
}
