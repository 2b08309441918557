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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import relay.core.Exceptions;
import relay.core.Operators;

/**
 * A {@link Subject} holding a current value: each new subscriber first receives the
 * current value, then follows the live broadcast. Every value replaces the current one.
 * <p>
 * After completion later subscribers only receive the completion; after an error they
 * only receive the error.
 *
 * @param <T> the value type
 */
public final class BehaviorSubject<T> extends Subject<T> {

	/**
	 * Create a {@link BehaviorSubject} starting with the given value.
	 *
	 * @param initial the initial current value
	 * @param <T> the value type
	 *
	 * @return a new {@link BehaviorSubject}
	 */
	public static <T> BehaviorSubject<T> createDefault(T initial) {
		return new BehaviorSubject<>(Objects.requireNonNull(initial, "initial"));
	}

	T value;

	BehaviorSubject(T initial) {
		this.value = initial;
	}

	/**
	 * Return the current value.
	 *
	 * @return the current value
	 * @throws RuntimeException the terminal error if this subject terminated with one,
	 * checked exceptions being wrapped
	 */
	public synchronized T getValue() {
		Throwable e = error;
		if (e != null) {
			throw Exceptions.propagate(e);
		}
		return value;
	}

	@Override
	public void onNext(T value) {
		Objects.requireNonNull(value, "value");
		SubjectInner<T>[] a;
		synchronized (this) {
			a = observers;
			if (a != TERMINATED) {
				this.value = value;
			}
		}
		if (a == TERMINATED) {
			Operators.onNextDropped(value);
			return;
		}
		for (SubjectInner<T> inner : a) {
			inner.onNext(value);
		}
	}

	@Override
	List<T> replayValues(boolean live) {
		return live ? Collections.singletonList(value) : Collections.emptyList();
	}

	@Override
	public String toString() {
		return "BehaviorSubject";
	}
}
