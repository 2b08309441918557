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

import relay.core.observable.Observable;

/**
 * A value holder that can be observed. Observers receive the current value then every
 * change, and are completed when the variable is {@link #close() closed}, which makes it
 * usable with try-with-resources to bind its end of life to a scope.
 *
 * @param <T> the value type
 */
public final class Variable<T> implements AutoCloseable {

	/**
	 * Create a new {@link Variable}.
	 *
	 * @param initial the initial value
	 * @param <T> the value type
	 *
	 * @return a new {@link Variable}
	 */
	public static <T> Variable<T> create(T initial) {
		return new Variable<>(initial);
	}

	final BehaviorSubject<T> subject;

	volatile boolean closed;

	Variable(T initial) {
		this.subject = BehaviorSubject.createDefault(initial);
	}

	/**
	 * @return the current value, still readable once closed
	 */
	public T get() {
		return subject.getValue();
	}

	/**
	 * Replace the current value and notify observers.
	 *
	 * @param value the new value
	 * @throws IllegalStateException if this variable is closed
	 */
	public void set(T value) {
		if (closed) {
			throw new IllegalStateException("Variable is closed");
		}
		subject.onNext(value);
	}

	/**
	 * @return the current value followed by every change, completing on close
	 */
	public Observable<T> asObservable() {
		return subject.asObservable();
	}

	/**
	 * Complete every observer. Idempotent.
	 */
	@Override
	public void close() {
		if (!closed) {
			closed = true;
			subject.onCompleted();
		}
	}

	@Override
	public String toString() {
		return "Variable(" + subject.getValue() + ")";
	}
}
