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

import org.jspecify.annotations.Nullable;
import relay.core.Operators;
import relay.core.Event;

/**
 * A {@link Subject} that only emits the last value it received, and only once it
 * completes: current and later subscribers then receive that value followed by the
 * completion, or the completion alone if no value was received.
 * <p>
 * An error discards the retained value: subscribers only receive the error.
 *
 * @param <T> the value type
 */
public final class AsyncSubject<T> extends Subject<T> {

	/**
	 * Create a new {@link AsyncSubject}.
	 *
	 * @param <T> the value type
	 *
	 * @return a new {@link AsyncSubject}
	 */
	public static <T> AsyncSubject<T> create() {
		return new AsyncSubject<>();
	}

	@Nullable T value;

	AsyncSubject() {
	}

	@Override
	public void onNext(T value) {
		Objects.requireNonNull(value, "value");
		boolean terminated;
		synchronized (this) {
			terminated = observers == TERMINATED;
			if (!terminated) {
				this.value = value;
			}
		}
		if (terminated) {
			Operators.onNextDropped(value);
		}
	}

	@Override
	public void onCompleted() {
		SubjectInner<T>[] a = terminate(null);
		if (a == null) {
			return;
		}
		T v = retainedValue();
		for (SubjectInner<T> inner : a) {
			if (v != null) {
				inner.onNext(v);
			}
			inner.emit(Event.completed());
		}
	}

	@Override
	List<T> replayValues(boolean live) {
		T v = value;
		if (live || error != null || v == null) {
			return Collections.emptyList();
		}
		return Collections.singletonList(v);
	}

	@Override
	void onTerminate(@Nullable Throwable e) {
		if (e != null) {
			value = null;
		}
	}

	@Nullable
	synchronized T retainedValue() {
		return value;
	}

	@Override
	public String toString() {
		return "AsyncSubject";
	}
}
