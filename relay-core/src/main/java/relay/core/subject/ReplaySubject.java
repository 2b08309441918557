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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import relay.core.Operators;

/**
 * A {@link Subject} that records values and replays them to every new subscriber, in
 * order, before it joins the live broadcast. The buffer is either unbounded or keeps
 * the latest {@code n} values, evicting the oldest.
 * <p>
 * After termination a new subscriber receives the buffered values followed by the
 * terminal event.
 * <p>
 * The buffer and the registration of subscribers are guarded by the subject monitor.
 * A new subscriber replays a snapshot of the buffer taken as it registers.
 *
 * @param <T> the value type
 */
public final class ReplaySubject<T> extends Subject<T> {

	/**
	 * Create a {@link ReplaySubject} that replays every value it ever received.
	 *
	 * @param <T> the value type
	 *
	 * @return a new unbounded {@link ReplaySubject}
	 */
	public static <T> ReplaySubject<T> create() {
		return new ReplaySubject<>(Integer.MAX_VALUE);
	}

	/**
	 * Create a {@link ReplaySubject} that replays the latest {@code bufferSize} values.
	 *
	 * @param bufferSize the maximum number of values retained, strictly positive
	 * @param <T> the value type
	 *
	 * @return a new bounded {@link ReplaySubject}
	 */
	public static <T> ReplaySubject<T> createWithSize(int bufferSize) {
		if (bufferSize < 1) {
			throw new IllegalArgumentException("bufferSize must be strictly positive, was: " + bufferSize);
		}
		return new ReplaySubject<>(bufferSize);
	}

	final int maxSize;

	final ArrayDeque<T> buffer = new ArrayDeque<>();

	ReplaySubject(int maxSize) {
		this.maxSize = maxSize;
	}

	/**
	 * @return the maximum number of values retained
	 */
	public int getBufferSize() {
		return maxSize;
	}

	/**
	 * @return a snapshot of the currently buffered values, oldest first
	 */
	public synchronized List<T> getValues() {
		return new ArrayList<>(buffer);
	}

	@Override
	public void onNext(T value) {
		Objects.requireNonNull(value, "value");
		SubjectInner<T>[] a;
		synchronized (this) {
			a = observers;
			if (a != TERMINATED) {
				if (buffer.size() == maxSize) {
					buffer.poll();
				}
				buffer.offer(value);
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
		return new ArrayList<>(buffer);
	}

	@Override
	public String toString() {
		return maxSize == Integer.MAX_VALUE ? "ReplaySubject(unbounded)" : "ReplaySubject(" + maxSize + ")";
	}
}
