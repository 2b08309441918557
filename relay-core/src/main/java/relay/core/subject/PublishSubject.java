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

import relay.core.Operators;

/**
 * A {@link Subject} that broadcasts values to its current subscribers only: there is
 * no buffer, late subscribers see the events emitted after they registered.
 * <p>
 * Once terminated, later subscribers immediately receive the terminal event.
 *
 * @param <T> the value type
 */
public final class PublishSubject<T> extends Subject<T> {

	/**
	 * Create a new {@link PublishSubject}.
	 *
	 * @param <T> the value type
	 *
	 * @return a new {@link PublishSubject}
	 */
	public static <T> PublishSubject<T> create() {
		return new PublishSubject<>();
	}

	PublishSubject() {
	}

	@Override
	public void onNext(T value) {
		Objects.requireNonNull(value, "value");
		SubjectInner<T>[] a = observers;
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
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		return "PublishSubject";
	}
}
