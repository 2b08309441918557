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

import java.util.Iterator;
import java.util.Objects;

/**
 * Emits the content of an {@link Iterable} source then completes. A failing
 * {@link Iterator} terminates the subscription with its error.
 *
 * @param <T> the value type
 */
final class ObservableFromIterable<T> extends Observable<T> {

	final Iterable<? extends T> iterable;

	ObservableFromIterable(Iterable<? extends T> iterable) {
		this.iterable = Objects.requireNonNull(iterable, "iterable");
	}

	@Override
	protected void subscribeActual(SafeObserver<T> observer) {
		Iterator<? extends T> it = Objects.requireNonNull(iterable.iterator(),
				"The iterator returned is null");
		for (;;) {
			if (observer.isDisposed()) {
				return;
			}
			if (!it.hasNext()) {
				observer.onCompleted();
				return;
			}
			T t = Objects.requireNonNull(it.next(), "The iterator returned a null value");
			observer.onNext(t);
		}
	}
}
