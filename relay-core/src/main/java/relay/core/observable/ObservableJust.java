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

import java.util.Objects;

/**
 * Emits the values of an array then completes, stopping early if the subscription is
 * disposed.
 *
 * @param <T> the value type
 */
final class ObservableJust<T> extends Observable<T> {

	final T[] array;

	ObservableJust(T[] array) {
		this.array = Objects.requireNonNull(array, "array");
	}

	@Override
	protected void subscribeActual(SafeObserver<T> observer) {
		T[] a = array;
		for (int i = 0; i < a.length; i++) {
			if (observer.isDisposed()) {
				return;
			}
			T t = a[i];
			if (t == null) {
				observer.onError(new NullPointerException("The " + i + "th array element was null"));
				return;
			}
			observer.onNext(t);
		}
		if (!observer.isDisposed()) {
			observer.onCompleted();
		}
	}
}
