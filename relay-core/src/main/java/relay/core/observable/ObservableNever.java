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

/**
 * Never signals anything.
 */
final class ObservableNever extends Observable<Object> {

	private static final Observable<Object> INSTANCE = new ObservableNever();

	ObservableNever() {
	}

	@Override
	protected void subscribeActual(SafeObserver<Object> observer) {
		//NO-OP
	}

	/**
	 * Returns a properly parametrized instance of this never Observable.
	 *
	 * @param <T> the value type
	 * @return a properly parametrized instance of this never Observable
	 */
	@SuppressWarnings("unchecked")
	static <T> Observable<T> instance() {
		return (Observable<T>) INSTANCE;
	}
}
