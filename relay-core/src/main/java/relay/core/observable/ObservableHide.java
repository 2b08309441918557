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
 * Hides the identity of the source {@link Observable}.
 *
 * @param <T> the value type
 */
final class ObservableHide<T> extends Observable<T> {

	final Observable<? extends T> source;

	ObservableHide(Observable<? extends T> source) {
		this.source = Objects.requireNonNull(source, "source");
	}

	@Override
	protected void subscribeActual(SafeObserver<T> observer) {
		observer.setUpstream(source.subscribe(observer));
	}

	@Override
	public Observable<T> hide() {
		return this;
	}
}
