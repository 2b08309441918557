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
import java.util.function.Supplier;

/**
 * Defers the creation of the actual {@link Observable} until subscription.
 *
 * @param <T> the value type
 */
final class ObservableDefer<T> extends Observable<T> {

	final Supplier<? extends Observable<? extends T>> supplier;

	ObservableDefer(Supplier<? extends Observable<? extends T>> supplier) {
		this.supplier = Objects.requireNonNull(supplier, "supplier");
	}

	@Override
	protected void subscribeActual(SafeObserver<T> observer) {
		Observable<? extends T> p = Objects.requireNonNull(supplier.get(),
				"The Observable returned by the supplier is null");
		observer.setUpstream(p.subscribe(observer));
	}
}
