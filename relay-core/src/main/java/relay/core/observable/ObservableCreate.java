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
import java.util.function.Function;

import relay.core.Disposable;
import relay.core.Observer;

/**
 * Runs a bespoke producer per subscription, its returned {@link Disposable} being the
 * teardown of that subscription.
 *
 * @param <T> the value type
 * @see Observable#create(Function)
 */
final class ObservableCreate<T> extends Observable<T> {

	final Function<? super Observer<T>, ? extends Disposable> producer;

	ObservableCreate(Function<? super Observer<T>, ? extends Disposable> producer) {
		this.producer = Objects.requireNonNull(producer, "producer");
	}

	@Override
	protected void subscribeActual(SafeObserver<T> observer) {
		Disposable teardown = producer.apply(observer);
		observer.setUpstream(Objects.requireNonNull(teardown, "The producer returned a null Disposable"));
	}
}
