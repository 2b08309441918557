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

package relay.core;

import java.util.Objects;

/**
 * A sink of {@link Event events}. For a single subscription, an {@link Observer} sees
 * the grammar {@code next* (error | completed)?}: once an error or completion event has
 * been delivered, no further event reaches it.
 * <p>
 * Conforming sources never invoke an observer concurrently, see
 * {@link relay.core.observable.Observable#subscribe(Observer)}. Event handler style
 * observers can be adapted with {@link relay.core.observable.Observers#from}.
 *
 * @param <T> the type of the values carried by next events
 */
public interface Observer<T> {

	/**
	 * Receive the next value.
	 *
	 * @param value the value, never null
	 */
	void onNext(T value);

	/**
	 * Receive the terminal error.
	 *
	 * @param e the error, never null
	 */
	void onError(Throwable e);

	/**
	 * Receive the terminal completion.
	 */
	void onCompleted();

	/**
	 * Receive an {@link Event}, dispatching to the matching callback.
	 *
	 * @param event the event, never null
	 */
	default void on(Event<? extends T> event) {
		switch (event.getType()) {
			case NEXT:
				onNext(Objects.requireNonNull(event.get()));
				break;
			case ERROR:
				onError(Objects.requireNonNull(event.getThrowable()));
				break;
			default:
				onCompleted();
		}
	}
}
