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
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import relay.core.Event;
import relay.core.Observer;

/**
 * Factories adapting callbacks to the {@link Observer} contract.
 */
public abstract class Observers {

	/**
	 * Create an {@link Observer} out of optional callbacks. A missing value or completion
	 * callback ignores the corresponding event; a missing error callback routes errors
	 * to {@link relay.core.Hooks#onErrorDropped(Consumer)}.
	 *
	 * @param onNext the value callback, or null
	 * @param onError the error callback, or null
	 * @param onCompleted the completion callback, or null
	 * @param <T> the value type
	 *
	 * @return a new {@link Observer}
	 */
	public static <T> Observer<T> create(@Nullable Consumer<? super T> onNext,
			@Nullable Consumer<? super Throwable> onError,
			@Nullable Runnable onCompleted) {
		return new LambdaObserver<>(onNext, onError, onCompleted);
	}

	/**
	 * Create an {@link Observer} handing every {@link Event} to a single handler.
	 *
	 * @param eventHandler the handler of all events
	 * @param <T> the value type
	 *
	 * @return a new {@link Observer}
	 */
	public static <T> Observer<T> from(Consumer<? super Event<? extends T>> eventHandler) {
		return new EventHandlerObserver<>(eventHandler);
	}

	static final class EventHandlerObserver<T> implements Observer<T> {

		final Consumer<? super Event<? extends T>> eventHandler;

		EventHandlerObserver(Consumer<? super Event<? extends T>> eventHandler) {
			this.eventHandler = Objects.requireNonNull(eventHandler, "eventHandler");
		}

		@Override
		public void on(Event<? extends T> event) {
			eventHandler.accept(event);
		}

		@Override
		public void onNext(T value) {
			on(Event.next(value));
		}

		@Override
		public void onError(Throwable e) {
			on(Event.error(e));
		}

		@Override
		public void onCompleted() {
			on(Event.completed());
		}
	}

	Observers() {
	}
}
