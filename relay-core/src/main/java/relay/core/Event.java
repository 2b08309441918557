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
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

/**
 * A domain representation of a reactive event: one unit of the
 * {@code next* (error | completed)?} grammar flowing from a producer to an
 * {@link Observer}.
 *
 * @param <T> the value type
 */
public interface Event<T> extends Supplier<T>, Consumer<Observer<? super T>> {

	/**
	 * Creates and returns an {@link Event} of variety {@code EventType.COMPLETED}.
	 *
	 * @param <T> the value type
	 *
	 * @return a shared {@code COMPLETED} {@link Event}
	 */
	static <T> Event<T> completed() {
		return ImmutableEvent.completed();
	}

	/**
	 * Creates and returns an {@link Event} of variety {@code EventType.ERROR}, which
	 * will hold the error.
	 *
	 * @param e the error associated to the event
	 * @param <T> the value type
	 *
	 * @return an {@code ERROR} {@link Event}
	 */
	static <T> Event<T> error(Throwable e) {
		return new ImmutableEvent<>(EventType.ERROR, null, Objects.requireNonNull(e, "e"));
	}

	/**
	 * Creates and returns an {@link Event} of variety {@code EventType.NEXT}, which
	 * will hold the value.
	 *
	 * @param t the item to be associated with the event
	 * @param <T> the value type
	 *
	 * @return a {@code NEXT} {@link Event}
	 */
	static <T> Event<T> next(T t) {
		return new ImmutableEvent<>(EventType.NEXT, Objects.requireNonNull(t, "t"), null);
	}

	/**
	 * Read the error associated with this (error) event.
	 *
	 * @return the Throwable associated with this (error) event, or null if not
	 * applicable
	 */
	@Nullable
	Throwable getThrowable();

	/**
	 * Retrieves the item associated with this (next) event.
	 *
	 * @return the item associated with this (next) event, or null if not applicable
	 */
	@Override
	@Nullable
	T get();

	/**
	 * Read the type of this event: {@link EventType#NEXT}, {@link EventType#ERROR} or
	 * {@link EventType#COMPLETED}
	 *
	 * @return the type of the event
	 */
	EventType getType();

	default boolean isNext() {
		return getType() == EventType.NEXT;
	}

	default boolean isError() {
		return getType() == EventType.ERROR;
	}

	default boolean isCompleted() {
		return getType() == EventType.COMPLETED;
	}

	default boolean isTerminal() {
		return getType().isTerminal();
	}

	/**
	 * Propagate the event represented by this {@link Event} instance to a
	 * given {@link Observer}.
	 *
	 * @param observer the {@link Observer} to play the {@link Event} on
	 */
	@Override
	default void accept(Observer<? super T> observer) {
		observer.on(this);
	}
}
