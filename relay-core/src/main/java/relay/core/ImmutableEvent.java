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

import java.io.Serializable;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * The common implementation of an {@link Event}.
 *
 * @param <T> the value type
 */
final class ImmutableEvent<T> implements Event<T>, Serializable {

	private static final long serialVersionUID = -4518471626471835423L;

	private static final Event<?> COMPLETED = new ImmutableEvent<>(EventType.COMPLETED, null, null);

	private final EventType type;

	@Nullable
	private final T value;

	@Nullable
	private final Throwable throwable;

	ImmutableEvent(EventType type, @Nullable T value, @Nullable Throwable throwable) {
		this.type = type;
		this.value = value;
		this.throwable = throwable;
	}

	@Override
	@Nullable
	public Throwable getThrowable() {
		return throwable;
	}

	@Override
	@Nullable
	public T get() {
		return value;
	}

	@Override
	public EventType getType() {
		return type;
	}

	@Override
	public boolean equals(@Nullable Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Event)) {
			return false;
		}

		Event<?> event = (Event<?>) o;

		if (getType() != event.getType()) {
			return false;
		}
		if (isCompleted()) {
			return true;
		}
		if (isError()) {
			return Objects.equals(this.getThrowable(), event.getThrowable());
		}
		return Objects.equals(this.get(), event.get());
	}

	@Override
	public int hashCode() {
		int result = getType().hashCode();
		if (isError()) {
			return 31 * result + Objects.hashCode(throwable);
		}
		if (isNext()) {
			return 31 * result + Objects.hashCode(value);
		}
		return result;
	}

	@Override
	public String toString() {
		switch (this.getType()) {
			case NEXT:
				return String.format("next(%s)", this.get());
			case ERROR:
				return String.format("error(%s)", this.getThrowable());
			default:
				return "completed()";
		}
	}

	@SuppressWarnings("unchecked")
	static <U> Event<U> completed() {
		return (Event<U>) COMPLETED;
	}
}
