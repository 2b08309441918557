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

package relay.core.subject;

import java.util.Objects;

import relay.core.Observer;
import relay.core.observable.Binder;
import relay.core.observable.Observable;
import relay.core.scheduler.Scheduler;
import relay.core.scheduler.Schedulers;

/**
 * A property that can be both observed and driven, bound to a fixed {@link Scheduler}
 * (by default the {@link Schedulers#main() main} one).
 * <p>
 * {@link #asObservable()} replays the current value then follows changes, always
 * delivered on the property scheduler. {@link #asObserver()} accepts values only and
 * applies them on that same scheduler; errors are handled as by any {@link Binder}. The
 * property never produces an error and completes on {@link #close()}.
 *
 * @param <T> the value type
 */
public final class ControlProperty<T> implements AutoCloseable {

	/**
	 * Create a {@link ControlProperty} bound to the {@link Schedulers#main() main}
	 * scheduler.
	 *
	 * @param initial the initial value
	 * @param <T> the value type
	 *
	 * @return a new {@link ControlProperty}
	 */
	public static <T> ControlProperty<T> create(T initial) {
		return create(initial, Schedulers.main());
	}

	/**
	 * Create a {@link ControlProperty} bound to the given {@link Scheduler}.
	 *
	 * @param initial the initial value
	 * @param scheduler the {@link Scheduler} changes are applied and delivered on
	 * @param <T> the value type
	 *
	 * @return a new {@link ControlProperty}
	 */
	public static <T> ControlProperty<T> create(T initial, Scheduler scheduler) {
		return new ControlProperty<>(initial, scheduler);
	}

	final BehaviorSubject<T> subject;

	final Scheduler scheduler;

	final Binder<T> binder;

	ControlProperty(T initial, Scheduler scheduler) {
		this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
		this.subject = BehaviorSubject.createDefault(initial);
		this.binder = Binder.create(scheduler, subject::onNext);
	}

	/**
	 * @return the current value
	 */
	public T getValue() {
		return subject.getValue();
	}

	/**
	 * @return the values of this property, current one first, delivered on the property
	 * scheduler
	 */
	public Observable<T> asObservable() {
		return subject.observeOn(scheduler);
	}

	/**
	 * @return an {@link Observer} setting the value of this property on the property
	 * scheduler
	 */
	public Observer<T> asObserver() {
		return binder;
	}

	/**
	 * Complete the observers of this property and release the binder worker. Values
	 * received afterwards are dropped.
	 */
	@Override
	public void close() {
		binder.dispose();
		subject.onCompleted();
	}

	@Override
	public String toString() {
		return "ControlProperty(" + scheduler + ")";
	}
}
