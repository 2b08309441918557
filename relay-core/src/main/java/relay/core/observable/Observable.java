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
import java.util.function.Function;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import relay.core.Disposable;
import relay.core.Event;
import relay.core.Exceptions;
import relay.core.Observer;
import relay.core.Operators;
import relay.core.scheduler.Scheduler;

/**
 * A producer of {@link Event events} admitting {@link Observer observers}.
 * <p>
 * Each call to {@link #subscribe(Observer)} starts an independent subscription, which
 * emits {@code next* (error | completed)?} to its observer. Delivery to one observer is
 * strictly sequential, even if the source emits from many threads, and stops as soon as
 * the returned {@link Disposable} is disposed.
 * <p>
 * Concrete sources implement {@link #subscribeActual(SafeObserver)}. Application code
 * usually relies on {@link #create(Function)} or on a {@link relay.core.subject.Subject}.
 *
 * @param <T> the type of the values carried by next events
 */
public abstract class Observable<T> {

	/**
	 * Create an {@link Observable} from a bespoke producer, invoked once per subscription
	 * with the {@link Observer} to emit to. The {@link Disposable} it returns is the
	 * teardown of that subscription, invoked when the subscription is disposed or once
	 * the terminal event has been delivered.
	 * <p>
	 * An exception thrown by the producer is delivered as an error event.
	 *
	 * @param producer the per-subscription producer
	 * @param <T> the value type
	 *
	 * @return a new {@link Observable}
	 */
	public static <T> Observable<T> create(Function<? super Observer<T>, ? extends Disposable> producer) {
		return new ObservableCreate<>(producer);
	}

	/**
	 * Create an {@link Observable} that defers the choice of the actual source to each
	 * subscription.
	 *
	 * @param supplier the {@link Observable} supplier, invoked on subscribe
	 * @param <T> the value type
	 *
	 * @return a new {@link Observable}
	 */
	public static <T> Observable<T> defer(Supplier<? extends Observable<? extends T>> supplier) {
		return new ObservableDefer<>(supplier);
	}

	/**
	 * Create an {@link Observable} that completes without emitting any value.
	 *
	 * @param <T> the value type
	 *
	 * @return an empty {@link Observable}
	 */
	public static <T> Observable<T> empty() {
		return ObservableEmpty.instance();
	}

	/**
	 * Create an {@link Observable} that terminates with the given error right after
	 * subscription.
	 *
	 * @param error the error to signal
	 * @param <T> the value type
	 *
	 * @return a new failing {@link Observable}
	 */
	public static <T> Observable<T> error(Throwable error) {
		return new ObservableError<>(error);
	}

	/**
	 * Create an {@link Observable} that emits the items contained in the provided
	 * {@link Iterable} then completes.
	 *
	 * @param it the {@link Iterable} to read data from
	 * @param <T> the value type
	 *
	 * @return a new {@link Observable}
	 */
	public static <T> Observable<T> fromIterable(Iterable<? extends T> it) {
		return new ObservableFromIterable<>(it);
	}

	/**
	 * Create an {@link Observable} that emits the provided values then completes.
	 *
	 * @param values the values to emit, none of them null
	 * @param <T> the value type
	 *
	 * @return a new {@link Observable}
	 */
	@SafeVarargs
	public static <T> Observable<T> just(T... values) {
		return new ObservableJust<>(values);
	}

	/**
	 * Create an {@link Observable} that never signals anything.
	 *
	 * @param <T> the value type
	 *
	 * @return a never-terminating {@link Observable}
	 */
	public static <T> Observable<T> never() {
		return ObservableNever.instance();
	}

	/**
	 * Subscribe the given {@link Observer} to this {@link Observable}.
	 * <p>
	 * The observer is wrapped in a {@link SafeObserver} which serializes and guards the
	 * delivery, and which is returned as the {@link Disposable} of the subscription.
	 *
	 * @param observer the {@link Observer} to subscribe
	 *
	 * @return a {@link Disposable} stopping delivery and releasing the subscription
	 */
	public final Disposable subscribe(Observer<? super T> observer) {
		Objects.requireNonNull(observer, "observer");
		SafeObserver<T> safe = new SafeObserver<>(observer);
		try {
			subscribeActual(safe);
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			if (safe.isTerminated()) {
				Operators.onErrorDropped(e);
			}
			else {
				safe.onError(e);
			}
		}
		return safe;
	}

	/**
	 * Subscribe to this {@link Observable} and request unbounded demand, ignoring every
	 * event. An error is routed to {@link relay.core.Hooks#onErrorDropped(Consumer)}.
	 *
	 * @return a new {@link Disposable} that can be used to cancel the subscription
	 */
	public final Disposable subscribe() {
		return subscribe(null, null, null);
	}

	/**
	 * Subscribe a {@link Consumer} to this {@link Observable} that will consume all the
	 * values. An error is routed to {@link relay.core.Hooks#onErrorDropped(Consumer)}.
	 *
	 * @param consumer the consumer to invoke on each value
	 *
	 * @return a new {@link Disposable} that can be used to cancel the subscription
	 */
	public final Disposable subscribe(Consumer<? super T> consumer) {
		Objects.requireNonNull(consumer, "consumer");
		return subscribe(consumer, null, null);
	}

	/**
	 * Subscribe to this {@link Observable} with a {@link Consumer} that will consume all
	 * the values and another that will react to the error.
	 *
	 * @param consumer the consumer to invoke on each value
	 * @param errorConsumer the consumer to invoke on error
	 *
	 * @return a new {@link Disposable} that can be used to cancel the subscription
	 */
	public final Disposable subscribe(@Nullable Consumer<? super T> consumer, Consumer<? super Throwable> errorConsumer) {
		Objects.requireNonNull(errorConsumer, "errorConsumer");
		return subscribe(consumer, errorConsumer, null);
	}

	/**
	 * Subscribe {@link Consumer} to this {@link Observable} that will respectively
	 * consume all the values, react to the error and to completion.
	 *
	 * @param consumer the consumer to invoke on each value
	 * @param errorConsumer the consumer to invoke on error
	 * @param completeConsumer the consumer to invoke on completion
	 *
	 * @return a new {@link Disposable} that can be used to cancel the subscription
	 */
	public final Disposable subscribe(@Nullable Consumer<? super T> consumer,
			@Nullable Consumer<? super Throwable> errorConsumer,
			@Nullable Runnable completeConsumer) {
		return subscribe(Observers.create(consumer, errorConsumer, completeConsumer));
	}

	/**
	 * Run the subscription, that is the producer setup and its initial emissions, on a
	 * {@link Scheduler.Worker worker} of the given {@link Scheduler}. Disposing before
	 * the scheduled subscription ran prevents it.
	 *
	 * @param scheduler the {@link Scheduler} to subscribe on
	 *
	 * @return an {@link Observable} subscribing on the given {@link Scheduler}
	 */
	public final Observable<T> subscribeOn(Scheduler scheduler) {
		return new ObservableSubscribeOn<>(this, scheduler);
	}

	/**
	 * Deliver every event on a single {@link Scheduler.Worker worker} of the given
	 * {@link Scheduler}, preserving their order. Disposing discards queued events and
	 * releases the worker, as does the delivery of the terminal event.
	 *
	 * @param scheduler the {@link Scheduler} to deliver on
	 *
	 * @return an {@link Observable} delivering on the given {@link Scheduler}
	 */
	public final Observable<T> observeOn(Scheduler scheduler) {
		return new ObservableObserveOn<>(this, scheduler);
	}

	/**
	 * Hide the identity of this {@link Observable}, for instance to expose a
	 * {@link relay.core.subject.Subject} without its {@link Observer} side.
	 *
	 * @return an {@link Observable} that only exposes subscription
	 */
	public Observable<T> hide() {
		return new ObservableHide<>(this);
	}

	/**
	 * Start producing for one subscription. Implementations attach their teardown
	 * through {@link SafeObserver#setUpstream(Disposable)} and emit to the given
	 * observer. An exception thrown from this method is delivered as an error event.
	 *
	 * @param observer the guarded {@link Observer} of this subscription
	 */
	protected abstract void subscribeActual(SafeObserver<T> observer);
}
