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

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;
import relay.core.Disposable;
import relay.core.Disposables;
import relay.core.Event;
import relay.core.Exceptions;
import relay.core.Observer;
import relay.core.Operators;

/**
 * The {@link Observer} every subscription goes through, as handed to
 * {@link Observable#subscribeActual(SafeObserver)}. It is also the {@link Disposable}
 * returned to the subscriber.
 * <ul>
 *     <li>Events emitted concurrently are serialized: the first thread to arrive
 *     delivers, others enqueue and the delivering thread drains what they added.</li>
 *     <li>An event arriving after the terminal event is a protocol violation, see
 *     {@link Operators#onProtocolViolation(Event)}.</li>
 *     <li>Events arriving after {@link #dispose()} are ignored.</li>
 *     <li>The upstream {@link Disposable} set through {@link #setUpstream(Disposable)}
 *     is disposed on {@link #dispose()} and after the terminal event was delivered.</li>
 *     <li>An exception thrown by the downstream observer never reaches the emitter: the
 *     subscription is disposed, then a failing {@code onNext} is reported to the observer
 *     through {@code onError} while a failing terminal callback is
 *     {@link Operators#onErrorDropped(Throwable) dropped}. Only
 *     {@link Exceptions#throwIfFatal(Throwable) fatal} exceptions are rethrown.</li>
 * </ul>
 *
 * @param <T> the value type
 */
public final class SafeObserver<T> implements Observer<T>, Disposable {

	final Observer<? super T> actual;

	boolean drainLoopInProgress;

	@Nullable ArrayDeque<Event<? extends T>> queue;

	volatile boolean done;

	volatile boolean cancelled;

	volatile @Nullable Disposable upstream;
	static final AtomicReferenceFieldUpdater<SafeObserver, Disposable> UPSTREAM =
			AtomicReferenceFieldUpdater.newUpdater(SafeObserver.class, Disposable.class, "upstream");

	SafeObserver(Observer<? super T> actual) {
		this.actual = Objects.requireNonNull(actual, "actual");
	}

	/**
	 * Attach the teardown of the subscription. Can only be called once: a second
	 * {@link Disposable} is disposed right away and reported. If this observer is already
	 * disposed or terminated, the given {@link Disposable} is disposed immediately.
	 *
	 * @param d the upstream {@link Disposable}
	 */
	public void setUpstream(Disposable d) {
		Objects.requireNonNull(d, "upstream");
		if (!UPSTREAM.compareAndSet(this, null, d)) {
			d.dispose();
			if (upstream != Disposables.DISPOSED) {
				Operators.onErrorDropped(new IllegalStateException("Duplicate upstream has been detected"));
			}
		}
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

	@Override
	public void on(Event<? extends T> event) {
		Objects.requireNonNull(event, "event");
		if (cancelled) {
			return;
		}
		if (done) {
			Operators.onProtocolViolation(event);
			return;
		}

		boolean violation = false;
		synchronized (this) {
			if (cancelled) {
				return;
			}
			if (done) {
				violation = true;
			}
			else {
				if (event.isTerminal()) {
					done = true;
				}
				if (drainLoopInProgress) {
					ArrayDeque<Event<? extends T>> q = queue;
					if (q == null) {
						q = new ArrayDeque<>();
						queue = q;
					}
					q.offer(event);
					return;
				}
				drainLoopInProgress = true;
			}
		}

		if (violation) {
			Operators.onProtocolViolation(event);
			return;
		}

		deliver(event);
		drainLoop();
	}

	void deliver(Event<? extends T> event) {
		try {
			actual.on(event);
		}
		catch (Throwable t) {
			Exceptions.throwIfFatal(t);
			cancel();
			if (event.isTerminal()) {
				Operators.onErrorDropped(t);
			}
			else {
				failedOnNext(t);
			}
			return;
		}
		if (event.isTerminal()) {
			Disposables.dispose(UPSTREAM, this);
		}
	}

	void failedOnNext(Throwable t) {
		done = true;
		try {
			actual.onError(t);
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			e.addSuppressed(t);
			Operators.onErrorDropped(e);
		}
	}

	void drainLoop() {
		for (;;) {
			Event<? extends T> next;
			synchronized (this) {
				ArrayDeque<Event<? extends T>> q = queue;
				if (cancelled || q == null || q.isEmpty()) {
					queue = null;
					drainLoopInProgress = false;
					return;
				}
				next = q.poll();
			}
			deliver(next);
		}
	}

	void cancel() {
		cancelled = true;
		synchronized (this) {
			queue = null;
		}
		Disposables.dispose(UPSTREAM, this);
	}

	boolean isTerminated() {
		return done || cancelled;
	}

	@Override
	public void dispose() {
		if (!cancelled) {
			cancel();
		}
	}

	@Override
	public boolean isDisposed() {
		return cancelled || Disposables.isDisposed(upstream);
	}

	@Override
	public String toString() {
		return "SafeObserver{" + actual + "}";
	}
}
