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

import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import relay.core.Disposable;
import relay.core.Event;
import relay.core.Observer;
import relay.core.Operators;
import relay.core.observable.Observable;
import relay.core.observable.SafeObserver;

/**
 * Base class for {@link Observable observables} that are also {@link Observer observers},
 * fanning the events they receive out to their current subscribers.
 * <p>
 * Subscribers are kept in a copy-on-write array: registration, removal and termination
 * are serialized on the subject monitor, emissions read the latest published array.
 * Once a terminal event has been recorded the subject is closed: current subscribers
 * receive that event once, later subscribers only receive the terminal outcome (plus
 * whatever the variant replays). Values and errors arriving after termination are
 * dropped through {@link Operators#onNextDropped(Object)} and
 * {@link Operators#onErrorDropped(Throwable)}.
 * <p>
 * A new subscriber is registered before the variant's replay is delivered to it, and
 * the replay runs without holding the subject monitor. Live events reaching that
 * subscriber while it is still replaying are queued and delivered right after the
 * replay, so nothing emitted meanwhile (even from the subscriber's own callbacks) is
 * lost or reordered.
 * <p>
 * Subjects do not serialize concurrent calls to their {@link Observer} side: emitting
 * from several threads at once must be coordinated by the caller.
 *
 * @param <T> the value type
 */
public abstract class Subject<T> extends Observable<T> implements Observer<T> {

	@SuppressWarnings("rawtypes")
	static final SubjectInner[] EMPTY = new SubjectInner[0];

	@SuppressWarnings("rawtypes")
	static final SubjectInner[] TERMINATED = new SubjectInner[0];

	@SuppressWarnings("unchecked")
	volatile SubjectInner<T>[] observers = EMPTY;

	@Nullable Throwable error;

	Subject() {
	}

	/**
	 * Return true if any {@link Observer} is actively subscribed.
	 *
	 * @return true if any {@link Observer} is actively subscribed
	 */
	public boolean hasObservers() {
		return observerCount() != 0;
	}

	/**
	 * Return the number of actively subscribed observers.
	 *
	 * @return the number of actively subscribed observers
	 */
	public int observerCount() {
		return observers.length;
	}

	/**
	 * Return true if a terminal event has been recorded.
	 *
	 * @return true if this subject is closed
	 */
	public boolean isTerminated() {
		return observers == TERMINATED;
	}

	/**
	 * Return the terminal error if any has been recorded.
	 *
	 * @return the error that terminated this subject, or null
	 */
	@Nullable
	public Throwable getError() {
		if (observers == TERMINATED) {
			return error;
		}
		return null;
	}

	/**
	 * Expose only the {@link Observable} side of this subject.
	 *
	 * @return an {@link Observable} hiding this subject's identity
	 */
	public Observable<T> asObservable() {
		return hide();
	}

	/**
	 * Expose only the {@link Observer} side of this subject.
	 *
	 * @return this subject as an {@link Observer}
	 */
	public Observer<T> asObserver() {
		return this;
	}

	@Override
	public void onCompleted() {
		SubjectInner<T>[] a = terminate(null);
		if (a == null) {
			return;
		}
		for (SubjectInner<T> inner : a) {
			inner.emit(Event.completed());
		}
	}

	@Override
	public void onError(Throwable e) {
		Objects.requireNonNull(e, "e");
		SubjectInner<T>[] a = terminate(e);
		if (a == null) {
			Operators.onErrorDropped(e);
			return;
		}
		for (SubjectInner<T> inner : a) {
			inner.emit(Event.error(e));
		}
	}

	@Override
	protected final void subscribeActual(SafeObserver<T> observer) {
		SubjectInner<T> inner = new SubjectInner<>(observer, this);
		observer.setUpstream(inner);

		List<T> replay;
		boolean live;
		synchronized (this) {
			live = observers != TERMINATED;
			replay = replayValues(live);
			if (live) {
				inner.replaying = !replay.isEmpty();
				add(inner);
			}
		}

		if (live) {
			if (inner.cancelled) {
				remove(inner);
				return;
			}
			inner.replay(replay);
			return;
		}

		for (T value : replay) {
			if (observer.isDisposed()) {
				return;
			}
			observer.onNext(value);
		}
		Throwable e = error;
		if (e != null) {
			observer.onError(e);
		}
		else {
			observer.onCompleted();
		}
	}

	/**
	 * The values a new subscriber receives before live events, or before the terminal
	 * outcome if the subject is closed. Called under the subject monitor.
	 *
	 * @param live false if this subject already recorded its terminal event
	 * @return the values to replay, oldest first
	 */
	abstract List<T> replayValues(boolean live);

	/**
	 * Record the terminal event and close the subject.
	 *
	 * @return the observers to notify, or null if already terminated
	 */
	@Nullable
	@SuppressWarnings("unchecked")
	final synchronized SubjectInner<T>[] terminate(@Nullable Throwable e) {
		SubjectInner<T>[] a = observers;
		if (a == TERMINATED) {
			return null;
		}
		error = e;
		onTerminate(e);
		observers = TERMINATED;
		return a;
	}

	/**
	 * Hook for variants to update their own state while the subject is being closed,
	 * called under the subject monitor.
	 *
	 * @param e the terminal error, null on completion
	 */
	void onTerminate(@Nullable Throwable e) {
	}

	final synchronized boolean add(SubjectInner<T> inner) {
		SubjectInner<T>[] a = observers;
		if (a == TERMINATED) {
			return false;
		}
		@SuppressWarnings("unchecked")
		SubjectInner<T>[] b = new SubjectInner[a.length + 1];
		System.arraycopy(a, 0, b, 0, a.length);
		b[a.length] = inner;
		observers = b;
		return true;
	}

	@SuppressWarnings("unchecked")
	final synchronized void remove(SubjectInner<T> inner) {
		SubjectInner<T>[] a = observers;
		int index = -1;
		for (int i = 0; i < a.length; i++) {
			if (a[i] == inner) {
				index = i;
				break;
			}
		}
		if (index < 0) {
			return;
		}
		if (a.length == 1) {
			observers = EMPTY;
			return;
		}
		SubjectInner<T>[] b = new SubjectInner[a.length - 1];
		System.arraycopy(a, 0, b, 0, index);
		System.arraycopy(a, index + 1, b, index, a.length - index - 1);
		observers = b;
	}

	/**
	 * The registration of one subscription: its key in the registry, the
	 * {@link Disposable} removing it, and the gate holding back live events while the
	 * replay is being delivered.
	 */
	static final class SubjectInner<T> implements Disposable {

		final SafeObserver<T> actual;

		final Subject<T> parent;

		volatile boolean cancelled;

		// only ever goes from true to false, once the missed events are drained
		volatile boolean replaying;

		@Nullable ArrayDeque<Event<T>> missed;

		SubjectInner(SafeObserver<T> actual, Subject<T> parent) {
			this.actual = actual;
			this.parent = parent;
		}

		void onNext(T value) {
			emit(Event.next(value));
		}

		void emit(Event<T> event) {
			if (replaying) {
				synchronized (this) {
					if (replaying) {
						ArrayDeque<Event<T>> q = missed;
						if (q == null) {
							q = new ArrayDeque<>();
							missed = q;
						}
						q.offer(event);
						return;
					}
				}
			}
			actual.on(event);
		}

		void replay(List<T> values) {
			if (!replaying) {
				return;
			}
			for (T value : values) {
				if (cancelled) {
					break;
				}
				actual.onNext(value);
			}
			for (;;) {
				ArrayDeque<Event<T>> q;
				synchronized (this) {
					q = missed;
					missed = null;
					if (q == null) {
						replaying = false;
						return;
					}
				}
				for (Event<T> event : q) {
					actual.on(event);
				}
			}
		}

		@Override
		public void dispose() {
			if (!cancelled) {
				cancelled = true;
				parent.remove(this);
			}
		}

		@Override
		public boolean isDisposed() {
			return cancelled;
		}
	}
}
