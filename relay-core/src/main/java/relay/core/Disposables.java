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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import org.jspecify.annotations.Nullable;

/**
 * Factories of {@link Disposable} and of {@link Disposable.Composite dispose bags}, plus
 * helpers managing a {@code volatile Disposable} field through an
 * {@link AtomicReferenceFieldUpdater}. Such a field ends up holding {@link #DISPOSED}
 * once released, after which anything stored into it is disposed on arrival.
 */
public final class Disposables {

	/**
	 * Marker stored in a field once it has been {@link #dispose(AtomicReferenceFieldUpdater, Object) released}.
	 */
	public static final Disposable DISPOSED = new Disposable() {
		@Override
		public void dispose() {
		}

		@Override
		public boolean isDisposed() {
			return true;
		}

		@Override
		public String toString() {
			return "DISPOSED";
		}
	};

	/**
	 * @return a new empty dispose bag
	 */
	public static Disposable.Composite composite() {
		return new DisposeBag(new ArrayList<>());
	}

	/**
	 * @param disposables the initial content
	 * @return a new dispose bag owning the given disposables
	 */
	public static Disposable.Composite composite(Disposable... disposables) {
		List<Disposable> members = new ArrayList<>(disposables.length);
		for (Disposable d : disposables) {
			members.add(Objects.requireNonNull(d, "disposable"));
		}
		return new DisposeBag(members);
	}

	/**
	 * @param onDispose the teardown action
	 * @return a new {@link Disposable} running the action on its first disposal only
	 */
	public static Disposable create(Runnable onDispose) {
		return new ActionDisposable(Objects.requireNonNull(onDispose, "onDispose"));
	}

	/**
	 * @return a new {@link Disposable} that only records whether it was disposed
	 */
	public static Disposable single() {
		return new FlagDisposable();
	}

	/**
	 * @return a new {@link Disposable} that is already disposed
	 */
	public static Disposable disposed() {
		FlagDisposable d = new FlagDisposable();
		d.set(true);
		return d;
	}

	/**
	 * @return a new {@link Disposable} that ignores disposal and is never disposed
	 */
	public static Disposable never() {
		return () -> { };
	}

	/**
	 * Store a {@link Disposable} into a field, leaving the previous one untouched.
	 *
	 * @param updater the field updater
	 * @param holder the instance holding the field
	 * @param next the new content
	 * @param <T> the holder type
	 * @return {@literal false} if the field was already released, in which case
	 * {@code next} has been disposed
	 */
	public static <T> boolean replace(AtomicReferenceFieldUpdater<T, Disposable> updater,
			T holder,
			@Nullable Disposable next) {
		Disposable previous = updater.getAndUpdate(holder, current -> current == DISPOSED ? DISPOSED : next);
		if (previous == DISPOSED) {
			if (next != null) {
				next.dispose();
			}
			return false;
		}
		return true;
	}

	/**
	 * Release a field: mark it {@link #DISPOSED} and dispose what it held.
	 *
	 * @param updater the field updater
	 * @param holder the instance holding the field
	 * @param <T> the holder type
	 * @return {@literal true} if this call released the field
	 */
	public static <T> boolean dispose(AtomicReferenceFieldUpdater<T, Disposable> updater, T holder) {
		if (updater.get(holder) == DISPOSED) {
			return false;
		}
		Disposable previous = updater.getAndSet(holder, DISPOSED);
		if (previous == DISPOSED) {
			return false;
		}
		if (previous != null) {
			previous.dispose();
		}
		return true;
	}

	/**
	 * @param d the content of a field
	 * @return {@literal true} if the field has been released
	 */
	public static boolean isDisposed(@Nullable Disposable d) {
		return d == DISPOSED;
	}

	private Disposables() {
	}

	static final class DisposeBag implements Disposable.Composite {

		// null once disposed, guarded by this
		@Nullable List<Disposable> members;

		DisposeBag(List<Disposable> members) {
			this.members = members;
		}

		@Override
		public boolean add(Disposable d) {
			Objects.requireNonNull(d, "disposable");
			synchronized (this) {
				List<Disposable> m = members;
				if (m != null) {
					m.add(d);
					return true;
				}
			}
			d.dispose();
			return false;
		}

		@Override
		public synchronized boolean remove(Disposable d) {
			List<Disposable> m = members;
			return m != null && m.remove(d);
		}

		@Override
		public synchronized int size() {
			List<Disposable> m = members;
			return m == null ? 0 : m.size();
		}

		@Override
		public synchronized boolean isDisposed() {
			return members == null;
		}

		@Override
		public void dispose() {
			List<Disposable> m;
			synchronized (this) {
				m = members;
				members = null;
			}
			if (m == null) {
				return;
			}
			List<Throwable> failures = Collections.emptyList();
			for (Disposable d : m) {
				try {
					d.dispose();
				}
				catch (Throwable t) {
					Exceptions.throwIfFatal(t);
					if (failures.isEmpty()) {
						failures = new ArrayList<>();
					}
					failures.add(t);
				}
			}
			if (failures.size() == 1) {
				throw Exceptions.propagate(failures.get(0));
			}
			if (failures.size() > 1) {
				throw Exceptions.multiple(failures);
			}
		}
	}

	static final class ActionDisposable extends AtomicReference<@Nullable Runnable> implements Disposable {

		ActionDisposable(Runnable onDispose) {
			super(onDispose);
		}

		@Override
		public void dispose() {
			Runnable action = getAndSet(null);
			if (action != null) {
				action.run();
			}
		}

		@Override
		public boolean isDisposed() {
			return get() == null;
		}

		private static final long serialVersionUID = -8219729196779211169L;
	}

	static final class FlagDisposable extends AtomicBoolean implements Disposable {

		@Override
		public void dispose() {
			set(true);
		}

		@Override
		public boolean isDisposed() {
			return get();
		}

		private static final long serialVersionUID = -7210960413394924599L;
	}
}
