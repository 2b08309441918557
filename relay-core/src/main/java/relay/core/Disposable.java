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

/**
 * A handle on something that can be released: a subscription, a scheduled task, a
 * worker. Releasing twice is harmless.
 */
@FunctionalInterface
public interface Disposable {

	/**
	 * Release the underlying subscription, task or resource. Only the first call has an
	 * effect.
	 */
	void dispose();

	/**
	 * Whether this handle is known to be released. Implementations that do not track
	 * their state keep answering {@literal false}, but {@literal true} is only returned
	 * once release is guaranteed.
	 *
	 * @return {@literal true} if released
	 */
	default boolean isDisposed() {
		return false;
	}

	/**
	 * Put this handle in the given dispose bag, which will release it together with the
	 * rest of its content. A bag that is already disposed releases it right away.
	 *
	 * @param bag the owning {@link Composite}
	 * @return this {@link Disposable}, for chaining
	 */
	default Disposable disposedBy(Composite bag) {
		bag.add(this);
		return this;
	}

	/**
	 * A dispose bag: a {@link Disposable} owning other disposables and releasing them all
	 * when it is itself disposed. A disposed bag stays disposed and releases everything
	 * added to it afterwards immediately.
	 */
	interface Composite extends Disposable {

		/**
		 * Hand a {@link Disposable} over to this bag.
		 *
		 * @param d the {@link Disposable} to own
		 * @return {@literal true} if added, {@literal false} if this bag is disposed, in
		 * which case {@code d} has been disposed
		 */
		boolean add(Disposable d);

		/**
		 * Take a {@link Disposable} back from this bag without disposing it.
		 *
		 * @param d the {@link Disposable} to take back
		 * @return {@literal true} if it was owned by this bag
		 */
		boolean remove(Disposable d);

		/**
		 * @return the number of disposables currently owned
		 */
		int size();
	}
}
