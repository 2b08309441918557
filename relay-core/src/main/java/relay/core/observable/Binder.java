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
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import relay.core.Disposable;
import relay.core.Exceptions;
import relay.core.Hooks;
import relay.core.Observer;
import relay.core.Operators;
import relay.core.scheduler.Scheduler;
import relay.core.scheduler.Schedulers;

/**
 * An {@link Observer} that applies an action to every value on a designated
 * {@link Scheduler}, typically the {@link Schedulers#main() main} one, through a single
 * {@link Scheduler.Worker worker} so that actions run in arrival order.
 * <p>
 * A binder is not meant to receive errors. In {@link Hooks#isDevelopmentMode()
 * development mode} an error is handed to the {@link Hooks#onFatal(Consumer) fatal
 * handler} as a {@link Exceptions.BinderError}, otherwise it is logged and discarded.
 * The action never sees it. Completion is ignored.
 * <p>
 * Once the binder is {@link #dispose() disposed}, or its scheduler rejects the action,
 * values are {@link Operators#onNextDropped(Object) dropped}.
 *
 * @param <T> the value type
 */
public final class Binder<T> implements Observer<T>, Disposable {

	static final Logger log = LoggerFactory.getLogger(Binder.class);

	/**
	 * Create a {@link Binder} applying the action on the {@link Schedulers#main() main}
	 * scheduler.
	 *
	 * @param action the action to apply to every value
	 * @param <T> the value type
	 *
	 * @return a new {@link Binder}
	 */
	public static <T> Binder<T> create(Consumer<? super T> action) {
		return create(Schedulers.main(), action);
	}

	/**
	 * Create a {@link Binder} applying the action on the given {@link Scheduler}.
	 *
	 * @param scheduler the {@link Scheduler} the action runs on
	 * @param action the action to apply to every value
	 * @param <T> the value type
	 *
	 * @return a new {@link Binder}
	 */
	public static <T> Binder<T> create(Scheduler scheduler, Consumer<? super T> action) {
		return new Binder<>(scheduler, action);
	}

	final Scheduler.Worker worker;

	final Consumer<? super T> action;

	Binder(Scheduler scheduler, Consumer<? super T> action) {
		Objects.requireNonNull(scheduler, "scheduler");
		this.action = Objects.requireNonNull(action, "action");
		this.worker = scheduler.createWorker();
	}

	@Override
	public void onNext(T value) {
		Objects.requireNonNull(value, "value");
		if (worker.isDisposed()) {
			Operators.onNextDropped(value);
			return;
		}
		try {
			worker.schedule(() -> action.accept(value));
		}
		catch (RejectedExecutionException ree) {
			log.debug("Binder worker rejected a value", ree);
			Operators.onNextDropped(value);
		}
	}

	@Override
	public void onError(Throwable e) {
		if (Hooks.isDevelopmentMode()) {
			Operators.onFatal(new Exceptions.BinderError(e));
		}
		else {
			log.error("Binding error", e);
		}
	}

	@Override
	public void onCompleted() {
		//ignored
	}

	/**
	 * Release the worker, cancelling actions that did not run yet.
	 */
	@Override
	public void dispose() {
		worker.dispose();
	}

	@Override
	public boolean isDisposed() {
		return worker.isDisposed();
	}
}
