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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers shared by sources, subjects and observers to route conditions that cannot be
 * delivered downstream: dropped values, dropped errors, protocol violations and fatal
 * conditions. Each helper applies the matching {@link Hooks} callback when one is
 * installed.
 */
public abstract class Operators {

	/**
	 * An unexpected exception is about to be dropped.
	 * <p>
	 * If no hook is registered for {@link Hooks#onErrorDropped(Consumer)}, the dropped
	 * error is logged at ERROR level.
	 *
	 * @param e the dropped exception
	 */
	public static void onErrorDropped(Throwable e) {
		Consumer<? super Throwable> hook = Hooks.onErrorDroppedHook;
		if (hook == null) {
			log.error("Operator called default onErrorDropped", e);
			return;
		}
		hook.accept(e);
	}

	/**
	 * An unexpected value is about to be dropped.
	 * <p>
	 * If no hook is registered for {@link Hooks#onNextDropped(Consumer)}, the dropped
	 * value is just logged at DEBUG level.
	 *
	 * @param <T> the dropped value type
	 * @param t the dropped data
	 */
	public static <T> void onNextDropped(T t) {
		Objects.requireNonNull(t, "onNext");
		Consumer<Object> hook = Hooks.onNextDroppedHook;
		if (hook != null) {
			hook.accept(t);
		}
		else if (log.isDebugEnabled()) {
			log.debug("onNextDropped: " + t);
		}
	}

	/**
	 * An event reached an observer that already received its terminal event. In
	 * development mode this is {@link #onFatal(Throwable) fatal}, otherwise the event is
	 * dropped and logged at DEBUG level.
	 *
	 * @param event the offending event
	 */
	public static void onProtocolViolation(Event<?> event) {
		if (Hooks.isDevelopmentMode()) {
			onFatal(Exceptions.failWithProtocolViolation(event));
		}
		else if (log.isDebugEnabled()) {
			log.debug("Dropping {} delivered after a terminal event", event);
		}
	}

	/**
	 * Hand a fatal condition to the {@link Hooks#onFatal(Consumer) fatal handler}, or
	 * throw it when no handler is installed.
	 *
	 * @param fatal the fatal condition
	 */
	public static void onFatal(Throwable fatal) {
		Consumer<? super Throwable> hook = Hooks.onFatalHook;
		if (hook != null) {
			hook.accept(fatal);
			return;
		}
		if (fatal instanceof Error) {
			throw (Error) fatal;
		}
		throw Exceptions.propagate(fatal);
	}

	Operators() {
	}

	static final Logger log = LoggerFactory.getLogger(Operators.class);
}
