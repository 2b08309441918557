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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allows for various lifecycle override of the event delivery: dropped values and
 * errors, fatal conditions and the development mode switch.
 * <p>
 * Development mode is initially read from the {@code relay.development} system
 * property. When it is on, conditions that indicate a programming error (an event
 * delivered after a terminal event, an error reaching a
 * {@link relay.core.observable.Binder}) are escalated to the {@link #onFatal(Consumer)
 * fatal handler} instead of being logged.
 */
public abstract class Hooks {

	/**
	 * Override global error dropped strategy which by default logs the error at ERROR
	 * level.
	 * <p>
	 * The hook is cumulative, so calling this method several times will set up the hook
	 * for as many consumer invocations (even if called with the same consumer instance).
	 *
	 * @param c the {@link Consumer} to apply to dropped errors
	 */
	public static void onErrorDropped(Consumer<? super Throwable> c) {
		Objects.requireNonNull(c, "onErrorDroppedHook");
		log.debug("Hooking new default : onErrorDropped");

		synchronized (log) {
			if (onErrorDroppedHook != null) {
				@SuppressWarnings("unchecked") Consumer<Throwable> _c =
						((Consumer<Throwable>) onErrorDroppedHook).andThen(c);
				onErrorDroppedHook = _c;
			}
			else {
				onErrorDroppedHook = c;
			}
		}
	}

	/**
	 * Override global data dropped strategy which by default logs at DEBUG level.
	 * <p>
	 * The hook is cumulative, so calling this method several times will set up the hook
	 * for as many consumer invocations (even if called with the same consumer instance).
	 *
	 * @param c the {@link Consumer} to apply to data (onNext) that is dropped
	 */
	public static void onNextDropped(Consumer<Object> c) {
		Objects.requireNonNull(c, "onNextDroppedHook");
		log.debug("Hooking new default : onNextDropped");

		synchronized (log) {
			if (onNextDroppedHook != null) {
				onNextDroppedHook = onNextDroppedHook.andThen(c);
			}
			else {
				onNextDroppedHook = c;
			}
		}
	}

	/**
	 * Replace the fatal handler, which by default rethrows the fatal condition to the
	 * caller. Fatal conditions are only raised in {@link #isDevelopmentMode() development
	 * mode}, as {@link Exceptions.ProtocolViolationException} or
	 * {@link Exceptions.BinderError}.
	 * <p>
	 * Unlike the dropped hooks, this hook is not cumulative.
	 *
	 * @param c the {@link Consumer} receiving fatal conditions
	 */
	public static void onFatal(Consumer<? super Throwable> c) {
		Objects.requireNonNull(c, "onFatalHook");
		log.debug("Hooking new default : onFatal");

		synchronized (log) {
			onFatalHook = c;
		}
	}

	/**
	 * Reset global error dropped strategy to logging the error.
	 */
	public static void resetOnErrorDropped() {
		log.debug("Reset to factory defaults : onErrorDropped");
		synchronized (log) {
			onErrorDroppedHook = null;
		}
	}

	/**
	 * Reset global data dropped strategy to logging at DEBUG level.
	 */
	public static void resetOnNextDropped() {
		log.debug("Reset to factory defaults : onNextDropped");
		synchronized (log) {
			onNextDroppedHook = null;
		}
	}

	/**
	 * Reset the fatal handler to rethrowing fatal conditions.
	 */
	public static void resetOnFatal() {
		log.debug("Reset to factory defaults : onFatal");
		synchronized (log) {
			onFatalHook = null;
		}
	}

	/**
	 * Escalate programming errors to the {@link #onFatal(Consumer) fatal handler}.
	 */
	public static void enableDevelopmentMode() {
		log.debug("Enabling development mode");
		developmentMode = true;
	}

	/**
	 * Log programming errors instead of escalating them, which is the default unless the
	 * {@code relay.development} system property is set to {@code true}.
	 */
	public static void disableDevelopmentMode() {
		log.debug("Disabling development mode");
		developmentMode = false;
	}

	/**
	 * @return true if development mode is on
	 */
	public static boolean isDevelopmentMode() {
		return developmentMode;
	}

	/**
	 * Reset every hook to its factory default, including the development mode flag
	 * which goes back to the value of the {@code relay.development} system property.
	 */
	public static void resetAll() {
		resetOnErrorDropped();
		resetOnNextDropped();
		resetOnFatal();
		developmentMode = DEVELOPMENT_DEFAULT;
	}

	static volatile @Nullable Consumer<? super Throwable> onErrorDroppedHook;
	static volatile @Nullable Consumer<Object>            onNextDroppedHook;
	static volatile @Nullable Consumer<? super Throwable> onFatalHook;

	static final boolean DEVELOPMENT_DEFAULT = Boolean.parseBoolean(System.getProperty("relay.development", "false"));

	static volatile boolean developmentMode = DEVELOPMENT_DEFAULT;

	static final Logger log = LoggerFactory.getLogger(Hooks.class);

	Hooks() {
	}
}
