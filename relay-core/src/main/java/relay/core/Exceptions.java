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

import java.util.Collection;
import java.util.concurrent.RejectedExecutionException;

import org.jspecify.annotations.Nullable;

/**
 * Exception factories and checks shared by observables, subjects and schedulers.
 * <p>
 * Two families of failures are raised here: rejections of work by a
 * {@link relay.core.scheduler.Scheduler}, and the failures that
 * {@link Hooks#isDevelopmentMode() development mode} uses to make programming errors
 * loud ({@link ProtocolViolationException}, {@link BinderError}). The latter are
 * {@link #throwIfFatal(Throwable) fatal}: they are never turned into error events.
 */
public abstract class Exceptions {

	static final RejectedExecutionException SCHEDULER_UNAVAILABLE =
			new SharedRejection("Scheduler unavailable");

	static final RejectedExecutionException NOT_TIME_CAPABLE =
			new SharedRejection("Scheduler is not capable of time-based scheduling");

	/**
	 * Rethrow the given {@link Throwable} if no observer should ever see it as an error
	 * event: errors of the JVM itself ({@link VirtualMachineError},
	 * {@link LinkageError}) and the development mode failures.
	 *
	 * @param t the exception to check, null being ignored
	 */
	public static void throwIfFatal(@Nullable Throwable t) {
		if (t instanceof ProtocolViolationException) {
			throw (ProtocolViolationException) t;
		}
		if (t instanceof VirtualMachineError || t instanceof LinkageError || t instanceof BinderError) {
			throw (Error) t;
		}
	}

	/**
	 * Turn any {@link Throwable} into something that can be thrown from a method without
	 * a {@code throws} clause. Runtime exceptions are returned as is, checked ones are
	 * wrapped so that {@link #unwrap(Throwable)} finds them back.
	 *
	 * @param t the exception to rethrow
	 * @return an unchecked exception, to be thrown by the caller
	 */
	public static RuntimeException propagate(Throwable t) {
		throwIfFatal(t);
		if (t instanceof RuntimeException) {
			return (RuntimeException) t;
		}
		return new UncheckedWrapper(t);
	}

	/**
	 * @param t an exception, possibly from {@link #propagate(Throwable)}
	 * @return the checked exception wrapped by {@link #propagate(Throwable)}, or
	 * {@code t} itself
	 */
	public static Throwable unwrap(Throwable t) {
		if (t instanceof UncheckedWrapper && t.getCause() != null) {
			return t.getCause();
		}
		return t;
	}

	/**
	 * Gather several failures, for instance of a batch of teardowns, into one exception
	 * carrying them as {@link Throwable#getSuppressed() suppressed} exceptions, in order.
	 *
	 * @param errors the failures to gather
	 * @return a new composite exception
	 */
	public static RuntimeException multiple(Collection<? extends Throwable> errors) {
		RuntimeException composite = new CompositeException(errors.size());
		for (Throwable e : errors) {
			composite.addSuppressed(e);
		}
		return composite;
	}

	/**
	 * @return the shared rejection of a disposed scheduler or worker
	 */
	public static RejectedExecutionException failWithRejected() {
		return SCHEDULER_UNAVAILABLE;
	}

	/**
	 * @return the shared rejection of a delayed or periodic task by a scheduler that
	 * only runs tasks right away
	 */
	public static RejectedExecutionException failWithRejectedNotTimeCapable() {
		return NOT_TIME_CAPABLE;
	}

	/**
	 * Report that the executor behind a scheduler refused a task.
	 *
	 * @param cause what the executor threw
	 * @return a new rejection with the given cause, or {@code cause} if it already is
	 * the result of this method
	 */
	public static RejectedExecutionException failWithRejected(Throwable cause) {
		if (cause instanceof ExecutorRejection) {
			return (RejectedExecutionException) cause;
		}
		return new ExecutorRejection(cause);
	}

	/**
	 * @param event the event delivered after a terminal one
	 * @return a new {@link ProtocolViolationException} describing it
	 */
	public static ProtocolViolationException failWithProtocolViolation(Event<?> event) {
		return new ProtocolViolationException("Event " + event + " delivered after a terminal event");
	}

	Exceptions() {
	}

	/**
	 * Signals an event delivered to an observer after that observer already received its
	 * terminal event. Only raised in development mode.
	 */
	public static final class ProtocolViolationException extends IllegalStateException {

		ProtocolViolationException(String message) {
			super(message);
		}

		private static final long serialVersionUID = 4203197725385418218L;
	}

	/**
	 * Signals an error event that reached a {@link relay.core.observable.Binder}, which is
	 * not meant to receive errors at all. Only raised in development mode.
	 */
	public static final class BinderError extends AssertionError {

		public BinderError(Throwable cause) {
			super("Binding error: " + cause, cause);
		}

		private static final long serialVersionUID = -2367915296434751187L;
	}

	static final class UncheckedWrapper extends RuntimeException {

		UncheckedWrapper(Throwable cause) {
			super(cause);
		}

		private static final long serialVersionUID = 2491425227432776143L;
	}

	static final class CompositeException extends RuntimeException {

		CompositeException(int count) {
			super(count + " exceptions occurred, see suppressed");
		}

		private static final long serialVersionUID = 8070744939537687606L;
	}

	static final class ExecutorRejection extends RejectedExecutionException {

		ExecutorRejection(Throwable cause) {
			super("Scheduler unavailable", cause);
		}

		private static final long serialVersionUID = -3916484437263012396L;
	}

	// shared instances, the stack trace would only point at class initialization
	static final class SharedRejection extends RejectedExecutionException {

		SharedRejection(String message) {
			super(message);
		}

		@Override
		public synchronized Throwable fillInStackTrace() {
			return this;
		}

		private static final long serialVersionUID = 6716317311716624566L;
	}
}
