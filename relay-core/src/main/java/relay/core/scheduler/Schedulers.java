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

package relay.core.scheduler;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import relay.core.Exceptions;

/**
 * {@link Schedulers} provides the various {@link Scheduler} flavors usable by
 * {@link relay.core.observable.Observable#observeOn observeOn} or
 * {@link relay.core.observable.Observable#subscribeOn subscribeOn}:
 * <ul>
 *     <li>{@link #immediate()}: the caller's thread</li>
 *     <li>{@link #main()}: the designated main serial context, process-wide and
 *     replaceable through {@link #setMain(Scheduler)}</li>
 *     <li>{@link #newSerial(String)}: a serial background context</li>
 *     <li>{@link #newConcurrent(String, int)}: a pool of background threads, bounded
 *     to a maximum number of concurrently running tasks</li>
 *     <li>{@link #fromExecutor(Executor)}: an execution context supplied by the host</li>
 * </ul>
 */
public abstract class Schedulers {

	/**
	 * Default maximum number of concurrently running tasks of
	 * {@link #newConcurrent(String)} schedulers: the number of processors available
	 * to the runtime on init (min 4), unless overridden by the
	 * {@code relay.schedulers.defaultPoolSize} system property.
	 *
	 * @see Runtime#availableProcessors()
	 */
	public static final int DEFAULT_POOL_SIZE =
			Optional.ofNullable(System.getProperty("relay.schedulers.defaultPoolSize"))
			        .map(Integer::parseInt)
			        .orElseGet(() -> Math.max(Runtime.getRuntime().availableProcessors(), 4));

	/**
	 * Name of the thread backing the default {@link #main()} scheduler.
	 */
	public static final String MAIN_THREAD_NAME = "relay-main";

	static final String IMMEDIATE     = "immediate";
	static final String SERIAL        = "serial";
	static final String CONCURRENT    = "concurrent";
	static final String FROM_EXECUTOR = "fromExecutor";

	static final Logger log = LoggerFactory.getLogger(Schedulers.class);

	static final AtomicLong MAIN_COUNTER = new AtomicLong();

	static volatile @Nullable BiConsumer<Thread, ? super Throwable> onHandleErrorHook;

	static volatile @Nullable Scheduler mainOverride;

	static volatile @Nullable Scheduler defaultMain;

	/**
	 * Executes tasks immediately on the caller's thread.
	 *
	 * @return a reusable {@link Scheduler}
	 */
	public static Scheduler immediate() {
		return ImmediateScheduler.INSTANCE;
	}

	/**
	 * The designated main serial execution context, typically owned by a UI toolkit.
	 * Returns the scheduler installed through {@link #setMain(Scheduler)} if any,
	 * otherwise a process-wide scheduler backed by a single daemon thread named after
	 * {@value #MAIN_THREAD_NAME}, created on first use.
	 *
	 * @return the main {@link Scheduler}
	 */
	public static Scheduler main() {
		Scheduler s = mainOverride;
		if (s != null) {
			return s;
		}
		s = defaultMain;
		if (s != null) {
			return s;
		}
		synchronized (Schedulers.class) {
			s = defaultMain;
			if (s == null) {
				s = new ExecutorServiceScheduler(MAIN_THREAD_NAME,
						newScheduledPool(1, new RelayThreadFactory(MAIN_THREAD_NAME, MAIN_COUNTER, true)),
						true);
				defaultMain = s;
			}
			return s;
		}
	}

	/**
	 * Replace the {@link #main()} scheduler, for instance with one bound to a UI event
	 * loop via {@link #fromExecutor(Executor)}, or with {@link #immediate()} in tests.
	 * This method should be called typically on app startup.
	 *
	 * @param scheduler the new main {@link Scheduler}
	 */
	public static void setMain(Scheduler scheduler) {
		mainOverride = Objects.requireNonNull(scheduler, "scheduler");
		if (log.isDebugEnabled()) {
			log.debug("Main scheduler replaced with {}", scheduler);
		}
	}

	/**
	 * Restore the default {@link #main()} scheduler, undoing {@link #setMain(Scheduler)}.
	 * The replaced scheduler is not disposed.
	 */
	public static void resetMain() {
		mainOverride = null;
		if (log.isDebugEnabled()) {
			log.debug("Reset to factory defaults: main scheduler");
		}
	}

	/**
	 * Create a new serial {@link Scheduler}: a single daemon thread runs every task in
	 * submission order. Time-capable.
	 *
	 * @param name thread name prefix
	 *
	 * @return a new serial {@link Scheduler}
	 */
	public static Scheduler newSerial(String name) {
		return newSerial(name, true);
	}

	/**
	 * Create a new serial {@link Scheduler}: a single thread runs every task in
	 * submission order. Time-capable.
	 *
	 * @param name thread name prefix
	 * @param daemon false if the thread should prevent the JVM from exiting
	 *
	 * @return a new serial {@link Scheduler}
	 */
	public static Scheduler newSerial(String name, boolean daemon) {
		Objects.requireNonNull(name, "name");
		return new ExecutorServiceScheduler(name,
				newScheduledPool(1, new RelayThreadFactory(name, new AtomicLong(), daemon)),
				true);
	}

	/**
	 * Create a new concurrent {@link Scheduler} of at most {@link #DEFAULT_POOL_SIZE}
	 * concurrently running tasks. Time-capable. Its {@link Scheduler.Worker workers}
	 * are still serial.
	 *
	 * @param name thread name prefix
	 *
	 * @return a new concurrent {@link Scheduler}
	 */
	public static Scheduler newConcurrent(String name) {
		return newConcurrent(name, DEFAULT_POOL_SIZE);
	}

	/**
	 * Create a new concurrent {@link Scheduler} running at most {@code maxConcurrency}
	 * tasks at the same time, on daemon threads that are released after 60 seconds of
	 * inactivity. Time-capable. Its {@link Scheduler.Worker workers} are still serial.
	 *
	 * @param name thread name prefix
	 * @param maxConcurrency maximum number of concurrently running tasks, strictly positive
	 *
	 * @return a new concurrent {@link Scheduler}
	 */
	public static Scheduler newConcurrent(String name, int maxConcurrency) {
		Objects.requireNonNull(name, "name");
		if (maxConcurrency <= 0) {
			throw new IllegalArgumentException("maxConcurrency must be strictly positive, was: " + maxConcurrency);
		}
		ScheduledThreadPoolExecutor pool =
				newScheduledPool(maxConcurrency, new RelayThreadFactory(name, new AtomicLong(), true));
		pool.setKeepAliveTime(60L, TimeUnit.SECONDS);
		pool.allowCoreThreadTimeOut(true);
		return new ExecutorServiceScheduler(name, pool, false);
	}

	/**
	 * Create a {@link Scheduler} which uses a backing {@link Executor} to schedule
	 * Runnables. Workers of this scheduler trampoline their tasks so that they run in
	 * FIFO order and strictly non-concurrently. Not time-capable.
	 * <p>
	 * Disposing the returned scheduler rejects further tasks but leaves the
	 * {@link Executor} itself untouched.
	 *
	 * @param executor an {@link Executor}
	 *
	 * @return a new {@link Scheduler}
	 */
	public static Scheduler fromExecutor(Executor executor) {
		return new ExecutorScheduler(executor);
	}

	/**
	 * Create a {@link Scheduler} which uses a backing {@link ExecutorService} to schedule
	 * Runnables, see {@link #fromExecutor(Executor)}.
	 *
	 * @param executorService an {@link ExecutorService}
	 *
	 * @return a new {@link Scheduler}
	 */
	public static Scheduler fromExecutorService(ExecutorService executorService) {
		return new ExecutorScheduler(executorService);
	}

	/**
	 * Define a hook that is executed when a task scheduled on a {@link Scheduler} has
	 * failed, after the failure has been logged. The hook receives the thread the task
	 * ran on.
	 *
	 * @param c the new hook to set.
	 */
	public static void onHandleError(BiConsumer<Thread, ? super Throwable> c) {
		if (log.isDebugEnabled()) {
			log.debug("Hooking new default: onHandleError");
		}
		onHandleErrorHook = Objects.requireNonNull(c, "onHandleError");
	}

	/**
	 * Reset the {@link #onHandleError(BiConsumer)} hook to the default no-op behavior.
	 */
	public static void resetOnHandleError() {
		if (log.isDebugEnabled()) {
			log.debug("Reset to factory defaults: onHandleError");
		}
		onHandleErrorHook = null;
	}

	static ScheduledThreadPoolExecutor newScheduledPool(int size, RelayThreadFactory factory) {
		ScheduledThreadPoolExecutor e = new ScheduledThreadPoolExecutor(size, factory);
		e.setRemoveOnCancelPolicy(true);
		return e;
	}

	/**
	 * Report a failure of a scheduled task: logged at ERROR, then passed to the
	 * {@link #onHandleError(BiConsumer)} hook if any. The thread's
	 * {@link Thread.UncaughtExceptionHandler} is not involved.
	 */
	static void handleError(Throwable ex) {
		Thread thread = Thread.currentThread();
		Throwable t = Exceptions.unwrap(ex);
		log.error("Scheduled task failed on thread " + thread.getName(), t);
		BiConsumer<Thread, ? super Throwable> hook = onHandleErrorHook;
		if (hook != null) {
			hook.accept(thread, t);
		}
	}

	Schedulers() {
	}
}
