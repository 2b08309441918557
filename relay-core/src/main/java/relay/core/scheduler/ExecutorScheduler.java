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
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

import relay.core.Disposable;
import relay.core.Exceptions;

/**
 * A {@link Scheduler} over an {@link Executor} supplied by the host, such as a UI event
 * loop. The executor is borrowed: disposing this scheduler only makes it reject new
 * tasks. Workers are {@link TrampolineWorker trampolines}. Not time-capable.
 */
final class ExecutorScheduler implements Scheduler {

	final Executor executor;

	volatile boolean disposed;

	ExecutorScheduler(Executor executor) {
		this.executor = Objects.requireNonNull(executor, "executor");
	}

	@Override
	public Disposable schedule(Runnable task) {
		Objects.requireNonNull(task, "task");
		if (disposed) {
			throw Exceptions.failWithRejected();
		}
		ExecutorTask t = new ExecutorTask(task);
		try {
			executor.execute(t);
		}
		catch (Throwable ex) {
			if (executor instanceof ExecutorService && ((ExecutorService) executor).isShutdown()) {
				disposed = true;
			}
			Schedulers.handleError(ex);
			throw Exceptions.failWithRejected(ex);
		}
		return t;
	}

	@Override
	public Worker createWorker() {
		if (disposed) {
			throw Exceptions.failWithRejected();
		}
		return new TrampolineWorker(executor);
	}

	@Override
	public void dispose() {
		disposed = true;
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	@Override
	public String toString() {
		return Schedulers.FROM_EXECUTOR + "(" + executor + ")";
	}
}
