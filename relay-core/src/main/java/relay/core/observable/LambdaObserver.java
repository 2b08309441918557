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

import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import relay.core.Observer;
import relay.core.Operators;

/**
 * A Java Lambda adapter to {@link Observer}. Missing callbacks are no-ops, except for
 * a missing error callback: errors are then routed to
 * {@link Operators#onErrorDropped(Throwable)}.
 *
 * @param <T> the value type
 */
final class LambdaObserver<T> implements Observer<T> {

	final @Nullable Consumer<? super T>         consumer;
	final @Nullable Consumer<? super Throwable> errorConsumer;
	final @Nullable Runnable                    completeConsumer;

	LambdaObserver(@Nullable Consumer<? super T> consumer,
			@Nullable Consumer<? super Throwable> errorConsumer,
			@Nullable Runnable completeConsumer) {
		this.consumer = consumer;
		this.errorConsumer = errorConsumer;
		this.completeConsumer = completeConsumer;
	}

	@Override
	public void onNext(T value) {
		if (consumer != null) {
			consumer.accept(value);
		}
	}

	@Override
	public void onError(Throwable e) {
		if (errorConsumer != null) {
			errorConsumer.accept(e);
		}
		else {
			Operators.onErrorDropped(e);
		}
	}

	@Override
	public void onCompleted() {
		if (completeConsumer != null) {
			completeConsumer.run();
		}
	}
}
