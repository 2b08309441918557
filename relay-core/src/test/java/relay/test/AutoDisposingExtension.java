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

package relay.test;

import java.util.ArrayDeque;
import java.util.Deque;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import relay.core.Disposable;

/**
 * Releases the schedulers, workers and subscriptions a test registered through
 * {@link #autoDispose(Disposable)} once it is over, last registered first.
 */
public class AutoDisposingExtension implements AfterEachCallback {

	final Deque<Disposable> registered = new ArrayDeque<>();

	/**
	 * @param disposable what to release after the test
	 * @param <T> its type
	 * @return the same instance
	 */
	public synchronized <T extends Disposable> T autoDispose(T disposable) {
		registered.push(disposable);
		return disposable;
	}

	@Override
	public void afterEach(ExtensionContext context) {
		Disposable d;
		while ((d = next()) != null) {
			d.dispose();
		}
	}

	synchronized Disposable next() {
		return registered.poll();
	}
}
