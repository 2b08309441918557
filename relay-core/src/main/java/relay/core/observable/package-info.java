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

/**
 * Provide the {@link relay.core.observable.Observable} contract along with its sources,
 * the execution-context operators {@code subscribeOn}/{@code observeOn} and the
 * observer adapters {@link relay.core.observable.Observers} and
 * {@link relay.core.observable.Binder}.
 * <p>
 * Every observer handed to {@link relay.core.observable.Observable#subscribe} is wrapped
 * in a {@link relay.core.observable.SafeObserver}, which serializes delivery and enforces
 * the {@code next* (error | completed)?} event grammar.
 */
@NullMarked
package relay.core.observable;

import org.jspecify.annotations.NullMarked;
