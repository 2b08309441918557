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
 * Subjects: entities that are both {@link relay.core.observable.Observable} and
 * {@link relay.core.Observer}, fanning events out to a registry of observers.
 *
 * <h2>PublishSubject</h2>
 * Live events only.
 *
 * <h2>ReplaySubject</h2>
 * Replays the last N (or all) values to new observers.
 *
 * <h2>BehaviorSubject</h2>
 * Replays the current value to new observers.
 *
 * <h2>AsyncSubject</h2>
 * Emits only the last value, on completion.
 */
@NullMarked
package relay.core.subject;

import org.jspecify.annotations.NullMarked;
