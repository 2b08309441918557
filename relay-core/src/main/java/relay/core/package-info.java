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
 * The event model shared by every relay package: {@link relay.core.Event} and
 * {@link relay.core.Observer}, subscription handles ({@link relay.core.Disposable},
 * {@link relay.core.Disposables}), and the process-wide error plumbing of
 * {@link relay.core.Hooks}, {@link relay.core.Operators} and {@link relay.core.Exceptions}.
 */
@NullMarked
package relay.core;

import org.jspecify.annotations.NullMarked;
