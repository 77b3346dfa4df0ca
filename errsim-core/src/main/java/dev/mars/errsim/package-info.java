/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * Deterministic error injection for tests.
 * <p>
 * Production code declares named injection points and asks them whether to fail;
 * tests decide when they do:
 * <ul>
 *   <li>{@link dev.mars.errsim.ErrsimPoint} - a named site and its activation state</li>
 *   <li>{@link dev.mars.errsim.Errsim} - process-wide activate/reset/lookup by name</li>
 *   <li>{@link dev.mars.errsim.ErrsimGuard} - activation scoped to a try-with-resources block</li>
 *   <li>{@link dev.mars.errsim.ErrsimConfig} - live or no-op mode and diagnostics switches</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Cheap when idle:</b> an inactive point costs one volatile read per check</li>
 *   <li><b>Bounded firing:</b> a point activated for n firings never fires more than n times</li>
 *   <li><b>Guaranteed cleanup:</b> a guard always deactivates on scope exit</li>
 *   <li><b>Same shape when disabled:</b> the no-op mode keeps every method, with no state behind it</li>
 * </ul>
 * <p>
 * A fired point returns a non-zero fault code; it never throws. What the code
 * means is up to the calling subsystem.
 *
 * @see dev.mars.errsim.Errsim
 */
package dev.mars.errsim;
