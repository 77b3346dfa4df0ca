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
 * Demo of error injection in a storage component.
 * <p>
 * {@link dev.mars.errsim.demo.FileOffloader} declares injection points the way
 * production code does; {@link dev.mars.errsim.demo.ErrsimDemo} activates them.
 *
 * @see dev.mars.errsim.demo.ErrsimDemo
 */
package dev.mars.errsim.demo;
