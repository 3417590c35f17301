/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.quackpool;

/**
 * How {@link SqlFiles} obtains SQL text.
 *
 * @since 1.0.0
 */
public enum LoadMode {
	/**
	 * Every declared file is read once, when the {@link SqlFiles} is built. A missing file fails the build.
	 */
	COMPILED,
	/**
	 * Files are read from disk on every load, so edits are picked up without a restart.
	 */
	DYNAMIC
}
