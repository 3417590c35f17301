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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

/**
 * A conventional SQL server client that is not reached through a {@link javax.sql.DataSource}, e.g. an HTTP or
 * vendor-protocol driver.
 * <p>
 * Whatever it returns is fed to {@link ResultExtractor}; wrap one with {@link Backends#of(Object)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface ServerClient {
	/**
	 * @return the driver's native result object
	 * @throws Exception if the server rejects the statement
	 */
	@Nullable
	Object query(@NonNull String sql,
							 @NonNull List<Object> parameters) throws Exception;
}
