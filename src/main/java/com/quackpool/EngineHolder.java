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

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * First supervision stage: owns the pool's {@link EngineHandle}.
 * <p>
 * Each handle this holder opens is released exactly once, by {@link #release()} or {@link #reopen()}.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class EngineHolder {
	@NonNull
	private final EngineDriver engineDriver;
	@NonNull
	private final String location;
	@NonNull
	private final EngineConfig engineConfig;
	@NonNull
	private final EngineListener engineListener;
	@NonNull
	private final AtomicReference<EngineHandle> engineHandle;
	@NonNull
	private final Logger logger;

	EngineHolder(@NonNull EngineDriver engineDriver,
							 @NonNull String location,
							 @NonNull EngineConfig engineConfig,
							 @NonNull EngineListener engineListener) {
		this.engineDriver = requireNonNull(engineDriver);
		this.location = requireNonNull(location);
		this.engineConfig = requireNonNull(engineConfig);
		this.engineListener = requireNonNull(engineListener);
		this.engineHandle = new AtomicReference<>();
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * @throws EngineOpenException if the driver cannot open the engine
	 */
	@NonNull
	EngineHandle open() {
		EngineHandle openedHandle = this.engineDriver.open(this.location, this.engineConfig);

		if (!this.engineHandle.compareAndSet(null, openedHandle)) {
			openedHandle.release();
			throw new IllegalStateException(format("Engine at '%s' is already held", this.location));
		}

		this.logger.log(FINE, format("Holding engine at '%s'", this.location));

		try {
			this.engineListener.engineOpened(openedHandle);
		} catch (RuntimeException e) {
			this.logger.log(WARNING, "Engine listener failed", e);
		}

		return openedHandle;
	}

	@NonNull
	EngineHandle reopen() {
		release();
		return open();
	}

	@NonNull
	EngineHandle getEngineHandle() {
		EngineHandle currentHandle = this.engineHandle.get();

		if (currentHandle == null)
			throw new IllegalStateException(format("No engine is held for '%s'", this.location));

		return currentHandle;
	}

	/**
	 * Releases the held handle, if any. Safe to call repeatedly.
	 */
	void release() {
		EngineHandle releasedHandle = this.engineHandle.getAndSet(null);

		if (releasedHandle == null)
			return;

		releasedHandle.release();
		this.logger.log(FINE, format("Released engine at '%s'", this.location));

		try {
			this.engineListener.engineReleased(releasedHandle);
		} catch (RuntimeException e) {
			this.logger.log(WARNING, "Engine listener failed", e);
		}
	}

	@NonNull
	String getLocation() {
		return this.location;
	}
}
