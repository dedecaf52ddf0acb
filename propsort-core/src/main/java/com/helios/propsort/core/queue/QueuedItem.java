/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.queue;

/**
 * An entry of a {@link MultiViewQueue}. The same instance is referenced by every view;
 * it is never mutated after creation.
 *
 * @param id unique, monotonically increasing per queue
 * @param payload the queued value
 */
public record QueuedItem<T>(long id, T payload) {
}
