/*
 * Copyright (c) 2025 Helios Prop Sorter
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.propsort.core.order;

/**
 * Thrown when a precedence table cannot be loaded or parsed.
 */
public class OrderTableException extends RuntimeException {

    public OrderTableException(String message) {
        super(message);
    }

    public OrderTableException(String message, Throwable cause) {
        super(message, cause);
    }
}
