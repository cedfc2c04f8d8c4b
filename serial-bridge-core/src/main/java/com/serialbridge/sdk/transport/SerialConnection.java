/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.serialbridge.sdk.transport;

import com.serialbridge.sdk.spec.SerialProtocol;
import com.serialbridge.sdk.spec.SerialTransport;

/**
 * A transport together with the protocol instance created for it.
 *
 * @param transport the transport owning the device
 * @param protocol the protocol attached to the transport
 * @param <P> the protocol type
 */
public record SerialConnection<P extends SerialProtocol>(SerialTransport transport, P protocol) {
}
