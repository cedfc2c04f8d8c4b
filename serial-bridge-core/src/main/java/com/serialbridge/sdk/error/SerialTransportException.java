/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.serialbridge.sdk.error;

import com.serialbridge.sdk.util.Assert;

/**
 * Exception raised by the serial transport layer itself, as opposed to errors coming
 * from the device, which are passed through unchanged.
 *
 * <p>
 * The {@link Reason} tells callers why the transport gave up, for example to tell an
 * unplugged device ({@link Reason#PEER_CLOSED}) apart from an owner that forgot to close
 * its transport ({@link Reason#NOT_CLOSED}).
 * </p>
 */
public class SerialTransportException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * Why the transport layer raised the exception.
	 */
	public enum Reason {

		/**
		 * The device signalled end of stream.
		 */
		PEER_CLOSED,

		/**
		 * A transport was reclaimed without its owner ever closing it.
		 */
		NOT_CLOSED,

		/**
		 * The active port is still held open by a live transport.
		 */
		PORT_BUSY,

		/**
		 * No active port has been configured.
		 */
		NO_ACTIVE_PORT

	}

	private final Reason reason;

	public SerialTransportException(Reason reason, String message) {
		this(reason, message, null);
	}

	public SerialTransportException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		Assert.notNull(reason, "The reason can not be null");
		this.reason = reason;
	}

	public static SerialTransportException peerClosed() {
		return new SerialTransportException(Reason.PEER_CLOSED, "Other side has closed");
	}

	public static SerialTransportException notClosed() {
		return new SerialTransportException(Reason.NOT_CLOSED, "Transport was not closed!");
	}

	public Reason getReason() {
		return reason;
	}

	public boolean isPeerClosed() {
		return reason == Reason.PEER_CLOSED;
	}

	public boolean isNotClosed() {
		return reason == Reason.NOT_CLOSED;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + reason + "]: " + getMessage();
	}

}
