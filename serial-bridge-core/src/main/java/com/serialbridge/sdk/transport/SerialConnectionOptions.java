/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.serialbridge.sdk.transport;

import java.util.Objects;

import com.serialbridge.sdk.spec.SerialOpenOptions;
import com.serialbridge.sdk.spec.SerialOpenOptions.FlowControl;
import com.serialbridge.sdk.util.Assert;

/**
 * Connection settings accepted by {@link SerialConnectionFactory}.
 *
 * <p>
 * The option set mirrors what callers of a classic serial API pass in. Only the baud
 * rate and RTS/CTS flow control reach the device; the url, parity, stop bits and
 * XON/XOFF settings are accepted so existing callers keep working, but have no effect:
 * the connection manager's active port is always the one opened, with its default
 * framing.
 * </p>
 *
 * <pre>{@code
 * SerialConnectionOptions options = SerialConnectionOptions.builder(115200)
 *     .rtscts(true)
 *     .build();
 * }</pre>
 */
public final class SerialConnectionOptions {

	private final String url;

	private final int baudRate;

	private final Parity parity;

	private final StopBits stopBits;

	private final boolean rtscts;

	private final boolean xonxoff;

	private SerialConnectionOptions(Builder builder) {
		this.url = builder.url;
		this.baudRate = builder.baudRate;
		this.parity = builder.parity;
		this.stopBits = builder.stopBits;
		this.rtscts = builder.rtscts;
		this.xonxoff = builder.xonxoff;
	}

	public static Builder builder(int baudRate) {
		return new Builder(baudRate);
	}

	public String getUrl() {
		return url;
	}

	public int getBaudRate() {
		return baudRate;
	}

	public Parity getParity() {
		return parity;
	}

	public StopBits getStopBits() {
		return stopBits;
	}

	public boolean isRtscts() {
		return rtscts;
	}

	public boolean isXonxoff() {
		return xonxoff;
	}

	/**
	 * Maps these settings to what the device is opened with.
	 * @return the device open options
	 */
	public SerialOpenOptions toOpenOptions() {
		return new SerialOpenOptions(baudRate, rtscts ? FlowControl.HARDWARE : FlowControl.NONE);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SerialConnectionOptions)) {
			return false;
		}
		SerialConnectionOptions that = (SerialConnectionOptions) o;
		return baudRate == that.baudRate && rtscts == that.rtscts && xonxoff == that.xonxoff
				&& Objects.equals(url, that.url) && parity == that.parity && stopBits == that.stopBits;
	}

	@Override
	public int hashCode() {
		return Objects.hash(url, baudRate, parity, stopBits, rtscts, xonxoff);
	}

	@Override
	public String toString() {
		return "SerialConnectionOptions{url=" + url + ", baudRate=" + baudRate + ", parity=" + parity + ", stopBits="
				+ stopBits + ", rtscts=" + rtscts + ", xonxoff=" + xonxoff + '}';
	}

	public enum Parity {

		NONE, EVEN, ODD, MARK, SPACE

	}

	public enum StopBits {

		ONE, ONE_POINT_FIVE, TWO

	}

	/**
	 * Builder for {@link SerialConnectionOptions}.
	 */
	public static final class Builder {

		private String url;

		private final int baudRate;

		private Parity parity = Parity.NONE;

		private StopBits stopBits = StopBits.ONE;

		private boolean rtscts;

		private boolean xonxoff;

		private Builder(int baudRate) {
			Assert.isTrue(baudRate > 0, "The baudRate must be positive");
			this.baudRate = baudRate;
		}

		/**
		 * Sets the port url. Accepted for compatibility; the active port is always used.
		 * @param url the port url
		 * @return this builder
		 */
		public Builder url(String url) {
			this.url = url;
			return this;
		}

		public Builder parity(Parity parity) {
			Assert.notNull(parity, "The parity can not be null");
			this.parity = parity;
			return this;
		}

		public Builder stopBits(StopBits stopBits) {
			Assert.notNull(stopBits, "The stopBits can not be null");
			this.stopBits = stopBits;
			return this;
		}

		/**
		 * Enables RTS/CTS hardware flow control.
		 * @param rtscts whether hardware flow control is on
		 * @return this builder
		 */
		public Builder rtscts(boolean rtscts) {
			this.rtscts = rtscts;
			return this;
		}

		public Builder xonxoff(boolean xonxoff) {
			this.xonxoff = xonxoff;
			return this;
		}

		public SerialConnectionOptions build() {
			return new SerialConnectionOptions(this);
		}

	}

}
