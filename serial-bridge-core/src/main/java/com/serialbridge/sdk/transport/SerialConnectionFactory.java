/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.serialbridge.sdk.transport;

import java.util.function.Function;
import java.util.function.Supplier;

import com.serialbridge.sdk.spec.SerialOpenOptions;
import com.serialbridge.sdk.spec.SerialPortDevice;
import com.serialbridge.sdk.spec.SerialProtocol;
import com.serialbridge.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Opens serial connections on the active port of a {@link SerialConnectionManager}.
 *
 * <p>
 * Opening is serialized against the shutdown of earlier connections: if a previous
 * transport's device is still closing, the factory logs a warning and waits for that
 * close to finish before opening the port again.
 * </p>
 *
 * <p>
 * Example:
 *
 * <pre>{@code
 * SerialConnectionManager manager = new SerialConnectionManager(port);
 * SerialConnectionFactory factory = new SerialConnectionFactory(manager);
 *
 * SerialConnection<MyProtocol> connection = factory
 *     .createConnection(MyProtocol::new, SerialConnectionOptions.builder(115200).build())
 *     .block();
 *
 * connection.transport().write(frame);
 * connection.transport().closeGracefully().block();
 * }</pre>
 */
public class SerialConnectionFactory {

	private static final Logger logger = LoggerFactory.getLogger(SerialConnectionFactory.class);

	private final SerialConnectionManager connectionManager;

	public SerialConnectionFactory(SerialConnectionManager connectionManager) {
		Assert.notNull(connectionManager, "The connectionManager can not be null");
		this.connectionManager = connectionManager;
	}

	/**
	 * Opens the active port and wraps it in a transport.
	 * @param protocolFactory creates the protocol attached to the new transport
	 * @param options the connection settings
	 * @param <P> the protocol type
	 * @return a {@link Mono} emitting the new connection. If the port fails to open the
	 * device's error is propagated unchanged and no protocol is created.
	 */
	public <P extends SerialProtocol> Mono<SerialConnection<P>> createConnection(Supplier<P> protocolFactory,
			SerialConnectionOptions options) {
		Assert.notNull(protocolFactory, "The protocolFactory can not be null");
		Assert.notNull(options, "The options can not be null");

		SerialOpenOptions openOptions = options.toOpenOptions();
		return connectionManager.acquire(openOptions).flatMap(port -> connect(port, protocolFactory));
	}

	private <P extends SerialProtocol> Mono<SerialConnection<P>> connect(SerialPortDevice port,
			Supplier<P> protocolFactory) {
		try {
			P protocol = protocolFactory.get();
			Assert.notNull(protocol, "The protocolFactory returned null");
			SerialPortTransport transport = new SerialPortTransport(protocol, port, connectionManager);
			logger.debug("Serial connection established");
			return Mono.just(new SerialConnection<>(transport, protocol));
		}
		catch (RuntimeException e) {
			logger.warn("Failed to set up serial connection, closing port", e);
			return Mono.fromFuture(connectionManager.release(port, () -> {
			}), true).then(Mono.error(e));
		}
	}

	/**
	 * Runs {@code body} with a new connection and closes the connection when the
	 * {@link Mono} returned by {@code body} terminates or is cancelled.
	 * @param protocolFactory creates the protocol attached to the new transport
	 * @param options the connection settings
	 * @param body the work to do with the connection
	 * @param <P> the protocol type
	 * @param <T> the result type
	 * @return the result of {@code body}
	 */
	public <P extends SerialProtocol, T> Mono<T> withConnection(Supplier<P> protocolFactory,
			SerialConnectionOptions options, Function<SerialConnection<P>, Mono<T>> body) {
		Assert.notNull(body, "The body can not be null");
		return Mono.usingWhen(createConnection(protocolFactory, options), body,
				connection -> connection.transport().closeGracefully());
	}

}
