/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.serialbridge.sdk.transport;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import com.serialbridge.sdk.error.SerialTransportException;
import com.serialbridge.sdk.spec.SerialOpenOptions;
import com.serialbridge.sdk.spec.SerialPortDevice;
import com.serialbridge.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the serial port that new connections are opened on and guarantees that at most
 * one device is opening or open at a time.
 *
 * <p>
 * The manager keeps:
 * <ul>
 * <li>the active port slot, set by configuration and read by
 * {@link SerialConnectionFactory}</li>
 * <li>a claim on that port, taken by {@link #acquire(SerialOpenOptions)} and given back
 * once the claiming transport's device close has finished</li>
 * <li>the registry of device closes still in flight; an entry exists for exactly as long
 * as a device is closing</li>
 * <li>the single event-loop thread every transport callback runs on</li>
 * </ul>
 *
 * <p>
 * Transports that are still open when the manager closes were never closed by their
 * owner. They are shut down with a {@link SerialTransportException.Reason#NOT_CLOSED}
 * error so the device is released anyway.
 * </p>
 */
public class SerialConnectionManager implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(SerialConnectionManager.class);

	private static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(10);

	private final Scheduler scheduler;

	private final Set<CompletableFuture<Void>> closingTasks = ConcurrentHashMap.newKeySet();

	private final Set<SerialPortTransport> liveTransports = ConcurrentHashMap.newKeySet();

	private final AtomicBoolean portClaimed = new AtomicBoolean(false);

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	private volatile SerialPortDevice activePort;

	private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;

	/**
	 * Creates a manager without an active port. Call {@link #setActivePort} before
	 * opening connections.
	 */
	public SerialConnectionManager() {
		// Daemon thread so the JVM can exit if close() is never called
		this.scheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "serial-bridge-loop");
			t.setDaemon(true);
			return t;
		}), "serial-bridge-loop");
	}

	/**
	 * Creates a manager opening connections on the given port.
	 * @param activePort the port new connections are opened on
	 */
	public SerialConnectionManager(SerialPortDevice activePort) {
		this();
		setActivePort(activePort);
	}

	/**
	 * Sets the maximum time {@link #close()} waits for in-flight device closes.
	 * @param timeout the close timeout
	 * @return this manager for chaining
	 */
	public SerialConnectionManager closeTimeout(Duration timeout) {
		Assert.notNull(timeout, "The timeout can not be null");
		this.closeTimeout = timeout;
		return this;
	}

	public void setActivePort(SerialPortDevice activePort) {
		Assert.notNull(activePort, "The activePort can not be null");
		this.activePort = activePort;
	}

	public SerialPortDevice getActivePort() {
		return activePort;
	}

	/**
	 * Returns the number of device closes still in flight.
	 * @return the closing registry size
	 */
	public int closingTaskCount() {
		return closingTasks.size();
	}

	/**
	 * Waits for every outstanding device close, then claims and opens the active port.
	 * @param options the settings to open the port with
	 * @return a {@link Mono} emitting the opened port. Errors with a
	 * {@link SerialTransportException} if no port is configured or the port is still held
	 * open by a live transport, or with the device's own error if it fails to open.
	 * Cancelling before the open completes closes the port and gives the claim back.
	 */
	public Mono<SerialPortDevice> acquire(SerialOpenOptions options) {
		Assert.notNull(options, "The options can not be null");
		return awaitDrain().then(Mono.defer(() -> claimAndOpen(options)));
	}

	private Mono<SerialPortDevice> claimAndOpen(SerialOpenOptions options) {
		Assert.state(!isClosing.get(), "The connection manager is closed");
		SerialPortDevice port = this.activePort;
		if (port == null) {
			return Mono.error(new SerialTransportException(SerialTransportException.Reason.NO_ACTIVE_PORT,
					"No active serial port has been configured"));
		}
		if (!portClaimed.compareAndSet(false, true)) {
			if (!closingTasks.isEmpty()) {
				// The holder started closing after the drain; its close frees the claim
				return awaitDrain().then(Mono.defer(() -> claimAndOpen(options)));
			}
			return Mono.error(new SerialTransportException(SerialTransportException.Reason.PORT_BUSY,
					"The serial port is still held open by another transport"));
		}
		logger.debug("Opening serial port: baudRate={}, flowControl={}", options.baudRate(), options.flowControl());
		AtomicBoolean settled = new AtomicBoolean(false);
		return Mono.defer(() -> port.open(options))
			.doOnSuccess(v -> settled.set(true))
			.doOnError(e -> {
				settled.set(true);
				logger.debug("Serial port failed to open", e);
				portClaimed.set(false);
			})
			.doOnCancel(() -> {
				if (settled.compareAndSet(false, true)) {
					logger.debug("Opening serial port was cancelled, closing it");
					release(port, () -> {
					});
				}
			})
			.thenReturn(port);
	}

	/**
	 * Waits until no device close is in flight. Logs a warning for every close it has to
	 * wait for: a connection is being opened before the previous one finished closing.
	 * @return a {@link Mono} that completes once the closing registry is empty
	 */
	public Mono<Void> awaitDrain() {
		return drain(true);
	}

	private Mono<Void> drain(boolean warn) {
		return Mono.defer(() -> {
			Iterator<CompletableFuture<Void>> pending = closingTasks.iterator();
			if (!pending.hasNext()) {
				return Mono.empty();
			}
			if (warn) {
				logger.warn("Serial connection was not closed before a new one was opened!"
						+ " Waiting before opening a new one.");
			}
			return Mono.fromFuture(pending.next(), true).then(drain(warn));
		});
	}

	/**
	 * Registers a device close that is about to start. {@link #awaitDrain()} waits for the
	 * returned future from this moment on, before the close itself has been issued.
	 * @return the future to pass to {@link #release(CompletableFuture, SerialPortDevice, Runnable)}
	 */
	CompletableFuture<Void> beginClose() {
		CompletableFuture<Void> closing = new CompletableFuture<>();
		closingTasks.add(closing);
		return closing;
	}

	/**
	 * Closes a port in the background and registers the close in the closing registry.
	 * Once the device is closed, successfully or not, the registry entry is removed, the
	 * port claim is given back and {@code onClosed} runs on the event loop.
	 * @param port the port to close
	 * @param onClosed callback run after the device closed
	 * @return a future completing after {@code onClosed} has run
	 */
	public CompletableFuture<Void> release(SerialPortDevice port, Runnable onClosed) {
		Assert.notNull(port, "The port can not be null");
		Assert.notNull(onClosed, "The onClosed callback can not be null");
		return release(beginClose(), port, onClosed);
	}

	CompletableFuture<Void> release(CompletableFuture<Void> closing, SerialPortDevice port, Runnable onClosed) {
		logger.debug("Closing serial port");
		Mono.defer(port::close)
			.doOnSuccess(v -> logger.debug("Closed serial port"))
			.onErrorResume(e -> {
				logger.warn("Serial port did not close cleanly", e);
				return Mono.empty();
			})
			.publishOn(scheduler)
			.subscribe(null, null, () -> finishClose(closing, onClosed));
		return closing;
	}

	private void finishClose(CompletableFuture<Void> closing, Runnable onClosed) {
		try {
			closingTasks.remove(closing);
			portClaimed.set(false);
			onClosed.run();
		}
		catch (RuntimeException e) {
			logger.error("Error after closing serial port", e);
		}
		finally {
			closing.complete(null);
		}
	}

	void register(SerialPortTransport transport) {
		liveTransports.add(transport);
	}

	void unregister(SerialPortTransport transport) {
		liveTransports.remove(transport);
	}

	Scheduler scheduler() {
		return scheduler;
	}

	/**
	 * Shuts down transports that were never closed, waits for every device close and
	 * stops the event loop.
	 * @return a {@link Mono} that completes once everything is released
	 */
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			isClosing.set(true);
			for (SerialPortTransport transport : List.copyOf(liveTransports)) {
				transport.reclaim();
			}
			return drain(false);
		}).then(Mono.fromRunnable(() -> {
			scheduler.dispose();
			logger.debug("Serial connection manager closed");
		}));
	}

	/**
	 * Blocking form of {@link #closeGracefully()}. Must not be called from a transport
	 * callback.
	 */
	@Override
	public void close() {
		closeGracefully().block(closeTimeout);
	}

}
