/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.serialbridge.sdk.transport;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.serialbridge.sdk.error.SerialTransportException;
import com.serialbridge.sdk.spec.ReadResult;
import com.serialbridge.sdk.spec.SerialPortDevice;
import com.serialbridge.sdk.spec.SerialPortReader;
import com.serialbridge.sdk.spec.SerialPortWriter;
import com.serialbridge.sdk.spec.SerialProtocol;
import com.serialbridge.sdk.spec.SerialTransport;
import com.serialbridge.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * {@link SerialTransport} over a {@link SerialPortDevice}.
 *
 * <p>
 * The transport locks the device's reader and writer for its whole lifetime and runs two
 * pumps on the connection manager's event loop:
 * <ul>
 * <li>the inbound pump reads chunk after chunk and hands each to
 * {@link SerialProtocol#dataReceived(byte[])}</li>
 * <li>the outbound pump drains the write queue, writing one chunk at a time</li>
 * </ul>
 *
 * <p>
 * Shutdown runs exactly once, whichever of these triggers it first: {@link #close()},
 * a failed write, the device reporting end of stream, a failed read, or the connection
 * manager reclaiming a transport its owner never closed. It cancels both pumps, releases
 * the reader and writer, hands the device close to the connection manager and tells the
 * protocol the connection is lost once the device is closed.
 * </p>
 *
 * <p>
 * A transport always owns its device: it is created over an opened port and keeps it
 * until shutdown hands it to the connection manager, so {@code connectionLost} is always
 * delivered after the device close.
 * </p>
 */
public class SerialPortTransport implements SerialTransport {

	private static final Logger logger = LoggerFactory.getLogger(SerialPortTransport.class);

	private final SerialConnectionManager connectionManager;

	private final Scheduler scheduler;

	private final AtomicReference<SerialProtocol> protocol;

	private final SerialPortDevice port;

	private final AtomicReference<SerialPortReader> reader;

	private final AtomicReference<SerialPortWriter> writer;

	private final Sinks.Many<byte[]> outboundSink;

	private final Sinks.Empty<Void> terminationSink = Sinks.empty();

	private final Disposable.Swap readerTask = Disposables.swap();

	private final Disposable.Swap writerTask = Disposables.swap();

	private final AtomicLong writeBufferSize = new AtomicLong();

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	/**
	 * Creates a transport over an opened port and starts both pumps. The protocol is
	 * told the connection is made once the constructor has returned.
	 * @param protocol the protocol receiving data and lifecycle callbacks
	 * @param port the opened port; ownership passes to this transport
	 * @param connectionManager the manager whose event loop and closing registry are used
	 */
	SerialPortTransport(SerialProtocol protocol, SerialPortDevice port, SerialConnectionManager connectionManager) {
		Assert.notNull(protocol, "The protocol can not be null");
		Assert.notNull(port, "The port can not be null");
		Assert.notNull(connectionManager, "The connectionManager can not be null");

		this.connectionManager = connectionManager;
		this.scheduler = connectionManager.scheduler();
		this.protocol = new AtomicReference<>(protocol);
		this.port = port;

		SerialPortReader acquiredReader = port.readable().getReader();
		SerialPortWriter acquiredWriter;
		try {
			acquiredWriter = port.writable().getWriter();
		}
		catch (RuntimeException e) {
			acquiredReader.releaseLock();
			throw e;
		}
		this.reader = new AtomicReference<>(acquiredReader);
		this.writer = new AtomicReference<>(acquiredWriter);

		this.outboundSink = Sinks.many().unicast().onBackpressureBuffer();

		try {
			connectionManager.register(this);
			this.scheduler.schedule(() -> notifyConnectionMade(protocol));
			this.readerTask.update(startInboundProcessing());
			this.writerTask.update(startOutboundProcessing());
		}
		catch (RuntimeException e) {
			// the caller still owns the port and closes it
			isClosing.set(true);
			readerTask.dispose();
			writerTask.dispose();
			releaseStreams();
			connectionManager.unregister(this);
			throw e;
		}
	}

	private void notifyConnectionMade(SerialProtocol made) {
		try {
			made.connectionMade(this);
		}
		catch (RuntimeException e) {
			logger.error("Protocol failed to handle connection made", e);
			shutdown(e);
		}
	}

	private Disposable startInboundProcessing() {
		return Mono.defer(this::readChunk)
			.repeat(() -> !isClosing.get() && reader.get() != null)
			.takeUntil(ReadResult::done)
			.subscribeOn(scheduler)
			.publishOn(scheduler)
			.subscribe(this::handleReadResult, this::handleReadError);
	}

	private Mono<ReadResult> readChunk() {
		SerialPortReader current = reader.get();
		return current != null ? current.read() : Mono.empty();
	}

	private void handleReadResult(ReadResult result) {
		if (result.done()) {
			logger.debug("Serial port reported end of stream");
			shutdown(SerialTransportException.peerClosed());
			return;
		}
		byte[] data = result.value();
		if (data == null || data.length == 0) {
			return;
		}
		SerialProtocol current = protocol.get();
		if (current == null) {
			return;
		}
		try {
			current.dataReceived(data);
		}
		catch (RuntimeException e) {
			logger.error("Protocol failed to handle received data", e);
			shutdown(e);
		}
	}

	private void handleReadError(Throwable error) {
		if (!isClosing.get()) {
			logger.debug("Error reading from serial port", error);
		}
		shutdown(error);
	}

	private Disposable startOutboundProcessing() {
		return this.outboundSink.asFlux()
			.publishOn(scheduler)
			.concatMap(this::writeChunk)
			.subscribe(null, this::handleWriteError);
	}

	private Mono<Void> writeChunk(byte[] chunk) {
		return Mono.defer(() -> {
			SerialPortWriter current = writer.get();
			return current != null ? current.write(chunk) : Mono.<Void>empty();
		}).doOnSuccess(v -> writeBufferSize.addAndGet(-chunk.length));
	}

	private void handleWriteError(Throwable error) {
		if (!isClosing.get()) {
			logger.debug("Error writing to serial port", error);
		}
		shutdown(error);
	}

	@Override
	public void write(byte[] chunk) {
		Assert.notNull(chunk, "The chunk can not be null");
		if (isClosing.get()) {
			logger.debug("Dropping {} bytes written to a closing transport", chunk.length);
			return;
		}
		byte[] copy = Arrays.copyOf(chunk, chunk.length);
		writeBufferSize.addAndGet(copy.length);
		// Concurrent producers contend on the sink; retry until this emission goes through
		this.outboundSink.emitNext(copy, (signalType, result) -> result == Sinks.EmitResult.FAIL_NON_SERIALIZED);
	}

	@Override
	public long getWriteBufferSize() {
		return isClosing.get() ? 0 : writeBufferSize.get();
	}

	@Override
	public void setProtocol(SerialProtocol protocol) {
		Assert.notNull(protocol, "The protocol can not be null");
		this.protocol.set(protocol);
	}

	@Override
	public SerialProtocol getProtocol() {
		SerialProtocol current = protocol.get();
		Assert.state(current != null, "The transport has been shut down and no longer has a protocol");
		return current;
	}

	@Override
	public boolean isClosing() {
		return isClosing.get();
	}

	@Override
	public void close() {
		shutdown(null);
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(this::close).then(terminationSink.asMono());
	}

	/**
	 * Shuts down a transport its owner never closed.
	 */
	void reclaim() {
		if (!isClosing.get()) {
			logger.error("Transport was not closed! Closing it on behalf of its owner");
		}
		shutdown(SerialTransportException.notClosed());
	}

	private void shutdown(Throwable cause) {
		if (!isClosing.compareAndSet(false, true)) {
			return;
		}
		// Registered before anything is released so a concurrent open waits for this close
		CompletableFuture<Void> closing = connectionManager.beginClose();
		logger.debug("Serial transport shutting down{}", cause != null ? ": " + cause : "");

		readerTask.dispose();
		writerTask.dispose();
		outboundSink.tryEmitComplete();
		writeBufferSize.set(0);
		releaseStreams();
		connectionManager.unregister(this);

		SerialProtocol lost = protocol.getAndSet(null);
		connectionManager.release(closing, port, () -> notifyConnectionLost(lost, cause));
	}

	/**
	 * Releases the reader and the writer. Each release happens at most once; calling this
	 * again has no effect.
	 */
	void releaseStreams() {
		SerialPortReader releasedReader = reader.getAndSet(null);
		if (releasedReader != null) {
			try {
				releasedReader.releaseLock();
			}
			catch (RuntimeException e) {
				logger.warn("Failed to release serial port reader", e);
			}
		}
		SerialPortWriter releasedWriter = writer.getAndSet(null);
		if (releasedWriter != null) {
			try {
				releasedWriter.releaseLock();
			}
			catch (RuntimeException e) {
				logger.warn("Failed to release serial port writer", e);
			}
		}
	}

	private void notifyConnectionLost(SerialProtocol lost, Throwable cause) {
		try {
			if (lost != null) {
				lost.connectionLost(cause);
			}
		}
		catch (RuntimeException e) {
			logger.error("Protocol failed to handle connection lost", e);
		}
		finally {
			terminationSink.tryEmitEmpty();
		}
	}

}
