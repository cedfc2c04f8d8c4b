/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.serialbridge.sdk.transport;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.serialbridge.sdk.MockSerialPort;
import com.serialbridge.sdk.RecordingProtocol;
import com.serialbridge.sdk.spec.SerialOpenOptions;
import com.serialbridge.sdk.spec.SerialOpenOptions.FlowControl;
import com.serialbridge.sdk.transport.SerialConnectionOptions.Parity;
import com.serialbridge.sdk.transport.SerialConnectionOptions.StopBits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.serialbridge.sdk.SerialTestFixtures.TIMEOUT;
import static com.serialbridge.sdk.SerialTestFixtures.awaitCondition;
import static com.serialbridge.sdk.SerialTestFixtures.bytes;
import static com.serialbridge.sdk.SerialTestFixtures.defaultOptions;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SerialConnectionFactory}.
 */
class SerialConnectionFactoryTest {

	private MockSerialPort port;

	private SerialConnectionManager manager;

	private SerialConnectionFactory factory;

	private ListAppender<ILoggingEvent> managerLog;

	@BeforeEach
	void setUp() {
		port = new MockSerialPort();
		manager = new SerialConnectionManager(port);
		factory = new SerialConnectionFactory(manager);

		managerLog = new ListAppender<>();
		managerLog.start();
		((Logger) LoggerFactory.getLogger(SerialConnectionManager.class)).addAppender(managerLog);
	}

	@AfterEach
	void tearDown() {
		port.completeReaderRelease();
		port.completeOpen();
		port.completeClose();
		manager.close();
		((Logger) LoggerFactory.getLogger(SerialConnectionManager.class)).detachAppender(managerLog);
		managerLog.stop();
	}

	private long drainWarnings() {
		return managerLog.list.stream()
			.filter(e -> e.getLevel() == Level.WARN)
			.filter(e -> e.getFormattedMessage().startsWith("Serial connection was not closed"))
			.count();
	}

	@Test
	void constructorRejectsNullManager() {
		assertThatThrownBy(() -> new SerialConnectionFactory(null)).isInstanceOf(IllegalArgumentException.class)
			.hasMessage("The connectionManager can not be null");
	}

	@Test
	void createConnectionWiresProtocolAndTransport() throws InterruptedException {
		RecordingProtocol protocol = new RecordingProtocol();

		SerialConnection<RecordingProtocol> connection = factory.createConnection(() -> protocol, defaultOptions())
			.block(TIMEOUT);

		assertThat(connection.protocol()).isSameAs(protocol);
		assertThat(connection.transport().getProtocol()).isSameAs(protocol);
		assertThat(protocol.awaitMade()).isTrue();
		assertThat(protocol.getTransport()).isSameAs(connection.transport());

		port.emit("hello");
		connection.transport().write(bytes("world"));
		awaitCondition(() -> protocol.getReceived().size() == 1 && port.writtenAsStrings().size() == 1);
		assertThat(protocol.getReceived()).containsExactly("hello");
		assertThat(port.writtenAsStrings()).containsExactly("world");

		connection.transport().closeGracefully().block(TIMEOUT);
	}

	@Test
	void hardwareFlowControlFollowsRtscts() {
		SerialConnectionOptions options = SerialConnectionOptions.builder(115200).rtscts(true).build();

		factory.createConnection(RecordingProtocol::new, options).block(TIMEOUT).transport().close();

		assertThat(port.getOpenCalls()).containsExactly(new SerialOpenOptions(115200, FlowControl.HARDWARE));
	}

	@Test
	void framingOptionsDoNotReachTheDevice() {
		SerialConnectionOptions options = SerialConnectionOptions.builder(9600)
			.url("/dev/ttyUSB3")
			.parity(Parity.EVEN)
			.stopBits(StopBits.TWO)
			.xonxoff(true)
			.build();

		factory.createConnection(RecordingProtocol::new, options).block(TIMEOUT).transport().close();

		assertThat(port.getOpenCalls()).containsExactly(new SerialOpenOptions(9600, FlowControl.NONE));
	}

	@Test
	void openFailurePropagatesUnchangedWithoutCreatingProtocol() {
		IOException failure = new IOException("Failed to open serial port");
		port.failOpen(failure);
		AtomicInteger protocolsCreated = new AtomicInteger();

		StepVerifier.create(factory.createConnection(() -> {
			protocolsCreated.incrementAndGet();
			return new RecordingProtocol();
		}, defaultOptions())).expectErrorMatches(e -> e == failure).verify(TIMEOUT);

		assertThat(protocolsCreated).hasValue(0);
		assertThat(port.isReaderLocked()).isFalse();
		assertThat(manager.closingTaskCount()).isZero();

		port.failOpen(null);
		StepVerifier.create(factory.createConnection(RecordingProtocol::new, defaultOptions()))
			.expectNextCount(1)
			.expectComplete()
			.verify(TIMEOUT);
	}

	@Test
	void failingProtocolFactoryClosesThePort() {
		IllegalStateException failure = new IllegalStateException("no protocol today");

		StepVerifier.create(factory.createConnection(() -> {
			throw failure;
		}, defaultOptions())).expectErrorMatches(e -> e == failure).verify(TIMEOUT);

		assertThat(port.isOpen()).isFalse();
		assertThat(port.getCloseCount()).isEqualTo(1);
		assertThat(manager.closingTaskCount()).isZero();
	}

	@Test
	void newConnectionWaitsForPreviousDeviceClose() throws InterruptedException {
		MockSerialPort.OpenPortCounter openPorts = new MockSerialPort.OpenPortCounter();
		MockSerialPort first = new MockSerialPort(openPorts);
		MockSerialPort second = new MockSerialPort(openPorts);
		manager.setActivePort(first);

		RecordingProtocol firstProtocol = new RecordingProtocol();
		SerialConnection<RecordingProtocol> firstConnection = factory
			.createConnection(() -> firstProtocol, defaultOptions())
			.block(TIMEOUT);
		first.holdClose();
		firstConnection.transport().close();
		awaitCondition(() -> first.getCloseCount() == 1);

		manager.setActivePort(second);
		AtomicReference<SerialConnection<RecordingProtocol>> secondConnection = new AtomicReference<>();
		factory.createConnection(RecordingProtocol::new, defaultOptions()).subscribe(secondConnection::set);
		Thread.sleep(100);

		assertThat(second.getOpenCalls()).isEmpty();
		assertThat(secondConnection.get()).isNull();

		first.completeClose();
		awaitCondition(() -> secondConnection.get() != null);

		assertThat(firstProtocol.isLost()).isTrue();
		assertThat(second.isOpen()).isTrue();
		assertThat(openPorts.max()).isEqualTo(1);
		assertThat(drainWarnings()).isEqualTo(1);

		secondConnection.get().transport().closeGracefully().block(TIMEOUT);
	}

	@Test
	void openDuringShutdownOnAnotherThreadWaitsForTheClose() throws InterruptedException {
		SerialConnection<RecordingProtocol> first = factory.createConnection(RecordingProtocol::new, defaultOptions())
			.block(TIMEOUT);
		assertThat(first.protocol().awaitMade()).isTrue();

		// Stall the shutdown while it releases the reader
		port.holdReaderRelease();
		Thread closer = new Thread(() -> first.transport().close(), "serial-test-closer");
		closer.start();
		awaitCondition(() -> port.getReaderReleaseCalls() == 1);

		assertThat(first.transport().isClosing()).isTrue();
		assertThat(manager.closingTaskCount()).isEqualTo(1);

		AtomicReference<SerialConnection<RecordingProtocol>> second = new AtomicReference<>();
		AtomicReference<Throwable> failure = new AtomicReference<>();
		factory.createConnection(RecordingProtocol::new, defaultOptions()).subscribe(second::set, failure::set);
		Thread.sleep(100);

		assertThat(second.get()).isNull();
		assertThat(failure.get()).isNull();

		port.completeReaderRelease();
		closer.join(TIMEOUT.toMillis());
		awaitCondition(() -> second.get() != null || failure.get() != null);

		assertThat(failure.get()).isNull();
		assertThat(first.protocol().isLost()).isTrue();
		assertThat(port.getOpenCalls()).hasSize(2);
		assertThat(drainWarnings()).isEqualTo(1);

		second.get().transport().closeGracefully().block(TIMEOUT);
	}

	@Test
	void cancelledOpenGivesThePortBack() throws InterruptedException {
		port.holdOpen();

		StepVerifier.create(factory.createConnection(RecordingProtocol::new, defaultOptions())
			.timeout(Duration.ofMillis(100)))
			.expectError(TimeoutException.class)
			.verify(TIMEOUT);
		awaitCondition(() -> manager.closingTaskCount() == 0);

		assertThat(port.getCloseCount()).isEqualTo(1);

		MockSerialPort healthy = new MockSerialPort();
		manager.setActivePort(healthy);
		SerialConnection<RecordingProtocol> connection = factory
			.createConnection(RecordingProtocol::new, defaultOptions())
			.block(TIMEOUT);

		assertThat(healthy.isOpen()).isTrue();
		assertThat(connection.transport().isClosing()).isFalse();
		connection.transport().closeGracefully().block(TIMEOUT);
	}

	@Test
	void reconnectFromConnectionLostDoesNotWarn() throws InterruptedException {
		AtomicReference<SerialConnection<RecordingProtocol>> reconnected = new AtomicReference<>();
		RecordingProtocol protocol = new RecordingProtocol().onConnectionLost(
				() -> factory.createConnection(RecordingProtocol::new, defaultOptions()).subscribe(reconnected::set));

		SerialConnection<RecordingProtocol> connection = factory.createConnection(() -> protocol, defaultOptions())
			.block(TIMEOUT);
		assertThat(protocol.awaitMade()).isTrue();

		port.endOfStream();
		awaitCondition(() -> reconnected.get() != null);

		assertThat(connection.transport().isClosing()).isTrue();
		assertThat(reconnected.get().transport().isClosing()).isFalse();
		assertThat(port.getOpenCalls()).hasSize(2);
		assertThat(drainWarnings()).isZero();

		reconnected.get().transport().closeGracefully().block(TIMEOUT);
	}

	@Test
	void withConnectionClosesConnectionAfterBody() throws InterruptedException {
		AtomicReference<RecordingProtocol> created = new AtomicReference<>();

		String result = factory.withConnection(() -> {
			RecordingProtocol protocol = new RecordingProtocol();
			created.set(protocol);
			return protocol;
		}, defaultOptions(), connection -> {
			assertThat(connection.transport().isClosing()).isFalse();
			return Mono.just("done");
		}).block(TIMEOUT);

		assertThat(result).isEqualTo("done");
		awaitCondition(() -> created.get().isLost());
		assertThat(port.isOpen()).isFalse();
	}

	@Test
	void withConnectionClosesConnectionWhenBodyFails() throws InterruptedException {
		AtomicReference<SerialConnection<RecordingProtocol>> seen = new AtomicReference<>();

		StepVerifier.create(factory.withConnection(RecordingProtocol::new, defaultOptions(), connection -> {
			seen.set(connection);
			return Mono.error(new IllegalStateException("body failed"));
		})).expectError(IllegalStateException.class).verify(TIMEOUT);

		assertThat(seen.get().transport().isClosing()).isTrue();
		awaitCondition(() -> seen.get().protocol().isLost());
	}

	@Test
	void createConnectionValidatesArguments() {
		assertThatThrownBy(() -> factory.createConnection(null, defaultOptions()))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> factory.createConnection(RecordingProtocol::new, null))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
