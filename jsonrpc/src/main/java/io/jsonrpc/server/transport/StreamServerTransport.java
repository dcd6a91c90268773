/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import io.jsonrpc.spec.JsonRpcServerTransport;
import io.jsonrpc.util.Assert;
import io.jsonrpc.util.LineDelimitedConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 基于持久连接的服务器传输。
 *
 * <p>
 * 每个连接上的帧以换行分隔。一个连接由许多并发调用共享：响应按完成顺序写回产生请求的那个连接，
 * 写入在该连接的出站线程上串行执行，客户端仅通过RPC {@code id} 区分它们。
 *
 * <p>
 * 可以服务一对现成的流（例如标准输入输出），也可以在 {@link ServerSocket} 上接受任意多个连接。
 */
public class StreamServerTransport implements JsonRpcServerTransport {

	private static final Logger logger = LoggerFactory.getLogger(StreamServerTransport.class);

	private final Sinks.Many<LineDelimitedConnection> connectionSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Set<LineDelimitedConnection> connections = ConcurrentHashMap.newKeySet();

	private final AtomicInteger connectionCounter = new AtomicInteger();

	private final ServerSocket serverSocket;

	private final Scheduler acceptScheduler;

	private volatile boolean isClosing = false;

	/**
	 * 服务单个连接。连接结束时入站帧序列结束。
	 * @param input 入站流
	 * @param output 出站流
	 */
	public StreamServerTransport(InputStream input, OutputStream output) {
		Assert.notNull(input, "The input stream can not be null");
		Assert.notNull(output, "The output stream can not be null");
		this.serverSocket = null;
		this.acceptScheduler = null;
		register(new LineDelimitedConnection("jsonrpc-server-0", input, output));
		this.connectionSink.tryEmitComplete();
	}

	private StreamServerTransport(ServerSocket serverSocket) {
		this.serverSocket = serverSocket;
		this.acceptScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "jsonrpc-accept");
		startAccepting();
	}

	/**
	 * 在给定的服务器套接字上接受连接。关闭传输会关闭服务器套接字和所有已接受的连接。
	 * @param serverSocket 已绑定的服务器套接字
	 * @return 新的传输
	 */
	public static StreamServerTransport listen(ServerSocket serverSocket) {
		Assert.notNull(serverSocket, "The serverSocket can not be null");
		Assert.isTrue(serverSocket.isBound(), "The serverSocket must be bound");
		return new StreamServerTransport(serverSocket);
	}

	private void startAccepting() {
		this.acceptScheduler.schedule(() -> {
			try {
				while (!this.isClosing) {
					Socket socket = this.serverSocket.accept();
					logger.debug("Accepted connection from {}", socket.getRemoteSocketAddress());
					register(new LineDelimitedConnection("jsonrpc-server-" + this.connectionCounter.incrementAndGet(),
							socket.getInputStream(), socket.getOutputStream()));
				}
			}
			catch (IOException e) {
				if (!this.isClosing) {
					logger.error("Error accepting connections on {}", this.serverSocket.getLocalSocketAddress(), e);
				}
			}
			finally {
				this.isClosing = true;
				this.connectionSink.tryEmitComplete();
			}
		});
	}

	private void register(LineDelimitedConnection connection) {
		this.connections.add(connection);
		if (!this.connectionSink.tryEmitNext(connection).isSuccess()) {
			logger.warn("Rejecting connection {}, transport is closing", connection);
			this.connections.remove(connection);
			connection.close();
		}
	}

	@Override
	public Flux<InboundFrame> receiveFrames() {
		return this.connectionSink.asFlux()
			.flatMap(connection -> connection.inbound()
				.<InboundFrame>map(payload -> new StreamFrame(payload, connection))
				.doFinally(signal -> {
					this.connections.remove(connection);
					connection.close();
				}), Integer.MAX_VALUE);
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			this.isClosing = true;
			closeServerSocket();
			return Flux.fromIterable(Set.copyOf(this.connections))
				.flatMap(LineDelimitedConnection::closeGracefully)
				.then(Mono.fromRunnable(this::disposeAcceptor));
		});
	}

	@Override
	public void close() {
		this.isClosing = true;
		closeServerSocket();
		this.connections.forEach(LineDelimitedConnection::close);
		disposeAcceptor();
	}

	private void closeServerSocket() {
		if (this.serverSocket == null) {
			return;
		}
		try {
			this.serverSocket.close();
		}
		catch (IOException e) {
			logger.warn("Error closing server socket: {}", e.getMessage());
		}
	}

	private void disposeAcceptor() {
		if (this.acceptScheduler != null) {
			this.acceptScheduler.dispose();
		}
	}

	private record StreamFrame(byte[] payload, LineDelimitedConnection connection) implements InboundFrame {

		@Override
		public Mono<Void> reply(byte[] response) {
			return this.connection.write(response);
		}

	}

}
