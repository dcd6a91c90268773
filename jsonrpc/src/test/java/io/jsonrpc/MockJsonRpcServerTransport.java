/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import io.jsonrpc.spec.JsonRpcServerTransport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * 由测试注入入站帧的服务器传输。每个帧的结果（响应字节或无响应）通过返回的future观察。
 */
public class MockJsonRpcServerTransport implements JsonRpcServerTransport {

	private final Sinks.Many<InboundFrame> inbound = Sinks.many().unicast().onBackpressureBuffer();

	private final AtomicBoolean closed = new AtomicBoolean(false);

	/**
	 * 注入一个帧。
	 * @return 应答时以响应文本完成、无响应时以空完成的future
	 */
	public synchronized CompletableFuture<Optional<String>> simulateIncomingFrame(String frame) {
		MockFrame mockFrame = new MockFrame(frame.getBytes(StandardCharsets.UTF_8));
		this.inbound.tryEmitNext(mockFrame);
		return mockFrame.outcome;
	}

	public boolean isClosed() {
		return this.closed.get();
	}

	@Override
	public Flux<InboundFrame> receiveFrames() {
		return this.inbound.asFlux();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			this.closed.set(true);
			synchronized (this) {
				this.inbound.tryEmitComplete();
			}
		});
	}

	private static final class MockFrame implements InboundFrame {

		private final byte[] payload;

		private final CompletableFuture<Optional<String>> outcome = new CompletableFuture<>();

		MockFrame(byte[] payload) {
			this.payload = payload;
		}

		@Override
		public byte[] payload() {
			return this.payload;
		}

		@Override
		public Mono<Void> reply(byte[] response) {
			return Mono.fromRunnable(() -> this.outcome.complete(Optional.of(new String(response, StandardCharsets.UTF_8))));
		}

		@Override
		public Mono<Void> complete() {
			return Mono.fromRunnable(() -> this.outcome.complete(Optional.empty()));
		}

	}

}
