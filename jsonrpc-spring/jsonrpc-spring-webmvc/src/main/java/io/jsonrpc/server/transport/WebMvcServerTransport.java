/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.jsonrpc.server.transport;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.jsonrpc.spec.JsonRpcException;
import io.jsonrpc.spec.JsonRpcServerTransport;
import io.jsonrpc.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * 基于Spring WebMvc函数式端点的请求/响应服务器传输。
 *
 * <p>
 * 发往端点的每个 {@code POST} 请求体是一个入站帧。处理线程阻塞等待服务器运行时为该帧给出的结果，
 * 有响应时以 {@code 200 application/json} 返回，没有响应时返回 {@code 204 No Content}。
 * 在 {@code replyTimeout} 内没有结果的请求得到 {@code 504}。
 *
 * <p>
 * 使用方式：将 {@link #getRouterFunction()} 注册为Spring bean，并把传输交给
 * {@link io.jsonrpc.server.JsonRpcServer}：<pre>{@code
 * @Bean
 * WebMvcServerTransport transport() {
 *     return WebMvcServerTransport.builder().endpoint("/rpc").build();
 * }
 *
 * @Bean
 * RouterFunction<ServerResponse> rpcRoutes(WebMvcServerTransport transport) {
 *     return transport.getRouterFunction();
 * }
 * }</pre>
 */
public class WebMvcServerTransport implements JsonRpcServerTransport {

	private static final Logger logger = LoggerFactory.getLogger(WebMvcServerTransport.class);

	/** 默认端点路径 */
	public static final String DEFAULT_ENDPOINT = "/rpc";

	/** 等待分发结果的默认时长 */
	public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofSeconds(90);

	private final String endpoint;

	private final Duration replyTimeout;

	private final RouterFunction<ServerResponse> routerFunction;

	private final Sinks.Many<InboundFrame> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Set<WebMvcFrame> inFlight = ConcurrentHashMap.newKeySet();

	private volatile boolean isClosing = false;

	public WebMvcServerTransport(String endpoint, Duration replyTimeout) {
		Assert.hasText(endpoint, "Endpoint must not be empty");
		Assert.notNull(replyTimeout, "Reply timeout must not be null");
		this.endpoint = endpoint;
		this.replyTimeout = replyTimeout;
		this.routerFunction = RouterFunctions.route().POST(this.endpoint, this::handleFrame).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * 返回定义此传输HTTP端点的WebMvc路由函数。
	 */
	public RouterFunction<ServerResponse> getRouterFunction() {
		return this.routerFunction;
	}

	@Override
	public Flux<InboundFrame> receiveFrames() {
		return this.inboundSink.asFlux();
	}

	private ServerResponse handleFrame(ServerRequest request) {
		if (this.isClosing) {
			return ServerResponse.status(HttpStatus.SERVICE_UNAVAILABLE).body("Server is shutting down");
		}

		byte[] payload;
		try {
			payload = request.servletRequest().getInputStream().readAllBytes();
		}
		catch (IOException e) {
			logger.error("Failed to read request body: {}", e.getMessage());
			return ServerResponse.badRequest().build();
		}

		WebMvcFrame frame = new WebMvcFrame(payload);
		this.inFlight.add(frame);
		try {
			Sinks.EmitResult result;
			synchronized (this.inboundSink) {
				result = this.inboundSink.tryEmitNext(frame);
			}
			if (result.isFailure()) {
				logger.warn("Rejecting frame, inbound queue refused it: {}", result);
				return ServerResponse.status(HttpStatus.SERVICE_UNAVAILABLE).build();
			}

			// Block for WebMVC compatibility
			Optional<byte[]> response = frame.result.get(this.replyTimeout.toMillis(), TimeUnit.MILLISECONDS);
			if (response.isEmpty()) {
				return ServerResponse.noContent().build();
			}
			return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).body(response.get());
		}
		catch (TimeoutException e) {
			logger.warn("No reply within {} for frame", this.replyTimeout);
			return ServerResponse.status(HttpStatus.GATEWAY_TIMEOUT).build();
		}
		catch (ExecutionException e) {
			logger.debug("Frame was not answered: {}", e.getCause().getMessage());
			return ServerResponse.status(HttpStatus.SERVICE_UNAVAILABLE).build();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return ServerResponse.status(HttpStatus.SERVICE_UNAVAILABLE).build();
		}
		finally {
			this.inFlight.remove(frame);
		}
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			this.isClosing = true;
			logger.debug("Initiating graceful shutdown with {} unanswered frames", this.inFlight.size());
			synchronized (this.inboundSink) {
				this.inboundSink.tryEmitComplete();
			}
			this.inFlight.forEach(frame -> frame.result
				.completeExceptionally(JsonRpcException.closed("WebMvc transport is shutting down")));
		});
	}

	private static final class WebMvcFrame implements InboundFrame {

		private final byte[] payload;

		private final CompletableFuture<Optional<byte[]>> result = new CompletableFuture<>();

		WebMvcFrame(byte[] payload) {
			this.payload = payload;
		}

		@Override
		public byte[] payload() {
			return this.payload;
		}

		@Override
		public Mono<Void> reply(byte[] response) {
			return Mono.fromRunnable(() -> this.result.complete(Optional.of(response)));
		}

		@Override
		public Mono<Void> complete() {
			return Mono.fromRunnable(() -> this.result.complete(Optional.empty()));
		}

	}

	/**
	 * {@link WebMvcServerTransport} 的构建器。
	 */
	public static class Builder {

		private String endpoint = DEFAULT_ENDPOINT;

		private Duration replyTimeout = DEFAULT_REPLY_TIMEOUT;

		public Builder endpoint(String endpoint) {
			Assert.hasText(endpoint, "Endpoint must not be empty");
			this.endpoint = endpoint;
			return this;
		}

		/**
		 * 设置处理线程等待分发结果的最长时间。应当大于服务器的分发超时。
		 */
		public Builder replyTimeout(Duration replyTimeout) {
			Assert.notNull(replyTimeout, "Reply timeout must not be null");
			this.replyTimeout = replyTimeout;
			return this;
		}

		public WebMvcServerTransport build() {
			return new WebMvcServerTransport(this.endpoint, this.replyTimeout);
		}

	}

}
